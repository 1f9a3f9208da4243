package work.pollochang.duplicate.image.grouping;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.cache.CachedHashes;
import work.pollochang.duplicate.image.cache.FileKey;
import work.pollochang.duplicate.image.core.DetectionConfig;
import work.pollochang.duplicate.image.core.ImageDecoder;
import work.pollochang.duplicate.image.core.ProviderUnstableException;
import work.pollochang.duplicate.image.core.RunControl;
import work.pollochang.duplicate.image.hash.HashProvider;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 策略選擇狀態機：ENHANCED -> ROTATION -> BASELINE。
 * 策略回報 {@link StrategyFailure} 時記錄降級並以相同輸入執行下一層；基本策略失敗則中止整個執行。
 */
@Slf4j
public class StrategySelector {

    private final PerceptualGroupingEngine engine;
    private final Function<StrategyKind, GroupingStrategy> factory;

    public StrategySelector(PerceptualGroupingEngine engine, Function<StrategyKind, GroupingStrategy> factory) {
        this.engine = engine;
        this.factory = factory;
    }

    public static Function<StrategyKind, GroupingStrategy> defaultFactory(HashProvider hashProvider, ImageDecoder decoder,
                                                                          DetectionConfig config,
                                                                          Map<FileKey, CachedHashes> cache) {
        return kind -> switch (kind) {
            case ENHANCED -> new EnhancedStrategy(hashProvider, decoder, config);
            case ROTATION -> new RotationInvariantStrategy(hashProvider, decoder, config);
            case BASELINE -> new BaselineStrategy(hashProvider, decoder, config, cache);
        };
    }

    public StrategyOutcome run(StrategyKind initial, List<String> paths, RunControl control) {
        StrategyKind current = initial;
        while (true) {
            StrategyOutcome outcome = engine.run(factory.apply(current), paths, control);
            if (!outcome.failed()) {
                return outcome;
            }
            StrategyFailure failure = outcome.failure();
            StrategyKind next = current.fallback();
            if (next == null) {
                throw new ProviderUnstableException(PerceptualGroupingEngine.STAGE, outcome.processed(),
                        "基本策略失敗: " + failure.message(), failure.cause());
            }
            log.warn("{} 策略失敗 ({}: {})，降級為 {}", current, failure.reason(), failure.message(), next);
            control.log(current + " 策略失敗，降級為 " + next);
            current = next;
        }
    }
}
