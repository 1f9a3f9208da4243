package work.pollochang.duplicate.image.core;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.cache.CachedHashes;
import work.pollochang.duplicate.image.cache.FileKey;
import work.pollochang.duplicate.image.grouping.PerceptualGroupingEngine;
import work.pollochang.duplicate.image.grouping.StrategyKind;
import work.pollochang.duplicate.image.grouping.StrategyOutcome;
import work.pollochang.duplicate.image.grouping.StrategySelector;
import work.pollochang.duplicate.image.hash.HashProvider;
import work.pollochang.duplicate.image.hash.HashProviders;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.RunStatistics;
import work.pollochang.duplicate.image.stage.ExactMatchStage;
import work.pollochang.duplicate.image.stage.PureColorStage;
import work.pollochang.duplicate.image.stage.StageResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 重複圖片偵測的協調器。
 * <p>
 * 依序執行完全相同檢查、純色檢查與感知比對，前一階段處理過的檔案不會進入下一階段
 * (完全相同群組的第一個檔案除外)。可由其他執行緒呼叫 {@link #stop()} 中止，
 * 中止時回傳已完成的群組，統計只包含已完整結束的階段。
 */
@Slf4j
@Setter
public class DuplicateDetector {

    /** 文字日誌回呼，可為 null */
    private Consumer<String> logCallback;
    /** 進度回呼，可為 null */
    private ProgressListener progressListener;
    /** 雜湊快取，可為 null */
    private Map<FileKey, CachedHashes> hashCache;
    private ImageDecoder decoder = new ImageIoDecoder();
    /** 未指定時依設定建立 */
    private HashProvider hashProvider;

    private volatile RunControl current;

    public DetectionResult detectDuplicates(List<String> inputPaths, DetectionConfig config) {
        long startNanos = System.nanoTime();
        List<String> paths = new ArrayList<>(new LinkedHashSet<>(inputPaths));
        RunControl control = new RunControl(progressListener, logCallback);
        current = control;

        HashProvider provider = hashProvider != null ? hashProvider : HashProviders.create(config.preferAccelerated());
        log.info("========================================重複圖片偵測參數設定========================================");
        log.info("檔案數: {}", paths.size());
        log.info("雜湊實作: {}", provider.name());
        log.info("門檻 dHash/aHash/pHash: {}/{}/{}", config.dhashThreshold(), config.ahashThreshold(), config.phashThreshold());
        log.info("純色檢測: {}, 旋轉比對: {}, 強化模式: {}", config.detectPureColor(), config.detectRotation(), config.enhancedSimilarity());
        log.info("執行緒數: {}", config.workerThreads());
        log.info("========================================重複圖片偵測參數設定========================================");

        List<DuplicateGroup> completed = new ArrayList<>();
        int failed = 0;
        int pureColor = 0;

        ExecutorService executor = Executors.newFixedThreadPool(config.workerThreads());
        try {
            control.enter(DetectionState.SCANNING_EXACT_MATCH);
            control.log("正在檢查完全相同的檔案...");
            StageResult exact = new ExactMatchStage(provider, executor, hashCache).run(paths, control);
            if (exact.stopped()) {
                return finish(DetectionState.STOPPED, completed, completed, paths.size(), pureColor, failed, null, startNanos);
            }
            failed += exact.failures();
            completed.addAll(exact.groups());
            List<String> survivors = exact.survivors();

            if (config.detectPureColor()) {
                control.enter(DetectionState.SCANNING_PURE_COLOR);
                control.log("正在檢查純色圖片...");
                StageResult pure = new PureColorStage(provider, decoder, executor, config.pureColorThreshold())
                        .run(survivors, control);
                if (pure.stopped()) {
                    return finish(DetectionState.STOPPED, completed, completed, paths.size(), pureColor, failed, null, startNanos);
                }
                failed += pure.failures();
                completed.addAll(pure.groups());
                pureColor = pure.pureColorImages();
                survivors = pure.survivors();
            }

            control.enter(DetectionState.SCANNING_PERCEPTUAL);
            control.log("正在進行感知雜湊比對...");
            PerceptualGroupingEngine engine = new PerceptualGroupingEngine(executor, config.workerThreads());
            StrategySelector selector = new StrategySelector(engine,
                    StrategySelector.defaultFactory(provider, decoder, config, hashCache));
            StrategyOutcome outcome = selector.run(StrategyKind.initial(config), survivors, control);
            if (outcome.stopped()) {
                List<DuplicateGroup> all = new ArrayList<>(completed);
                all.addAll(outcome.groups());
                return finish(DetectionState.STOPPED, all, completed, paths.size(), pureColor, failed, outcome.kind(), startNanos);
            }
            failed += outcome.failures();
            completed.addAll(outcome.groups());
            return finish(DetectionState.DONE, completed, completed, paths.size(), pureColor, failed, outcome.kind(), startNanos);
        } finally {
            current = null;
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    log.warn("執行緒池等待逾時，部分任務可能未完成。");
                }
            } catch (InterruptedException e) {
                log.error("執行緒池被中斷。", e);
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * 要求目前的執行盡快停止；沒有執行中的偵測時不做任何事。
     */
    public void stop() {
        RunControl control = current;
        if (control != null) {
            log.info("收到停止要求");
            control.requestStop();
        }
    }

    public DetectionState getState() {
        RunControl control = current;
        return control == null ? DetectionState.IDLE : control.state();
    }

    /**
     * @param groups  回傳的群組
     * @param counted 納入統計的群組 (已完整結束的階段)
     */
    private DetectionResult finish(DetectionState state, List<DuplicateGroup> groups, List<DuplicateGroup> counted,
                                   int total, int pureColor, int failed, StrategyKind strategy, long startNanos) {
        RunControl control = current;
        if (control != null && control.state() != state) {
            control.enter(state);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        RunStatistics stats = RunStatistics.summarize(total, counted, pureColor, failed, elapsed);
        log.info("========================================偵測統計報告========================================");
        log.info(" 結束狀態: {}", state);
        log.info(" 圖片總數: {}", stats.totalImages());
        log.info(" 重複群組數: {}", stats.duplicateGroups());
        log.info(" 重複圖片數: {}", stats.duplicateImages());
        log.info(" 純色圖片數: {}", stats.pureColorImages());
        log.info(" 失敗檔案數: {}", stats.failedFiles());
        log.info(" 執行時間: {} 秒", elapsed.toMillis() / 1000.0);
        log.info("========================================偵測統計報告========================================");
        if (control != null) {
            control.log("偵測結束 (" + state + ")：" + stats.duplicateGroups() + " 組，" + stats.duplicateImages() + " 張重複圖片");
        }
        return new DetectionResult(groups, stats, state, strategy);
    }
}
