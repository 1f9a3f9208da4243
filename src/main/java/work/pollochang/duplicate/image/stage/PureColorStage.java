package work.pollochang.duplicate.image.stage;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.core.DecodedImage;
import work.pollochang.duplicate.image.core.ImageDecoder;
import work.pollochang.duplicate.image.core.RunControl;
import work.pollochang.duplicate.image.hash.HashProvider;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.GroupMember;
import work.pollochang.duplicate.image.model.ReasonTag;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * 找出純色圖片。所有純色圖片合成一組 (不兩兩比較)，並從後續比對中移除。
 * 只有一張純色圖片時不成組，但仍會移除並計數。
 */
@Slf4j
public class PureColorStage {

    public static final String NAME = "pure-color";

    private final HashProvider hashProvider;
    private final ImageDecoder decoder;
    private final ExecutorService executor;
    private final double threshold;

    public PureColorStage(HashProvider hashProvider, ImageDecoder decoder, ExecutorService executor, double threshold) {
        this.hashProvider = hashProvider;
        this.decoder = decoder;
        this.executor = executor;
        this.threshold = threshold;
    }

    public StageResult run(List<String> paths, RunControl control) {
        OrderedBatch.Outcome<Boolean> outcome = OrderedBatch.run(executor, NAME, paths, path -> {
            try (DecodedImage decoded = decoder.decode(Paths.get(path))) {
                return hashProvider.isPureColor(decoded.image(), threshold);
            }
        }, control);
        if (outcome.stopped()) {
            return StageResult.stopped(paths, outcome.failures());
        }

        List<GroupMember> pure = new ArrayList<>();
        List<String> survivors = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            Boolean isPure = outcome.results().get(i);
            if (isPure == null) {
                continue;
            }
            if (isPure) {
                pure.add(GroupMember.of(paths.get(i)));
            } else {
                survivors.add(paths.get(i));
            }
        }

        List<DuplicateGroup> groups = pure.size() >= 2
                ? List.of(new DuplicateGroup(ReasonTag.PURE_COLOR, ReasonTag.PURE_COLOR.label(), pure))
                : List.of();
        log.info("純色檢查完成: {} 張純色圖片，{} 個檔案進入感知比對", pure.size(), survivors.size());
        return new StageResult(groups, survivors, outcome.failures(), pure.size(), false);
    }
}
