package work.pollochang.duplicate.image.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 一次偵測的統計。
 *
 * @param totalImages         輸入的圖片數
 * @param duplicateGroups     群組數 (含純色群組)
 * @param duplicateImages     各群組 (成員數 - 1) 的總和
 * @param pureColorImages     判定為純色的圖片數
 * @param failedFiles         讀取或解碼失敗而略過的檔案數
 * @param reasonHistogram     原因描述 -> 群組數
 * @param tagHistogram        原因標籤 -> 群組數
 * @param elapsed             執行時間
 */
public record RunStatistics(int totalImages, int duplicateGroups, int duplicateImages, int pureColorImages,
                            int failedFiles, Map<String, Integer> reasonHistogram,
                            Map<ReasonTag, Integer> tagHistogram, Duration elapsed) {

    public RunStatistics {
        reasonHistogram = Collections.unmodifiableMap(new TreeMap<>(reasonHistogram));
        tagHistogram = tagHistogram.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(tagHistogram));
    }

    public static RunStatistics empty(int totalImages) {
        return new RunStatistics(totalImages, 0, 0, 0, 0, Map.of(), Map.of(), Duration.ZERO);
    }

    /**
     * 由已完成的群組彙總統計。
     */
    public static RunStatistics summarize(int totalImages, List<DuplicateGroup> groups, int pureColorImages,
                                          int failedFiles, Duration elapsed) {
        int duplicates = 0;
        Map<String, Integer> reasons = new TreeMap<>();
        Map<ReasonTag, Integer> tags = new EnumMap<>(ReasonTag.class);
        for (DuplicateGroup group : groups) {
            duplicates += group.size() - 1;
            reasons.merge(group.reason(), 1, Integer::sum);
            for (ReasonTag tag : group.reasonTags()) {
                tags.merge(tag, 1, Integer::sum);
            }
        }
        return new RunStatistics(totalImages, groups.size(), duplicates, pureColorImages, failedFiles,
                reasons, tags, elapsed);
    }
}
