package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.model.ImageRecord;

/**
 * 加入群組的候選圖及其比對結果。
 */
public record Match(ImageRecord record, PairComparison comparison) {
}
