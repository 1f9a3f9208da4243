package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.hash.HashDistances;
import work.pollochang.duplicate.image.model.ReasonTag;

import java.util.Set;

/**
 * 基準圖與候選圖的比對結果。
 *
 * @param similar       是否加入群組
 * @param distances     各演算法的距離 (旋轉與強化模式為所有組合中的最小值)
 * @param agreeing      判定相似的演算法
 * @param rotationAngle 最佳組合的角度差，只有旋轉與強化模式會填
 * @param detectionType 強化模式的變換描述
 * @param confidence    強化模式的信心度
 */
public record PairComparison(boolean similar, HashDistances distances, Set<ReasonTag> agreeing,
                             Integer rotationAngle, String detectionType, Double confidence) {

    public PairComparison {
        agreeing = Set.copyOf(agreeing);
    }
}
