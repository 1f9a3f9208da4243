package work.pollochang.duplicate.image.model;

import work.pollochang.duplicate.image.feature.FeatureVector;
import work.pollochang.duplicate.image.hash.PerceptualHashes;

/**
 * 強化模式的一個變體：原圖旋轉 {@code angle} 度、縮放 {@code scale} 倍後的雜湊與特徵。
 *
 * @param width  以原始尺寸換算的變體寬度
 * @param height 以原始尺寸換算的變體高度
 */
public record ScaledVariant(int angle, double scale, int hashSize, int width, int height,
                            PerceptualHashes hashes, FeatureVector features) {
}
