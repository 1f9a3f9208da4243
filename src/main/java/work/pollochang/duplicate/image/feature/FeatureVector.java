package work.pollochang.duplicate.image.feature;

/**
 * 圖片的全域特徵，用於強化模式的信心度計算。
 *
 * @param aspectRatio 寬 / 高
 * @param brightness  灰階平均值 (0-255)
 * @param contrast    灰階標準差
 * @param entropy     256 階灰階直方圖的夏農熵 (bits)
 * @param edgeDensity Sobel 梯度強度平均值
 */
public record FeatureVector(double aspectRatio, double brightness, double contrast, double entropy, double edgeDensity) {

    private static final double BRIGHTNESS_WEIGHT = 0.2;
    private static final double CONTRAST_WEIGHT = 0.2;
    private static final double ASPECT_WEIGHT = 0.15;
    private static final double ENTROPY_WEIGHT = 0.15;
    private static final double EDGE_WEIGHT = 0.15;
    private static final double WEIGHT_SUM = BRIGHTNESS_WEIGHT + CONTRAST_WEIGHT + ASPECT_WEIGHT + ENTROPY_WEIGHT + EDGE_WEIGHT;

    /**
     * 加權相似度，範圍 [0, 1]，1 代表特徵完全相同。對稱。
     */
    public double similarity(FeatureVector other) {
        double maxAspect = Math.max(aspectRatio, other.aspectRatio);
        double aspect = maxAspect > 0 ? 1 - Math.abs(aspectRatio - other.aspectRatio) / maxAspect : 1;
        double bright = 1 - Math.abs(brightness - other.brightness) / 255.0;
        double contr = 1 - Math.abs(contrast - other.contrast) / 128.0;
        double entr = 1 - Math.abs(entropy - other.entropy) / 8.0;
        double edge = 1 - Math.abs(edgeDensity - other.edgeDensity) / 255.0;

        double weighted = BRIGHTNESS_WEIGHT * clamp(bright)
                + CONTRAST_WEIGHT * clamp(contr)
                + ASPECT_WEIGHT * clamp(aspect)
                + ENTROPY_WEIGHT * clamp(entr)
                + EDGE_WEIGHT * clamp(edge);
        return clamp(weighted / WEIGHT_SUM);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
