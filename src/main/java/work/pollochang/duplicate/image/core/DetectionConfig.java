package work.pollochang.duplicate.image.core;

import lombok.With;

import java.util.List;

/**
 * 偵測參數。所有門檻都是漢明距離。
 *
 * @param dhashThreshold          基本 / 旋轉模式的差值雜湊門檻 (距離小於門檻才算相似)
 * @param ahashThreshold          基本 / 旋轉模式的平均雜湊門檻
 * @param phashThreshold          基本 / 旋轉模式的頻域雜湊門檻
 * @param detectPureColor         是否偵測純色圖片
 * @param detectRotation          是否使用旋轉比對
 * @param enhancedSimilarity      是否使用強化模式 (優先於旋轉比對)
 * @param confidenceThreshold     強化模式接受成員的最低信心度
 * @param hashSize                雜湊邊長
 * @param pureColorThreshold      純色判斷的標準差門檻
 * @param enhancedDhashThreshold  強化模式差值雜湊門檻 (距離小於等於門檻即相似)
 * @param enhancedAhashThreshold  強化模式平均雜湊門檻
 * @param enhancedPhashThreshold  強化模式頻域雜湊門檻
 * @param featureWeight           強化模式綜合分數中特徵相似度的權重
 * @param scales                  強化模式的縮放比例
 * @param hashSizes               強化模式的雜湊邊長
 * @param workerThreads           雜湊計算的執行緒數
 * @param preferAccelerated       是否優先使用 OpenCV
 */
@With
public record DetectionConfig(
        int dhashThreshold,
        int ahashThreshold,
        int phashThreshold,
        boolean detectPureColor,
        boolean detectRotation,
        boolean enhancedSimilarity,
        double confidenceThreshold,
        int hashSize,
        double pureColorThreshold,
        int enhancedDhashThreshold,
        int enhancedAhashThreshold,
        int enhancedPhashThreshold,
        double featureWeight,
        List<Double> scales,
        List<Integer> hashSizes,
        int workerThreads,
        boolean preferAccelerated
) {

    public DetectionConfig {
        if (hashSize < 2) {
            throw new IllegalArgumentException("hashSize 必須至少為 2: " + hashSize);
        }
        if (dhashThreshold < 0 || ahashThreshold < 0 || phashThreshold < 0
                || enhancedDhashThreshold < 0 || enhancedAhashThreshold < 0 || enhancedPhashThreshold < 0) {
            throw new IllegalArgumentException("雜湊門檻不可為負數");
        }
        if (featureWeight < 0 || featureWeight > 1) {
            throw new IllegalArgumentException("featureWeight 必須介於 0 與 1: " + featureWeight);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads 必須至少為 1: " + workerThreads);
        }
        scales = List.copyOf(scales);
        hashSizes = List.copyOf(hashSizes);
        if (scales.isEmpty() || hashSizes.isEmpty()) {
            throw new IllegalArgumentException("scales 與 hashSizes 不可為空");
        }
    }

    public static DetectionConfig defaults() {
        return new DetectionConfig(
                8, 2, 2,
                true, false, false,
                0.6, 8, 3.0,
                12, 4, 4,
                0.3,
                List.of(0.75, 1.0, 1.25),
                List.of(8),
                Runtime.getRuntime().availableProcessors(),
                false
        );
    }
}
