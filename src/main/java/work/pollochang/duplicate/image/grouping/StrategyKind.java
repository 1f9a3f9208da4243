package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.core.DetectionConfig;

/**
 * 感知比對策略，依降級順序排列。
 */
public enum StrategyKind {
    ENHANCED,
    ROTATION,
    BASELINE;

    /**
     * 失敗時改用的策略；基本策略沒有下一層。
     */
    public StrategyKind fallback() {
        return switch (this) {
            case ENHANCED -> ROTATION;
            case ROTATION -> BASELINE;
            case BASELINE -> null;
        };
    }

    public static StrategyKind initial(DetectionConfig config) {
        if (config.enhancedSimilarity()) {
            return ENHANCED;
        }
        return config.detectRotation() ? ROTATION : BASELINE;
    }
}
