package work.pollochang.duplicate.image.stage;

import work.pollochang.duplicate.image.core.ProviderUnstableException;

/**
 * 單一階段的失敗容許量：{@code max(10, 批次大小的 10%)}，超過即視為提供者不穩定。
 */
public class ErrorBudget {

    private static final int MIN_LIMIT = 10;

    private final String stage;
    private final int limit;
    private int failures;
    private int processed;

    public ErrorBudget(String stage, int batchSize) {
        this.stage = stage;
        this.limit = Math.max(MIN_LIMIT, batchSize / 10);
    }

    public void recordSuccess() {
        processed++;
    }

    /**
     * @throws ProviderUnstableException 失敗數超過上限時
     */
    public void recordFailure() {
        failures++;
        if (failures > limit) {
            throw new ProviderUnstableException(stage, processed, failures, limit);
        }
    }

    public int failures() {
        return failures;
    }

    public int processed() {
        return processed;
    }

    public int limit() {
        return limit;
    }
}
