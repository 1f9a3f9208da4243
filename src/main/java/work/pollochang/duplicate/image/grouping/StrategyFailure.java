package work.pollochang.duplicate.image.grouping;

/**
 * 策略執行失敗的原因，由 {@link StrategySelector} 決定是否降級。
 */
public record StrategyFailure(Reason reason, String message, Throwable cause) {

    public enum Reason {
        /** 比對過程拋出非預期的例外 */
        COMPARISON_FAILED,
        /** 記憶體不足，通常是變體數太多 */
        RESOURCE_EXHAUSTED
    }

    static StrategyFailure of(Reason reason, Throwable cause) {
        return new StrategyFailure(reason, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }
}
