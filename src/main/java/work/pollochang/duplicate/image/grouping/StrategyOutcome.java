package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.model.DuplicateGroup;

import java.util.List;

/**
 * @param kind     執行的策略
 * @param groups    完成的群組
 * @param processed 準備階段成功的檔案數
 * @param failures  準備階段失敗的檔案數
 * @param stopped  是否因停止要求中斷
 * @param failure  策略失敗時的原因，成功時為 null
 */
public record StrategyOutcome(StrategyKind kind, List<DuplicateGroup> groups, int processed, int failures,
                              boolean stopped, StrategyFailure failure) {

    public StrategyOutcome {
        groups = List.copyOf(groups);
    }

    public boolean failed() {
        return failure != null;
    }

    static StrategyOutcome completed(StrategyKind kind, List<DuplicateGroup> groups, int processed, int failures) {
        return new StrategyOutcome(kind, groups, processed, failures, false, null);
    }

    static StrategyOutcome stopped(StrategyKind kind, List<DuplicateGroup> groups, int processed, int failures) {
        return new StrategyOutcome(kind, groups, processed, failures, true, null);
    }

    static StrategyOutcome failed(StrategyKind kind, int processed, StrategyFailure failure) {
        return new StrategyOutcome(kind, List.of(), processed, 0, false, failure);
    }
}
