package work.pollochang.duplicate.image.core;

import work.pollochang.duplicate.image.grouping.StrategyKind;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.RunStatistics;

import java.util.List;

/**
 * @param groups       依發現順序排列的群組
 * @param statistics   已完成階段的統計
 * @param state        {@link DetectionState#DONE} 或 {@link DetectionState#STOPPED}
 * @param strategyUsed 感知比對實際使用的策略；未進入感知比對時為 null
 */
public record DetectionResult(List<DuplicateGroup> groups, RunStatistics statistics,
                              DetectionState state, StrategyKind strategyUsed) {

    public DetectionResult {
        groups = List.copyOf(groups);
    }

    public boolean isStopped() {
        return state == DetectionState.STOPPED;
    }
}
