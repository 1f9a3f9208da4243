package work.pollochang.duplicate.image.grouping;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.pollochang.duplicate.image.core.ProviderUnstableException;
import work.pollochang.duplicate.image.core.RunControl;
import work.pollochang.duplicate.image.hash.HashDistances;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.GroupMember;
import work.pollochang.duplicate.image.model.ImageRecord;
import work.pollochang.duplicate.image.model.ReasonTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PerceptualGroupingEngineTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    /**
     * 以路徑名稱的第一個字元判斷相似：同字首即相似，另可指定額外的相似配對。
     */
    private static class PrefixStrategy implements GroupingStrategy {

        private final Set<String> extraPairs;
        final AtomicInteger comparisons = new AtomicInteger();

        PrefixStrategy(Set<String> extraPairs) {
            this.extraPairs = extraPairs;
        }

        @Override
        public StrategyKind kind() {
            return StrategyKind.BASELINE;
        }

        @Override
        public ImageRecord prepare(String path) throws Exception {
            if (path.startsWith("broken")) {
                throw new java.io.IOException("無法讀取");
            }
            return ImageRecord.of(path, null);
        }

        @Override
        public PairComparison compare(ImageRecord base, ImageRecord candidate) {
            comparisons.incrementAndGet();
            boolean similar = base.path().charAt(0) == candidate.path().charAt(0)
                    || extraPairs.contains(base.path() + "|" + candidate.path());
            return new PairComparison(similar, HashDistances.ZERO, Set.of(ReasonTag.DIFFERENCE_HASH_SIMILAR), null, null, null);
        }

        @Override
        public DuplicateGroup buildGroup(ImageRecord base, List<Match> matches) {
            List<GroupMember> members = new ArrayList<>();
            members.add(GroupMember.of(base.path()));
            matches.forEach(m -> members.add(GroupMember.of(m.record().path())));
            return new DuplicateGroup(ReasonTag.DIFFERENCE_HASH_SIMILAR, "difference", members);
        }
    }

    @Test
    void groupsGreedilyInInputOrder() {
        PerceptualGroupingEngine engine = new PerceptualGroupingEngine(executor, 4);

        StrategyOutcome outcome = engine.run(new PrefixStrategy(Set.of()),
                List.of("a1", "b1", "a2", "c1", "b2", "a3"), RunControl.detached());

        assertFalse(outcome.failed());
        assertEquals(2, outcome.groups().size());
        assertEquals(List.of("a1", "a2", "a3"), outcome.groups().get(0).paths());
        assertEquals(List.of("b1", "b2"), outcome.groups().get(1).paths());
    }

    @Test
    void groupingIsNotTransitive() {
        PerceptualGroupingEngine engine = new PerceptualGroupingEngine(executor, 1);
        // x 與 y 相似、y 與 z 相似，但 x 與 z 不相似：z 不會被併入
        PrefixStrategy strategy = new PrefixStrategy(Set.of("x|y", "y|z"));

        StrategyOutcome outcome = engine.run(strategy, List.of("x", "y", "z"), RunControl.detached());

        assertEquals(1, outcome.groups().size());
        assertEquals(List.of("x", "y"), outcome.groups().get(0).paths());
    }

    @Test
    void consumedRecordsAreNotComparedAgain() {
        PerceptualGroupingEngine engine = new PerceptualGroupingEngine(executor, 1);
        PrefixStrategy strategy = new PrefixStrategy(Set.of());

        engine.run(strategy, List.of("a1", "a2", "a3", "a4"), RunControl.detached());

        // 第一輪比較 3 次之後全部被標記，不再有比較
        assertEquals(3, strategy.comparisons.get());
    }

    @Test
    void parallelComparisonMatchesSequentialResult() {
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < PerceptualGroupingEngine.PARALLEL_MIN_CANDIDATES + 50; i++) {
            paths.add((char) ('a' + i % 7) + String.valueOf(i));
        }

        StrategyOutcome parallel = new PerceptualGroupingEngine(executor, 4)
                .run(new PrefixStrategy(Set.of()), paths, RunControl.detached());
        StrategyOutcome sequential = new PerceptualGroupingEngine(executor, 1)
                .run(new PrefixStrategy(Set.of()), paths, RunControl.detached());

        assertEquals(7, parallel.groups().size());
        assertEquals(sequential.groups(), parallel.groups());
    }

    @Test
    void unreadableFilesAreCountedAndSkipped() {
        PerceptualGroupingEngine engine = new PerceptualGroupingEngine(executor, 2);

        StrategyOutcome outcome = engine.run(new PrefixStrategy(Set.of()),
                List.of("a1", "broken1", "a2"), RunControl.detached());

        assertEquals(1, outcome.failures());
        assertEquals(List.of("a1", "a2"), outcome.groups().get(0).paths());
    }

    @Test
    void tooManyUnreadableFilesIsFatal() {
        List<String> paths = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            paths.add("broken" + i);
        }

        assertThrows(ProviderUnstableException.class, () -> new PerceptualGroupingEngine(executor, 2)
                .run(new PrefixStrategy(Set.of()), paths, RunControl.detached()));
    }

    @Test
    void unexpectedExceptionBecomesStrategyFailure() {
        GroupingStrategy failing = new PrefixStrategy(Set.of()) {
            @Override
            public PairComparison compare(ImageRecord base, ImageRecord candidate) {
                throw new IllegalStateException("boom");
            }
        };

        StrategyOutcome outcome = new PerceptualGroupingEngine(executor, 1)
                .run(failing, List.of("a1", "a2"), RunControl.detached());

        assertTrue(outcome.failed());
        assertEquals(StrategyFailure.Reason.COMPARISON_FAILED, outcome.failure().reason());
        assertEquals(2, outcome.processed());
    }

    @Test
    void stopRequestKeepsFinalizedGroupsOnly() {
        RunControl control = RunControl.detached();
        PrefixStrategy strategy = new PrefixStrategy(Set.of()) {
            @Override
            public DuplicateGroup buildGroup(ImageRecord base, List<Match> matches) {
                control.requestStop();
                return super.buildGroup(base, matches);
            }
        };

        StrategyOutcome outcome = new PerceptualGroupingEngine(executor, 1)
                .run(strategy, List.of("a1", "a2", "b1", "b2"), control);

        assertTrue(outcome.stopped());
        assertEquals(1, outcome.groups().size());
        assertEquals(List.of("a1", "a2"), outcome.groups().get(0).paths());
    }
}
