package work.pollochang.duplicate.image.grouping;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.core.ProviderUnstableException;
import work.pollochang.duplicate.image.core.RunControl;
import work.pollochang.duplicate.image.hash.HashLengthMismatchException;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.ImageRecord;
import work.pollochang.duplicate.image.stage.OrderedBatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 貪婪分組：依輸入順序逐一以未分組的圖片為基準，與其後所有未分組的圖片比對，
 * 相似者與基準合成一組並標記為已處理。不做遞移合併。
 * <p>
 * 雜湊在執行緒池上平行計算；單一基準的候選很多時，比對也分段平行進行，
 * 標記已處理只在呼叫端執行緒上進行。
 */
@Slf4j
public class PerceptualGroupingEngine {

    public static final String STAGE = "perceptual";

    /** 候選數達到此值才分段平行比對 */
    static final int PARALLEL_MIN_CANDIDATES = 256;

    private final ExecutorService executor;
    private final int parallelism;

    public PerceptualGroupingEngine(ExecutorService executor, int parallelism) {
        this.executor = executor;
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * 以指定策略分組。策略內部的非預期例外轉為 {@link StrategyFailure}，
     * 失敗數超過上限與雜湊長度不符仍直接拋出。
     */
    public StrategyOutcome run(GroupingStrategy strategy, List<String> paths, RunControl control) {
        StrategyKind kind = strategy.kind();
        log.info("開始感知比對 ({})，共 {} 個檔案", kind, paths.size());
        control.log("感知比對策略: " + kind);
        int processed = 0;
        try {
            OrderedBatch.Outcome<ImageRecord> prepared = OrderedBatch.run(executor, STAGE, paths, strategy::prepare, control);
            if (prepared.stopped()) {
                return StrategyOutcome.stopped(kind, List.of(), 0, prepared.failures());
            }
            List<ImageRecord> records = new ArrayList<>(paths.size());
            for (ImageRecord record : prepared.results()) {
                if (record != null) {
                    records.add(record);
                }
            }
            processed = records.size();
            return group(strategy, records, prepared.failures(), control);
        } catch (ProviderUnstableException | HashLengthMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} 策略執行失敗", kind, e);
            return StrategyOutcome.failed(kind, processed, StrategyFailure.of(StrategyFailure.Reason.COMPARISON_FAILED, e));
        } catch (OutOfMemoryError e) {
            log.error("{} 策略記憶體不足", kind, e);
            return StrategyOutcome.failed(kind, processed, StrategyFailure.of(StrategyFailure.Reason.RESOURCE_EXHAUSTED, e));
        }
    }

    private StrategyOutcome group(GroupingStrategy strategy, List<ImageRecord> records, int failures, RunControl control) {
        int n = records.size();
        ConsumedSet consumed = new ConsumedSet(n);
        List<DuplicateGroup> groups = new ArrayList<>();

        for (int i = 0; i < n; i++) {
            if (control.isStopRequested()) {
                log.info("感知比對收到停止要求，已完成 {} 組", groups.size());
                return StrategyOutcome.stopped(strategy.kind(), groups, n, failures);
            }
            if (consumed.isConsumed(i)) {
                continue;
            }
            ImageRecord base = records.get(i);
            List<Integer> candidateIndexes = new ArrayList<>();
            for (int j = i + 1; j < n; j++) {
                if (!consumed.isConsumed(j)) {
                    candidateIndexes.add(j);
                }
            }

            List<PairComparison> comparisons = compareAll(strategy, base, records, candidateIndexes, control);
            if (comparisons == null) {
                // 目前基準的部分結果直接捨棄
                return StrategyOutcome.stopped(strategy.kind(), groups, n, failures);
            }

            List<Match> matches = new ArrayList<>();
            for (int k = 0; k < comparisons.size(); k++) {
                PairComparison comparison = comparisons.get(k);
                if (comparison.similar()) {
                    int j = candidateIndexes.get(k);
                    consumed.consume(j);
                    matches.add(new Match(records.get(j), comparison));
                }
            }
            if (!matches.isEmpty()) {
                consumed.consume(i);
                DuplicateGroup group = strategy.buildGroup(base, matches);
                groups.add(group);
                log.info("{} - 發現相似群組 #{}: {} 個檔案 ({})", base.path(), groups.size(), group.size(), group.reason());
                control.log("發現相似群組 #" + groups.size() + ": " + group.paths());
            }
            control.progress(i + 1, n, base.path());
        }
        log.info("感知比對完成 ({}): {} 組", strategy.kind(), groups.size());
        return StrategyOutcome.completed(strategy.kind(), groups, n, failures);
    }

    /**
     * @return 與候選對齊的比對結果；收到停止要求時回傳 null
     */
    private List<PairComparison> compareAll(GroupingStrategy strategy, ImageRecord base, List<ImageRecord> records,
                                            List<Integer> candidates, RunControl control) {
        if (candidates.size() < PARALLEL_MIN_CANDIDATES || parallelism == 1) {
            return compareChunk(strategy, base, records, candidates, control);
        }

        int chunkSize = (candidates.size() + parallelism - 1) / parallelism;
        List<Callable<List<PairComparison>>> tasks = new ArrayList<>();
        for (int from = 0; from < candidates.size(); from += chunkSize) {
            List<Integer> chunk = candidates.subList(from, Math.min(candidates.size(), from + chunkSize));
            tasks.add(() -> compareChunk(strategy, base, records, chunk, control));
        }

        List<PairComparison> results = new ArrayList<>(candidates.size());
        try {
            for (Future<List<PairComparison>> future : executor.invokeAll(tasks)) {
                List<PairComparison> part = future.get();
                if (part == null) {
                    return null;
                }
                results.addAll(part);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("平行比對被中斷", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("平行比對失敗", cause);
        }
        return results;
    }

    private static List<PairComparison> compareChunk(GroupingStrategy strategy, ImageRecord base, List<ImageRecord> records,
                                                     List<Integer> candidates, RunControl control) {
        List<PairComparison> results = new ArrayList<>(candidates.size());
        for (int k = 0; k < candidates.size(); k++) {
            if (k % RunControl.CHECK_INTERVAL == 0 && control.isStopRequested()) {
                return null;
            }
            results.add(strategy.compare(base, records.get(candidates.get(k))));
        }
        return results;
    }
}
