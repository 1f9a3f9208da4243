package work.pollochang.duplicate.image.stage;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.core.ProviderUnstableException;
import work.pollochang.duplicate.image.core.RunControl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 將每個輸入提交到執行緒池，依輸入順序收集結果。
 * <p>
 * 失敗的項目記錄後以 null 佔位，並計入 {@link ErrorBudget}；
 * 收到停止要求或超過失敗上限時取消尚未完成的任務。
 */
@Slf4j
public final class OrderedBatch {

    private OrderedBatch() {}

    @FunctionalInterface
    public interface Work<T> {
        T apply(String path) throws Exception;
    }

    /**
     * @param results  與輸入對齊的結果，失敗的位置為 null；停止時只有已收集的部分
     * @param failures 失敗數
     * @param stopped  是否因停止要求中斷
     */
    public record Outcome<T>(List<T> results, int failures, boolean stopped) {
    }

    public static <T> Outcome<T> run(ExecutorService executor, String stage, List<String> paths,
                                     Work<T> work, RunControl control) {
        List<Future<T>> futures = new ArrayList<>(paths.size());
        for (String path : paths) {
            futures.add(executor.submit(() -> work.apply(path)));
        }

        ErrorBudget budget = new ErrorBudget(stage, paths.size());
        List<T> results = new ArrayList<>(paths.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                if (control.isStopRequested()) {
                    log.info("{} 階段收到停止要求，已處理 {}/{}", stage, i, paths.size());
                    cancelAll(futures);
                    return new Outcome<>(results, budget.failures(), true);
                }
                String path = paths.get(i);
                try {
                    results.add(futures.get(i).get());
                    budget.recordSuccess();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("{} - {} 階段處理失敗，略過: {}", path, stage, cause.getMessage());
                    log.debug("{} - 失敗原因", path, cause);
                    control.log(path + " - 處理失敗: " + cause.getMessage());
                    results.add(null);
                    budget.recordFailure();
                }
                control.progress(i + 1, paths.size(), path);
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new ProviderUnstableException(stage, budget.processed(), "等待工作時被中斷", e);
        } catch (ProviderUnstableException e) {
            cancelAll(futures);
            throw e;
        }
        return new Outcome<>(results, budget.failures(), false);
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
