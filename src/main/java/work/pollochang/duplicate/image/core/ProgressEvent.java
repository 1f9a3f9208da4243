package work.pollochang.duplicate.image.core;

import java.time.Duration;

/**
 * 進度通知。
 *
 * @param state       目前階段
 * @param completed   已完成的項目數
 * @param total       項目總數
 * @param currentItem 正在處理的檔案或比對對象，可能為 null
 * @param eta         預估剩餘時間，無法估計時為 null
 */
public record ProgressEvent(DetectionState state, int completed, int total, String currentItem, Duration eta) {

    public double percentage() {
        return total <= 0 ? 100.0 : 100.0 * completed / total;
    }

    static ProgressEvent of(DetectionState state, int completed, int total, String currentItem, long startNanos) {
        Duration eta = null;
        if (completed > 0 && total > completed) {
            long elapsed = System.nanoTime() - startNanos;
            eta = Duration.ofNanos(elapsed / completed * (total - completed));
        }
        return new ProgressEvent(state, completed, total, currentItem, eta);
    }
}
