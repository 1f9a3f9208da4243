package work.pollochang.duplicate.image.core;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 執行中的停止旗標與回報通道，由協調器交給各階段。
 */
public class RunControl {

    /** 內層比對每隔多少次檢查一次停止旗標 */
    public static final int CHECK_INTERVAL = 64;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final ProgressListener progressListener;
    private final Consumer<String> logSink;
    private volatile DetectionState state = DetectionState.IDLE;
    private volatile long stageStartNanos = System.nanoTime();

    public RunControl(ProgressListener progressListener, Consumer<String> logSink) {
        this.progressListener = progressListener == null ? ProgressListener.NONE : progressListener;
        this.logSink = logSink == null ? message -> { } : logSink;
    }

    public static RunControl detached() {
        return new RunControl(null, null);
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public DetectionState state() {
        return state;
    }

    void enter(DetectionState next) {
        this.state = next;
        this.stageStartNanos = System.nanoTime();
    }

    public void progress(int completed, int total, String currentItem) {
        progressListener.onProgress(ProgressEvent.of(state, completed, total, currentItem, stageStartNanos));
    }

    public void log(String message) {
        logSink.accept(message);
    }
}
