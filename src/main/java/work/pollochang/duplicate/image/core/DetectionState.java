package work.pollochang.duplicate.image.core;

public enum DetectionState {
    IDLE,
    SCANNING_EXACT_MATCH,
    SCANNING_PURE_COLOR,
    SCANNING_PERCEPTUAL,
    DONE,
    STOPPED;

    public boolean isScanning() {
        return this == SCANNING_EXACT_MATCH || this == SCANNING_PURE_COLOR || this == SCANNING_PERCEPTUAL;
    }
}
