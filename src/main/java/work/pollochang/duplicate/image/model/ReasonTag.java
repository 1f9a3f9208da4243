package work.pollochang.duplicate.image.model;

/**
 * 群組成立的原因標籤，可組合。
 */
public enum ReasonTag {
    EXACT_MATCH("exact_match"),
    PURE_COLOR("pure_color"),
    DIFFERENCE_HASH_SIMILAR("difference"),
    AVERAGE_HASH_SIMILAR("average"),
    FREQUENCY_HASH_SIMILAR("frequency"),
    ROTATION_DETECTED("rotation"),
    ENHANCED_DETECTED("enhanced");

    private final String label;

    ReasonTag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
