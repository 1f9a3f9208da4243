package work.pollochang.duplicate.image.hash;

/**
 * 三種感知雜湊的漢明距離。
 */
public record HashDistances(int difference, int average, int frequency) {

    /** 群組基準圖對自己的距離 */
    public static final HashDistances ZERO = new HashDistances(0, 0, 0);

    public int sum() {
        return difference + average + frequency;
    }

    /**
     * 三種距離的平均值。
     */
    public double mean() {
        return sum() / 3.0;
    }

    /**
     * 逐項取最小值。
     */
    public HashDistances min(HashDistances other) {
        if (other == null) {
            return this;
        }
        return new HashDistances(
                Math.min(difference, other.difference),
                Math.min(average, other.average),
                Math.min(frequency, other.frequency)
        );
    }
}
