package work.pollochang.duplicate.image.hash;

/**
 * 同一張圖 (或同一個變體) 的三種感知雜湊。
 * @param difference 差值雜湊 (dHash)
 * @param average 平均雜湊 (aHash)，純色時為標記值
 * @param frequency 頻域雜湊 (pHash)
 */
public record PerceptualHashes(PerceptualHash difference, PerceptualHash average, PerceptualHash frequency) {

    public HashDistances distancesTo(PerceptualHashes other) {
        return new HashDistances(
                difference.distanceTo(other.difference),
                average.distanceTo(other.average),
                frequency.distanceTo(other.frequency)
        );
    }
}
