package work.pollochang.duplicate.image.cache;

import work.pollochang.duplicate.image.hash.PerceptualHash;
import work.pollochang.duplicate.image.hash.PerceptualHashes;

import java.util.Objects;
import java.util.Optional;

/**
 * 快取的雜湊值，以十六進位字串保存。尚未計算的欄位為 null。
 * <p>
 * 感知雜湊只在雜湊邊長、提供者與純色門檻都相同時才能沿用。
 *
 * @param provider           計算感知雜湊的提供者名稱，例如 {@code java}
 * @param pureColorThreshold 計算平均雜湊時使用的純色門檻
 */
public record CachedHashes(String fingerprint, int hashSize, String provider, double pureColorThreshold,
                           String difference, String average, String frequency) {

    public static CachedHashes ofFingerprint(String fingerprint) {
        return new CachedHashes(fingerprint, 0, null, 0, null, null, null);
    }

    public static CachedHashes ofHashes(int hashSize, String provider, double pureColorThreshold,
                                        PerceptualHashes hashes) {
        return ofFingerprint(null).withHashes(hashSize, provider, pureColorThreshold, hashes);
    }

    public CachedHashes withFingerprint(String value) {
        return new CachedHashes(value, hashSize, provider, pureColorThreshold, difference, average, frequency);
    }

    public CachedHashes withHashes(int size, String providerName, double threshold, PerceptualHashes hashes) {
        return new CachedHashes(fingerprint, size, providerName, threshold, hashes.difference().toHex(),
                hashes.average().toHex(), hashes.frequency().toHex());
    }

    /**
     * 還原感知雜湊；邊長、提供者或純色門檻不同，或尚未計算時回傳空值。
     */
    public Optional<PerceptualHashes> toHashes(int size, String providerName, double threshold) {
        if (size != hashSize || !Objects.equals(provider, providerName)
                || Double.compare(pureColorThreshold, threshold) != 0
                || difference == null || average == null || frequency == null) {
            return Optional.empty();
        }
        int bits = size * size;
        try {
            return Optional.of(new PerceptualHashes(
                    PerceptualHash.fromHex(difference, bits),
                    PerceptualHash.fromHex(average, bits),
                    PerceptualHash.fromHex(frequency, bits - 1)));
        } catch (IllegalArgumentException e) {
            // 損毀的紀錄當作未命中，重新計算後會被覆寫
            return Optional.empty();
        }
    }

    /**
     * 合併兩筆紀錄，{@code update} 中非空的欄位優先。
     */
    public static CachedHashes merge(CachedHashes current, CachedHashes update) {
        if (current == null) {
            return update;
        }
        String fp = update.fingerprint != null ? update.fingerprint : current.fingerprint;
        if (update.difference != null) {
            return update.withFingerprint(fp);
        }
        return current.withFingerprint(fp);
    }
}
