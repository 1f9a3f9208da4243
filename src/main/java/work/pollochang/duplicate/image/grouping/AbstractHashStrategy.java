package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.core.DecodedImage;
import work.pollochang.duplicate.image.core.DecodeFailureException;
import work.pollochang.duplicate.image.core.DetectionConfig;
import work.pollochang.duplicate.image.core.ImageDecoder;
import work.pollochang.duplicate.image.hash.HashDistances;
import work.pollochang.duplicate.image.hash.HashProvider;
import work.pollochang.duplicate.image.model.ReasonTag;

import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Set;

/**
 * 三種策略共用的解碼與投票邏輯。
 */
abstract class AbstractHashStrategy implements GroupingStrategy {

    protected final HashProvider hashProvider;
    protected final ImageDecoder decoder;
    protected final DetectionConfig config;

    protected AbstractHashStrategy(HashProvider hashProvider, ImageDecoder decoder, DetectionConfig config) {
        this.hashProvider = hashProvider;
        this.decoder = decoder;
        this.config = config;
    }

    protected DecodedImage decode(String path) throws DecodeFailureException {
        return decoder.decode(Paths.get(path));
    }

    /**
     * 判定相似的演算法。
     * @param inclusive true 時距離等於門檻也算相似 (強化模式)，否則必須小於門檻
     */
    static Set<ReasonTag> votes(HashDistances d, int dhash, int ahash, int phash, boolean inclusive) {
        Set<ReasonTag> agreeing = EnumSet.noneOf(ReasonTag.class);
        if (within(d.difference(), dhash, inclusive)) {
            agreeing.add(ReasonTag.DIFFERENCE_HASH_SIMILAR);
        }
        if (within(d.average(), ahash, inclusive)) {
            agreeing.add(ReasonTag.AVERAGE_HASH_SIMILAR);
        }
        if (within(d.frequency(), phash, inclusive)) {
            agreeing.add(ReasonTag.FREQUENCY_HASH_SIMILAR);
        }
        return agreeing;
    }

    private static boolean within(int distance, int threshold, boolean inclusive) {
        return inclusive ? distance <= threshold : distance < threshold;
    }

    /**
     * 依列舉順序以 "+" 串接演算法名稱，例如 {@code difference+average}。
     */
    static String joinLabels(Set<ReasonTag> tags) {
        StringBuilder sb = new StringBuilder();
        for (ReasonTag tag : EnumSet.copyOf(tags)) {
            if (sb.length() > 0) {
                sb.append('+');
            }
            sb.append(tag.label());
        }
        return sb.toString();
    }
}
