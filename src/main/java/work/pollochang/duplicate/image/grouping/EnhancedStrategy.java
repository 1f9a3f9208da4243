package work.pollochang.duplicate.image.grouping;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.core.DecodedImage;
import work.pollochang.duplicate.image.core.DetectionConfig;
import work.pollochang.duplicate.image.core.ImageDecoder;
import work.pollochang.duplicate.image.feature.FeatureExtractor;
import work.pollochang.duplicate.image.feature.FeatureVector;
import work.pollochang.duplicate.image.hash.HashDistances;
import work.pollochang.duplicate.image.hash.HashProvider;
import work.pollochang.duplicate.image.hash.PerceptualHashes;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.GroupMember;
import work.pollochang.duplicate.image.model.ImageRecord;
import work.pollochang.duplicate.image.model.ReasonTag;
import work.pollochang.duplicate.image.model.ScaledVariant;
import work.pollochang.duplicate.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 強化比對：每張圖預先計算 角度 x 縮放 x 雜湊邊長 的變體，
 * 所有變體組合中取各演算法的最小距離投票，並以雜湊距離與特徵相似度的綜合分數挑出最佳組合。
 * <p>
 * 判定規則：至少兩種演算法相似，或一種相似且最佳組合的特徵相似度大於 {@value #FEATURE_SIMILAR}；
 * 之後信心度還必須達到 {@link DetectionConfig#confidenceThreshold()}。
 */
@Slf4j
public class EnhancedStrategy extends AbstractHashStrategy {

    static final int[] ANGLES = {0, 90, 180, 270};

    /** 特徵只在 256 像素內計算，變體也不需要更大 */
    static final int WORKING_SIZE = 256;

    static final double FEATURE_SIMILAR = 0.7;

    private static final double SCALE_TOLERANCE = 0.1;

    public EnhancedStrategy(HashProvider hashProvider, ImageDecoder decoder, DetectionConfig config) {
        super(hashProvider, decoder, config);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.ENHANCED;
    }

    @Override
    public ImageRecord prepare(String path) throws Exception {
        try (DecodedImage decoded = decode(path)) {
            BufferedImage working = ImageTools.fitWithin(decoded.image(), WORKING_SIZE);
            List<ScaledVariant> variants = new ArrayList<>(ANGLES.length * config.scales().size() * config.hashSizes().size());
            for (int angle : ANGLES) {
                BufferedImage rotated = ImageTools.rotate(working, angle);
                boolean swap = angle == 90 || angle == 270;
                for (double scale : config.scales()) {
                    BufferedImage scaled = scale == 1.0 ? rotated : ImageTools.resizeImage(rotated, scale);
                    // 以原始尺寸換算變體尺寸，用來判斷解析度是否不同
                    int w = Math.max(1, (int) Math.round((swap ? decoded.originalHeight() : decoded.originalWidth()) * scale));
                    int h = Math.max(1, (int) Math.round((swap ? decoded.originalWidth() : decoded.originalHeight()) * scale));
                    FeatureVector features = FeatureExtractor.extract(scaled);
                    for (int hashSize : config.hashSizes()) {
                        PerceptualHashes hashes = hashProvider.perceptualHashes(scaled, hashSize, config.pureColorThreshold());
                        variants.add(new ScaledVariant(angle, scale, hashSize, w, h, hashes, features));
                    }
                }
            }
            PerceptualHashes original = hashProvider.perceptualHashes(working, config.hashSize(), config.pureColorThreshold());
            return new ImageRecord(path, original, null, variants, FeatureExtractor.extract(working));
        }
    }

    @Override
    public PairComparison compare(ImageRecord base, ImageRecord candidate) {
        HashDistances min = null;
        ScaledVariant bestI = null;
        ScaledVariant bestJ = null;
        HashDistances bestDistances = null;
        double bestScore = Double.MAX_VALUE;
        double bestFeature = 0;
        double w = config.featureWeight();

        for (ScaledVariant vi : base.variants()) {
            for (ScaledVariant vj : candidate.variants()) {
                if (vi.hashSize() != vj.hashSize()) {
                    continue;
                }
                HashDistances d = vi.hashes().distancesTo(vj.hashes());
                double featureSimilarity = vi.features().similarity(vj.features());
                int maxBits = vi.hashSize() * vi.hashSize();
                double score = d.mean() * (1 - w) + (1 - featureSimilarity) * maxBits * w;
                min = d.min(min);
                if (score < bestScore) {
                    bestScore = score;
                    bestI = vi;
                    bestJ = vj;
                    bestDistances = d;
                    bestFeature = featureSimilarity;
                }
            }
        }
        if (bestI == null) {
            return new PairComparison(false, null, Set.of(), null, null, null);
        }

        Set<ReasonTag> agreeing = votes(min, config.enhancedDhashThreshold(), config.enhancedAhashThreshold(),
                config.enhancedPhashThreshold(), true);
        boolean similar = agreeing.size() >= 2 || (!agreeing.isEmpty() && bestFeature > FEATURE_SIMILAR);
        double confidence = confidence(bestDistances, bestFeature, bestI.hashSize() * bestI.hashSize());
        boolean accepted = similar && confidence >= config.confidenceThreshold();
        int rotation = Math.floorMod(bestJ.angle() - bestI.angle(), 360);
        return new PairComparison(accepted, min, agreeing, rotation, detectionType(bestI, bestJ), confidence);
    }

    static double confidence(HashDistances best, double featureSimilarity, int maxBits) {
        double value = 0.7 * (1 - best.mean() / maxBits) + 0.3 * featureSimilarity;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * 例如 {@code rotation 180°+scale 1.3x+resolution change}；沒有任何變換時為 {@code identical}。
     */
    static String detectionType(ScaledVariant a, ScaledVariant b) {
        List<String> parts = new ArrayList<>(3);
        int angle = Math.abs(a.angle() - b.angle());
        if (angle > 180) {
            angle = 360 - angle;
        }
        if (angle > 0) {
            parts.add("rotation " + angle + "°");
        }
        if (Math.abs(a.scale() - b.scale()) > SCALE_TOLERANCE) {
            double ratio = Math.max(a.scale(), b.scale()) / Math.min(a.scale(), b.scale());
            parts.add(String.format(Locale.ROOT, "scale %.1fx", ratio));
        }
        if (a.width() != b.width() || a.height() != b.height()) {
            parts.add("resolution change");
        }
        return parts.isEmpty() ? "identical" : String.join("+", parts);
    }

    @Override
    public DuplicateGroup buildGroup(ImageRecord base, List<Match> matches) {
        List<GroupMember> members = new ArrayList<>(matches.size() + 1);
        members.add(new GroupMember(base.path(), HashDistances.ZERO, 0, null, null));
        Set<ReasonTag> tags = EnumSet.of(ReasonTag.ENHANCED_DETECTED);
        Set<String> types = new LinkedHashSet<>();
        double confidenceSum = 0;
        for (Match match : matches) {
            PairComparison c = match.comparison();
            members.add(new GroupMember(match.record().path(), c.distances(), c.rotationAngle(),
                    c.detectionType(), c.confidence()));
            tags.addAll(c.agreeing());
            types.add(c.detectionType());
            confidenceSum += c.confidence();
        }
        double groupConfidence = confidenceSum / matches.size();
        log.debug("{} - 強化比對群組 {} 個成員，平均信心度 {}", base.path(), members.size(),
                String.format(Locale.ROOT, "%.3f", groupConfidence));
        return new DuplicateGroup(tags, "enhanced(" + String.join("+", types) + ")", members, groupConfidence);
    }
}
