package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.core.DecodedImage;
import work.pollochang.duplicate.image.core.DetectionConfig;
import work.pollochang.duplicate.image.core.ImageDecoder;
import work.pollochang.duplicate.image.hash.HashDistances;
import work.pollochang.duplicate.image.hash.HashProvider;
import work.pollochang.duplicate.image.hash.PerceptualHashes;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.GroupMember;
import work.pollochang.duplicate.image.model.ImageRecord;
import work.pollochang.duplicate.image.model.ReasonTag;
import work.pollochang.duplicate.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 考慮 0、90、180、270 度旋轉的比對。16 種角度組合中各演算法取最小距離後投票。
 */
public class RotationInvariantStrategy extends AbstractHashStrategy {

    static final int[] ANGLES = {0, 90, 180, 270};

    /** 旋轉前先縮小，雜湊只需要很小的縮圖 */
    static final int WORKING_SIZE = 512;

    static final String ROTATION_SUFFIX = " (rotation detected)";

    public RotationInvariantStrategy(HashProvider hashProvider, ImageDecoder decoder, DetectionConfig config) {
        super(hashProvider, decoder, config);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.ROTATION;
    }

    @Override
    public ImageRecord prepare(String path) throws Exception {
        try (DecodedImage decoded = decode(path)) {
            BufferedImage working = ImageTools.fitWithin(decoded.image(), WORKING_SIZE);
            Map<Integer, PerceptualHashes> rotated = new HashMap<>();
            for (int angle : ANGLES) {
                rotated.put(angle, hashProvider.perceptualHashes(ImageTools.rotate(working, angle),
                        config.hashSize(), config.pureColorThreshold()));
            }
            return new ImageRecord(path, rotated.get(0), rotated, null, null);
        }
    }

    @Override
    public PairComparison compare(ImageRecord base, ImageRecord candidate) {
        HashDistances min = null;
        int bestSum = Integer.MAX_VALUE;
        int bestAngle = 0;
        for (int angleI : ANGLES) {
            PerceptualHashes hi = base.rotatedHashes().get(angleI);
            for (int angleJ : ANGLES) {
                HashDistances d = hi.distancesTo(candidate.rotatedHashes().get(angleJ));
                min = d.min(min);
                if (d.sum() < bestSum) {
                    bestSum = d.sum();
                    bestAngle = Math.floorMod(angleJ - angleI, 360);
                }
            }
        }
        Set<ReasonTag> agreeing = votes(min, config.dhashThreshold(), config.ahashThreshold(), config.phashThreshold(), false);
        return new PairComparison(agreeing.size() >= 2, min, agreeing, bestAngle, null, null);
    }

    @Override
    public DuplicateGroup buildGroup(ImageRecord base, List<Match> matches) {
        List<GroupMember> members = new ArrayList<>(matches.size() + 1);
        members.add(new GroupMember(base.path(), HashDistances.ZERO, 0, null, null));
        Set<ReasonTag> agreeing = EnumSet.noneOf(ReasonTag.class);
        for (Match match : matches) {
            PairComparison c = match.comparison();
            members.add(new GroupMember(match.record().path(), c.distances(), c.rotationAngle(), null, null));
            agreeing.addAll(c.agreeing());
        }
        Set<ReasonTag> tags = EnumSet.copyOf(agreeing);
        tags.add(ReasonTag.ROTATION_DETECTED);
        return new DuplicateGroup(tags, joinLabels(agreeing) + ROTATION_SUFFIX, members, null);
    }
}
