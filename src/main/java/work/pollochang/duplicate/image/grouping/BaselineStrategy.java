package work.pollochang.duplicate.image.grouping;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.cache.CachedHashes;
import work.pollochang.duplicate.image.cache.FileKey;
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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 單一方向比對：三種雜湊中至少兩種距離小於門檻即視為相似。
 */
@Slf4j
public class BaselineStrategy extends AbstractHashStrategy {

    private final Map<FileKey, CachedHashes> cache;

    /**
     * @param cache 可為 null；提供時沿用未變動檔案的雜湊
     */
    public BaselineStrategy(HashProvider hashProvider, ImageDecoder decoder, DetectionConfig config,
                            Map<FileKey, CachedHashes> cache) {
        super(hashProvider, decoder, config);
        this.cache = cache;
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.BASELINE;
    }

    @Override
    public ImageRecord prepare(String path) throws Exception {
        FileKey key = cache != null ? FileKey.of(Paths.get(path)) : null;
        if (key != null) {
            CachedHashes cached = cache.get(key);
            Optional<PerceptualHashes> hit = cached == null ? Optional.empty() : cached.toHashes(config.hashSize(), hashProvider.name(), config.pureColorThreshold());
            if (hit.isPresent()) {
                log.debug("{} - 使用快取的雜湊", path);
                return ImageRecord.of(path, hit.get());
            }
        }
        PerceptualHashes hashes;
        try (DecodedImage decoded = decode(path)) {
            hashes = hashProvider.perceptualHashes(decoded.image(), config.hashSize(), config.pureColorThreshold());
        }
        if (key != null) {
            cache.merge(key, CachedHashes.ofHashes(config.hashSize(), hashProvider.name(), config.pureColorThreshold(), hashes),
                    CachedHashes::merge);
        }
        return ImageRecord.of(path, hashes);
    }

    @Override
    public PairComparison compare(ImageRecord base, ImageRecord candidate) {
        HashDistances d = base.hashes().distancesTo(candidate.hashes());
        Set<ReasonTag> agreeing = votes(d, config.dhashThreshold(), config.ahashThreshold(), config.phashThreshold(), false);
        return new PairComparison(agreeing.size() >= 2, d, agreeing, null, null, null);
    }

    @Override
    public DuplicateGroup buildGroup(ImageRecord base, List<Match> matches) {
        List<GroupMember> members = new ArrayList<>(matches.size() + 1);
        members.add(GroupMember.withDistances(base.path(), HashDistances.ZERO));
        Set<ReasonTag> tags = EnumSet.noneOf(ReasonTag.class);
        for (Match match : matches) {
            members.add(GroupMember.withDistances(match.record().path(), match.comparison().distances()));
            tags.addAll(match.comparison().agreeing());
        }
        // 原因描述取最後加入的成員
        String reason = joinLabels(matches.get(matches.size() - 1).comparison().agreeing());
        return new DuplicateGroup(tags, reason, members, null);
    }
}
