package work.pollochang.duplicate.image.stage;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.duplicate.image.cache.CachedHashes;
import work.pollochang.duplicate.image.cache.FileKey;
import work.pollochang.duplicate.image.core.RunControl;
import work.pollochang.duplicate.image.hash.HashProvider;
import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.GroupMember;
import work.pollochang.duplicate.image.model.ReasonTag;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * 以檔案內容的 MD5 找出完全相同的檔案。
 * 每組只保留第一個檔案進入後續階段，其餘視為已處理。
 */
@Slf4j
public class ExactMatchStage {

    public static final String NAME = "exact-match";

    private final HashProvider hashProvider;
    private final ExecutorService executor;
    private final Map<FileKey, CachedHashes> cache;

    /**
     * @param cache 可為 null；提供時以檔案大小與修改時間判斷是否沿用既有指紋
     */
    public ExactMatchStage(HashProvider hashProvider, ExecutorService executor, Map<FileKey, CachedHashes> cache) {
        this.hashProvider = hashProvider;
        this.executor = executor;
        this.cache = cache;
    }

    public StageResult run(List<String> paths, RunControl control) {
        OrderedBatch.Outcome<String> outcome = OrderedBatch.run(executor, NAME, paths, this::fingerprint, control);
        if (outcome.stopped()) {
            return StageResult.stopped(paths, outcome.failures());
        }

        Map<String, List<String>> byFingerprint = new LinkedHashMap<>();
        for (int i = 0; i < paths.size(); i++) {
            String fingerprint = outcome.results().get(i);
            if (fingerprint != null) {
                byFingerprint.computeIfAbsent(fingerprint, k -> new ArrayList<>()).add(paths.get(i));
            }
        }

        List<DuplicateGroup> groups = new ArrayList<>();
        List<String> survivors = new ArrayList<>();
        for (List<String> same : byFingerprint.values()) {
            survivors.add(same.get(0));
            if (same.size() >= 2) {
                List<GroupMember> members = same.stream().map(GroupMember::of).toList();
                groups.add(new DuplicateGroup(ReasonTag.EXACT_MATCH, ReasonTag.EXACT_MATCH.label(), members));
            }
        }
        // 依輸入順序排列倖存者
        List<String> ordered = new ArrayList<>(survivors.size());
        Set<String> keep = new HashSet<>(survivors);
        for (String path : paths) {
            if (keep.remove(path)) {
                ordered.add(path);
            }
        }

        log.info("完全相同檢查完成: {} 組，{} 個檔案進入下一階段，{} 個失敗", groups.size(), ordered.size(), outcome.failures());
        return new StageResult(groups, ordered, outcome.failures(), 0, false);
    }

    private String fingerprint(String pathString) throws Exception {
        Path path = Paths.get(pathString);
        FileKey key = cache != null ? FileKey.of(path) : null;
        if (key != null) {
            CachedHashes cached = cache.get(key);
            if (cached != null && cached.fingerprint() != null) {
                return cached.fingerprint();
            }
        }
        String fingerprint = hashProvider.contentFingerprint(Files.readAllBytes(path));
        if (key != null) {
            cache.merge(key, CachedHashes.ofFingerprint(fingerprint), CachedHashes::merge);
        }
        return fingerprint;
    }
}
