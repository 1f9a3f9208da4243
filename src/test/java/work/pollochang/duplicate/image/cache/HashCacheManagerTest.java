package work.pollochang.duplicate.image.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.duplicate.image.TestImages;
import work.pollochang.duplicate.image.hash.JavaHashProvider;
import work.pollochang.duplicate.image.hash.PerceptualHashes;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HashCacheManagerTest {

    @Test
    void savedEntriesAreLoadedBack(@TempDir Path dir) {
        PerceptualHashes hashes = new JavaHashProvider().perceptualHashes(TestImages.blocks(7), 8, 3.0);
        FileKey withHashes = new FileKey("/images/a.png", 1024, 1_700_000_000_000L);
        FileKey fingerprintOnly = new FileKey("/images/b.png", 2048, 1_700_000_000_001L);
        Map<FileKey, CachedHashes> cache = new HashMap<>();
        cache.put(withHashes, CachedHashes.ofHashes(8, "java", 3.0, hashes).withFingerprint("0123456789abcdef0123456789abcdef"));
        cache.put(fingerprintOnly, CachedHashes.ofFingerprint("fedcba9876543210fedcba9876543210"));

        Path db = dir.resolve("cache");
        try (HashCacheManager manager = new HashCacheManager(db)) {
            manager.initSchema();
            manager.saveAllFromMap(cache);
        }

        Map<FileKey, CachedHashes> loaded;
        try (HashCacheManager manager = new HashCacheManager(db)) {
            manager.initSchema();
            loaded = manager.loadAllToMap();
        }

        assertEquals(2, loaded.size());
        assertEquals(hashes, loaded.get(withHashes).toHashes(8, "java", 3.0).orElseThrow());
        assertEquals("0123456789abcdef0123456789abcdef", loaded.get(withHashes).fingerprint());
        assertEquals("fedcba9876543210fedcba9876543210", loaded.get(fingerprintOnly).fingerprint());
        assertEquals("java", loaded.get(withHashes).provider());
        assertEquals(3.0, loaded.get(withHashes).pureColorThreshold());
        assertTrue(loaded.get(withHashes).toHashes(8, "opencv", 3.0).isEmpty());
        assertTrue(loaded.get(fingerprintOnly).toHashes(8, "java", 3.0).isEmpty());
    }

    @Test
    void changedFileIsADifferentKey(@TempDir Path dir) {
        FileKey original = new FileKey("/images/a.png", 1024, 1L);
        Path db = dir.resolve("cache");
        try (HashCacheManager manager = new HashCacheManager(db)) {
            manager.initSchema();
            manager.saveAllFromMap(Map.of(original, CachedHashes.ofFingerprint("aa")));
            Map<FileKey, CachedHashes> loaded = manager.loadAllToMap();

            assertNull(loaded.get(new FileKey("/images/a.png", 1024, 2L)));
            assertNotNull(loaded.get(original));
        }
    }
}
