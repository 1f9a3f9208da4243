package work.pollochang.duplicate.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.pollochang.duplicate.image.core.DuplicateDetector;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ExecuteTest {

    @Test
    void writesReportsForDirectory(@TempDir Path dir) throws Exception {
        Path images = Files.createDirectories(dir.resolve("images"));
        Path a = TestImages.write(TestImages.blocks(1), images.resolve("a.png"));
        Files.copy(a, images.resolve("b.png"));
        Path out = dir.resolve("out");

        int exit = new CommandLine(new Execute()).execute(images.toString(), "-o", out.toString(), "--threads", "2");

        assertEquals(0, exit);
        List<String> names;
        try (Stream<Path> files = Files.list(out)) {
            names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
        }
        assertEquals(3, names.size());
        assertTrue(names.stream().anyMatch(n -> n.startsWith("duplicates_") && n.endsWith(".csv")));
        assertTrue(names.stream().anyMatch(n -> n.startsWith("duplicates_") && n.endsWith(".json")));
        assertTrue(names.stream().anyMatch(n -> n.startsWith("summary_")));
    }

    @Test
    void usesHashCacheWhenRequested(@TempDir Path dir) throws Exception {
        Path images = Files.createDirectories(dir.resolve("images"));
        TestImages.write(TestImages.blocks(2), images.resolve("a.png"));
        File db = dir.resolve("hash-cache").toFile();

        int exit = new CommandLine(new Execute()).execute(images.toString(),
                "-o", dir.resolve("out").toString(), "--cache-db", db.getPath());

        assertEquals(0, exit);
        assertTrue(Files.exists(dir.resolve("hash-cache.mv.db")));
    }

    @Test
    void missingDirectoryArgumentIsUsageError() {
        assertEquals(2, new CommandLine(new Execute()).execute());
    }

    @Test
    void shutdownHookStopsDetectorAndWaitsForReports() throws Exception {
        DuplicateDetector detector = mock(DuplicateDetector.class);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = Execute.stopOnShutdown(detector, finished, 30);

        hook.start();
        verify(detector, timeout(2000)).stop();
        hook.join(200);
        assertTrue(hook.isAlive());

        finished.countDown();
        hook.join(2000);
        assertFalse(hook.isAlive());
    }

    @Test
    void shutdownHookGivesUpAfterTimeout() throws Exception {
        Thread hook = Execute.stopOnShutdown(mock(DuplicateDetector.class), new CountDownLatch(1), 0);

        hook.start();
        hook.join(2000);

        assertFalse(hook.isAlive());
    }
}
