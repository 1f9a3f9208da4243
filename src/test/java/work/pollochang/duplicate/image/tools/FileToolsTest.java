package work.pollochang.duplicate.image.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @Test
    void scanImages_filtersByExtensionAndSorts(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("b.PNG"), "x");
        Files.writeString(dir.resolve("a.jpg"), "x");
        Files.writeString(dir.resolve("notes.txt"), "x");
        Files.createDirectories(dir.resolve("sub"));
        Files.writeString(dir.resolve("sub/c.webp"), "x");

        List<String> flat = FileTools.scanImages(dir, false);
        List<String> deep = FileTools.scanImages(dir, true);

        assertEquals(List.of(
                dir.resolve("a.jpg").toAbsolutePath().normalize().toString(),
                dir.resolve("b.PNG").toAbsolutePath().normalize().toString()), flat);
        assertEquals(3, deep.size());
        assertTrue(deep.get(2).endsWith("c.webp"));
    }

    @Test
    void scanImages_rejectsNonDirectory(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("a.png"), "x");

        assertThrows(IOException.class, () -> FileTools.scanImages(file, true));
    }

    @Test
    void formatFileSize_usesBinaryUnits() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("1 KB", FileTools.formatFileSize(1024));
        assertEquals("512 B", FileTools.formatFileSize(512));
    }
}
