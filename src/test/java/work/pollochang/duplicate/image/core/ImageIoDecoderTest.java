package work.pollochang.duplicate.image.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.duplicate.image.TestImages;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageIoDecoderTest {

    @Test
    void decodesAtFullSizeBelowLimit(@TempDir Path dir) throws Exception {
        Path file = TestImages.write(TestImages.blocks(1), dir.resolve("a.png"));

        try (DecodedImage decoded = new ImageIoDecoder().decode(file)) {
            assertEquals(96, decoded.image().getWidth());
            assertEquals(64, decoded.image().getHeight());
            assertEquals(1, decoded.subsampling());
            assertEquals(file, decoded.source());
        }
    }

    @Test
    void subsamplesLargeImagesAndKeepsOriginalDimensions(@TempDir Path dir) throws Exception {
        Path file = TestImages.write(TestImages.blocks(2, 400, 200, 40, 20), dir.resolve("big.png"));

        try (DecodedImage decoded = new ImageIoDecoder(100).decode(file)) {
            assertEquals(4, decoded.subsampling());
            assertEquals(100, decoded.image().getWidth());
            assertEquals(400, decoded.originalWidth());
            assertEquals(200, decoded.originalHeight());
        }
    }

    @Test
    void nonImageFileFails(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("note.png"), "not an image", StandardCharsets.UTF_8);

        DecodeFailureException e = assertThrows(DecodeFailureException.class, () -> new ImageIoDecoder().decode(file));

        assertEquals(file, e.getPath());
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        Path file = dir.resolve("missing.png");

        assertThrows(DecodeFailureException.class, () -> new ImageIoDecoder().decode(file));
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ImageIoDecoder(0));
    }
}
