package work.pollochang.duplicate.image.grouping;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.duplicate.image.TestImages;
import work.pollochang.duplicate.image.core.DetectionConfig;
import work.pollochang.duplicate.image.core.ImageIoDecoder;
import work.pollochang.duplicate.image.hash.HashDistances;
import work.pollochang.duplicate.image.hash.JavaHashProvider;
import work.pollochang.duplicate.image.model.ImageRecord;
import work.pollochang.duplicate.image.model.ScaledVariant;
import work.pollochang.duplicate.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EnhancedStrategyTest {

    private final EnhancedStrategy strategy =
            new EnhancedStrategy(new JavaHashProvider(), new ImageIoDecoder(), DetectionConfig.defaults());

    private static ScaledVariant variant(int angle, double scale, int width, int height) {
        return new ScaledVariant(angle, scale, 8, width, height, null, null);
    }

    @Test
    void detectionType_describesRotationScaleAndResolution() {
        assertEquals("identical", EnhancedStrategy.detectionType(variant(0, 1.0, 10, 10), variant(0, 1.0, 10, 10)));
        assertEquals("rotation 90°", EnhancedStrategy.detectionType(variant(0, 1.0, 10, 10), variant(270, 1.0, 10, 10)));
        assertEquals("rotation 180°+scale 1.3x+resolution change",
                EnhancedStrategy.detectionType(variant(180, 1.0, 100, 80), variant(0, 0.75, 97, 78)));
    }

    @Test
    void confidence_isClampedBlendOfHashAndFeatures() {
        assertEquals(1.0, EnhancedStrategy.confidence(HashDistances.ZERO, 1.0, 64), 1e-9);
        assertEquals(0.7 * (1 - 6 / 3.0 / 64) + 0.3 * 0.5,
                EnhancedStrategy.confidence(new HashDistances(2, 2, 2), 0.5, 64), 1e-9);
        assertEquals(0.0, EnhancedStrategy.confidence(new HashDistances(200, 200, 200), 0.0, 64), 1e-9);
    }

    @Test
    void prepareBuildsEveryAngleScaleVariant(@TempDir Path dir) throws Exception {
        String a = TestImages.write(TestImages.blocks(31), dir.resolve("a.png")).toString();

        ImageRecord record = strategy.prepare(a);

        assertEquals(12, record.variants().size());
        assertNotNull(record.features());
        ScaledVariant quarter = record.variants().stream()
                .filter(v -> v.angle() == 90 && v.scale() == 1.0).findFirst().orElseThrow();
        assertEquals(64, quarter.width());
        assertEquals(96, quarter.height());
    }

    @Test
    void rotatedAndRescaledCopyIsAccepted(@TempDir Path dir) throws Exception {
        BufferedImage original = TestImages.blocks(33);
        BufferedImage changed = ImageTools.rotate(ImageTools.resizeImage(original, 1.3), 180);
        String a = TestImages.write(original, dir.resolve("a.png")).toString();
        String c = TestImages.write(changed, dir.resolve("c.png")).toString();

        PairComparison comparison = strategy.compare(strategy.prepare(a), strategy.prepare(c));

        assertTrue(comparison.similar());
        assertTrue(comparison.confidence() >= 0.6, "confidence " + comparison.confidence());
        assertTrue(comparison.detectionType().contains("rotation 180°"), comparison.detectionType());
    }

    @Test
    void unrelatedImagesAreRejected(@TempDir Path dir) throws Exception {
        String a = TestImages.write(TestImages.blocks(33), dir.resolve("a.png")).toString();
        String b = TestImages.write(TestImages.blocks(34), dir.resolve("b.png")).toString();

        assertFalse(strategy.compare(strategy.prepare(a), strategy.prepare(b)).similar());
    }
}
