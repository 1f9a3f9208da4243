package work.pollochang.duplicate.image.hash;

import org.junit.jupiter.api.Test;
import work.pollochang.duplicate.image.TestImages;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JavaHashProviderTest {

    private final JavaHashProvider provider = new JavaHashProvider();

    private static BufferedImage horizontalRamp(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int g = x * 255 / (width - 1);
                image.setRGB(x, y, (g << 16) | (g << 8) | g);
            }
        }
        return image;
    }

    @Test
    void contentFingerprint_isLowercaseMd5() {
        assertEquals("900150983cd24fb0d6963f7d28e17f72",
                provider.contentFingerprint("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void differenceHash_brighterToTheRightSetsEveryBit() {
        PerceptualHash hash = provider.differenceHash(horizontalRamp(90, 80), 8);

        assertEquals(64, hash.bitLength());
        for (int i = 0; i < 64; i++) {
            assertTrue(hash.bit(i), "bit " + i);
        }
    }

    @Test
    void averageHash_returnsSentinelForSolidImage() {
        PerceptualHash hash = provider.averageHash(TestImages.solid(50, 50, new Color(120, 30, 200)), 8);

        assertTrue(hash.isPureColor());
        assertEquals(64, hash.bitLength());
    }

    @Test
    void frequencyHash_dropsDcTerm() {
        PerceptualHash hash = provider.frequencyHash(TestImages.blocks(1), 8);

        assertEquals(63, hash.bitLength());
    }

    @Test
    void hashes_areStableAcrossResolutions() {
        BufferedImage small = TestImages.blocks(7);
        BufferedImage large = TestImages.blocks(7, 192, 128, 24, 16);

        PerceptualHashes a = provider.perceptualHashes(small, 8, HashProvider.DEFAULT_PURE_COLOR_THRESHOLD);
        PerceptualHashes b = provider.perceptualHashes(large, 8, HashProvider.DEFAULT_PURE_COLOR_THRESHOLD);

        HashDistances d = a.distancesTo(b);
        assertTrue(d.difference() <= 2, "difference " + d);
        assertTrue(d.average() <= 2, "average " + d);
        assertTrue(d.frequency() <= 2, "frequency " + d);
    }

    @Test
    void hashes_separateUnrelatedImages() {
        PerceptualHashes a = provider.perceptualHashes(TestImages.blocks(1), 8, 3.0);
        PerceptualHashes b = provider.perceptualHashes(TestImages.blocks(2), 8, 3.0);

        assertTrue(a.distancesTo(b).sum() > 20, a.distancesTo(b).toString());
    }

    @Test
    void isPureColor_detectsUniformImages() {
        assertTrue(provider.isPureColor(TestImages.solid(200, 150, Color.WHITE), 3.0));
        assertTrue(provider.isPureColor(TestImages.solid(5, 5, Color.BLACK), 3.0));
        assertFalse(provider.isPureColor(TestImages.blocks(3), 3.0));
    }

    @Test
    void isPureColor_toleratesNoiseBelowThreshold() {
        BufferedImage image = TestImages.solid(40, 40, new Color(100, 100, 100));
        for (int y = 0; y < 40; y += 2) {
            for (int x = 0; x < 40; x++) {
                image.setRGB(x, y, new Color(101, 101, 101).getRGB());
            }
        }

        assertTrue(provider.isPureColor(image, 3.0));
        assertFalse(provider.isPureColor(image, 0.1));
    }

    @Test
    void hashing_isDeterministic() {
        BufferedImage image = TestImages.blocks(11);

        assertEquals(provider.perceptualHashes(image, 8, 3.0), provider.perceptualHashes(image, 8, 3.0));
    }
}
