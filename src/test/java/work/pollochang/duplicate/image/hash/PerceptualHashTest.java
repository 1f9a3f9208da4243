package work.pollochang.duplicate.image.hash;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PerceptualHashTest {

    private static boolean[] pattern(int length, int every) {
        boolean[] bits = new boolean[length];
        for (int i = 0; i < length; i += every) {
            bits[i] = true;
        }
        return bits;
    }

    @Test
    void hammingDistance_countsDifferingBits() {
        boolean[] a = new boolean[64];
        boolean[] b = new boolean[64];
        b[0] = true;
        b[63] = true;
        b[31] = true;

        assertEquals(3, PerceptualHash.hammingDistance(PerceptualHash.fromBits(a), PerceptualHash.fromBits(b)));
        assertEquals(0, PerceptualHash.fromBits(b).distanceTo(PerceptualHash.fromBits(b.clone())));
    }

    @Test
    void hammingDistance_isSymmetric() {
        PerceptualHash a = PerceptualHash.fromBits(pattern(64, 3));
        PerceptualHash b = PerceptualHash.fromBits(pattern(64, 5));

        assertEquals(a.distanceTo(b), b.distanceTo(a));
    }

    @Test
    void pureColorSentinel_isAlwaysMaximallyDistant() {
        PerceptualHash sentinel = PerceptualHash.pureColor(64);
        PerceptualHash real = PerceptualHash.fromBits(pattern(64, 2));

        assertEquals(64, sentinel.distanceTo(real));
        assertEquals(64, real.distanceTo(sentinel));
        // 與自己比較也是最大距離，純色圖片不會靠平均雜湊湊成群組
        assertEquals(64, sentinel.distanceTo(PerceptualHash.pureColor(64)));
    }

    @Test
    void hammingDistance_rejectsDifferentLengths() {
        PerceptualHash a = PerceptualHash.fromBits(new boolean[64]);
        PerceptualHash b = PerceptualHash.fromBits(new boolean[63]);

        assertThrows(HashLengthMismatchException.class, () -> a.distanceTo(b));
    }

    @Test
    void hex_restoresOddLengthHash() {
        PerceptualHash original = PerceptualHash.fromBits(pattern(63, 4));

        PerceptualHash restored = PerceptualHash.fromHex(original.toHex(), 63);

        assertEquals(16, original.toHex().length());
        assertEquals(original, restored);
        assertTrue(PerceptualHash.fromHex("pure_color_image", 64).isPureColor());
    }

    @Test
    void hex_rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> PerceptualHash.fromHex("abc", 64));
    }
}
