package work.pollochang.duplicate.image.hash;

import java.util.Arrays;
import java.util.Objects;

/**
 * 固定長度的感知雜湊位元串。
 * <p>
 * 另有一個 {@link #pureColor(int)} 標記值，代表平均雜湊在純色圖片上無法產生有意義的位元，
 * 它與任何雜湊 (包含自己) 比較時都視為最大距離，避免純色圖片成為相似群組的基準。
 */
public final class PerceptualHash {

    private static final String PURE_COLOR_MARKER = "pure_color_image";

    private final long[] words;
    private final int bitLength;
    private final boolean pureColor;

    private PerceptualHash(long[] words, int bitLength, boolean pureColor) {
        this.words = words;
        this.bitLength = bitLength;
        this.pureColor = pureColor;
    }

    /**
     * 依布林矩陣 (列優先攤平) 建立雜湊。
     * @param bits 每個位元是否為 1
     * @return 雜湊
     */
    public static PerceptualHash fromBits(boolean[] bits) {
        Objects.requireNonNull(bits, "bits must not be null");
        long[] words = new long[(bits.length + 63) / 64];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                words[i / 64] |= 1L << (i % 64);
            }
        }
        return new PerceptualHash(words, bits.length, false);
    }

    /**
     * 純色標記值。
     * @param nominalBits 同一演算法正常雜湊的位元長度，作為最大距離
     */
    public static PerceptualHash pureColor(int nominalBits) {
        return new PerceptualHash(new long[0], nominalBits, true);
    }

    /**
     * 計算兩個雜湊的漢明距離。
     *
     * @throws HashLengthMismatchException 兩個真實雜湊長度不同時
     */
    public static int hammingDistance(PerceptualHash a, PerceptualHash b) {
        Objects.requireNonNull(a, "a must not be null");
        Objects.requireNonNull(b, "b must not be null");
        if (a.pureColor || b.pureColor) {
            return Math.max(a.bitLength, b.bitLength);
        }
        if (a.bitLength != b.bitLength) {
            throw new HashLengthMismatchException(a.bitLength, b.bitLength);
        }
        int distance = 0;
        for (int i = 0; i < a.words.length; i++) {
            distance += Long.bitCount(a.words[i] ^ b.words[i]);
        }
        return distance;
    }

    public int distanceTo(PerceptualHash other) {
        return hammingDistance(this, other);
    }

    public int bitLength() {
        return bitLength;
    }

    public boolean isPureColor() {
        return pureColor;
    }

    public boolean bit(int index) {
        if (index < 0 || index >= bitLength || pureColor) {
            throw new IndexOutOfBoundsException("bit index " + index + " of " + bitLength);
        }
        return (words[index / 64] & (1L << (index % 64))) != 0;
    }

    /**
     * 以十六進位字串表示，每 4 個位元一個字元 (位元 0 為第一個字元的最高位)。
     * 純色標記輸出固定字串，供快取還原。
     */
    public String toHex() {
        if (pureColor) {
            return PURE_COLOR_MARKER;
        }
        StringBuilder sb = new StringBuilder((bitLength + 3) / 4);
        for (int i = 0; i < bitLength; i += 4) {
            int nibble = 0;
            for (int k = 0; k < 4; k++) {
                nibble <<= 1;
                if (i + k < bitLength && bit(i + k)) {
                    nibble |= 1;
                }
            }
            sb.append(Character.forDigit(nibble, 16));
        }
        return sb.toString();
    }

    /**
     * 還原 {@link #toHex()} 的輸出。
     * @param hex 十六進位字串或純色標記
     * @param bitLength 原始位元長度
     */
    public static PerceptualHash fromHex(String hex, int bitLength) {
        Objects.requireNonNull(hex, "hex must not be null");
        if (PURE_COLOR_MARKER.equals(hex)) {
            return pureColor(bitLength);
        }
        if (hex.length() != (bitLength + 3) / 4) {
            throw new IllegalArgumentException("十六進位長度 " + hex.length() + " 與位元長度 " + bitLength + " 不符");
        }
        boolean[] bits = new boolean[bitLength];
        for (int c = 0; c < hex.length(); c++) {
            int nibble = Character.digit(hex.charAt(c), 16);
            if (nibble < 0) {
                throw new IllegalArgumentException("非十六進位字元: " + hex);
            }
            for (int k = 0; k < 4; k++) {
                int index = c * 4 + k;
                if (index < bitLength) {
                    bits[index] = (nibble & (8 >> k)) != 0;
                }
            }
        }
        return fromBits(bits);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PerceptualHash other)) return false;
        return bitLength == other.bitLength && pureColor == other.pureColor && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(words) + bitLength) + (pureColor ? 1 : 0);
    }

    @Override
    public String toString() {
        return "PerceptualHash[" + toHex() + "]";
    }
}
