package work.pollochang.duplicate.image.hash;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static work.pollochang.duplicate.image.tools.ImageTools.grayscaleMatrix;

/**
 * 純 Java 的雜湊實作，只依賴 Java2D。
 *
 * <p>DCT 採用預先計算的餘弦表，每個 hashSize 的表在第一次使用時建立並快取。</p>
 */
public class JavaHashProvider implements HashProvider {

    private static final int MIN_PURE_COLOR_SAMPLES = 100;

    private final ConcurrentMap<Integer, double[][]> cosineTables = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return "java";
    }

    @Override
    public PerceptualHash differenceHash(BufferedImage image, int hashSize) {
        Objects.requireNonNull(image, "image must not be null");
        double[][] pixels = grayscaleMatrix(image, hashSize + 1, hashSize);
        boolean[] bits = new boolean[hashSize * hashSize];
        for (int y = 0; y < hashSize; y++) {
            for (int x = 0; x < hashSize; x++) {
                bits[y * hashSize + x] = pixels[y][x + 1] > pixels[y][x];
            }
        }
        return PerceptualHash.fromBits(bits);
    }

    @Override
    public PerceptualHash averageHash(BufferedImage image, int hashSize, double pureColorThreshold) {
        Objects.requireNonNull(image, "image must not be null");
        double[][] pixels = grayscaleMatrix(image, hashSize, hashSize);
        double sum = 0;
        for (double[] row : pixels) {
            for (double v : row) {
                sum += v;
            }
        }
        double mean = sum / (hashSize * hashSize);
        if (standardDeviation(pixels, mean) < pureColorThreshold) {
            return PerceptualHash.pureColor(hashSize * hashSize);
        }
        boolean[] bits = new boolean[hashSize * hashSize];
        for (int y = 0; y < hashSize; y++) {
            for (int x = 0; x < hashSize; x++) {
                bits[y * hashSize + x] = pixels[y][x] > mean;
            }
        }
        return PerceptualHash.fromBits(bits);
    }

    @Override
    public PerceptualHash frequencyHash(BufferedImage image, int hashSize) {
        Objects.requireNonNull(image, "image must not be null");
        int size = hashSize * 4;
        double[][] pixels = grayscaleMatrix(image, size, size);
        double[][] cosines = cosineTable(size, hashSize);

        // 只計算左上 hashSize x hashSize 的低頻係數
        double[] coefficients = new double[hashSize * hashSize - 1];
        int k = 0;
        for (int u = 0; u < hashSize; u++) {
            for (int v = 0; v < hashSize; v++) {
                if (u == 0 && v == 0) {
                    continue;
                }
                double sum = 0;
                for (int y = 0; y < size; y++) {
                    double cy = cosines[u][y];
                    double[] row = pixels[y];
                    for (int x = 0; x < size; x++) {
                        sum += cy * cosines[v][x] * row[x];
                    }
                }
                coefficients[k++] = sum;
            }
        }
        return FrequencyBits.aboveMedian(coefficients);
    }

    @Override
    public boolean isPureColor(BufferedImage image, double threshold) {
        Objects.requireNonNull(image, "image must not be null");
        int width = image.getWidth();
        int height = image.getHeight();
        long pixelCount = (long) width * height;

        int[] samples;
        if (pixelCount <= MIN_PURE_COLOR_SAMPLES) {
            samples = image.getRGB(0, 0, width, height, null, 0, width);
        } else {
            // 固定種子，同一張圖每次取樣結果相同
            Random random = new Random(31L * width + height);
            samples = new int[MIN_PURE_COLOR_SAMPLES];
            for (int i = 0; i < samples.length; i++) {
                samples[i] = image.getRGB(random.nextInt(width), random.nextInt(height));
            }
        }
        return ChannelStatistics.of(samples).allBelow(threshold);
    }

    private double[][] cosineTable(int size, int hashSize) {
        return cosineTables.computeIfAbsent(hashSize, key -> {
            double[][] table = new double[hashSize][size];
            for (int u = 0; u < hashSize; u++) {
                for (int x = 0; x < size; x++) {
                    table[u][x] = Math.cos(((2 * x + 1) * u * Math.PI) / (2.0 * size));
                }
            }
            return table;
        });
    }

    private static double standardDeviation(double[][] pixels, double mean) {
        double sq = 0;
        int count = 0;
        for (double[] row : pixels) {
            for (double v : row) {
                sq += (v - mean) * (v - mean);
                count++;
            }
        }
        return Math.sqrt(sq / count);
    }

    /**
     * 頻域係數與中位數比較後的位元，兩種實作共用。
     */
    static final class FrequencyBits {

        private FrequencyBits() {}

        static PerceptualHash aboveMedian(double[] coefficients) {
            double[] sorted = Arrays.copyOf(coefficients, coefficients.length);
            Arrays.sort(sorted);
            int n = sorted.length;
            double median = (n % 2 == 1) ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
            boolean[] bits = new boolean[n];
            for (int i = 0; i < n; i++) {
                bits[i] = coefficients[i] > median;
            }
            return PerceptualHash.fromBits(bits);
        }
    }
}
