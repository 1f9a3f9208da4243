package work.pollochang.duplicate.image.feature;

import work.pollochang.duplicate.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 計算 {@link FeatureVector}。
 * <p>
 * 除了寬高比以外，其餘特徵都在最長邊不超過 {@value #WORKING_SIZE} 像素的灰階副本上計算，
 * 同一張圖的不同解析度版本會得到接近的數值。
 */
public final class FeatureExtractor {

    static final int WORKING_SIZE = 256;

    private FeatureExtractor() {}

    public static FeatureVector extract(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        double aspectRatio = (double) image.getWidth() / image.getHeight();

        BufferedImage working = ImageTools.fitWithin(image, WORKING_SIZE);
        int w = working.getWidth();
        int h = working.getHeight();
        double[][] gray = ImageTools.grayscaleMatrix(working, w, h);

        double sum = 0;
        int[] histogram = new int[256];
        for (double[] row : gray) {
            for (double v : row) {
                sum += v;
                histogram[(int) Math.max(0, Math.min(255, Math.round(v)))]++;
            }
        }
        int n = w * h;
        double mean = sum / n;

        double sq = 0;
        for (double[] row : gray) {
            for (double v : row) {
                sq += (v - mean) * (v - mean);
            }
        }
        double contrast = Math.sqrt(sq / n);

        double entropy = 0;
        for (int count : histogram) {
            if (count > 0) {
                double p = (double) count / n;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }

        return new FeatureVector(aspectRatio, mean, contrast, entropy, sobelMean(gray, w, h));
    }

    private static double sobelMean(double[][] g, int w, int h) {
        if (w < 3 || h < 3) {
            return 0;
        }
        double total = 0;
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                double gx = (g[y - 1][x + 1] + 2 * g[y][x + 1] + g[y + 1][x + 1])
                        - (g[y - 1][x - 1] + 2 * g[y][x - 1] + g[y + 1][x - 1]);
                double gy = (g[y + 1][x - 1] + 2 * g[y + 1][x] + g[y + 1][x + 1])
                        - (g[y - 1][x - 1] + 2 * g[y - 1][x] + g[y - 1][x + 1]);
                total += Math.sqrt(gx * gx + gy * gy);
            }
        }
        return total / ((double) (w - 2) * (h - 2));
    }
}
