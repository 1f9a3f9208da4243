package work.pollochang.duplicate.image.hash;

import lombok.extern.slf4j.Slf4j;
import nu.pattern.OpenCV;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Objects;

/**
 * 使用 OpenCV 原生函式庫的雜湊實作。
 * <p>
 * 縮放採用 {@link Imgproc#INTER_AREA}，DCT 使用 {@link Core#dct(Mat, Mat)}，
 * 與 {@link JavaHashProvider} 的演算法一致，但數值細節 (捨入、DCT 正規化) 不保證位元完全相同，
 * 因此同一次執行中只能使用同一個提供者。
 */
@Slf4j
public class OpenCvHashProvider implements HashProvider {

    private static volatile boolean loaded;

    private OpenCvHashProvider() {}

    /**
     * 載入原生函式庫並建立提供者。
     * @throws UnsatisfiedLinkError 平台沒有可用的原生函式庫時
     */
    public static synchronized OpenCvHashProvider load() {
        if (!loaded) {
            OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV 原生函式庫已載入: {}", Core.VERSION);
        }
        return new OpenCvHashProvider();
    }

    @Override
    public String name() {
        return "opencv";
    }

    @Override
    public PerceptualHash differenceHash(BufferedImage image, int hashSize) {
        double[][] pixels = grayscale(image, hashSize + 1, hashSize);
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
        Mat gray = toGray(image);
        Mat small = new Mat();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        try {
            Imgproc.resize(gray, small, new Size(hashSize, hashSize), 0, 0, Imgproc.INTER_AREA);
            Core.meanStdDev(small, mean, std);
            if (std.toArray()[0] < pureColorThreshold) {
                return PerceptualHash.pureColor(hashSize * hashSize);
            }
            double avg = mean.toArray()[0];
            boolean[] bits = new boolean[hashSize * hashSize];
            for (int y = 0; y < hashSize; y++) {
                for (int x = 0; x < hashSize; x++) {
                    bits[y * hashSize + x] = small.get(y, x)[0] > avg;
                }
            }
            return PerceptualHash.fromBits(bits);
        } finally {
            gray.release();
            small.release();
            mean.release();
            std.release();
        }
    }

    @Override
    public PerceptualHash frequencyHash(BufferedImage image, int hashSize) {
        int size = hashSize * 4;
        Mat gray = toGray(image);
        Mat small = new Mat();
        Mat floats = new Mat();
        Mat dct = new Mat();
        try {
            Imgproc.resize(gray, small, new Size(size, size), 0, 0, Imgproc.INTER_AREA);
            small.convertTo(floats, CvType.CV_32F);
            Core.dct(floats, dct);
            double[] coefficients = new double[hashSize * hashSize - 1];
            int k = 0;
            for (int u = 0; u < hashSize; u++) {
                for (int v = 0; v < hashSize; v++) {
                    if (u == 0 && v == 0) {
                        continue;
                    }
                    coefficients[k++] = dct.get(u, v)[0];
                }
            }
            return JavaHashProvider.FrequencyBits.aboveMedian(coefficients);
        } finally {
            gray.release();
            small.release();
            floats.release();
            dct.release();
        }
    }

    @Override
    public boolean isPureColor(BufferedImage image, double threshold) {
        // 原生實作直接統計全部像素，樣本數必然不少於 100
        Mat bgr = toBgr(image);
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble std = new MatOfDouble();
        try {
            Core.meanStdDev(bgr, mean, std);
            double[] values = std.toArray();
            return values[0] < threshold && values[1] < threshold && values[2] < threshold;
        } finally {
            bgr.release();
            mean.release();
            std.release();
        }
    }

    private static double[][] grayscale(BufferedImage image, int width, int height) {
        Mat gray = toGray(image);
        Mat small = new Mat();
        try {
            Imgproc.resize(gray, small, new Size(width, height), 0, 0, Imgproc.INTER_AREA);
            double[][] matrix = new double[height][width];
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    matrix[y][x] = small.get(y, x)[0];
                }
            }
            return matrix;
        } finally {
            gray.release();
            small.release();
        }
    }

    private static Mat toGray(BufferedImage image) {
        Mat bgr = toBgr(image);
        Mat gray = new Mat();
        try {
            Imgproc.cvtColor(bgr, gray, Imgproc.COLOR_BGR2GRAY);
            return gray;
        } finally {
            bgr.release();
        }
    }

    private static Mat toBgr(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        BufferedImage bgrImage = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = bgrImage.createGraphics();
            try {
                g.setPaint(Color.WHITE);
                g.fillRect(0, 0, image.getWidth(), image.getHeight());
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        byte[] data = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(bgrImage.getHeight(), bgrImage.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, data);
        return mat;
    }
}
