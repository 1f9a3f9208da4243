package work.pollochang.duplicate.image.hash;

import java.awt.image.BufferedImage;

/**
 * 雜湊計算提供者。
 * <p>
 * 呼叫端只依賴這個介面；目前有純 Java 實作 {@link JavaHashProvider}
 * 與使用 OpenCV 原生函式庫加速的 {@link OpenCvHashProvider}。
 * 實作必須能在多執行緒下對不同圖片同時呼叫。
 */
public interface HashProvider {

    /** 純色判斷的預設標準差門檻 (0-255) */
    double DEFAULT_PURE_COLOR_THRESHOLD = 3.0;

    String name();

    /**
     * 差值雜湊：縮放為 (hashSize+1) x hashSize 灰階，右側像素較亮時位元為 1。
     */
    PerceptualHash differenceHash(BufferedImage image, int hashSize);

    /**
     * 平均雜湊：縮放為 hashSize x hashSize 灰階，像素大於平均值時位元為 1；
     * 像素標準差低於 {@code pureColorThreshold} 時回傳純色標記。
     */
    PerceptualHash averageHash(BufferedImage image, int hashSize, double pureColorThreshold);

    /**
     * 頻域雜湊：縮放為 (4*hashSize)^2 灰階後做二維 DCT，取左上 hashSize x hashSize 係數，
     * 去掉直流項，與其餘係數中位數比較。
     */
    PerceptualHash frequencyHash(BufferedImage image, int hashSize);

    /**
     * 以隨機取樣的像素判斷是否為純色圖片，R、G、B 三個通道的標準差都低於門檻才算。
     */
    boolean isPureColor(BufferedImage image, double threshold);

    /**
     * 對原始檔案位元組計算內容指紋 (MD5，小寫十六進位)。
     */
    default String contentFingerprint(byte[] rawBytes) {
        return ContentDigests.md5Hex(rawBytes);
    }

    default PerceptualHash averageHash(BufferedImage image, int hashSize) {
        return averageHash(image, hashSize, DEFAULT_PURE_COLOR_THRESHOLD);
    }

    default PerceptualHashes perceptualHashes(BufferedImage image, int hashSize, double pureColorThreshold) {
        return new PerceptualHashes(
                differenceHash(image, hashSize),
                averageHash(image, hashSize, pureColorThreshold),
                frequencyHash(image, hashSize)
        );
    }
}
