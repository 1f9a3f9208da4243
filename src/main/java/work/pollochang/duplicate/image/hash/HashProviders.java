package work.pollochang.duplicate.image.hash;

import lombok.extern.slf4j.Slf4j;

/**
 * 依設定選擇雜湊提供者。
 */
@Slf4j
public final class HashProviders {

    private HashProviders() {}

    /**
     * @param preferAccelerated 是否優先使用 OpenCV 加速實作；載入失敗時退回純 Java 實作
     */
    public static HashProvider create(boolean preferAccelerated) {
        if (preferAccelerated) {
            try {
                return OpenCvHashProvider.load();
            } catch (LinkageError | RuntimeException e) {
                log.warn("無法載入 OpenCV 原生函式庫，改用純 Java 雜湊實作", e);
            }
        }
        return new JavaHashProvider();
    }
}
