package work.pollochang.duplicate.image.core;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * 解碼後的圖片。讀取時可能經過二次取樣，原始尺寸另外保留。
 *
 * @param source         來源檔案
 * @param image          解碼結果
 * @param originalWidth  檔案中的寬度
 * @param originalHeight 檔案中的高度
 * @param subsampling    二次取樣比率，1 代表未取樣
 */
public record DecodedImage(Path source, BufferedImage image, int originalWidth, int originalHeight, int subsampling)
        implements AutoCloseable {

    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
    }
}
