package work.pollochang.duplicate.image.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 以 ImageIO 解碼圖片。超大圖片在讀取時就做二次取樣以降低記憶體用量，
 * 雜湊只需要很小的縮圖，取樣不影響結果。
 */
@Slf4j
public class ImageIoDecoder implements ImageDecoder {

    /** 預設讀取時最長邊的目標上限 */
    public static final int DEFAULT_MAX_DIMENSION = 4096;

    private final int maxDimension;

    public ImageIoDecoder() {
        this(DEFAULT_MAX_DIMENSION);
    }

    public ImageIoDecoder(int maxDimension) {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension 必須為正數: " + maxDimension);
        }
        this.maxDimension = maxDimension;
    }

    @Override
    public DecodedImage decode(Path inputPath) throws DecodeFailureException {
        try (InputStream raw = Files.newInputStream(inputPath);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            if (in == null) {
                throw new DecodeFailureException(inputPath, "無法建立圖片輸入流");
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new DecodeFailureException(inputPath, "找不到對應的圖片讀取器");
            }

            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = 1;
                int maxDim = Math.max(width, height);
                if (maxDim > maxDimension) {
                    subsampling = (int) Math.floor((double) maxDim / maxDimension);
                }
                // ImageIO 的 subsampling 只支援整數，取 2 的冪對 JPG 解碼器較友好
                if (subsampling > 1) {
                    subsampling = Integer.highestOneBit(subsampling);
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                if (image == null) {
                    throw new DecodeFailureException(inputPath, "解碼結果為空");
                }
                return new DecodedImage(inputPath, image, width, height, subsampling);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new DecodeFailureException(inputPath, "讀取圖片時發生 I/O 錯誤 (可能非支援格式或檔案損毀)", e);
        } catch (OutOfMemoryError e) {
            // 儘管已經做了二次取樣，極端情況下仍可能發生
            throw new DecodeFailureException(inputPath, "解碼時記憶體不足", e);
        } catch (RuntimeException e) {
            // 部分 ImageIO 外掛會以 RuntimeException 回報損毀的檔案
            throw new DecodeFailureException(inputPath, "解碼時發生錯誤", e);
        }
    }
}
