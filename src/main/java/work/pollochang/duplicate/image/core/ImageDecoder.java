package work.pollochang.duplicate.image.core;

import java.nio.file.Path;

/**
 * 圖片解碼器。實作必須可同時被多個執行緒呼叫。
 */
@FunctionalInterface
public interface ImageDecoder {

    DecodedImage decode(Path path) throws DecodeFailureException;
}
