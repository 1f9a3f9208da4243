package work.pollochang.duplicate.image.core;

import java.nio.file.Path;

/**
 * 單一檔案無法讀取或解碼。呼叫端記錄後略過該檔案。
 */
public class DecodeFailureException extends Exception {

    private final transient Path path;

    public DecodeFailureException(Path path, String message) {
        super(path + " - " + message);
        this.path = path;
    }

    public DecodeFailureException(Path path, String message, Throwable cause) {
        super(path + " - " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
