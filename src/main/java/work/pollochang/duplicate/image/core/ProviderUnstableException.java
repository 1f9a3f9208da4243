package work.pollochang.duplicate.image.core;

import lombok.Getter;

/**
 * 單一階段的失敗檔案數超過容許上限，或基本策略本身失敗，整個執行中止。
 */
@Getter
public class ProviderUnstableException extends RuntimeException {

    /** 發生問題的階段名稱 */
    private final String stage;
    /** 中止前已成功處理的檔案數 */
    private final int processed;
    private final int failures;

    public ProviderUnstableException(String stage, int processed, int failures, int limit) {
        super(String.format("%s 階段失敗檔案數 %d 超過上限 %d (已成功處理 %d 個)", stage, failures, limit, processed));
        this.stage = stage;
        this.processed = processed;
        this.failures = failures;
    }

    public ProviderUnstableException(String stage, int processed, String message, Throwable cause) {
        super(stage + " - " + message + " (已成功處理 " + processed + " 個)", cause);
        this.stage = stage;
        this.processed = processed;
        this.failures = 0;
    }
}
