package work.pollochang.duplicate.image.stage;

import work.pollochang.duplicate.image.model.DuplicateGroup;

import java.util.List;

/**
 * 單一階段的結果。
 *
 * @param groups          本階段產生的群組
 * @param survivors       進入下一階段的路徑，維持輸入順序
 * @param failures        讀取或解碼失敗的檔案數
 * @param pureColorImages 本階段判定為純色的圖片數
 * @param stopped         是否因停止要求而中斷；中斷時 groups 為空
 */
public record StageResult(List<DuplicateGroup> groups, List<String> survivors, int failures,
                          int pureColorImages, boolean stopped) {

    public StageResult {
        groups = List.copyOf(groups);
        survivors = List.copyOf(survivors);
    }

    public static StageResult stopped(List<String> survivors, int failures) {
        return new StageResult(List.of(), survivors, failures, 0, true);
    }
}
