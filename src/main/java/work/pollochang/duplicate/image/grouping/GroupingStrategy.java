package work.pollochang.duplicate.image.grouping;

import work.pollochang.duplicate.image.model.DuplicateGroup;
import work.pollochang.duplicate.image.model.ImageRecord;

import java.util.List;

/**
 * 感知比對策略。{@link #prepare(String)} 與 {@link #compare(ImageRecord, ImageRecord)}
 * 會在多個執行緒上同時呼叫。
 */
public interface GroupingStrategy {

    StrategyKind kind();

    /**
     * 讀取圖片並計算此策略需要的雜湊。
     * @throws Exception 讀取或解碼失敗，呼叫端計入失敗數後略過
     */
    ImageRecord prepare(String path) throws Exception;

    PairComparison compare(ImageRecord base, ImageRecord candidate);

    /**
     * @param matches 依輸入順序排列、至少一個
     */
    DuplicateGroup buildGroup(ImageRecord base, List<Match> matches);
}
