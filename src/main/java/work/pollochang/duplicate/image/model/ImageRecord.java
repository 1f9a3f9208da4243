package work.pollochang.duplicate.image.model;

import work.pollochang.duplicate.image.feature.FeatureVector;
import work.pollochang.duplicate.image.hash.PerceptualHashes;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 感知比對階段每張圖片的資料，計算完成後不再變動。
 *
 * @param path          圖片路徑
 * @param hashes        原圖的三種雜湊
 * @param rotatedHashes 角度 -> 雜湊，只有旋轉模式會填
 * @param variants      強化模式的變體，只有強化模式會填
 * @param features      原圖的全域特徵，只有強化模式會填
 */
public record ImageRecord(String path, PerceptualHashes hashes,
                          Map<Integer, PerceptualHashes> rotatedHashes,
                          List<ScaledVariant> variants, FeatureVector features) {

    public ImageRecord {
        Objects.requireNonNull(path, "path must not be null");
        rotatedHashes = rotatedHashes == null ? Map.of() : Map.copyOf(rotatedHashes);
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public static ImageRecord of(String path, PerceptualHashes hashes) {
        return new ImageRecord(path, hashes, null, null, null);
    }
}
