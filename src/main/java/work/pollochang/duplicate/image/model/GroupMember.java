package work.pollochang.duplicate.image.model;

import work.pollochang.duplicate.image.hash.HashDistances;

import java.util.Objects;

/**
 * 群組中的一張圖片。
 *
 * @param path          圖片路徑
 * @param distances     與基準圖的雜湊距離；完全相同與純色群組沒有此資訊
 * @param rotationAngle 相對基準圖的旋轉角度 (逆時針，度)，只有旋轉模式會填
 * @param detectionType 強化模式偵測到的變換描述
 * @param confidence    強化模式的信心度
 */
public record GroupMember(String path, HashDistances distances, Integer rotationAngle,
                          String detectionType, Double confidence) {

    public GroupMember {
        Objects.requireNonNull(path, "path must not be null");
    }

    public static GroupMember of(String path) {
        return new GroupMember(path, null, null, null, null);
    }

    public static GroupMember withDistances(String path, HashDistances distances) {
        return new GroupMember(path, distances, null, null, null);
    }
}
