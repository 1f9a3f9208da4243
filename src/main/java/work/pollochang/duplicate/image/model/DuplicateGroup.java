package work.pollochang.duplicate.image.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 一組重複或相似的圖片，第一個成員為基準圖。
 *
 * @param reasonTags 成立原因
 * @param reason     人類可讀的原因，例如 {@code difference+average}
 * @param members    至少兩個成員
 * @param confidence 加入成員的平均信心度，只有強化模式會填
 */
public record DuplicateGroup(Set<ReasonTag> reasonTags, String reason, List<GroupMember> members, Double confidence) {

    public DuplicateGroup {
        if (reasonTags == null || reasonTags.isEmpty()) {
            throw new IllegalArgumentException("群組必須至少有一個原因標籤");
        }
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("群組必須至少有兩個成員");
        }
        reasonTags = Collections.unmodifiableSet(EnumSet.copyOf(reasonTags));
        members = List.copyOf(members);
    }

    public DuplicateGroup(ReasonTag tag, String reason, List<GroupMember> members) {
        this(EnumSet.of(tag), reason, members, null);
    }

    public GroupMember base() {
        return members.get(0);
    }

    public List<String> paths() {
        return members.stream().map(GroupMember::path).toList();
    }

    public int size() {
        return members.size();
    }
}
