package debugpro.runtime.detail;

import debugpro.runtime.ErrorCategory;

import java.util.Collections;
import java.util.List;

/**
 * 成员不存在：对象、运行时类型、可用成员（最多 {@value #MAX_MEMBERS} 个）和相似成员。
 */
public final class MemberDetail extends DiagnosticDetail {

    public static final int MAX_MEMBERS = 100;

    private final String objectName;
    private final String objectValue;
    private final String typeName;
    private final String missingMember;
    private final List<String> members;
    private final int memberCount;
    private final List<String> similarMembers;

    public MemberDetail(String objectName, String objectValue, String typeName, String missingMember,
                        List<String> members, int memberCount, List<String> similarMembers) {
        super(ErrorCategory.MEMBER_NOT_FOUND);
        this.objectName = objectName;
        this.objectValue = objectValue;
        this.typeName = typeName;
        this.missingMember = missingMember;
        this.members = Collections.unmodifiableList(
                members.size() > MAX_MEMBERS ? members.subList(0, MAX_MEMBERS) : members);
        this.memberCount = memberCount;
        this.similarMembers = Collections.unmodifiableList(similarMembers);
    }

    public String getObjectName() { return objectName; }
    public String getObjectValue() { return objectValue; }
    public String getTypeName() { return typeName; }
    public String getMissingMember() { return missingMember; }
    public List<String> getMembers() { return members; }

    /** 成员总数（可能超过显示上限） */
    public int getMemberCount() { return memberCount; }

    public int getHiddenMemberCount() {
        return Math.max(0, memberCount - members.size());
    }

    public List<String> getSimilarMembers() { return similarMembers; }
}
