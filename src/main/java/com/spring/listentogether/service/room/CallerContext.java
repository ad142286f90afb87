package com.spring.listentogether.service.room;

/**
 * 명령을 보낸 호출자 (외부에서 넘겨준 식별자를 그대로 신뢰한다)
 *
 * @param groupScope 그룹/채널 ID. 비어 있으면 개인 세션(private)
 */
public record CallerContext(String userId, String userName, String groupScope) {

    public static final String PRIVATE_SCOPE = "private";
    public static final String UNKNOWN_USER = "알 수 없는 사용자";

    public CallerContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        userName = (userName == null || userName.isBlank()) ? UNKNOWN_USER : userName;
        groupScope = (groupScope == null || groupScope.isBlank()) ? PRIVATE_SCOPE : groupScope;
    }

    public static CallerContext of(String userId, String userName, String groupScope) {
        return new CallerContext(userId, userName, groupScope);
    }

    public MemberKey memberKey() {
        return new MemberKey(userId, groupScope);
    }
}
