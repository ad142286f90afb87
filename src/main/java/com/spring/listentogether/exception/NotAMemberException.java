package com.spring.listentogether.exception;

public class NotAMemberException extends BusinessException {
    public NotAMemberException() {
        super(ErrorCode.NOT_A_MEMBER, "음악 방에 참여하고 있지 않습니다. 먼저 방에 참여해주세요.");
    }

    public NotAMemberException(String message) {
        super(ErrorCode.NOT_A_MEMBER, message);
    }
}
