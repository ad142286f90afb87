package com.spring.listentogether.exception;

public class OwnerCannotLeaveException extends BusinessException {
    public OwnerCannotLeaveException() {
        super(ErrorCode.OWNER_CANNOT_LEAVE, "방장은 나갈 수 없습니다. 방 닫기를 사용해주세요.");
    }

    public OwnerCannotLeaveException(String message) {
        super(ErrorCode.OWNER_CANNOT_LEAVE, message);
    }
}
