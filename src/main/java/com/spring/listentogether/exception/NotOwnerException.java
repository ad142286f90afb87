package com.spring.listentogether.exception;

public class NotOwnerException extends BusinessException {
    public NotOwnerException() {
        super(ErrorCode.NOT_OWNER, "방장만 할 수 있는 작업입니다.");
    }

    public NotOwnerException(String message) {
        super(ErrorCode.NOT_OWNER, message);
    }
}
