package com.spring.listentogether.exception;

public class NoPendingSearchException extends BusinessException {
    public NoPendingSearchException() {
        super(ErrorCode.NO_PENDING_SEARCH, "먼저 노래를 검색해주세요.");
    }

    public NoPendingSearchException(String message) {
        super(ErrorCode.NO_PENDING_SEARCH, message);
    }
}
