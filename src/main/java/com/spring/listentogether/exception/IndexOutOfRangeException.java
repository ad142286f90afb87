package com.spring.listentogether.exception;

public class IndexOutOfRangeException extends BusinessException {
    public IndexOutOfRangeException() {
        super(ErrorCode.INDEX_OUT_OF_RANGE, "번호가 범위를 벗어났습니다.");
    }

    public IndexOutOfRangeException(String message) {
        super(ErrorCode.INDEX_OUT_OF_RANGE, message);
    }
}
