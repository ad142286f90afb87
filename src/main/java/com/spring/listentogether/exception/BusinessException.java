package com.spring.listentogether.exception;

/**
 * 방 / 재생 목록 규칙 위반의 최상위 예외
 *
 * 메시지는 채팅방에 그대로 보여줄 짧은 안내 문구다.
 * 방 상태를 바꾸기 전에 던지므로 예외가 나도 방은 부분 변경되지 않는다.
 */
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int httpStatus() {
        return errorCode.getStatus().value();
    }
}
