package com.spring.listentogether.exception;

/**
 * 음악 제공자 조회 실패
 *
 * 제공자 내부에서만 던지고 제공자 경계에서 빈 결과 / 대체 링크로 변환된다.
 */
public class ExternalApiException extends BusinessException {
    public ExternalApiException(String message) {
        super(ErrorCode.EXTERNAL_API_ERROR, message);
    }

    public ExternalApiException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_API_ERROR, message, cause);
    }
}
