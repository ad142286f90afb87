package com.spring.listentogether.exception;

import java.time.LocalDateTime;

/**
 * 실패 응답 본문
 *
 * code 는 클라이언트(채팅 어댑터)가 분기용으로 쓰고, message 는 사용자에게 그대로 보여준다.
 */
public record ApiErrorResponse(
    LocalDateTime timestamp,
    int status,
    ErrorCode code,
    String message,
    String path
) {
    public static ApiErrorResponse of(ErrorCode code, String message, String path) {
        return new ApiErrorResponse(LocalDateTime.now(), code.getStatus().value(), code, message, path);
    }
}
