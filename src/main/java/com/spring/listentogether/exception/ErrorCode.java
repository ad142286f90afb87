package com.spring.listentogether.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 표준화
 *
 * 코드마다 응답 HTTP 상태가 고정된다.
 */
public enum ErrorCode {
    ROOM_ALREADY_EXISTS(HttpStatus.CONFLICT),
    NO_ACTIVE_ROOM(HttpStatus.NOT_FOUND),
    NOT_A_MEMBER(HttpStatus.FORBIDDEN),
    OWNER_CANNOT_LEAVE(HttpStatus.CONFLICT),
    NOT_OWNER(HttpStatus.FORBIDDEN),
    INDEX_OUT_OF_RANGE(HttpStatus.BAD_REQUEST),
    NO_PENDING_SEARCH(HttpStatus.CONFLICT),
    EMPTY_PLAYLIST(HttpStatus.CONFLICT),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    EXTERNAL_API_ERROR(HttpStatus.BAD_GATEWAY),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
