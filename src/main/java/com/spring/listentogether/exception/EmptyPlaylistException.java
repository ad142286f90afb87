package com.spring.listentogether.exception;

public class EmptyPlaylistException extends BusinessException {
    public EmptyPlaylistException() {
        super(ErrorCode.EMPTY_PLAYLIST, "재생 목록이 비어 있습니다. 먼저 노래를 추가해주세요.");
    }

    public EmptyPlaylistException(String message) {
        super(ErrorCode.EMPTY_PLAYLIST, message);
    }
}
