package com.spring.listentogether.exception;

public class NoActiveRoomException extends BusinessException {
    public NoActiveRoomException() {
        super(ErrorCode.NO_ACTIVE_ROOM, "현재 음악 방이 없습니다. 방을 먼저 만들어주세요.");
    }

    public NoActiveRoomException(String message) {
        super(ErrorCode.NO_ACTIVE_ROOM, message);
    }
}
