package com.spring.listentogether.exception;

public class RoomAlreadyExistsException extends BusinessException {
    public RoomAlreadyExistsException() {
        super(ErrorCode.ROOM_ALREADY_EXISTS, "이 그룹에는 이미 음악 방이 있습니다. 기존 방을 먼저 닫아주세요.");
    }

    public RoomAlreadyExistsException(String message) {
        super(ErrorCode.ROOM_ALREADY_EXISTS, message);
    }
}
