package com.spring.listentogether.domain.room;

/**
 * 방 참여자 (id + 표시 이름)
 */
public record RoomMember(String userId, String name) {}
