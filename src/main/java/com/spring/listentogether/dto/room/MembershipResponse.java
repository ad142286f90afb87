package com.spring.listentogether.dto.room;

/**
 * 방 생성/참여/퇴장/닫기 결과
 *
 * status: CREATED | JOINED | ALREADY_MEMBER | LEFT | CLOSED
 */
public record MembershipResponse(
    String roomId,
    String status,
    int memberCount,
    String message
) {}
