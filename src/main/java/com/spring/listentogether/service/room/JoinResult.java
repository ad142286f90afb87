package com.spring.listentogether.service.room;

import com.spring.listentogether.domain.room.RoomSnapshot;

public record JoinResult(MembershipStatus status, RoomSnapshot room) {}
