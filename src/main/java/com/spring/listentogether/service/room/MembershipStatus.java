package com.spring.listentogether.service.room;

public enum MembershipStatus {
    JOINED,
    ALREADY_MEMBER
}
