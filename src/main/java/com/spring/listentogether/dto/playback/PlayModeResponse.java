package com.spring.listentogether.dto.playback;

public record PlayModeResponse(
    String mode,               // SEQUENTIAL | RANDOM
    String displayName,
    boolean changed,           // false = 조회만 함
    String message
) {}
