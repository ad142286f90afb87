package com.spring.listentogether.dto.playback;

/**
 * mode: "sequence" | "random" (한국어/중국어 표기도 허용). 그 밖의 값은 현재 모드 조회
 */
public record PlayModeRequest(String mode) {}
