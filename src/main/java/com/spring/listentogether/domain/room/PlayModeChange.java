package com.spring.listentogether.domain.room;

import com.spring.listentogether.domain.enums.PlayMode;

/**
 * 재생 모드 변경 결과
 * @param mode 적용 후 현재 모드
 * @param changed false 면 입력을 알아듣지 못해 현재 모드만 조회한 것
 */
public record PlayModeChange(PlayMode mode, boolean changed) {}
