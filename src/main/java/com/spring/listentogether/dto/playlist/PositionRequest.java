package com.spring.listentogether.dto.playlist;

import jakarta.validation.constraints.NotBlank;

/**
 * 1-based 번호 입력 (선택 / 이동 공용). 숫자 해석은 PositionParser 가 한다.
 */
public record PositionRequest(
    @NotBlank(message = "번호를 입력해주세요. 예: 1")
    String position
) {}
