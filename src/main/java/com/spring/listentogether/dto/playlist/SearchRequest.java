package com.spring.listentogether.dto.playlist;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SearchRequest(
    @NotBlank(message = "노래 제목을 입력해주세요. 예: 稻香")
    @Size(max = 100, message = "검색어가 너무 깁니다.")
    String keyword
) {}
