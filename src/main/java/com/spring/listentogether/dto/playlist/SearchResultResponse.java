package com.spring.listentogether.dto.playlist;

import com.spring.listentogether.dto.music.SongResponse;

import java.util.List;

/**
 * 검색 결과. songs 가 비어 있으면 "찾지 못함" 안내 (오류 아님)
 */
public record SearchResultResponse(
    String keyword,
    List<SongResponse> songs,
    int totalCount,
    String message
) {}
