package com.spring.listentogether.dto.playlist;

import com.spring.listentogether.dto.music.SongResponse;

import java.util.List;

/**
 * @param currentPosition 현재 곡의 1-based 번호, 없으면 0
 */
public record PlaylistResponse(
    List<SongResponse> songs,
    int totalCount,
    int currentPosition,
    String message
) {}
