package com.spring.listentogether.dto.playlist;

import com.spring.listentogether.dto.music.SongResponse;

public record SongAddedResponse(
    SongResponse song,
    String addedBy,
    int playlistSize,
    String message
) {}
