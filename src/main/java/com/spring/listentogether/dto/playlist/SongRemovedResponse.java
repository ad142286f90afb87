package com.spring.listentogether.dto.playlist;

import com.spring.listentogether.dto.music.SongResponse;

public record SongRemovedResponse(
    SongResponse removed,
    int playlistSize,
    String message
) {}
