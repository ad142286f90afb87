package com.spring.listentogether.dto.playback;

import com.spring.listentogether.dto.music.SongResponse;

/**
 * 재생 제어 응답
 *
 * status: STARTED | ALREADY_PLAYING | PAUSED | ALREADY_PAUSED | NEXT | PREVIOUS | JUMPED
 */
public record PlaybackResponse(
    String status,
    SongResponse song,         // 일시정지 응답에서는 null
    boolean playing,
    String message
) {}
