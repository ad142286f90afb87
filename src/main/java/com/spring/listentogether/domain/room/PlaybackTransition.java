package com.spring.listentogether.domain.room;

/**
 * 재생/일시정지 요청 결과
 *
 * ALREADY_* 는 오류가 아니라 "이미 그 상태"라는 안내용 상태다.
 */
public enum PlaybackTransition {
    STARTED,
    ALREADY_PLAYING,
    PAUSED,
    ALREADY_PAUSED
}
