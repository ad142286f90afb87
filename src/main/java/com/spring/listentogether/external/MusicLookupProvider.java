package com.spring.listentogether.external;

import com.spring.listentogether.domain.enums.MusicSource;
import com.spring.listentogether.domain.music.Song;

import java.util.List;

/**
 * 외부 음악 조회 제공자
 *
 * 두 메서드 모두 예외를 밖으로 던지지 않는다.
 * - search: 실패하면 빈 목록
 * - resolvePlayUrl: 실패하면 곡 페이지 링크 (fallbackPageUrl)
 */
public interface MusicLookupProvider {

    MusicSource source();

    List<Song> search(String keyword, int limit);

    String resolvePlayUrl(Song song);

    /**
     * 재생 링크를 얻지 못했을 때 돌려주는 곡 상세 페이지 링크 (스트림 아님)
     */
    String fallbackPageUrl(String songId);
}
