package com.spring.listentogether.dto.music;

import com.spring.listentogether.domain.music.Song;

/**
 * 노래 표시용 응답 DTO
 *
 * position 은 사용자에게 보여주는 1-based 번호 (검색 결과 / 재생 목록 공통)
 */
public record SongResponse(
    int position,
    String id,
    String name,
    String artist,
    String album,
    int durationSeconds,
    String durationText,       // m:ss
    String coverUrl,
    String source,             // qq | netease
    String sourceName,
    String playUrl,            // 아직 조회 전이면 ""
    boolean directStream,      // false 면 곡 페이지 링크
    boolean current,
    String display
) {
    public static SongResponse of(Song song, int index, boolean current) {
        return new SongResponse(
            index + 1,
            song.getId(),
            song.getName(),
            song.getArtist(),
            song.getAlbum(),
            song.getDurationSeconds(),
            song.getDurationText(),
            song.getCoverUrl(),
            song.getSource().getTag(),
            song.getSource().getDisplayName(),
            song.getPlayUrl(),
            song.isDirectStream(),
            current,
            song.toDisplay()
        );
    }
}
