package com.spring.listentogether.domain.music;

import com.spring.listentogether.domain.enums.MusicSource;
import lombok.Getter;

import java.util.Locale;

/**
 * 검색 결과로 만들어지는 노래
 *
 * 메타데이터는 불변이고 재생 링크(playUrl)만 최초 1회 채워진다.
 * 한 번 채워진 링크는 다른 값으로 덮어쓰지 않는다 (같은 인스턴스 기준).
 */
@Getter
public class Song {

    private static final String[] DIRECT_STREAM_SUFFIXES = {".mp3", ".m4a", ".flac", ".ogg"};

    /** 제공자 범위의 ID (QQ: songmid, 넷이즈: 숫자 id) */
    private final String id;
    private final String name;
    private final String artist;
    private final String album;
    private final int durationSeconds;
    private final String coverUrl;
    private final MusicSource source;

    private volatile String playUrl = "";

    public Song(String id, String name, String artist, String album,
                int durationSeconds, String coverUrl, MusicSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.id = id == null ? "" : id;
        this.name = name == null ? "" : name;
        this.artist = artist == null ? "" : artist;
        this.album = album == null ? "" : album;
        this.durationSeconds = Math.max(0, durationSeconds);
        this.coverUrl = coverUrl == null ? "" : coverUrl;
        this.source = source;
    }

    public boolean hasPlayUrl() {
        return !playUrl.isEmpty();
    }

    /**
     * 재생 링크가 비어 있을 때만 기록한다.
     * @return 기록 후(또는 기존) 링크
     */
    public synchronized String assignPlayUrlIfAbsent(String url) {
        if (playUrl.isEmpty() && url != null && !url.isBlank()) {
            playUrl = url;
        }
        return playUrl;
    }

    /**
     * 직접 재생 가능한 오디오 파일 링크인지 (아니면 곡 페이지 링크)
     */
    public boolean isDirectStream() {
        String url = playUrl;
        int query = url.indexOf('?');
        String path = (query >= 0 ? url.substring(0, query) : url).toLowerCase(Locale.ROOT);
        for (String suffix : DIRECT_STREAM_SUFFIXES) {
            if (path.endsWith(suffix)) return true;
        }
        return false;
    }

    /** m:ss */
    public String getDurationText() {
        return String.format("%d:%02d", durationSeconds / 60, durationSeconds % 60);
    }

    public String toDisplay() {
        return "🎵 " + name + " - " + artist + " [" + source.getDisplayName() + "]";
    }

    @Override
    public String toString() {
        return "Song{" + source.getTag() + ":" + id + ", " + name + " - " + artist + "}";
    }
}
