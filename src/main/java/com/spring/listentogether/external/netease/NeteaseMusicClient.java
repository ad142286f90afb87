package com.spring.listentogether.external.netease;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.listentogether.config.MusicApiProperties;
import com.spring.listentogether.domain.enums.MusicSource;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.exception.ExternalApiException;
import com.spring.listentogether.external.MusicLookupProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 넷이즈 클라우드 뮤직 조회 Client (검색 우선순위 2)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NeteaseMusicClient implements MusicLookupProvider {

    private static final String SONG_PAGE_URL = "https://music.163.com/song?id=";
    private static final int BIT_RATE = 320000;

    private final RestClient neteaseMusicRestClient;
    private final ObjectMapper objectMapper;
    private final MusicApiProperties props;

    @Override
    public MusicSource source() {
        return MusicSource.NETEASE;
    }

    @Override
    public List<Song> search(String keyword, int limit) {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(props.neteaseSearchUrl())
                .queryParam("s", keyword)
                .queryParam("type", 1)
                .queryParam("limit", limit)
                .queryParam("offset", 0)
                .build()
                .encode()
                .toUri();

            NeteaseSearchResponse response = read(get(uri, false), NeteaseSearchResponse.class);
            if (response.code() != 200) {
                log.warn("⚠️ [NETEASE] Search returned code={} | keyword={}", response.code(), keyword);
                return List.of();
            }

            return response.itemsOrEmpty().stream()
                .map(this::toSong)
                .toList();

        } catch (Exception e) {
            log.error("❌ [NETEASE] Search failed | keyword={} | {}", keyword, e.toString());
            return List.of();
        }
    }

    @Override
    public String resolvePlayUrl(Song song) {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(props.neteasePlayUrl())
                .queryParam("ids", "[" + song.getId() + "]")
                .queryParam("br", BIT_RATE)
                .build()
                .encode()
                .toUri();

            return read(get(uri, true), NeteaseSongUrlResponse.class)
                .firstUrl()
                .orElseGet(() -> {
                    log.warn("⚠️ [NETEASE] No stream url (no rights?) | id={}", song.getId());
                    return fallbackPageUrl(song.getId());
                });

        } catch (Exception e) {
            log.error("❌ [NETEASE] Play url lookup failed | id={} | {}", song.getId(), e.toString());
            return fallbackPageUrl(song.getId());
        }
    }

    @Override
    public String fallbackPageUrl(String songId) {
        return SONG_PAGE_URL + songId;
    }

    // ── Private Helpers ──

    private String get(URI uri, boolean withCookie) {
        RestClient.RequestHeadersSpec<?> request = neteaseMusicRestClient.get().uri(uri);
        if (withCookie) {
            // 재생 링크 API 는 익명 쿠키가 없으면 code=-460 을 돌려준다
            request = request.header(HttpHeaders.COOKIE, props.neteaseCookie());
        }

        String body = request.retrieve().body(String.class);
        if (body == null || body.isBlank()) {
            throw new ExternalApiException("넷이즈 응답이 비어 있습니다.");
        }
        return body;
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExternalApiException("넷이즈 응답 파싱 실패", e);
        }
    }

    private Song toSong(NeteaseSearchResponse.Item item) {
        String artists = item.artists() == null ? "" : item.artists().stream()
            .map(a -> a.name() == null ? "" : a.name())
            .collect(Collectors.joining(", "));

        NeteaseSearchResponse.Album album = item.album();

        return new Song(
            String.valueOf(item.id()),
            item.name(),
            artists,
            album == null ? "" : album.name(),
            (int) (item.duration() / 1000),
            album == null ? "" : album.picUrl(),
            MusicSource.NETEASE
        );
    }
}
