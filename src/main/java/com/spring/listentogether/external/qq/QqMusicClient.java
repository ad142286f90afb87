package com.spring.listentogether.external.qq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spring.listentogether.config.MusicApiProperties;
import com.spring.listentogether.domain.enums.MusicSource;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.exception.ExternalApiException;
import com.spring.listentogether.external.MusicLookupProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * QQ 음악 조회 Client (검색 우선순위 1)
 *
 * 응답 Content-Type 이 text/html 로 오는 경우가 있어 문자열로 받은 뒤 직접 역직렬화한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QqMusicClient implements MusicLookupProvider {

    private static final String SONG_PAGE_URL = "https://y.qq.com/n/ryqq/songDetail/";
    private static final String COVER_URL_FORMAT = "https://y.qq.com/music/photo_new/T002R300x300M000%s.jpg";
    private static final String UNKNOWN_ARTIST = "알 수 없는 아티스트";
    private static final String GUID = "1234567890";

    private final RestClient qqMusicRestClient;
    private final ObjectMapper objectMapper;
    private final MusicApiProperties props;

    @Override
    public MusicSource source() {
        return MusicSource.QQ;
    }

    @Override
    public List<Song> search(String keyword, int limit) {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(props.qqSearchUrl())
                .queryParam("w", keyword)
                .queryParam("p", 1)
                .queryParam("n", limit)
                .queryParam("format", "json")
                .queryParam("aggr", 1)
                .queryParam("lossless", 0)
                .queryParam("cr", 1)
                .queryParam("new_json", 1)
                .build()
                .encode()
                .toUri();

            QqSearchResponse response = read(get(uri), QqSearchResponse.class);
            if (response.code() != 0) {
                log.warn("⚠️ [QQ] Search returned code={} | keyword={}", response.code(), keyword);
                return List.of();
            }

            return response.itemsOrEmpty().stream()
                .map(this::toSong)
                .toList();

        } catch (Exception e) {
            log.error("❌ [QQ] Search failed | keyword={} | {}", keyword, e.toString());
            return List.of();
        }
    }

    @Override
    public String resolvePlayUrl(Song song) {
        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(props.qqPlayUrl())
                .queryParam("data", vkeyRequestJson(song.getId()))
                .build()
                .encode()
                .toUri();

            return read(get(uri), QqVkeyResponse.class)
                .streamUrl()
                .orElseGet(() -> {
                    log.warn("⚠️ [QQ] No stream url (no rights?) | mid={}", song.getId());
                    return fallbackPageUrl(song.getId());
                });

        } catch (Exception e) {
            log.error("❌ [QQ] Play url lookup failed | mid={} | {}", song.getId(), e.toString());
            return fallbackPageUrl(song.getId());
        }
    }

    @Override
    public String fallbackPageUrl(String songId) {
        return SONG_PAGE_URL + songId;
    }

    // ── Private Helpers ──

    private String get(URI uri) {
        String body = qqMusicRestClient.get()
            .uri(uri)
            .retrieve()
            .body(String.class);

        if (body == null || body.isBlank()) {
            throw new ExternalApiException("QQ 음악 응답이 비어 있습니다.");
        }
        return body;
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExternalApiException("QQ 음악 응답 파싱 실패", e);
        }
    }

    private String vkeyRequestJson(String songMid) throws JsonProcessingException {
        Map<String, Object> request = Map.of(
            "req", Map.of(
                "module", "CDN.SrfCdnDispatchServer",
                "method", "GetCdnDispatch",
                "param", Map.of("guid", GUID, "calltype", 0, "userip", "")
            ),
            "req_0", Map.of(
                "module", "vkey.GetVkeyServer",
                "method", "CgiGetVkey",
                "param", Map.of(
                    "guid", GUID,
                    "songmid", List.of(songMid),
                    "songtype", List.of(0),
                    "uin", "0",
                    "loginflag", 1,
                    "platform", "20"
                )
            )
        );
        return objectMapper.writeValueAsString(request);
    }

    private Song toSong(QqSearchResponse.Item item) {
        String artists = item.singer() == null || item.singer().isEmpty()
            ? UNKNOWN_ARTIST
            : item.singer().stream()
                .map(s -> s.name() == null ? "" : s.name())
                .collect(Collectors.joining(", "));

        QqSearchResponse.Album album = item.album();
        String albumMid = album == null ? null : album.mid();

        return new Song(
            item.mid(),
            item.name(),
            artists,
            album == null ? "" : album.name(),
            item.interval(),
            albumMid == null || albumMid.isBlank() ? "" : String.format(COVER_URL_FORMAT, albumMid),
            MusicSource.QQ
        );
    }
}
