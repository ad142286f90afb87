package com.spring.listentogether.external.qq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * QQ 음악 client_search_cp 응답 DTO (new_json=1)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QqSearchResponse(
    int code,
    Data data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(SongPage song) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SongPage(List<Item> list) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
        String mid,
        String name,
        List<Singer> singer,
        Album album,
        int interval   // 초 단위
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Singer(String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Album(String mid, String name) {}

    public List<Item> itemsOrEmpty() {
        if (data == null || data.song() == null || data.song().list() == null) {
            return List.of();
        }
        return data.song().list();
    }
}
