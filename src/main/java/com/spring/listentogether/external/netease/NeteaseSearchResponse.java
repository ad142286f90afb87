package com.spring.listentogether.external.netease;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 넷이즈 /api/search/get (type=1, 단일 곡) 응답 DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NeteaseSearchResponse(
    int code,
    Result result
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(List<Item> songs) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
        long id,
        String name,
        List<Artist> artists,
        Album album,
        long duration   // 밀리초
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Artist(String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Album(String name, String picUrl) {}

    public List<Item> itemsOrEmpty() {
        if (result == null || result.songs() == null) {
            return List.of();
        }
        return result.songs();
    }
}
