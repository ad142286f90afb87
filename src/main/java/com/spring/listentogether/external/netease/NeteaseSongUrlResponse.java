package com.spring.listentogether.external.netease;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * 넷이즈 /api/song/enhance/player/url 응답 DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NeteaseSongUrlResponse(
    int code,
    List<Entry> data
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(long id, String url) {}

    public Optional<String> firstUrl() {
        if (code != 200 || data == null || data.isEmpty() || data.get(0) == null) {
            return Optional.empty();
        }
        String url = data.get(0).url();
        return (url == null || url.isBlank()) ? Optional.empty() : Optional.of(url);
    }
}
