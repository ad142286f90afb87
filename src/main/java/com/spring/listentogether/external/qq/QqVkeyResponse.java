package com.spring.listentogether.external.qq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * QQ 음악 musicu.fcg (vkey.GetVkeyServer) 응답 DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QqVkeyResponse(
    @JsonProperty("req_0") VkeyResult vkey
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VkeyResult(int code, VkeyData data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VkeyData(List<String> sip, List<MidUrlInfo> midurlinfo) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MidUrlInfo(String purl) {}

    /**
     * sip[0] + purl. 재생 권한이 없으면 purl 이 비어 있어 empty
     */
    public Optional<String> streamUrl() {
        if (vkey == null || vkey.code() != 0 || vkey.data() == null) {
            return Optional.empty();
        }
        List<MidUrlInfo> infos = vkey.data().midurlinfo();
        if (infos == null || infos.isEmpty() || infos.get(0) == null) {
            return Optional.empty();
        }
        String purl = infos.get(0).purl();
        if (purl == null || purl.isBlank()) {
            return Optional.empty();
        }
        List<String> sip = vkey.data().sip();
        String host = (sip == null || sip.isEmpty() || sip.get(0) == null) ? "" : sip.get(0);
        return Optional.of(host + purl);
    }
}
