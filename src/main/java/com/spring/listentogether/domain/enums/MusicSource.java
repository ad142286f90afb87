package com.spring.listentogether.domain.enums;

/**
 * 노래 출처 (조회 제공자)
 *
 * 선언 순서가 곧 검색 우선순위다. QQ 음악에서 결과가 없을 때만 넷이즈로 넘어간다.
 */
public enum MusicSource {
    QQ("qq", "QQ음악"),
    NETEASE("netease", "넷이즈");

    private final String tag;
    private final String displayName;

    MusicSource(String tag, String displayName) {
        this.tag = tag;
        this.displayName = displayName;
    }

    public String getTag() {
        return tag;
    }

    public String getDisplayName() {
        return displayName;
    }
}
