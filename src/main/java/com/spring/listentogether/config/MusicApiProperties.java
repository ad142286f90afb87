package com.spring.listentogether.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * QQ 음악 / 넷이즈 클라우드 뮤직 조회용 설정 프로퍼티
 *
 * timeout: 조회 1건당 전체 데드라인 (connect/read 타임아웃에도 동일하게 적용)
 */
@ConfigurationProperties(prefix = "music.api")
public record MusicApiProperties(
    String qqSearchUrl,
    String qqPlayUrl,
    String neteaseSearchUrl,
    String neteasePlayUrl,
    String userAgent,
    String neteaseCookie,
    Duration timeout,
    int searchLimit,
    int lookupThreads
) {}
