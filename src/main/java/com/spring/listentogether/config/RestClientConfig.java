package com.spring.listentogether.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * 음악 제공자별 RestClient 설정
 *
 * 두 제공자 모두 브라우저 UA + Referer 가 없으면 빈 응답을 내려주므로 기본 헤더로 고정한다.
 */
@Configuration
@EnableConfigurationProperties(MusicApiProperties.class)
public class RestClientConfig {

    @Bean
    public RestClient qqMusicRestClient(MusicApiProperties props) {
        return RestClient.builder()
            .requestFactory(requestFactory(props))
            .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.REFERER, "https://y.qq.com")
            .build();
    }

    @Bean
    public RestClient neteaseMusicRestClient(MusicApiProperties props) {
        return RestClient.builder()
            .requestFactory(requestFactory(props))
            .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent())
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .defaultHeader(HttpHeaders.REFERER, "https://music.163.com")
            .build();
    }

    private SimpleClientHttpRequestFactory requestFactory(MusicApiProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int timeoutMillis = (int) props.timeout().toMillis();
        factory.setConnectTimeout(timeoutMillis);
        factory.setReadTimeout(timeoutMillis);
        return factory;
    }
}
