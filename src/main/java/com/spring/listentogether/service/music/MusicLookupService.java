package com.spring.listentogether.service.music;

import com.spring.listentogether.config.MusicApiProperties;
import com.spring.listentogether.domain.enums.MusicSource;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.external.MusicLookupProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 음악 조회 서비스 (제공자 fallback 체인)
 *
 * - 검색: QQ → 넷이즈 고정 우선순위. 먼저 결과가 나온 쪽을 그대로 쓴다 (병합/정렬 없음)
 * - 재생 링크: Song 에 기록된 출처의 제공자에게만 묻는다. 실패하면 곡 페이지 링크
 * - 모든 조회는 lookupExecutor 에서 돌고 music.api.timeout 을 넘기면 실패로 간주한다
 * - 방 잠금을 쥔 채로 호출하면 안 된다
 */
@Service
@Slf4j
public class MusicLookupService {

    private final List<MusicLookupProvider> providers;
    private final Map<MusicSource, MusicLookupProvider> providersBySource = new EnumMap<>(MusicSource.class);
    private final Executor lookupExecutor;
    private final Duration timeout;

    /** 같은 Song 인스턴스에 대한 재생 링크 조회는 한 번만 나간다 */
    private final Map<Song, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public MusicLookupService(List<MusicLookupProvider> providers,
                              @Qualifier("lookupExecutor") Executor lookupExecutor,
                              MusicApiProperties props) {
        this.providers = providers.stream()
            .sorted(Comparator.comparing(MusicLookupProvider::source))
            .toList();
        this.providers.forEach(p -> providersBySource.put(p.source(), p));
        this.lookupExecutor = lookupExecutor;
        this.timeout = props.timeout();
    }

    /**
     * 우선순위대로 제공자를 돌며 첫 번째 비어 있지 않은 결과를 반환.
     * 모두 비면 빈 목록 (오류 아님)
     */
    public List<Song> search(String keyword, int limit) {
        for (MusicLookupProvider provider : providers) {
            List<Song> songs = callWithDeadline(
                () -> provider.search(keyword, limit),
                List.<Song>of(),
                provider.source() + " search");

            if (songs != null && !songs.isEmpty()) {
                log.info("🔍 [LOOKUP] {} result(s) from {} | keyword={}", songs.size(), provider.source(), keyword);
                return songs;
            }
            log.debug("🔍 [LOOKUP] No result from {} | keyword={}", provider.source(), keyword);
        }
        log.info("🔍 [LOOKUP] No result from any provider | keyword={}", keyword);
        return List.of();
    }

    /**
     * 재생 링크를 구해 Song 에 기록하고 돌려준다. 이미 있으면 네트워크 호출 없이 반환.
     * 항상 어떤 링크든 돌려준다 (최악의 경우 곡 페이지 링크).
     */
    public String resolvePlayUrl(Song song) {
        if (song.hasPlayUrl()) {
            log.debug("🎧 [LOOKUP] Play url cache hit | {}", song);
            return song.getPlayUrl();
        }

        CompletableFuture<String> mine = new CompletableFuture<>();
        CompletableFuture<String> running = inFlight.putIfAbsent(song, mine);
        if (running != null) {
            return awaitOther(song, running);
        }

        try {
            // 앞선 조회가 방금 끝났을 수 있다
            if (song.hasPlayUrl()) {
                mine.complete(song.getPlayUrl());
                return song.getPlayUrl();
            }

            MusicLookupProvider provider = providersBySource.get(song.getSource());
            String fallback = provider.fallbackPageUrl(song.getId());
            String url = callWithDeadline(() -> provider.resolvePlayUrl(song), fallback,
                provider.source() + " play url");

            String stored = song.assignPlayUrlIfAbsent(url == null || url.isBlank() ? fallback : url);
            mine.complete(stored);
            return stored;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(song, mine);
        }
    }

    // ── Private Helpers ──

    private String awaitOther(Song song, CompletableFuture<String> running) {
        try {
            return running.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("⚠️ [LOOKUP] Waiting for in-flight play url failed | {} | {}", song, e.toString());
        }
        return song.hasPlayUrl()
            ? song.getPlayUrl()
            : song.assignPlayUrlIfAbsent(providersBySource.get(song.getSource()).fallbackPageUrl(song.getId()));
    }

    /**
     * 제공자 호출을 lookupExecutor 에서 실행하고 timeout 까지만 기다린다.
     * 타임아웃/인터럽트/예외는 모두 fallback 값으로 바뀐다.
     */
    private <T> T callWithDeadline(Supplier<T> call, T fallback, String what) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(call, lookupExecutor);
        } catch (RuntimeException e) {
            // 풀 포화 (RejectedExecutionException)
            log.error("❌ [LOOKUP] {} could not be scheduled | {}", what, e.toString());
            return fallback;
        }

        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result == null ? fallback : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⏱️ [LOOKUP] {} timed out after {}ms", what, timeout.toMillis());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("⚠️ [LOOKUP] {} interrupted", what);
        } catch (ExecutionException e) {
            log.error("❌ [LOOKUP] {} failed", what, e.getCause());
        }
        return fallback;
    }
}
