package com.spring.listentogether.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * 재생 모드
 *
 * SEQUENTIAL: 다음 곡 = 커서 + 1 (마지막 곡 다음은 처음으로)
 * RANDOM:     다음 곡 = 재생 목록 전체에서 균등 무작위 (직전 곡 재선택 허용)
 *
 * 이전 곡은 모드와 무관하게 항상 순차 이동이다.
 */
public enum PlayMode {
    SEQUENTIAL("순차 재생"),
    RANDOM("랜덤 재생");

    private final String displayName;

    PlayMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 사용자 입력을 모드로 해석. 알 수 없는 입력이면 empty
     */
    public static Optional<PlayMode> parse(String input) {
        if (input == null) return Optional.empty();
        return switch (input.trim().toLowerCase(Locale.ROOT)) {
            case "sequence", "sequential", "순차", "순차재생", "순차 재생", "顺序" -> Optional.of(SEQUENTIAL);
            case "random", "shuffle", "랜덤", "랜덤재생", "랜덤 재생", "随机" -> Optional.of(RANDOM);
            default -> Optional.empty();
        };
    }
}
