package com.spring.listentogether.domain.room;

import com.spring.listentogether.domain.enums.PlayMode;
import com.spring.listentogether.domain.music.Song;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 방 잠금 안에서 떠 온 읽기 전용 사본.
 * 잠금 밖에서 응답을 조립할 때 사용한다.
 */
public record RoomSnapshot(
    String roomId,
    String groupScope,
    RoomMember owner,
    Map<String, String> members,
    List<Song> playlist,
    int currentIndex,
    boolean playing,
    PlayMode playMode,
    LocalDateTime createdAt
) {
    public Optional<Song> currentSong() {
        if (currentIndex < 0 || currentIndex >= playlist.size()) {
            return Optional.empty();
        }
        return Optional.of(playlist.get(currentIndex));
    }
}
