package com.spring.listentogether.dto.room;

import com.spring.listentogether.domain.room.RoomSnapshot;
import com.spring.listentogether.dto.music.SongResponse;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 방 정보 응답 DTO
 */
public record RoomInfoResponse(
    String roomId,
    String groupScope,
    String ownerId,
    String ownerName,
    List<String> memberNames,
    int memberCount,
    int songCount,
    boolean playing,
    String status,             // 재생 중 | 일시정지
    String playMode,
    String playModeDisplayName,
    SongResponse currentSong,  // 없으면 null
    LocalDateTime createdAt
) {
    public static RoomInfoResponse from(RoomSnapshot room) {
        SongResponse current = room.currentSong()
            .map(song -> SongResponse.of(song, room.currentIndex(), true))
            .orElse(null);

        return new RoomInfoResponse(
            room.roomId(),
            room.groupScope(),
            room.owner().userId(),
            room.owner().name(),
            List.copyOf(room.members().values()),
            room.members().size(),
            room.playlist().size(),
            room.playing(),
            room.playing() ? "재생 중" : "일시정지",
            room.playMode().name(),
            room.playMode().getDisplayName(),
            current,
            room.createdAt()
        );
    }
}
