package com.spring.listentogether.service;

import com.spring.listentogether.config.MusicApiProperties;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.domain.room.RoomSnapshot;
import com.spring.listentogether.dto.music.SongResponse;
import com.spring.listentogether.dto.playlist.PlaylistResponse;
import com.spring.listentogether.dto.playlist.SearchResultResponse;
import com.spring.listentogether.dto.playlist.SongAddedResponse;
import com.spring.listentogether.dto.playlist.SongRemovedResponse;
import com.spring.listentogether.exception.BadRequestException;
import com.spring.listentogether.exception.IndexOutOfRangeException;
import com.spring.listentogether.exception.NotOwnerException;
import com.spring.listentogether.service.music.MusicLookupService;
import com.spring.listentogether.service.room.CallerContext;
import com.spring.listentogether.service.room.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.IntStream;

/**
 * 검색 / 선택 / 재생 목록 관리
 *
 * 검색과 재생 링크 조회는 방 잠금 밖에서 실행한다:
 * 잠금(검증·변경) → 잠금 해제 → 외부 조회 → (Song 에 링크 기록)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlaylistService {

    private final RoomRegistry roomRegistry;
    private final MusicLookupService musicLookupService;
    private final MusicApiProperties props;

    private record Added(Song song, int index, int playlistSize) {}

    private record Removed(Song song, int index, int playlistSize) {}

    public SearchResultResponse search(CallerContext caller, String keyword) {
        if (keyword == null || keyword.isBlank()) {
            throw new BadRequestException("노래 제목을 입력해주세요. 예: 稻香");
        }
        String trimmed = keyword.trim();

        // 참여자가 아니면 외부 호출 전에 거절
        roomRegistry.resolveRoomFor(caller);

        List<Song> songs = musicLookupService.search(trimmed, props.searchLimit());
        if (songs.isEmpty()) {
            return new SearchResultResponse(trimmed, List.of(), 0,
                "❌ 관련 노래를 찾지 못했습니다. 다른 검색어를 시도해주세요.");
        }

        roomRegistry.stashSearchResults(caller, songs);

        List<SongResponse> results = IntStream.range(0, songs.size())
            .mapToObj(i -> SongResponse.of(songs.get(i), i, false))
            .toList();
        return new SearchResultResponse(trimmed, results, results.size(),
            "번호를 골라 재생 목록에 추가하세요. 예: 1");
    }

    /**
     * 대기 중인 검색 결과에서 1-based 번호로 골라 재생 목록 끝에 추가.
     * 번호가 범위를 벗어나면 검색 결과는 그대로 남는다.
     */
    public SongAddedResponse select(CallerContext caller, String position) {
        int index = PositionParser.toIndex(position, "1");

        Added added = roomRegistry.withRoom(caller, room -> {
            List<Song> pending = roomRegistry.peekSearchResults(caller);
            if (index < 0 || index >= pending.size()) {
                throw new IndexOutOfRangeException(
                    "번호가 범위를 벗어났습니다. (1 ~ " + pending.size() + ")");
            }
            roomRegistry.takeSearchResults(caller);

            Song song = pending.get(index);
            int size = room.addSong(song);
            return new Added(song, size - 1, size);
        });

        log.info("➕ [PLAYLIST] Song added: scope={}, by={}, song={}, size={}",
            caller.groupScope(), caller.userId(), added.song(), added.playlistSize());

        musicLookupService.resolvePlayUrl(added.song());

        return new SongAddedResponse(
            SongResponse.of(added.song(), added.index(), false),
            caller.userName(),
            added.playlistSize(),
            "✅ " + caller.userName() + " 님이 노래를 추가했습니다. 현재 재생 목록 " + added.playlistSize() + "곡"
        );
    }

    public PlaylistResponse getPlaylist(CallerContext caller) {
        RoomSnapshot room = roomRegistry.resolveRoomFor(caller);

        List<SongResponse> songs = IntStream.range(0, room.playlist().size())
            .mapToObj(i -> SongResponse.of(room.playlist().get(i), i, i == room.currentIndex()))
            .toList();
        String message = songs.isEmpty() ? "📋 재생 목록이 비어 있습니다." : "📋 재생 목록 " + songs.size() + "곡";

        return new PlaylistResponse(songs, songs.size(), room.currentIndex() + 1, message);
    }

    public SongRemovedResponse remove(CallerContext caller, String position) {
        int index = PositionParser.toIndex(position, "2");

        Removed removed = roomRegistry.withRoom(caller, room -> {
            Song song = room.removeSong(index);
            return new Removed(song, index, room.playlistSize());
        });

        log.info("➖ [PLAYLIST] Song removed: scope={}, by={}, song={}, size={}",
            caller.groupScope(), caller.userId(), removed.song(), removed.playlistSize());

        return new SongRemovedResponse(
            SongResponse.of(removed.song(), removed.index(), false),
            removed.playlistSize(),
            "✅ 삭제했습니다: " + removed.song().toDisplay()
        );
    }

    /**
     * 방장만 비울 수 있다. 재생 상태도 정지로 바뀐다.
     */
    public PlaylistResponse clear(CallerContext caller) {
        roomRegistry.withRoom(caller, room -> {
            if (!room.isOwner(caller.userId())) {
                throw new NotOwnerException("방장만 재생 목록을 비울 수 있습니다.");
            }
            room.clear();
            return null;
        });

        log.info("🧹 [PLAYLIST] Playlist cleared: scope={}", caller.groupScope());
        return new PlaylistResponse(List.of(), 0, 0, "✅ 재생 목록을 비웠습니다.");
    }
}
