package com.spring.listentogether.service;

import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.domain.room.MusicRoom;
import com.spring.listentogether.domain.room.PlayModeChange;
import com.spring.listentogether.domain.room.PlaybackTransition;
import com.spring.listentogether.dto.music.SongResponse;
import com.spring.listentogether.dto.playback.PlayModeResponse;
import com.spring.listentogether.dto.playback.PlaybackResponse;
import com.spring.listentogether.exception.EmptyPlaylistException;
import com.spring.listentogether.service.music.MusicLookupService;
import com.spring.listentogether.service.room.CallerContext;
import com.spring.listentogether.service.room.RoomRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Function;

/**
 * 재생 제어 (재생 / 일시정지 / 다음 / 이전 / 이동 / 모드)
 *
 * 커서 이동은 방 잠금 안에서, 재생 링크 조회는 잠금을 놓은 뒤에 한다.
 * 느린 조회 하나가 같은 방의 다른 참여자 명령을 막지 않게 하기 위함.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlaybackService {

    private final RoomRegistry roomRegistry;
    private final MusicLookupService musicLookupService;

    /** 잠금 안에서 떠 온 커서 이동 결과 */
    private record Step(String status, Song song, int index, boolean playing) {}

    public PlaybackResponse play(CallerContext caller) {
        Step step = roomRegistry.withRoom(caller, room -> {
            PlaybackTransition transition = room.play();
            return new Step(transition.name(), room.currentSong().orElse(null),
                room.getCurrentIndex(), room.isPlaying());
        });

        if (PlaybackTransition.ALREADY_PLAYING.name().equals(step.status())) {
            return respond(step, "▶️ 이미 재생 중입니다.");
        }

        log.info("▶️ [PLAYBACK] Started: scope={}, song={}", caller.groupScope(), step.song());
        resolve(step);
        return respond(step, "▶️ 재생을 시작합니다.");
    }

    public PlaybackResponse pause(CallerContext caller) {
        PlaybackTransition transition = roomRegistry.withRoom(caller, MusicRoom::pause);

        if (transition == PlaybackTransition.ALREADY_PAUSED) {
            return new PlaybackResponse(transition.name(), null, false, "⏸️ 재생 중인 음악이 없습니다.");
        }
        log.info("⏸️ [PLAYBACK] Paused: scope={}", caller.groupScope());
        return new PlaybackResponse(transition.name(), null, false, "⏸️ 일시정지했습니다.");
    }

    public PlaybackResponse next(CallerContext caller) {
        Step step = navigate(caller, "NEXT", MusicRoom::advance);
        resolve(step);
        return respond(step, "⏭️ 다음 곡");
    }

    public PlaybackResponse previous(CallerContext caller) {
        Step step = navigate(caller, "PREVIOUS", MusicRoom::retreat);
        resolve(step);
        return respond(step, "⏮️ 이전 곡");
    }

    public PlaybackResponse jump(CallerContext caller, String position) {
        int index = PositionParser.toIndex(position, "3");
        Step step = navigate(caller, "JUMPED", room -> Optional.of(room.skipTo(index)));
        resolve(step);
        return respond(step, "🎵 " + (step.index() + 1) + "번째 곡으로 이동합니다.");
    }

    /**
     * 알 수 없는 모드 입력은 오류 없이 현재 모드를 알려준다
     */
    public PlayModeResponse changeMode(CallerContext caller, String mode) {
        PlayModeChange change = roomRegistry.withRoom(caller, room -> room.changeMode(mode));

        if (!change.changed()) {
            return new PlayModeResponse(change.mode().name(), change.mode().getDisplayName(), false,
                "현재 재생 모드: " + change.mode().getDisplayName() + " (sequence 또는 random 으로 바꿀 수 있습니다)");
        }
        log.info("🔀 [PLAYBACK] Play mode changed: scope={}, mode={}", caller.groupScope(), change.mode());
        return new PlayModeResponse(change.mode().name(), change.mode().getDisplayName(), true,
            "🔀 재생 모드: " + change.mode().getDisplayName());
    }

    public PlayModeResponse currentMode(CallerContext caller) {
        return changeMode(caller, null);
    }

    // ── Private Helpers ──

    private Step navigate(CallerContext caller, String status, Function<MusicRoom, Optional<Song>> move) {
        Step step = roomRegistry.withRoom(caller, room -> {
            if (room.playlistSize() == 0) {
                throw new EmptyPlaylistException("재생 목록이 비어 있습니다.");
            }
            Song song = move.apply(room).orElseThrow(EmptyPlaylistException::new);
            return new Step(status, song, room.getCurrentIndex(), room.isPlaying());
        });
        log.debug("🎵 [PLAYBACK] {}: scope={}, index={}, song={}", status, caller.groupScope(), step.index(), step.song());
        return step;
    }

    private void resolve(Step step) {
        if (step.song() != null) {
            musicLookupService.resolvePlayUrl(step.song());
        }
    }

    private PlaybackResponse respond(Step step, String message) {
        SongResponse song = step.song() == null ? null : SongResponse.of(step.song(), step.index(), true);
        return new PlaybackResponse(step.status(), song, step.playing(), message);
    }
}
