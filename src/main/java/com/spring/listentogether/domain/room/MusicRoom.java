package com.spring.listentogether.domain.room;

import com.spring.listentogether.domain.enums.PlayMode;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.exception.EmptyPlaylistException;
import com.spring.listentogether.exception.IndexOutOfRangeException;
import com.spring.listentogether.exception.OwnerCannotLeaveException;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * 같이 듣기 방 (재생 목록 + 참여자 + 재생 커서)
 *
 * 동기화하지 않는다. 모든 호출은 RoomRegistry 의 그룹 잠금 안에서만 이뤄진다.
 *
 * 불변식:
 * - currentIndex 는 -1(현재 곡 없음) 이거나 [0, playlist.size()) 범위
 * - 방장은 항상 참여자
 * - 방장 권한 검사는 호출 측 책임 (clear 포함)
 */
public class MusicRoom {

    public static final int NO_CURRENT_SONG = -1;

    @Getter
    private final String roomId;
    @Getter
    private final String groupScope;
    @Getter
    private final RoomMember owner;
    @Getter
    private final LocalDateTime createdAt;

    private final List<Song> playlist = new ArrayList<>();
    private final Map<String, String> members = new LinkedHashMap<>();
    private final Random random;

    @Getter
    private int currentIndex = NO_CURRENT_SONG;
    @Getter
    private boolean playing;
    @Getter
    private PlayMode playMode = PlayMode.SEQUENTIAL;

    public MusicRoom(String roomId, String groupScope, RoomMember owner, Random random) {
        this.roomId = roomId;
        this.groupScope = groupScope;
        this.owner = owner;
        this.random = random;
        this.createdAt = LocalDateTime.now();
        this.members.put(owner.userId(), owner.name());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  재생 목록
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * 목록 끝에 추가. 커서는 건드리지 않는다.
     * @return 추가 후 목록 길이
     */
    public int addSong(Song song) {
        playlist.add(song);
        return playlist.size();
    }

    /**
     * 0-based 위치의 노래 제거.
     * 커서가 새 길이를 넘으면 max(0, len-1) 로 당긴다 (재생 상태는 그대로).
     */
    public Song removeSong(int index) {
        requireIndex(index);
        Song removed = playlist.remove(index);
        if (currentIndex >= playlist.size()) {
            // 빈 목록이 되면 -1 로 둔다
            currentIndex = playlist.isEmpty() ? NO_CURRENT_SONG : Math.max(0, playlist.size() - 1);
        }
        return removed;
    }

    public Optional<Song> currentSong() {
        if (currentIndex < 0 || currentIndex >= playlist.size()) {
            return Optional.empty();
        }
        return Optional.of(playlist.get(currentIndex));
    }

    /**
     * 다음 곡. RANDOM 이면 [0, len) 균등 무작위, 아니면 +1 (끝에서 0 으로)
     */
    public Optional<Song> advance() {
        if (playlist.isEmpty()) {
            return Optional.empty();
        }
        if (playMode == PlayMode.RANDOM) {
            currentIndex = random.nextInt(playlist.size());
        } else {
            currentIndex = Math.floorMod(currentIndex + 1, playlist.size());
        }
        return currentSong();
    }

    /**
     * 이전 곡. 모드와 무관하게 -1 (0 에서 마지막 곡으로)
     */
    public Optional<Song> retreat() {
        if (playlist.isEmpty()) {
            return Optional.empty();
        }
        currentIndex = Math.floorMod(currentIndex - 1, playlist.size());
        return currentSong();
    }

    public Song skipTo(int index) {
        requireIndex(index);
        currentIndex = index;
        return playlist.get(index);
    }

    /**
     * 알아들을 수 없는 입력은 오류가 아니라 현재 모드 조회로 처리한다.
     */
    public PlayModeChange changeMode(String requested) {
        Optional<PlayMode> parsed = PlayMode.parse(requested);
        parsed.ifPresent(mode -> this.playMode = mode);
        return new PlayModeChange(playMode, parsed.isPresent());
    }

    public void clear() {
        playlist.clear();
        currentIndex = NO_CURRENT_SONG;
        playing = false;
    }

    public int playlistSize() {
        return playlist.size();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  재생 상태 (stopped <-> playing)
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    public PlaybackTransition play() {
        if (playlist.isEmpty()) {
            throw new EmptyPlaylistException();
        }
        if (playing) {
            return PlaybackTransition.ALREADY_PLAYING;
        }
        playing = true;
        if (currentIndex < 0) {
            currentIndex = 0;
        }
        return PlaybackTransition.STARTED;
    }

    public PlaybackTransition pause() {
        if (!playing) {
            return PlaybackTransition.ALREADY_PAUSED;
        }
        playing = false;
        return PlaybackTransition.PAUSED;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  참여자
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * @return 새로 들어왔으면 true, 이미 참여자면 false (이름은 갱신하지 않음)
     */
    public boolean addMember(String userId, String name) {
        return members.putIfAbsent(userId, name) == null;
    }

    /**
     * @return 참여자였으면 true
     */
    public boolean removeMember(String userId) {
        if (isOwner(userId)) {
            throw new OwnerCannotLeaveException();
        }
        return members.remove(userId) != null;
    }

    public boolean isOwner(String userId) {
        return owner.userId().equals(userId);
    }

    public boolean isMember(String userId) {
        return members.containsKey(userId);
    }

    public List<String> memberIds() {
        return List.copyOf(members.keySet());
    }

    public RoomSnapshot snapshot() {
        return new RoomSnapshot(
            roomId,
            groupScope,
            owner,
            Collections.unmodifiableMap(new LinkedHashMap<>(members)),
            List.copyOf(playlist),
            currentIndex,
            playing,
            playMode,
            createdAt
        );
    }

    private void requireIndex(int index) {
        if (index < 0 || index >= playlist.size()) {
            throw new IndexOutOfRangeException(
                "번호가 범위를 벗어났습니다. (1 ~ " + playlist.size() + ")");
        }
    }
}
