package com.spring.listentogether.service.room;

import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.domain.room.MusicRoom;
import com.spring.listentogether.domain.room.RoomMember;
import com.spring.listentogether.domain.room.RoomSnapshot;
import com.spring.listentogether.exception.NoActiveRoomException;
import com.spring.listentogether.exception.NoPendingSearchException;
import com.spring.listentogether.exception.NotAMemberException;
import com.spring.listentogether.exception.NotOwnerException;
import com.spring.listentogether.exception.OwnerCannotLeaveException;
import com.spring.listentogether.exception.RoomAlreadyExistsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 같이 듣기 방 레지스트리 (프로세스 메모리, 재시작 시 소멸)
 *
 * - 그룹 스코프당 방은 최대 1개
 * - (userId, groupScope) → roomKey 역색인으로 "호출자가 속한 방"을 바로 찾는다
 * - (userId, groupScope) → 대기 중인 검색 결과 (호출자당 1개, 새 검색이 덮어씀)
 *
 * 같은 그룹 스코프에 대한 모든 변경은 스코프별 ReentrantLock 안에서 실행된다.
 * 서로 다른 스코프끼리는 잠금을 공유하지 않는다.
 * 잠금 안에서는 네트워크 호출을 하지 않는다.
 */
@Component
@Slf4j
public class RoomRegistry {

    private static final String ROOM_KEY_PREFIX = "room_";

    /** roomKey → 방 */
    private final Map<String, MusicRoom> rooms = new ConcurrentHashMap<>();

    /** (userId, groupScope) → roomKey */
    private final Map<MemberKey, String> memberIndex = new ConcurrentHashMap<>();

    /** (userId, groupScope) → 마지막 검색 결과 */
    private final Map<MemberKey, List<Song>> pendingSearches = new ConcurrentHashMap<>();

    /**
     * groupScope → 잠금. 한 번 만든 잠금은 지우지 않는다
     * (지우면 대기 중인 스레드와 새 스레드가 서로 다른 잠금을 잡게 된다)
     */
    private final Map<String, ReentrantLock> scopeLocks = new ConcurrentHashMap<>();

    private final Supplier<Random> randomFactory;

    public RoomRegistry() {
        this(Random::new);
    }

    public RoomRegistry(Supplier<Random> randomFactory) {
        this.randomFactory = randomFactory;
    }

    public static String roomKey(String groupScope) {
        return ROOM_KEY_PREFIX + groupScope;
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  방 생명주기
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    public RoomSnapshot createRoom(CallerContext caller) {
        return locked(caller.groupScope(), () -> {
            String roomKey = roomKey(caller.groupScope());
            if (rooms.containsKey(roomKey)) {
                throw new RoomAlreadyExistsException();
            }

            MusicRoom room = new MusicRoom(roomKey, caller.groupScope(),
                new RoomMember(caller.userId(), caller.userName()), randomFactory.get());
            rooms.put(roomKey, room);
            memberIndex.put(caller.memberKey(), roomKey);

            log.info("🏠 [ROOM] Room created: scope={}, owner={}({})",
                caller.groupScope(), caller.userName(), caller.userId());
            return room.snapshot();
        });
    }

    /**
     * 이미 참여 중이면 상태만 ALREADY_MEMBER 로 돌려준다 (오류 아님)
     */
    public JoinResult joinRoom(CallerContext caller) {
        return locked(caller.groupScope(), () -> {
            MusicRoom room = activeRoom(caller.groupScope());

            if (!room.addMember(caller.userId(), caller.userName())) {
                memberIndex.put(caller.memberKey(), room.getRoomId());
                return new JoinResult(MembershipStatus.ALREADY_MEMBER, room.snapshot());
            }
            memberIndex.put(caller.memberKey(), room.getRoomId());

            log.info("👋 [ROOM] Member joined: scope={}, user={}({}), members={}",
                caller.groupScope(), caller.userName(), caller.userId(), room.memberIds().size());
            return new JoinResult(MembershipStatus.JOINED, room.snapshot());
        });
    }

    public RoomSnapshot leaveRoom(CallerContext caller) {
        return locked(caller.groupScope(), () -> {
            // 방이 없어도 "참여 중인 방이 없음" 으로 안내한다
            if (!rooms.containsKey(roomKey(caller.groupScope()))) {
                throw new NotAMemberException();
            }
            MusicRoom room = memberRoom(caller);
            if (room.isOwner(caller.userId())) {
                throw new OwnerCannotLeaveException();
            }

            room.removeMember(caller.userId());
            memberIndex.remove(caller.memberKey());
            pendingSearches.remove(caller.memberKey());

            log.info("🚪 [ROOM] Member left: scope={}, user={}, members={}",
                caller.groupScope(), caller.userId(), room.memberIds().size());
            return room.snapshot();
        });
    }

    /**
     * 방장만 닫을 수 있다. 모든 참여자의 역색인과 대기 검색 결과를 함께 지운다.
     * @return 닫히기 직전 상태
     */
    public RoomSnapshot closeRoom(CallerContext caller) {
        return locked(caller.groupScope(), () -> {
            MusicRoom room = activeRoom(caller.groupScope());
            if (!room.isOwner(caller.userId())) {
                throw new NotOwnerException("방장만 방을 닫을 수 있습니다.");
            }

            RoomSnapshot last = room.snapshot();
            for (String memberId : room.memberIds()) {
                MemberKey key = new MemberKey(memberId, caller.groupScope());
                memberIndex.remove(key);
                pendingSearches.remove(key);
            }
            rooms.remove(room.getRoomId());

            log.info("🗑️ [ROOM] Room closed: scope={}, members={}, songs={}",
                caller.groupScope(), last.members().size(), last.playlist().size());
            return last;
        });
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  조회 / 잠금 실행
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * 호출자가 속한 방의 현재 상태.
     * 방이 없으면 NoActiveRoom, 방은 있는데 참여자가 아니면 NotAMember
     */
    public RoomSnapshot resolveRoomFor(CallerContext caller) {
        return locked(caller.groupScope(), () -> memberRoom(caller).snapshot());
    }

    public Optional<RoomSnapshot> findRoom(String groupScope) {
        return locked(groupScope, () -> Optional.ofNullable(rooms.get(roomKey(groupScope)))
            .map(MusicRoom::snapshot));
    }

    /**
     * 호출자의 방을 찾아 스코프 잠금 안에서 action 을 실행한다.
     * action 안에서 네트워크 호출 금지.
     */
    public <T> T withRoom(CallerContext caller, Function<MusicRoom, T> action) {
        return locked(caller.groupScope(), () -> action.apply(memberRoom(caller)));
    }

    public int activeRoomCount() {
        return rooms.size();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    //  검색 결과 대기열
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    /**
     * 호출자의 대기 검색 결과를 교체한다. 방 참여자가 아니면 거부.
     */
    public void stashSearchResults(CallerContext caller, List<Song> songs) {
        locked(caller.groupScope(), () -> {
            memberRoom(caller);
            pendingSearches.put(caller.memberKey(), List.copyOf(songs));
            return null;
        });
    }

    /**
     * 대기 검색 결과를 꺼내면서 지운다. 두 번째 호출은 NoPendingSearch.
     */
    public List<Song> takeSearchResults(CallerContext caller) {
        return locked(caller.groupScope(), () -> {
            List<Song> songs = pendingSearches.remove(caller.memberKey());
            if (songs == null) {
                throw new NoPendingSearchException();
            }
            return songs;
        });
    }

    /**
     * 지우지 않고 조회만. 선택 번호 검증용
     */
    public List<Song> peekSearchResults(CallerContext caller) {
        return locked(caller.groupScope(), () -> {
            List<Song> songs = pendingSearches.get(caller.memberKey());
            if (songs == null) {
                throw new NoPendingSearchException();
            }
            return songs;
        });
    }

    // ── Private Helpers ──

    private <T> T locked(String groupScope, Supplier<T> action) {
        ReentrantLock lock = scopeLocks.computeIfAbsent(groupScope, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private MusicRoom activeRoom(String groupScope) {
        MusicRoom room = rooms.get(roomKey(groupScope));
        if (room == null) {
            throw new NoActiveRoomException();
        }
        return room;
    }

    private MusicRoom memberRoom(CallerContext caller) {
        MusicRoom room = activeRoom(caller.groupScope());
        String indexed = memberIndex.get(caller.memberKey());
        if (!room.getRoomId().equals(indexed) || !room.isMember(caller.userId())) {
            throw new NotAMemberException();
        }
        return room;
    }
}
