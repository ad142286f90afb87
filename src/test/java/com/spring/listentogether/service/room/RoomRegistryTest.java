package com.spring.listentogether.service.room;

import com.spring.listentogether.domain.enums.MusicSource;
import com.spring.listentogether.domain.music.Song;
import com.spring.listentogether.domain.room.RoomSnapshot;
import com.spring.listentogether.exception.NoActiveRoomException;
import com.spring.listentogether.exception.NoPendingSearchException;
import com.spring.listentogether.exception.NotAMemberException;
import com.spring.listentogether.exception.NotOwnerException;
import com.spring.listentogether.exception.OwnerCannotLeaveException;
import com.spring.listentogether.exception.RoomAlreadyExistsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomRegistryTest {

    private static final CallerContext OWNER = CallerContext.of("owner", "방장", "g1");
    private static final CallerContext MEMBER = CallerContext.of("m1", "멤버", "g1");
    private static final CallerContext STRANGER = CallerContext.of("s1", "손님", "g1");

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry();
    }

    private static Song song(String id) {
        return new Song(id, "song-" + id, "artist", "album", 180, "", MusicSource.NETEASE);
    }

    @Test
    @DisplayName("같은 스코프에 방은 하나뿐")
    void createTwiceFails() {
        RoomSnapshot created = registry.createRoom(OWNER);

        assertThat(created.roomId()).isEqualTo("room_g1");
        assertThat(created.owner().userId()).isEqualTo("owner");
        assertThatThrownBy(() -> registry.createRoom(MEMBER)).isInstanceOf(RoomAlreadyExistsException.class);
        assertThat(registry.activeRoomCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("방이 없으면 참여는 NoActiveRoom")
    void joinWithoutRoom() {
        assertThatThrownBy(() -> registry.joinRoom(MEMBER)).isInstanceOf(NoActiveRoomException.class);
    }

    @Test
    @DisplayName("두 번 참여해도 참여자 목록에는 한 번만")
    void joinIsIdempotent() {
        registry.createRoom(OWNER);

        JoinResult first = registry.joinRoom(MEMBER);
        JoinResult second = registry.joinRoom(MEMBER);

        assertThat(first.status()).isEqualTo(MembershipStatus.JOINED);
        assertThat(second.status()).isEqualTo(MembershipStatus.ALREADY_MEMBER);
        assertThat(second.room().members()).containsOnlyKeys("owner", "m1");
    }

    @Test
    @DisplayName("방장이 다시 참여해도 ALREADY_MEMBER")
    void ownerJoinIsAlreadyMember() {
        registry.createRoom(OWNER);
        assertThat(registry.joinRoom(OWNER).status()).isEqualTo(MembershipStatus.ALREADY_MEMBER);
    }

    @Test
    @DisplayName("방장은 나갈 수 없다")
    void ownerCannotLeave() {
        registry.createRoom(OWNER);

        assertThatThrownBy(() -> registry.leaveRoom(OWNER)).isInstanceOf(OwnerCannotLeaveException.class);
        assertThat(registry.resolveRoomFor(OWNER).members()).containsKey("owner");
    }

    @Test
    @DisplayName("참여자가 아니면 나가기는 NotAMember (방이 없어도)")
    void leaveAsNonMember() {
        assertThatThrownBy(() -> registry.leaveRoom(STRANGER)).isInstanceOf(NotAMemberException.class);

        registry.createRoom(OWNER);
        assertThatThrownBy(() -> registry.leaveRoom(STRANGER)).isInstanceOf(NotAMemberException.class);
    }

    @Test
    @DisplayName("나간 참여자는 더 이상 방을 조회할 수 없고 대기 검색도 사라진다")
    void leaveRemovesIndexAndStash() {
        registry.createRoom(OWNER);
        registry.joinRoom(MEMBER);
        registry.stashSearchResults(MEMBER, List.of(song("1")));

        RoomSnapshot after = registry.leaveRoom(MEMBER);

        assertThat(after.members()).containsOnlyKeys("owner");
        assertThatThrownBy(() -> registry.resolveRoomFor(MEMBER)).isInstanceOf(NotAMemberException.class);

        registry.joinRoom(MEMBER);
        assertThatThrownBy(() -> registry.takeSearchResults(MEMBER)).isInstanceOf(NoPendingSearchException.class);
    }

    @Test
    @DisplayName("방장이 아니면 닫을 수 없다")
    void onlyOwnerCloses() {
        registry.createRoom(OWNER);
        registry.joinRoom(MEMBER);

        assertThatThrownBy(() -> registry.closeRoom(MEMBER)).isInstanceOf(NotOwnerException.class);
        assertThat(registry.activeRoomCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("방을 닫으면 모든 참여자의 색인과 대기 검색이 사라지고 새 방을 만들 수 있다")
    void closeEvictsEverything() {
        registry.createRoom(OWNER);
        registry.joinRoom(MEMBER);
        registry.stashSearchResults(MEMBER, List.of(song("1")));

        RoomSnapshot last = registry.closeRoom(OWNER);

        assertThat(last.members()).containsOnlyKeys("owner", "m1");
        assertThat(registry.activeRoomCount()).isZero();
        assertThat(registry.findRoom("g1")).isEmpty();
        assertThatThrownBy(() -> registry.resolveRoomFor(MEMBER)).isInstanceOf(NoActiveRoomException.class);

        registry.createRoom(MEMBER);
        assertThatThrownBy(() -> registry.takeSearchResults(MEMBER)).isInstanceOf(NoPendingSearchException.class);
        assertThatThrownBy(() -> registry.resolveRoomFor(OWNER)).isInstanceOf(NotAMemberException.class);
    }

    @Test
    @DisplayName("방 조회/명령은 참여자만")
    void withRoomRequiresMembership() {
        registry.createRoom(OWNER);

        assertThatThrownBy(() -> registry.withRoom(STRANGER, room -> room.addSong(song("1"))))
            .isInstanceOf(NotAMemberException.class);
        assertThatThrownBy(() -> registry.stashSearchResults(STRANGER, List.of(song("1"))))
            .isInstanceOf(NotAMemberException.class);
        assertThat(registry.findRoom("g1").orElseThrow().playlist()).isEmpty();
    }

    @Test
    @DisplayName("새 검색은 이전 대기 결과를 덮어쓰고, 꺼내면 사라진다")
    void stashReplaceAndTake() {
        registry.createRoom(OWNER);
        registry.stashSearchResults(OWNER, List.of(song("1"), song("2")));
        registry.stashSearchResults(OWNER, List.of(song("3")));

        assertThat(registry.peekSearchResults(OWNER)).extracting(Song::getId).containsExactly("3");
        assertThat(registry.takeSearchResults(OWNER)).extracting(Song::getId).containsExactly("3");
        assertThatThrownBy(() -> registry.takeSearchResults(OWNER)).isInstanceOf(NoPendingSearchException.class);
    }

    @Test
    @DisplayName("대기 검색 결과는 호출자별")
    void stashIsPerCaller() {
        registry.createRoom(OWNER);
        registry.joinRoom(MEMBER);
        registry.stashSearchResults(MEMBER, List.of(song("1")));

        assertThatThrownBy(() -> registry.takeSearchResults(OWNER)).isInstanceOf(NoPendingSearchException.class);
        assertThat(registry.takeSearchResults(MEMBER)).hasSize(1);
    }

    @Test
    @DisplayName("서로 다른 스코프의 방은 독립적")
    void scopesAreIndependent() {
        CallerContext otherOwner = CallerContext.of("owner", "방장", "g2");
        registry.createRoom(OWNER);
        registry.createRoom(otherOwner);

        registry.withRoom(OWNER, room -> room.addSong(song("1")));

        assertThat(registry.activeRoomCount()).isEqualTo(2);
        assertThat(registry.resolveRoomFor(OWNER).playlist()).hasSize(1);
        assertThat(registry.resolveRoomFor(otherOwner).playlist()).isEmpty();

        registry.closeRoom(OWNER);
        assertThat(registry.resolveRoomFor(otherOwner).roomId()).isEqualTo("room_g2");
    }

    @Test
    @DisplayName("빈 스코프는 private 으로 취급")
    void blankScopeIsPrivate() {
        CallerContext solo = CallerContext.of("u1", "", null);
        RoomSnapshot room = registry.createRoom(solo);

        assertThat(room.groupScope()).isEqualTo(CallerContext.PRIVATE_SCOPE);
        assertThat(room.members()).containsEntry("u1", CallerContext.UNKNOWN_USER);
    }

    @Test
    @DisplayName("밑줄이 들어간 ID 라도 (사용자, 스코프) 쌍이 다르면 색인과 대기 검색이 섞이지 않는다")
    void underscoreIdsDoNotCollideAcrossScopes() {
        CallerContext ownerOfBC = CallerContext.of("a", "에이", "b_c");
        CallerContext ownerOfC = CallerContext.of("a_b", "에이비", "c");
        registry.createRoom(ownerOfBC);
        registry.createRoom(ownerOfC);

        registry.stashSearchResults(ownerOfBC, List.of(song("1")));
        registry.stashSearchResults(ownerOfC, List.of(song("2")));
        assertThat(registry.peekSearchResults(ownerOfBC)).extracting(Song::getId).containsExactly("1");
        assertThat(registry.peekSearchResults(ownerOfC)).extracting(Song::getId).containsExactly("2");

        registry.closeRoom(ownerOfC);

        assertThat(registry.resolveRoomFor(ownerOfBC).roomId()).isEqualTo("room_b_c");
        assertThat(registry.takeSearchResults(ownerOfBC)).extracting(Song::getId).containsExactly("1");
        assertThat(registry.<Integer>withRoom(ownerOfBC, room -> room.addSong(song("3")))).isEqualTo(1);
    }

    @Test
    @DisplayName("동시에 같은 대기 결과를 꺼내면 정확히 한 명만 성공")
    void concurrentTakeSucceedsOnce() throws Exception {
        registry.createRoom(OWNER);
        registry.stashSearchResults(OWNER, List.of(song("1")));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger success = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    registry.takeSearchResults(OWNER);
                    success.incrementAndGet();
                } catch (NoPendingSearchException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(success.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(threads - 1);
    }

    @Test
    @DisplayName("동시에 방을 만들면 정확히 하나만 성공")
    void concurrentCreateSucceedsOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<String> winners = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            CallerContext caller = CallerContext.of("u" + i, "user" + i, "race");
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    registry.createRoom(caller);
                    winners.add(caller.userId());
                } catch (RoomAlreadyExistsException ignored) {
                    // 패배한 쪽
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(winners).hasSize(1);
        assertThat(registry.findRoom("race").orElseThrow().owner().userId()).isEqualTo(winners.get(0));
    }

    @Test
    @DisplayName("동시 추가도 한 곡도 잃지 않는다")
    void concurrentAddsAreNotLost() throws Exception {
        registry.createRoom(OWNER);
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int base = t * perThread;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    Song s = song(String.valueOf(base + i));
                    registry.withRoom(OWNER, room -> room.addSong(s));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(registry.resolveRoomFor(OWNER).playlist()).hasSize(threads * perThread);
    }
}
