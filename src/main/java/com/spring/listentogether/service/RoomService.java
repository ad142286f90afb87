package com.spring.listentogether.service;

import com.spring.listentogether.domain.room.RoomSnapshot;
import com.spring.listentogether.dto.room.MembershipResponse;
import com.spring.listentogether.dto.room.RoomInfoResponse;
import com.spring.listentogether.exception.NoActiveRoomException;
import com.spring.listentogether.service.room.CallerContext;
import com.spring.listentogether.service.room.JoinResult;
import com.spring.listentogether.service.room.MembershipStatus;
import com.spring.listentogether.service.room.RoomRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 방 생성 / 참여 / 퇴장 / 닫기 / 정보 조회
 */
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRegistry roomRegistry;

    public MembershipResponse createRoom(CallerContext caller) {
        RoomSnapshot room = roomRegistry.createRoom(caller);
        return new MembershipResponse(
            room.roomId(),
            "CREATED",
            room.members().size(),
            "🏠 음악 방이 만들어졌습니다! 방장: " + caller.userName()
        );
    }

    public MembershipResponse joinRoom(CallerContext caller) {
        JoinResult result = roomRegistry.joinRoom(caller);
        RoomSnapshot room = result.room();

        String message = result.status() == MembershipStatus.ALREADY_MEMBER
            ? "이미 이 방에 참여하고 있습니다."
            : "✅ " + caller.userName() + " 님이 방에 들어왔습니다. 현재 인원: " + room.members().size() + "명";

        return new MembershipResponse(room.roomId(), result.status().name(), room.members().size(), message);
    }

    public MembershipResponse leaveRoom(CallerContext caller) {
        RoomSnapshot room = roomRegistry.leaveRoom(caller);
        return new MembershipResponse(
            room.roomId(),
            "LEFT",
            room.members().size(),
            "👋 " + caller.userName() + " 님이 방을 나갔습니다."
        );
    }

    public MembershipResponse closeRoom(CallerContext caller) {
        RoomSnapshot room = roomRegistry.closeRoom(caller);
        return new MembershipResponse(room.roomId(), "CLOSED", 0, "🏠 음악 방이 닫혔습니다.");
    }

    /**
     * 같은 그룹이면 참여하지 않아도 볼 수 있다
     */
    public RoomInfoResponse getRoomInfo(String groupScope) {
        return roomRegistry.findRoom(groupScope)
            .map(RoomInfoResponse::from)
            .orElseThrow(NoActiveRoomException::new);
    }
}
