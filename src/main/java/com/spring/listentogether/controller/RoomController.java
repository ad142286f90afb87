package com.spring.listentogether.controller;

import com.spring.listentogether.dto.room.MembershipResponse;
import com.spring.listentogether.dto.room.RoomInfoResponse;
import com.spring.listentogether.service.RoomService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * 방 관리 API
 *
 * POST   /api/v1/rooms/{groupScope}            : 방 만들기 (만든 사람이 방장)
 * GET    /api/v1/rooms/{groupScope}            : 방 정보
 * DELETE /api/v1/rooms/{groupScope}            : 방 닫기 (방장만)
 * POST   /api/v1/rooms/{groupScope}/members    : 참여
 * DELETE /api/v1/rooms/{groupScope}/members/me : 나가기 (방장은 불가)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/rooms/{groupScope}")
public class RoomController {

    private final RoomService roomService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MembershipResponse createRoom(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return roomService.createRoom(CallerHeaders.caller(userId, userName, groupScope));
    }

    @GetMapping
    public RoomInfoResponse getRoomInfo(@PathVariable String groupScope) {
        return roomService.getRoomInfo(groupScope);
    }

    @DeleteMapping
    public MembershipResponse closeRoom(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return roomService.closeRoom(CallerHeaders.caller(userId, userName, groupScope));
    }

    @PostMapping("/members")
    public MembershipResponse joinRoom(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return roomService.joinRoom(CallerHeaders.caller(userId, userName, groupScope));
    }

    @DeleteMapping("/members/me")
    public MembershipResponse leaveRoom(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return roomService.leaveRoom(CallerHeaders.caller(userId, userName, groupScope));
    }
}
