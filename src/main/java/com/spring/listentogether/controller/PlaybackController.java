package com.spring.listentogether.controller;

import com.spring.listentogether.dto.playback.PlayModeRequest;
import com.spring.listentogether.dto.playback.PlayModeResponse;
import com.spring.listentogether.dto.playback.PlaybackResponse;
import com.spring.listentogether.dto.playlist.PositionRequest;
import com.spring.listentogether.service.PlaybackService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 재생 제어 API
 *
 * POST /api/v1/rooms/{groupScope}/playback/play
 * POST /api/v1/rooms/{groupScope}/playback/pause
 * POST /api/v1/rooms/{groupScope}/playback/next
 * POST /api/v1/rooms/{groupScope}/playback/previous
 * POST /api/v1/rooms/{groupScope}/playback/jump   : body {position}
 * GET  /api/v1/rooms/{groupScope}/mode            : 현재 재생 모드
 * PUT  /api/v1/rooms/{groupScope}/mode            : body {mode}, 모르는 값이면 조회로 처리
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/rooms/{groupScope}")
public class PlaybackController {

    private final PlaybackService playbackService;

    @PostMapping("/playback/play")
    public PlaybackResponse play(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playbackService.play(CallerHeaders.caller(userId, userName, groupScope));
    }

    @PostMapping("/playback/pause")
    public PlaybackResponse pause(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playbackService.pause(CallerHeaders.caller(userId, userName, groupScope));
    }

    @PostMapping("/playback/next")
    public PlaybackResponse next(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playbackService.next(CallerHeaders.caller(userId, userName, groupScope));
    }

    @PostMapping("/playback/previous")
    public PlaybackResponse previous(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playbackService.previous(CallerHeaders.caller(userId, userName, groupScope));
    }

    @PostMapping("/playback/jump")
    public PlaybackResponse jump(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName,
        @RequestBody @Valid PositionRequest request
    ) {
        return playbackService.jump(CallerHeaders.caller(userId, userName, groupScope), request.position());
    }

    @GetMapping("/mode")
    public PlayModeResponse currentMode(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playbackService.currentMode(CallerHeaders.caller(userId, userName, groupScope));
    }

    @PutMapping("/mode")
    public PlayModeResponse changeMode(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName,
        @RequestBody PlayModeRequest request
    ) {
        return playbackService.changeMode(CallerHeaders.caller(userId, userName, groupScope), request.mode());
    }
}
