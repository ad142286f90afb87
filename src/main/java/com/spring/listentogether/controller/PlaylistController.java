package com.spring.listentogether.controller;

import com.spring.listentogether.dto.playlist.PlaylistResponse;
import com.spring.listentogether.dto.playlist.PositionRequest;
import com.spring.listentogether.dto.playlist.SearchRequest;
import com.spring.listentogether.dto.playlist.SearchResultResponse;
import com.spring.listentogether.dto.playlist.SongAddedResponse;
import com.spring.listentogether.dto.playlist.SongRemovedResponse;
import com.spring.listentogether.service.PlaylistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 검색 / 선택 / 재생 목록 API
 *
 * POST   /api/v1/rooms/{groupScope}/search               : 노래 검색 (결과는 호출자별로 보관)
 * POST   /api/v1/rooms/{groupScope}/selection            : 검색 결과에서 번호로 선택
 * GET    /api/v1/rooms/{groupScope}/playlist             : 재생 목록
 * DELETE /api/v1/rooms/{groupScope}/playlist/{position}  : 번호로 삭제
 * DELETE /api/v1/rooms/{groupScope}/playlist             : 전체 비우기 (방장만)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/rooms/{groupScope}")
public class PlaylistController {

    private final PlaylistService playlistService;

    @PostMapping("/search")
    public SearchResultResponse search(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName,
        @RequestBody @Valid SearchRequest request
    ) {
        return playlistService.search(CallerHeaders.caller(userId, userName, groupScope), request.keyword());
    }

    @PostMapping("/selection")
    public SongAddedResponse select(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName,
        @RequestBody @Valid PositionRequest request
    ) {
        return playlistService.select(CallerHeaders.caller(userId, userName, groupScope), request.position());
    }

    @GetMapping("/playlist")
    public PlaylistResponse getPlaylist(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playlistService.getPlaylist(CallerHeaders.caller(userId, userName, groupScope));
    }

    @DeleteMapping("/playlist/{position}")
    public SongRemovedResponse remove(
        @PathVariable String groupScope,
        @PathVariable String position,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playlistService.remove(CallerHeaders.caller(userId, userName, groupScope), position);
    }

    @DeleteMapping("/playlist")
    public PlaylistResponse clear(
        @PathVariable String groupScope,
        @RequestHeader(CallerHeaders.USER_ID) String userId,
        @RequestHeader(value = CallerHeaders.USER_NAME, required = false) String userName
    ) {
        return playlistService.clear(CallerHeaders.caller(userId, userName, groupScope));
    }
}
