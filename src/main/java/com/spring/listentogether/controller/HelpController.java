package com.spring.listentogether.controller;

import com.spring.listentogether.dto.help.HelpResponse;
import com.spring.listentogether.dto.help.HelpResponse.Command;
import com.spring.listentogether.dto.help.HelpResponse.Section;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 명령어 도움말
 */
@RestController
public class HelpController {

    private static final String ROOM = "/api/v1/rooms/{groupScope}";

    private static final HelpResponse HELP = new HelpResponse(
        "🎵 같이 듣기 - 도움말",
        List.of(
            new Section("방 관리", List.of(
                new Command("POST", ROOM, "음악 방 만들기"),
                new Command("POST", ROOM + "/members", "현재 방에 참여"),
                new Command("DELETE", ROOM + "/members/me", "방 나가기"),
                new Command("DELETE", ROOM, "방 닫기 (방장만)"),
                new Command("GET", ROOM, "방 정보 보기")
            )),
            new Section("노래", List.of(
                new Command("POST", ROOM + "/search", "노래 검색 (QQ음악 / 넷이즈)"),
                new Command("POST", ROOM + "/selection", "검색 결과에서 번호로 골라 추가"),
                new Command("GET", ROOM + "/playlist", "재생 목록 보기"),
                new Command("DELETE", ROOM + "/playlist/{position}", "번호로 노래 삭제"),
                new Command("DELETE", ROOM + "/playlist", "재생 목록 비우기 (방장만)")
            )),
            new Section("재생 제어", List.of(
                new Command("POST", ROOM + "/playback/play", "재생 시작"),
                new Command("POST", ROOM + "/playback/pause", "일시정지"),
                new Command("POST", ROOM + "/playback/next", "다음 곡"),
                new Command("POST", ROOM + "/playback/previous", "이전 곡"),
                new Command("POST", ROOM + "/playback/jump", "번호로 이동"),
                new Command("PUT", ROOM + "/mode", "재생 모드 설정 (sequence / random)")
            ))
        ),
        "💡 노래 출처는 QQ음악과 넷이즈 클라우드 뮤직입니다. 번호는 1부터 셉니다."
    );

    @GetMapping("/api/v1/help")
    public HelpResponse help() {
        return HELP;
    }
}
