package com.spring.listentogether.controller;

import com.spring.listentogether.exception.BadRequestException;
import com.spring.listentogether.service.room.CallerContext;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * 호출자 식별 헤더
 *
 * X-User-Id   (필수) 채팅 플랫폼의 사용자 ID
 * X-User-Name (선택) 표시 이름. 헤더에 한글을 그대로 못 싣는 클라이언트는 UTF-8 percent-encoding
 */
final class CallerHeaders {

    static final String USER_ID = "X-User-Id";
    static final String USER_NAME = "X-User-Name";

    private CallerHeaders() {}

    static CallerContext caller(String userId, String userName, String groupScope) {
        if (userId == null || userId.isBlank()) {
            throw new BadRequestException("사용자 식별 헤더가 비어 있습니다: " + USER_ID);
        }
        String name = userName;
        if (name != null && name.indexOf('%') >= 0) {
            try {
                name = URLDecoder.decode(name, StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e) {
                // 잘못된 인코딩이면 받은 값 그대로 표시
                name = userName;
            }
        }
        return CallerContext.of(userId.trim(), name, groupScope);
    }
}
