package com.spring.listentogether.service.room;

/**
 * (userId, groupScope) 쌍. 역색인과 대기 검색 결과의 키
 *
 * 문자열 이어 붙이기 대신 두 값을 그대로 비교한다 ("a" + "b_c" 와 "a_b" + "c" 는 다른 키).
 */
public record MemberKey(String userId, String groupScope) {}
