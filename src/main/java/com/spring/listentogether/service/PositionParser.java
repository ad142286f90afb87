package com.spring.listentogether.service;

import com.spring.listentogether.exception.BadRequestException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 사용자가 입력한 1-based 번호 → 0-based 인덱스
 *
 * "3", "3번", "/jump 3" 처럼 입력 안의 첫 숫자 묶음을 번호로 본다.
 * 범위 검사는 하지 않는다 (방/검색 결과 쪽에서 IndexOutOfRange 로 처리).
 */
public final class PositionParser {

    private static final Pattern DIGITS = Pattern.compile("(\\d+)");

    private PositionParser() {}

    public static int toIndex(String raw, String example) {
        if (raw == null) {
            throw BadRequestException.invalidPosition(example);
        }
        Matcher matcher = DIGITS.matcher(raw);
        if (!matcher.find()) {
            throw BadRequestException.invalidPosition(example);
        }
        try {
            return Integer.parseInt(matcher.group(1)) - 1;
        } catch (NumberFormatException e) {
            throw new BadRequestException("번호가 너무 큽니다. 예: " + example);
        }
    }
}
