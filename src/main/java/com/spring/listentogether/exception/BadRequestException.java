package com.spring.listentogether.exception;

/**
 * 사용자 입력 자체가 잘못됨 (빈 검색어, 숫자가 없는 번호, 식별 헤더 누락)
 *
 * 범위를 벗어난 번호는 여기가 아니라 IndexOutOfRangeException
 */
public class BadRequestException extends BusinessException {

    public BadRequestException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }

    /**
     * @param example 안내 문구에 붙일 입력 예시 (예: "1")
     */
    public static BadRequestException invalidPosition(String example) {
        return new BadRequestException("올바른 번호를 입력해주세요. 예: " + example);
    }
}
