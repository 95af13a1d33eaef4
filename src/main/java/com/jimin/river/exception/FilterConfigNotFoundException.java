package com.jimin.river.exception;

/**
 * 존재하지 않는 필터 / 필터 그룹 ID
 */
public class FilterConfigNotFoundException extends RuntimeException {

    public FilterConfigNotFoundException(String type, Long id) {
        super(type + "을(를) 찾을 수 없습니다. ID: " + id);
    }
}
