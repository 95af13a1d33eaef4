package com.jimin.river.exception;

public class DuplicateFeedException extends RuntimeException {

    public DuplicateFeedException(String url) {
        super("이미 구독 중인 피드입니다: " + url);
    }
}
