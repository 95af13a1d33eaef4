package com.jimin.river.exception;

/**
 * 파이프라인 오류 분류
 */
public enum FailureKind {
    VALIDATION,
    FETCH,
    PARSE,
    FILTER,
    PERSISTENCE
}
