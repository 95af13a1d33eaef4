package com.jimin.river.dto;

/**
 * 저장 단계 결과 (피드 1개)
 */
public record SaveOutcome(int inserted, int updated, int filtered, int trimmed) {

    public static SaveOutcome metadataOnly(int filtered) {
        return new SaveOutcome(0, 0, filtered, 0);
    }

    public int saved() {
        return inserted + updated;
    }
}
