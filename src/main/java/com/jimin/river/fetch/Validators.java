package com.jimin.river.fetch;

/**
 * HTTP 캐시 검증자 (Last-Modified / ETag)
 *
 * 빈 문자열은 "값 없음"과 같다.
 */
public record Validators(String lastModified, String etag) {

    public static final Validators NONE = new Validators(null, null);

    public Validators {
        lastModified = blankToNull(lastModified);
        etag = blankToNull(etag);
    }

    public boolean isEmpty() {
        return lastModified == null && etag == null;
    }

    /**
     * 필드별로 값이 없으면 fallback 쪽 값을 쓴다.
     */
    public Validators orElse(Validators fallback) {
        if (fallback == null) {
            return this;
        }
        return new Validators(
                lastModified != null ? lastModified : fallback.lastModified,
                etag != null ? etag : fallback.etag
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
