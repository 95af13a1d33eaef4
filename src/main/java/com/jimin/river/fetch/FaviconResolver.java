package com.jimin.river.fetch;

/**
 * 사이트 주소 → 저장된 파비콘 파일 이름
 */
public interface FaviconResolver {

    String DEFAULT_ICON = "default.ico";

    String resolve(String siteUrl);
}
