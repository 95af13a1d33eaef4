package com.jimin.river.fetch;

import org.springframework.stereotype.Component;

/**
 * 파비콘 다운로드 없이 항상 기본 아이콘
 */
@Component
public class DefaultFaviconResolver implements FaviconResolver {

    @Override
    public String resolve(String siteUrl) {
        return DEFAULT_ICON;
    }
}
