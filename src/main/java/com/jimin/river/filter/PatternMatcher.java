package com.jimin.river.filter;

import com.jimin.river.exception.FilterEvaluationException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 키워드 / 정규식 매칭 + 컴파일된 정규식 캐시
 *
 * 캐시 키: (pattern, caseSensitive)
 * 조회는 read lock, 컴파일은 write lock을 잡은 뒤 한 번 더 확인하고 수행한다.
 */
@Component
public class PatternMatcher {

    private static final int CASE_INSENSITIVE_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private final Map<CacheKey, Pattern> regexCache = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * @param filter 평가할 필터
     * @param target 비교 대상 문자열 (null은 빈 문자열)
     * @throws FilterEvaluationException 잘못된 정규식 또는 알 수 없는 패턴 타입
     */
    public boolean matches(FilterDefinition filter, String target) {
        String text = target == null ? "" : target;
        PatternType type = PatternType.fromWireName(filter.patternType())
                .orElseThrow(() -> new FilterEvaluationException(
                        "알 수 없는 패턴 타입: " + filter.patternType()));

        if (type == PatternType.KEYWORD) {
            return matchesKeyword(filter.pattern(), filter.caseSensitive(), text);
        }
        return compiled(filter.pattern(), filter.caseSensitive()).matcher(text).find();
    }

    /**
     * 정규식 문법만 검사한다 (캐시에 넣지 않음).
     * 새 필터를 저장하기 전 검증용.
     */
    public static void validateRegexPattern(String pattern, boolean caseSensitive) {
        compile(pattern, caseSensitive);
    }

    public void clearCache() {
        lock.writeLock().lock();
        try {
            regexCache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int cachedPatternCount() {
        lock.readLock().lock();
        try {
            return regexCache.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static boolean matchesKeyword(String pattern, boolean caseSensitive, String text) {
        String keyword = pattern == null ? "" : pattern;
        if (caseSensitive) {
            return text.contains(keyword);
        }
        return text.toLowerCase(Locale.ROOT).contains(keyword.toLowerCase(Locale.ROOT));
    }

    private Pattern compiled(String pattern, boolean caseSensitive) {
        CacheKey key = new CacheKey(pattern, caseSensitive);

        lock.readLock().lock();
        try {
            Pattern cached = regexCache.get(key);
            if (cached != null) {
                return cached;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // 대기하는 동안 다른 스레드가 이미 컴파일했을 수 있음
            Pattern cached = regexCache.get(key);
            if (cached != null) {
                return cached;
            }
            Pattern compiled = compile(pattern, caseSensitive);
            regexCache.put(key, compiled);
            return compiled;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Pattern compile(String pattern, boolean caseSensitive) {
        if (pattern == null) {
            throw new FilterEvaluationException("정규식 패턴이 비어 있습니다");
        }
        try {
            return caseSensitive ? Pattern.compile(pattern) : Pattern.compile(pattern, CASE_INSENSITIVE_FLAGS);
        } catch (PatternSyntaxException e) {
            throw new FilterEvaluationException("잘못된 정규식 패턴 '" + pattern + "': " + e.getDescription(), e);
        }
    }

    private record CacheKey(String pattern, boolean caseSensitive) {
    }
}
