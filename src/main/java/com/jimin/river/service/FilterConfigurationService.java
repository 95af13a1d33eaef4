package com.jimin.river.service;

import com.jimin.river.dto.FilterGroupRequest;
import com.jimin.river.dto.FilterRequest;
import com.jimin.river.dto.FilterRuleRequest;
import com.jimin.river.entity.EntryFilter;
import com.jimin.river.entity.FilterGroup;
import com.jimin.river.entity.FilterGroupRule;
import com.jimin.river.exception.FilterConfigNotFoundException;
import com.jimin.river.filter.FilterDefinition;
import com.jimin.river.filter.FilterEngine;
import com.jimin.river.filter.FilterGroupSnapshot;
import com.jimin.river.filter.PatternMatcher;
import com.jimin.river.filter.PatternType;
import com.jimin.river.store.FeedStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * FilterConfigurationService - 필터 / 필터 그룹 / 규칙 관리
 *
 * 모든 변경은 커밋 후 FilterEngine 캐시를 무효화한다 (다음 평가 때 새 설정을 읽음).
 * 필터 수정/삭제 시에는 정규식 캐시도 비운다.
 * 정규식 필터는 저장 전에 컴파일해서 검증한다.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
@Transactional
public class FilterConfigurationService {

    private final FeedStore feedStore;
    private final FilterEngine filterEngine;

    // ===== 필터 =====

    public EntryFilter createFilter(@Valid FilterRequest request) {
        validatePattern(request);
        EntryFilter filter = new EntryFilter();
        apply(filter, request);
        EntryFilter saved = feedStore.saveFilter(filter);
        invalidateAfterCommit();
        log.info("필터 생성: {} ({} / {})", saved.getName(), saved.getPatternType(), saved.getTargetType());
        return saved;
    }

    public EntryFilter updateFilter(Long filterId, @Valid FilterRequest request) {
        validatePattern(request);
        EntryFilter filter = feedStore.findFilter(filterId)
                .orElseThrow(() -> new FilterConfigNotFoundException("필터", filterId));
        apply(filter, request);
        EntryFilter saved = feedStore.saveFilter(filter);
        clearCachesAfterCommit();
        log.info("필터 수정: {} (ID {})", saved.getName(), filterId);
        return saved;
    }

    /**
     * 필터와 이 필터를 참조하는 규칙을 함께 삭제
     */
    public void deleteFilter(Long filterId) {
        if (!feedStore.deleteFilter(filterId)) {
            throw new FilterConfigNotFoundException("필터", filterId);
        }
        clearCachesAfterCommit();
        log.info("필터 삭제: ID {}", filterId);
    }

    // ===== 그룹 =====

    public FilterGroup createGroup(@Valid FilterGroupRequest request) {
        FilterGroup group = new FilterGroup();
        apply(group, request);
        FilterGroup saved = feedStore.saveGroup(group);
        invalidateAfterCommit();
        log.info("필터 그룹 생성: {} ({}, priority {})", saved.getName(), saved.getAction(), saved.getPriority());
        return saved;
    }

    public FilterGroup updateGroup(Long groupId, @Valid FilterGroupRequest request) {
        FilterGroup group = feedStore.findGroup(groupId)
                .orElseThrow(() -> new FilterConfigNotFoundException("필터 그룹", groupId));
        apply(group, request);
        FilterGroup saved = feedStore.saveGroup(group);
        invalidateAfterCommit();
        log.info("필터 그룹 수정: {} (ID {})", saved.getName(), groupId);
        return saved;
    }

    public void deleteGroup(Long groupId) {
        if (!feedStore.deleteGroup(groupId)) {
            throw new FilterConfigNotFoundException("필터 그룹", groupId);
        }
        invalidateAfterCommit();
        log.info("필터 그룹 삭제: ID {}", groupId);
    }

    /**
     * 그룹의 규칙 전체 교체 (position 순으로 평가)
     */
    public FilterGroup replaceRules(Long groupId, List<@Valid FilterRuleRequest> rules) {
        for (FilterRuleRequest rule : rules) {
            if (feedStore.findFilter(rule.filterId()).isEmpty()) {
                throw new FilterConfigNotFoundException("필터", rule.filterId());
            }
        }
        List<FeedStore.RuleSpec> specs = rules.stream()
                .map(rule -> new FeedStore.RuleSpec(rule.filterId(), rule.operator(), rule.position()))
                .collect(Collectors.toList());
        FilterGroup saved = feedStore.replaceGroupRules(groupId, specs);
        invalidateAfterCommit();
        log.info("필터 그룹 규칙 교체: ID {} ({}개)", groupId, specs.size());
        return saved;
    }

    // ===== 미리보기 =====

    /**
     * 저장하지 않은 필터를 샘플 문자열에 적용
     */
    @Transactional(readOnly = true)
    public boolean testFilter(@Valid FilterRequest request, String text) {
        validatePattern(request);
        FilterDefinition definition = new FilterDefinition(null, request.name(), request.pattern(),
                request.patternType(), request.targetType(), request.caseSensitive());
        return filterEngine.testFilter(definition, text);
    }

    /**
     * 저장된 그룹을 샘플 문자열에 적용
     */
    @Transactional(readOnly = true)
    public boolean testFilterGroup(Long groupId, String text) {
        FilterGroup group = feedStore.findGroup(groupId)
                .orElseThrow(() -> new FilterConfigNotFoundException("필터 그룹", groupId));

        Map<Long, FilterDefinition> filters = new HashMap<>();
        for (FilterGroupRule rule : group.getRules()) {
            feedStore.findFilter(rule.getFilterId())
                    .ifPresent(filter -> filters.put(filter.getId(), FilterDefinition.from(filter)));
        }
        return filterEngine.testFilterGroup(FilterGroupSnapshot.from(group, filters), text);
    }

    private static void validatePattern(FilterRequest request) {
        if (PatternType.fromWireName(request.patternType()).orElse(null) == PatternType.REGEX) {
            PatternMatcher.validateRegexPattern(request.pattern(), request.caseSensitive());
        }
    }

    private static void apply(EntryFilter filter, FilterRequest request) {
        filter.setName(request.name().trim());
        filter.setPattern(request.pattern());
        filter.setPatternType(request.patternType());
        filter.setTargetType(request.targetType());
        filter.setCaseSensitive(request.caseSensitive());
    }

    private static void apply(FilterGroup group, FilterGroupRequest request) {
        group.setName(request.name().trim());
        group.setAction(request.action());
        group.setActive(request.active());
        group.setPriority(request.priority());
        group.setApplyToCategory(request.applyToCategory() == null || request.applyToCategory().isBlank()
                ? null : request.applyToCategory().trim());
    }

    private void invalidateAfterCommit() {
        runAfterCommit(filterEngine::invalidateCache);
    }

    // 수정/삭제된 필터의 컴파일된 정규식까지 비운다
    private void clearCachesAfterCommit() {
        runAfterCommit(filterEngine::clearCache);
    }

    private static void runAfterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
