package com.jimin.river.service;

import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.dto.FilterGroupRequest;
import com.jimin.river.dto.FilterRequest;
import com.jimin.river.dto.FilterRuleRequest;
import com.jimin.river.entity.EntryFilter;
import com.jimin.river.entity.FilterGroup;
import com.jimin.river.exception.FilterConfigNotFoundException;
import com.jimin.river.exception.FilterEvaluationException;
import com.jimin.river.filter.FilterDecision;
import com.jimin.river.filter.FilterEngine;
import com.jimin.river.filter.PatternMatcher;
import com.jimin.river.repository.EntryFilterRepository;
import com.jimin.river.repository.FilterGroupRepository;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class FilterConfigurationServiceTest {

    @Autowired
    private FilterConfigurationService service;

    @Autowired
    private FilterEngine filterEngine;

    @Autowired
    private PatternMatcher patternMatcher;

    @Autowired
    private FilterGroupRepository groupRepository;

    @Autowired
    private EntryFilterRepository filterRepository;

    @BeforeEach
    void setUp() {
        groupRepository.deleteAll();
        filterRepository.deleteAllInBatch();
        filterEngine.clearCache();
    }

    @Test
    void newGroupIsVisibleToEngineAfterCommit() {
        assertEquals(FilterDecision.KEEP, filterEngine.filterEntry(entry("Python Tutorial"), null, List.of()));

        EntryFilter go = service.createFilter(keyword("go", "Go"));
        EntryFilter rust = service.createFilter(keyword("rust", "Rust"));
        FilterGroup langs = service.createGroup(new FilterGroupRequest("langs", "keep", true, 0, " "));
        service.replaceRules(langs.getId(), List.of(
                new FilterRuleRequest(go.getId(), "AND", 0),
                new FilterRuleRequest(rust.getId(), "OR", 1)));

        assertEquals(FilterDecision.KEEP, filterEngine.filterEntry(entry("Rust Guide"), null, List.of()));
        assertEquals(FilterDecision.DISCARD, filterEngine.filterEntry(entry("Python Tutorial"), null, List.of()));
    }

    @Test
    void invalidRegexIsRejectedBeforeSaving() {
        FilterRequest broken = new FilterRequest("broken", "([a-z", "regex", "title", false);

        assertThrows(FilterEvaluationException.class, () -> service.createFilter(broken));
        assertEquals(0, filterRepository.count());
    }

    @Test
    void requestValidationRejectsUnknownTypes() {
        assertThrows(ConstraintViolationException.class,
                () -> service.createFilter(new FilterRequest("x", "Go", "glob", "title", false)));
        assertThrows(ConstraintViolationException.class,
                () -> service.createFilter(new FilterRequest(" ", "Go", "keyword", "title", false)));
        assertThrows(ConstraintViolationException.class,
                () -> service.createGroup(new FilterGroupRequest("g", "maybe", true, 0, null)));
    }

    @Test
    void rulesMustReferenceExistingFilters() {
        FilterGroup group = service.createGroup(new FilterGroupRequest("g", "discard", true, 0, null));

        assertThrows(FilterConfigNotFoundException.class,
                () -> service.replaceRules(group.getId(), List.of(new FilterRuleRequest(999_999L, "AND", 0))));
    }

    @Test
    void deletingFilterDetachesItFromGroups() {
        EntryFilter sponsored = service.createFilter(keyword("ads", "Sponsored"));
        FilterGroup noAds = service.createGroup(new FilterGroupRequest("no ads", "discard", true, 0, null));
        service.replaceRules(noAds.getId(), List.of(new FilterRuleRequest(sponsored.getId(), "AND", 0)));
        assertEquals(FilterDecision.DISCARD, filterEngine.filterEntry(entry("Sponsored: deal"), null, List.of()));

        service.deleteFilter(sponsored.getId());

        assertEquals(FilterDecision.KEEP, filterEngine.filterEntry(entry("Sponsored: deal"), null, List.of()));
        assertThrows(FilterConfigNotFoundException.class, () -> service.deleteFilter(sponsored.getId()));
    }

    @Test
    void changingRegexFilterDropsCompiledPatterns() {
        EntryFilter release = service.createFilter(new FilterRequest("release", "v\\d+\\.\\d+", "regex", "title", false));
        FilterGroup releases = service.createGroup(new FilterGroupRequest("releases", "discard", true, 0, null));
        service.replaceRules(releases.getId(), List.of(new FilterRuleRequest(release.getId(), "AND", 0)));
        assertEquals(FilterDecision.DISCARD, filterEngine.filterEntry(entry("Release v1.24"), null, List.of()));
        assertTrue(patternMatcher.cachedPatternCount() > 0);

        service.updateFilter(release.getId(), new FilterRequest("release", "^RC\\d+", "regex", "title", false));

        assertEquals(0, patternMatcher.cachedPatternCount());
        assertEquals(FilterDecision.KEEP, filterEngine.filterEntry(entry("Release v1.24"), null, List.of()));
        assertEquals(FilterDecision.DISCARD, filterEngine.filterEntry(entry("RC2 notes"), null, List.of()));
        assertTrue(patternMatcher.cachedPatternCount() > 0);

        service.deleteFilter(release.getId());

        assertEquals(0, patternMatcher.cachedPatternCount());
    }

    @Test
    void deactivatingGroupStopsFiltering() {
        EntryFilter sponsored = service.createFilter(keyword("ads", "Sponsored"));
        FilterGroup noAds = service.createGroup(new FilterGroupRequest("no ads", "discard", true, 0, null));
        service.replaceRules(noAds.getId(), List.of(new FilterRuleRequest(sponsored.getId(), "AND", 0)));

        service.updateGroup(noAds.getId(), new FilterGroupRequest("no ads", "discard", false, 0, null));

        assertEquals(FilterDecision.KEEP, filterEngine.filterEntry(entry("Sponsored: deal"), null, List.of()));
    }

    @Test
    void previewsFilterAndGroup() {
        assertTrue(service.testFilter(new FilterRequest("v", "v\\d+\\.\\d+", "regex", "title", false),
                "Release v1.24 is out"));
        assertFalse(service.testFilter(keyword("go", "Go"), "Python Tutorial"));

        EntryFilter go = service.createFilter(keyword("go", "Go"));
        EntryFilter tutorial = service.createFilter(keyword("tutorial", "Tutorial"));
        FilterGroup both = service.createGroup(new FilterGroupRequest("both", "keep", true, 0, null));
        service.replaceRules(both.getId(), List.of(
                new FilterRuleRequest(go.getId(), "AND", 0),
                new FilterRuleRequest(tutorial.getId(), "AND", 1)));

        assertTrue(service.testFilterGroup(both.getId(), "Go Tutorial"));
        assertFalse(service.testFilterGroup(both.getId(), "Go Release"));
        assertThrows(FilterConfigNotFoundException.class, () -> service.testFilterGroup(999_999L, "Go"));
    }

    private static FilterRequest keyword(String name, String pattern) {
        return new FilterRequest(name, pattern, "keyword", "title", false);
    }

    private static EntryCandidate entry(String title) {
        return new EntryCandidate(title, "https://blog.example.com/" + title.hashCode(), null, null,
                LocalDateTime.of(2026, 3, 10, 9, 0), null);
    }
}
