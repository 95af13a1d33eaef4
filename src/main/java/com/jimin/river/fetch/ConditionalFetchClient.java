package com.jimin.river.fetch;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.dto.FetchResult;
import com.jimin.river.entity.Feed;
import com.jimin.river.exception.FeedFetchException;
import com.jimin.river.exception.FeedPipelineException;
import com.jimin.river.exception.FeedValidationException;
import com.jimin.river.store.FeedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * ConditionalFetchClient - 조건부 GET으로 피드 1개 수집
 *
 * 동작 방식:
 * 1. 목적지 검사 (DestinationGuard) → 리다이렉트마다 다시 검사, 최대 5회
 * 2. If-Modified-Since / If-None-Match 전송 (메모리 캐시 → 없으면 DB 값)
 * 3. 304: 항목 없이 검증자만 유지
 * 4. 2xx: 본문 최대 5 MiB 읽고 파싱 (요청 타임아웃은 본문 수신까지 포함)
 * 5. 워터마크(저장된 최신 publishedAt)보다 새로운 항목만 publishedAt 최신순으로 반환
 *
 * 4xx/5xx(429 포함)는 FeedFetchException, 백오프는 하지 않는다.
 */
@Slf4j
@Component
public class ConditionalFetchClient implements FeedFetcher {

    static final String FAVICON_PATH = "/static/favicons/";

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);
    private static final String ACCEPT =
            "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.5";

    private final HttpClient httpClient;
    private final DestinationGuard destinationGuard;
    private final ValidatorCache validatorCache;
    private final FeedParser feedParser;
    private final FaviconResolver faviconResolver;
    private final FeedStore feedStore;
    private final Clock clock;
    private final RiverProperties.Fetch settings;

    public ConditionalFetchClient(HttpClient httpClient, DestinationGuard destinationGuard,
                                  ValidatorCache validatorCache, FeedParser feedParser,
                                  FaviconResolver faviconResolver, FeedStore feedStore,
                                  Clock clock, RiverProperties properties) {
        this.httpClient = httpClient;
        this.destinationGuard = destinationGuard;
        this.validatorCache = validatorCache;
        this.feedParser = feedParser;
        this.faviconResolver = faviconResolver;
        this.feedStore = feedStore;
        this.clock = clock;
        this.settings = properties.fetch();
    }

    @Override
    public FetchResult fetch(Feed feed, UpdateContext context) {
        try {
            return doFetch(feed, context);
        } catch (FeedPipelineException e) {
            log.debug("피드 수집 실패: {} [{}] - {}", feed.getUrl(), e.kind(), e.getMessage());
            return FetchResult.failed(feed, e);
        }
    }

    private FetchResult doFetch(Feed feed, UpdateContext context) {
        URI uri = toUri(feed.getUrl());
        Validators sent = validatorsFor(feed);

        LimitedBodyHandler bodyHandler = new LimitedBodyHandler(settings.maxBodyBytes());
        HttpResponse<byte[]> response = send(uri, sent, bodyHandler, context);
        int status = response.statusCode();

        if (status == 304) {
            // 304는 검증자를 안 보내는 서버도 있음 → 보낸 값 유지
            Validators kept = validatorsOf(response.headers()).orElse(sent);
            validatorCache.put(feed.getId(), kept);
            log.debug("변경 없음 (304): {}", feed.getUrl());
            return FetchResult.notModified(feed, kept);
        }
        if (status >= 400) {
            throw new FeedFetchException("HTTP " + status + " 응답: " + feed.getUrl(), status);
        }
        if (status < 200 || status >= 300) {
            throw new FeedFetchException("예상하지 못한 응답 상태 " + status + ": " + feed.getUrl(), status);
        }

        byte[] body = response.body();
        if (bodyHandler.truncated()) {
            // 잘린 본문은 보통 파싱 단계에서 실패한다
            log.warn("본문이 {} bytes 제한에 도달하여 잘렸습니다: {}", bodyHandler.limit(), feed.getUrl());
        }
        ParsedFeed parsed = feedParser.parse(new ByteArrayInputStream(body));
        Validators received = validatorsOf(response.headers());

        List<EntryCandidate> entries = newEntries(feed, parsed);

        // 파싱까지 성공한 뒤에만 캐시 갱신 (실패하면 다음 주기에 전체 본문을 다시 받음)
        validatorCache.put(feed.getId(), received);

        log.debug("수집 완료: {} - 신규 후보 {}건 / 전체 {}건", feed.getUrl(), entries.size(), parsed.items().size());
        return FetchResult.fetched(feed, parsed.title(), parsed.link(), entries, received);
    }

    /**
     * 리다이렉트는 홉마다 목적지 검사 후 직접 따라간다.
     * 요청 타임아웃은 홉마다 헤더부터 본문 수신 완료까지 적용된다.
     */
    private HttpResponse<byte[]> send(URI uri, Validators validators, LimitedBodyHandler bodyHandler,
                                      UpdateContext context) {
        URI current = uri;
        for (int hop = 0; ; hop++) {
            // 홉마다 요청 전에 목적지 검사 (리다이렉트 포함)
            destinationGuard.check(current);

            // HttpRequest.timeout은 헤더 수신까지만 → 본문까지 orTimeout으로 감싼다
            CompletableFuture<HttpResponse<byte[]>> exchange = httpClient
                    .sendAsync(buildRequest(current, validators), bodyHandler)
                    .orTimeout(settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
            HttpResponse<byte[]> response;
            try {
                response = context.await(exchange);
            } catch (FeedPipelineException e) {
                // 타임아웃/취소 후에도 본문 수신이 남아 있으면 연결을 끊는다
                bodyHandler.abort();
                throw e;
            }
            int status = response.statusCode();
            if (!REDIRECT_STATUSES.contains(status)) {
                return response;
            }

            if (hop >= settings.maxRedirects()) {
                throw new FeedFetchException("리다이렉트가 너무 많습니다 (최대 " + settings.maxRedirects() + "회): " + uri, status);
            }
            String location = response.headers().firstValue("Location")
                    .orElseThrow(() -> new FeedFetchException("Location 헤더가 없는 리다이렉트: " + uri, status));
            current = resolveRedirect(current, location);
            log.debug("리다이렉트 {} → {}", uri, current);
        }
    }

    private HttpRequest buildRequest(URI uri, Validators validators) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(settings.requestTimeout())
                .header("User-Agent", settings.userAgent())
                .header("Accept", ACCEPT)
                .GET();
        if (validators.lastModified() != null) {
            builder.header("If-Modified-Since", validators.lastModified());
        }
        if (validators.etag() != null) {
            builder.header("If-None-Match", validators.etag());
        }
        return builder.build();
    }

    private Validators validatorsFor(Feed feed) {
        return validatorCache.get(feed.getId())
                .filter(cached -> !cached.isEmpty())
                .orElseGet(() -> new Validators(feed.getLastModified(), feed.getEtag()));
    }

    private static Validators validatorsOf(HttpHeaders headers) {
        return new Validators(
                headers.firstValue("Last-Modified").orElse(null),
                headers.firstValue("ETag").orElse(null)
        );
    }

    private List<EntryCandidate> newEntries(Feed feed, ParsedFeed parsed) {
        LocalDateTime fetchedAt = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Optional<LocalDateTime> watermark = feedStore.getEntryWatermark(feed.getId());

        List<EntryCandidate> entries = new ArrayList<>();
        String faviconUrl = null;
        for (ParsedFeed.Item item : parsed.items()) {
            if (item.link() == null) {
                continue;
            }
            LocalDateTime publishedAt = item.publishedAt() == null
                    ? fetchedAt
                    : LocalDateTime.ofInstant(item.publishedAt(), ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
            // 워터마크와 같은 시각도 이미 저장된 것으로 본다
            if (watermark.isPresent() && !publishedAt.isAfter(watermark.get())) {
                continue;
            }
            // 파비콘은 신규 항목이 있을 때 한 번만 조회
            if (faviconUrl == null) {
                faviconUrl = faviconUrl(parsed.link() != null ? parsed.link() : feed.getUrl());
            }
            entries.add(new EntryCandidate(item.title(), item.link(), item.content(), item.guid(),
                    publishedAt, faviconUrl));
        }
        entries.sort(Comparator.comparing(EntryCandidate::publishedAt).reversed());
        return entries;
    }

    private String faviconUrl(String siteUrl) {
        String file;
        try {
            file = faviconResolver.resolve(siteUrl);
        } catch (RuntimeException e) {
            log.warn("파비콘 조회 실패, 기본 아이콘 사용: {} - {}", siteUrl, e.getMessage());
            file = FaviconResolver.DEFAULT_ICON;
        }
        if (file == null || file.isBlank()) {
            file = FaviconResolver.DEFAULT_ICON;
        }
        return FAVICON_PATH + file;
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new FeedValidationException("피드 URL이 비어 있습니다");
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new FeedValidationException("잘못된 피드 URL입니다: " + url, e);
        }
    }

    private static URI resolveRedirect(URI base, String location) {
        try {
            return base.resolve(new URI(location.trim()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new FeedFetchException("잘못된 리다이렉트 주소: " + location, e);
        }
    }
}
