package com.jimin.river.fetch;

import com.jimin.river.exception.FeedParseException;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Rome 라이브러리 기반 파서 (RSS 0.9x/1.0/2.0, Atom 0.3/1.0)
 *
 * XmlReader가 XML 선언/BOM을 보고 문자 인코딩을 결정한다.
 */
@Component
public class RomeFeedParser implements FeedParser {

    @Override
    public ParsedFeed parse(InputStream body) {
        try (XmlReader reader = new XmlReader(body)) {
            SyndFeed feed = new SyndFeedInput().build(reader);

            List<ParsedFeed.Item> items = new ArrayList<>();
            for (SyndEntry entry : feed.getEntries()) {
                items.add(new ParsedFeed.Item(
                        trimToNull(entry.getTitle()),
                        entryLink(entry),
                        trimToNull(entry.getUri()),
                        content(entry),
                        toInstant(entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate())
                ));
            }
            return new ParsedFeed(trimToNull(feed.getTitle()), trimToNull(feed.getLink()), items);

        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedParseException("피드 형식이 아닙니다: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FeedParseException("피드 본문을 읽을 수 없습니다: " + e.getMessage(), e);
        }
    }

    // link가 없으면 http(s) 형태의 guid/id를 링크로 사용
    private static String entryLink(SyndEntry entry) {
        String link = trimToNull(entry.getLink());
        if (link != null) {
            return link;
        }
        String uri = trimToNull(entry.getUri());
        if (uri != null && (uri.startsWith("http://") || uri.startsWith("https://"))) {
            return uri;
        }
        return null;
    }

    // Atom content / RSS content:encoded가 있으면 우선, 없으면 description(summary)
    private static String content(SyndEntry entry) {
        for (SyndContent content : entry.getContents()) {
            if (content.getValue() != null && !content.getValue().isBlank()) {
                return content.getValue();
            }
        }
        SyndContent description = entry.getDescription();
        return description != null ? description.getValue() : null;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
