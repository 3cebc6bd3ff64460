package io.newsharvest.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import io.newsharvest.ingestion.api.dto.FeedItem;
import io.newsharvest.ingestion.api.dto.FetchedPage;
import io.newsharvest.ingestion.api.exception.ErrorCategory;
import io.newsharvest.ingestion.api.exception.FeedUnavailableException;
import io.newsharvest.ingestion.api.exception.PageFetchException;
import io.newsharvest.ingestion.api.util.HtmlText;
import io.newsharvest.ingestion.api.util.RetryPolicies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fetches an RSS/Atom feed and normalises its entries into {@link FeedItem}s.
 */
@Service
public class FeedFetcherService {

    private static final Logger logger = LoggerFactory.getLogger(FeedFetcherService.class);

    private final PageFetcher pageFetcher;
    private final RetryPolicies retryPolicies;

    public FeedFetcherService(PageFetcher pageFetcher, RetryPolicies retryPolicies) {
        this.pageFetcher = pageFetcher;
        this.retryPolicies = retryPolicies;
    }

    /**
     * Fetch and parse a feed.
     *
     * @param feedUrl RSS or Atom feed URL
     * @return entries in feed order, one per distinct link
     * @throws FeedUnavailableException on HTTP failure, timeout or malformed XML
     */
    public List<FeedItem> fetch(String feedUrl) throws FeedUnavailableException {
        logger.debug("Fetching feed: {}", feedUrl);

        FetchedPage page;
        try {
            page = retryPolicies.feed().<FetchedPage, PageFetchException>execute(
                    context -> pageFetcher.fetch(feedUrl, PageFetcher.FEED_ACCEPT));
        } catch (PageFetchException e) {
            throw FeedUnavailableException.from(feedUrl, e);
        }

        List<FeedItem> items = parse(feedUrl, page.body());
        logger.debug("Feed {} yielded {} items", feedUrl, items.size());
        return items;
    }

    List<FeedItem> parse(String feedUrl, byte[] xml) throws FeedUnavailableException {
        SyndFeed feed;
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(xml))) {
            feed = new SyndFeedInput().build(reader);
        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedUnavailableException(feedUrl, "Feed parsing error: " + e.getMessage(), e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new FeedUnavailableException(feedUrl, "I/O error reading feed: " + e.getMessage(), e, ErrorCategory.IO_ERROR);
        }

        if (feed == null) {
            throw new FeedUnavailableException(feedUrl, "Feed is null", ErrorCategory.PARSE_ERROR);
        }

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed has no entries: {}", feedUrl);
            return Collections.emptyList();
        }

        String feedTitle = feed.getTitle() != null ? HtmlText.toPlainText(feed.getTitle()) : "";

        Map<String, FeedItem> byLink = new LinkedHashMap<>();
        feed.getEntries().stream()
                .map(entry -> convertToItem(entry, feedTitle))
                .filter(Objects::nonNull)
                .forEach(item -> byLink.putIfAbsent(item.link(), item));

        return new ArrayList<>(byLink.values());
    }

    private FeedItem convertToItem(SyndEntry entry, String feedTitle) {
        if (entry == null) {
            return null;
        }

        var title = entry.getTitle() != null ? HtmlText.toPlainText(entry.getTitle()) : "";
        var link = entry.getLink() != null ? entry.getLink().trim() : "";

        if (title.isBlank() || link.isBlank()) {
            logger.debug("Skipping entry with missing title or link: title='{}', link='{}'", title, link);
            return null;
        }

        var descriptionHtml = entry.getDescription() != null ? nullToEmpty(entry.getDescription().getValue()) : "";
        var encoded = entry.getContents() == null ? "" : entry.getContents().stream()
                .map(SyndContent::getValue)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));

        var categories = entry.getCategories() == null ? List.<String>of() : entry.getCategories().stream()
                .map(SyndCategory::getName)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .distinct()
                .toList();

        return new FeedItem(
                title,
                link,
                toLocalDateTime(entry.getPublishedDate(), entry.getUpdatedDate()),
                encoded.isBlank() ? descriptionHtml : encoded,
                HtmlText.toPlainText(descriptionHtml),
                entry.getUri() != null ? entry.getUri() : link,
                resolveSourceLabel(entry, feedTitle),
                categories,
                findImageEnclosure(entry)
        );
    }

    private LocalDateTime toLocalDateTime(Date published, Date updated) {
        Date date = published != null ? published : updated;
        return date != null
                ? date.toInstant().atZone(ZoneId.systemDefault()).toLocalDateTime()
                : LocalDateTime.now();
    }

    private String resolveSourceLabel(SyndEntry entry, String feedTitle) {
        if (entry.getSource() != null && entry.getSource().getTitle() != null) {
            return HtmlText.toPlainText(entry.getSource().getTitle());
        }
        return feedTitle;
    }

    private String findImageEnclosure(SyndEntry entry) {
        if (entry.getEnclosures() == null) return null;

        return entry.getEnclosures().stream()
                .filter(enclosure -> enclosure.getUrl() != null && !enclosure.getUrl().isBlank())
                .filter(this::isImageEnclosure)
                .map(SyndEnclosure::getUrl)
                .findFirst()
                .orElse(null);
    }

    private boolean isImageEnclosure(SyndEnclosure enclosure) {
        if (enclosure.getType() != null) {
            return enclosure.getType().toLowerCase(Locale.ROOT).startsWith("image/");
        }
        return enclosure.getUrl().toLowerCase(Locale.ROOT).matches(".*\\.(jpe?g|png|webp|gif)(\\?.*)?$");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
