package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ExtractedContent;
import io.newsharvest.ingestion.api.dto.ExtractionStrategy;
import io.newsharvest.ingestion.api.dto.FeedItem;
import io.newsharvest.ingestion.api.dto.RawImage;
import io.newsharvest.ingestion.api.exception.PageFetchException;
import io.newsharvest.ingestion.api.util.HtmlText;
import io.newsharvest.ingestion.config.ExtractionConfig;
import io.newsharvest.ingestion.config.NewsConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Acquires content for a feed item, degrading through the strategies in order:
 * primary extraction, feed-embedded content, meta description, title only.
 * The first strategy that succeeds wins; later ones are not attempted.
 */
@Service
public class ContentFallbackService {

    private static final Logger logger = LoggerFactory.getLogger(ContentFallbackService.class);

    private static final List<String> META_DESCRIPTION_SELECTORS = List.of(
            "meta[property=og:description]",
            "meta[name=twitter:description]",
            "meta[name=description]"
    );

    private final ContentExtractorService extractor;
    private final ExtractionConfig config;

    @Autowired
    public ContentFallbackService(ContentExtractorService extractor, NewsConfig newsConfig) {
        this(extractor, newsConfig.extraction());
    }

    ContentFallbackService(ContentExtractorService extractor, ExtractionConfig config) {
        this.extractor = extractor;
        this.config = config;
    }

    /**
     * @return content tagged with the strategy that produced it; {@code success=false} only when
     * every strategy failed, which happens only for an item without a usable title
     */
    public ExtractedContent acquire(FeedItem item) {
        ContentExtractorService.Attempt primary = extractor.extract(item.link());
        if (primary.content().success()) {
            return primary.content();
        }

        ExtractedContent rss = fromFeedContent(item);
        if (rss.success()) {
            logger.info("Using feed content for {}", item.link());
            return rss;
        }

        ExtractedContent meta = fromMetaDescription(item, primary.page());
        if (meta.success()) {
            logger.info("Using meta description for {}", item.link());
            return meta;
        }

        ExtractedContent titleOnly = fromTitle(item);
        if (titleOnly.success()) {
            logger.warn("Falling back to title only for {}", item.link());
        }
        return titleOnly;
    }

    ExtractedContent fromFeedContent(FeedItem item) {
        String html = item.rawContent();
        String text = HtmlText.toPlainText(html);
        if (text.length() <= config.minRssContentLength() && item.hasDescription()) {
            text = item.description().trim();
        }

        if (text.length() <= config.minRssContentLength()) {
            return ExtractedContent.failed(ExtractionStrategy.RSS_CONTENT_FALLBACK);
        }

        List<RawImage> images = new ArrayList<>();
        if (!html.isBlank()) {
            images.addAll(ContentExtractorService.collectImages(Jsoup.parseBodyFragment(html, item.link())));
        }
        if (item.enclosureUrl() != null && !item.enclosureUrl().isBlank()) {
            images.add(RawImage.of(item.enclosureUrl()));
        }

        return ExtractedContent.succeeded(text, images, ExtractionStrategy.RSS_CONTENT_FALLBACK);
    }

    ExtractedContent fromMetaDescription(FeedItem item, Document cachedPage) {
        Document page = cachedPage;
        if (page == null) {
            try {
                page = extractor.fetchDocument(item.link());
            } catch (PageFetchException e) {
                logger.debug("Meta description fetch failed for {}: {}", item.link(), e.getMessage());
                return ExtractedContent.failed(ExtractionStrategy.META_DESCRIPTION_FALLBACK);
            }
        }

        for (String selector : META_DESCRIPTION_SELECTORS) {
            String content = HtmlText.toPlainText(page.select(selector).attr("content"));
            if (content.length() > config.minMetaDescriptionLength()) {
                return ExtractedContent.succeeded(content, List.of(), ExtractionStrategy.META_DESCRIPTION_FALLBACK);
            }
        }

        return ExtractedContent.failed(ExtractionStrategy.META_DESCRIPTION_FALLBACK);
    }

    ExtractedContent fromTitle(FeedItem item) {
        String title = item.title().trim();
        if (title.isEmpty()) {
            return ExtractedContent.failed(ExtractionStrategy.TITLE_ONLY_FALLBACK);
        }
        return ExtractedContent.succeeded(title, List.of(), ExtractionStrategy.TITLE_ONLY_FALLBACK);
    }
}
