package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ExtractedContent;
import io.newsharvest.ingestion.api.dto.ExtractionStrategy;
import io.newsharvest.ingestion.api.dto.FetchedPage;
import io.newsharvest.ingestion.api.dto.RawImage;
import io.newsharvest.ingestion.api.exception.PageFetchException;
import io.newsharvest.ingestion.api.util.HtmlText;
import io.newsharvest.ingestion.api.util.RetryPolicies;
import io.newsharvest.ingestion.config.ExtractionConfig;
import io.newsharvest.ingestion.config.NewsConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Primary extraction: fetch the source page and isolate readable article text and images.
 * Failures are reported as {@code success=false}, never thrown, so the fallback chain can continue.
 */
@Service
public class ContentExtractorService {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractorService.class);

    private static final String REMOVE_SELECTORS = String.join(", ",
            "script", "style", "noscript", "iframe", "svg", "canvas",
            "nav", "header", "footer", "aside", "form", "button", "input",
            "[role=banner]", "[role=navigation]", "[role=contentinfo]",
            ".advertisement", ".ad", ".ads", ".social-share", ".comments", ".related-articles",
            ".newsletter", ".cookie-banner"
    );

    private static final List<String> CONTENT_SELECTORS = List.of(
            "article",
            "[role=main]",
            ".article-content",
            ".post-content",
            ".entry-content",
            ".story-body",
            ".article-body",
            "main",
            "#content",
            ".main-content",
            ".content"
    );

    private static final int MIN_CANDIDATE_PARAGRAPHS = 3;

    private final PageFetcher pageFetcher;
    private final RetryPolicies retryPolicies;
    private final ExtractionConfig config;

    @Autowired
    public ContentExtractorService(PageFetcher pageFetcher, RetryPolicies retryPolicies, NewsConfig newsConfig) {
        this(pageFetcher, retryPolicies, newsConfig.extraction());
    }

    ContentExtractorService(PageFetcher pageFetcher, RetryPolicies retryPolicies, ExtractionConfig config) {
        this.pageFetcher = pageFetcher;
        this.retryPolicies = retryPolicies;
        this.config = config;
    }

    /**
     * Outcome of the primary strategy. {@code page} is the parsed document when the fetch itself
     * succeeded, so later strategies can reuse it; it is null after a network failure.
     */
    public record Attempt(ExtractedContent content, Document page) {
    }

    public Attempt extract(String url) {
        Document page;
        try {
            page = fetchDocument(url);
        } catch (PageFetchException e) {
            logger.warn("Primary extraction fetch failed for {}: {} (category: {})", url, e.getMessage(), e.getCategory());
            return new Attempt(ExtractedContent.failed(ExtractionStrategy.PRIMARY_EXTRACTION), null);
        }

        ExtractedContent content = extractFromDocument(page.clone());
        if (!content.success()) {
            logger.debug("Primary extraction yielded insufficient content for {}", url);
        }
        return new Attempt(content, page);
    }

    /**
     * Fetch a page through the page retry policy and parse it with its final URL as base.
     */
    public Document fetchDocument(String url) throws PageFetchException {
        FetchedPage fetched = retryPolicies.page().<FetchedPage, PageFetchException>execute(
                context -> pageFetcher.fetch(url, PageFetcher.HTML_ACCEPT));
        return Jsoup.parse(fetched.text(), fetched.finalUrl());
    }

    ExtractedContent extractFromDocument(Document doc) {
        String ogImage = doc.select("meta[property=og:image]").attr("abs:content");

        doc.select(REMOVE_SELECTORS).remove();

        String text = isolateMainContent(doc);
        if (text.length() < config.minMainContentLength()) {
            String paragraphs = joinParagraphs(doc.select("p"));
            if (paragraphs.length() > text.length()) {
                text = paragraphs;
            }
        }
        text = HtmlText.normalize(text);

        List<RawImage> images = new ArrayList<>();
        if (!ogImage.isBlank()) {
            images.add(RawImage.of(ogImage));
        }
        images.addAll(collectImages(doc));

        if (text.length() <= config.minPrimaryLength()) {
            return ExtractedContent.failed(ExtractionStrategy.PRIMARY_EXTRACTION);
        }
        return ExtractedContent.succeeded(text, images, ExtractionStrategy.PRIMARY_EXTRACTION);
    }

    private String isolateMainContent(Document doc) {
        for (String selector : CONTENT_SELECTORS) {
            Element element = doc.selectFirst(selector);
            if (element != null && element.text().trim().length() > config.minMainContentLength()) {
                String text = joinParagraphs(element.select("p"));
                return text.isEmpty() ? element.text() : text;
            }
        }

        Element body = doc.body();
        if (body == null) return "";

        Element best = null;
        int bestScore = 0;
        for (Element candidate : body.select("div, section")) {
            Elements paragraphs = candidate.select("p");
            if (paragraphs.size() < MIN_CANDIDATE_PARAGRAPHS) continue;

            int score = paragraphs.stream().mapToInt(p -> p.text().length()).sum();
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        return best == null ? "" : joinParagraphs(best.select("p"));
    }

    private String joinParagraphs(Elements paragraphs) {
        StringBuilder sb = new StringBuilder();
        for (Element p : paragraphs) {
            String text = p.text().trim();
            if (text.length() <= config.minParagraphLength()) continue;
            if (!sb.isEmpty()) sb.append("\n\n");
            sb.append(text);
        }
        return sb.toString();
    }

    /**
     * Images with resolvable absolute http(s) URLs; lazy-loaded {@code data-src} is used when
     * {@code src} is missing or inline.
     */
    static List<RawImage> collectImages(Element root) {
        List<RawImage> images = new ArrayList<>();

        for (Element img : root.select("img")) {
            String src = img.absUrl("src");
            if (src.isBlank() || src.toLowerCase(Locale.ROOT).startsWith("data:")) {
                src = img.absUrl("data-src");
            }
            if (src.isBlank() || !src.toLowerCase(Locale.ROOT).startsWith("http")) continue;

            images.add(new RawImage(src, img.attr("alt").trim(), parseDimension(img.attr("width")),
                    parseDimension(img.attr("height"))));
        }
        return images;
    }

    private static Integer parseDimension(String value) {
        if (value == null) return null;

        String digits = value.trim().replaceAll("px$", "");
        if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit) || digits.length() > 5) {
            return null;
        }
        return Integer.valueOf(digits);
    }
}
