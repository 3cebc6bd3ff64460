package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ArticleImage;
import io.newsharvest.ingestion.api.dto.ArticleRecord;
import io.newsharvest.ingestion.api.dto.Author;
import io.newsharvest.ingestion.api.dto.CandidateArticle;
import io.newsharvest.ingestion.api.dto.FeedItem;
import io.newsharvest.ingestion.api.dto.ScoredImage;
import io.newsharvest.ingestion.api.dto.StructuredArticle;
import io.newsharvest.ingestion.api.util.HtmlText;
import io.newsharvest.ingestion.api.util.SlugGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Maps a candidate to the stored record. Rewritten fields win; otherwise the record is
 * built from the raw extracted text with the same length limits the rewriter applies.
 */
@Component
public class ArticleAssembler {

    static final int EXCERPT_LENGTH = 300;
    static final int SEO_TITLE_LENGTH = 60;
    static final int SEO_DESCRIPTION_LENGTH = 160;
    static final int MAX_TAGS = 10;

    private final Clock clock;

    @Autowired
    public ArticleAssembler() {
        this(Clock.systemDefaultZone());
    }

    ArticleAssembler(Clock clock) {
        this.clock = clock;
    }

    public ArticleRecord toRecord(CandidateArticle candidate, Author author) {
        FeedItem item = candidate.feedItem();
        StructuredArticle rewritten = candidate.rewritten();

        String title;
        String slug;
        String excerpt;
        String content;
        String seoTitle;
        String seoDescription;
        List<String> tags;
        String location;
        String plainText;

        if (rewritten != null) {
            title = rewritten.title();
            slug = rewritten.slug();
            excerpt = rewritten.excerpt();
            content = rewritten.content();
            seoTitle = rewritten.seoTitle();
            seoDescription = rewritten.seoDescription();
            tags = rewritten.tags();
            location = rewritten.location();
            plainText = HtmlText.toPlainText(content);
        } else {
            String body = candidate.content().bodyText();
            title = item.title();
            slug = SlugGenerator.generate(title, clock);
            excerpt = HtmlText.excerpt(body, EXCERPT_LENGTH);
            content = HtmlText.toHtmlBody(body, candidate.sourceUrl());
            seoTitle = HtmlText.truncate(title, SEO_TITLE_LENGTH);
            seoDescription = HtmlText.truncate(excerpt, SEO_DESCRIPTION_LENGTH);
            tags = item.categories().stream().limit(MAX_TAGS).toList();
            location = "";
            plainText = body;
        }

        return new ArticleRecord(
                null,
                title,
                slug,
                excerpt,
                content,
                candidate.sourceUrl(),
                candidate.category().id(),
                candidate.category().name(),
                author.id(),
                item.publishedAt(),
                seoTitle,
                seoDescription,
                tags,
                location,
                candidate.bestImage() != null ? candidate.bestImage().url() : null,
                thumbnailUrl(candidate),
                candidate.images().stream().map(ArticleImage::of).toList(),
                candidate.content().strategyUsed(),
                candidate.quality(),
                HtmlText.readTimeMinutes(plainText),
                LocalDateTime.now(clock)
        );
    }

    private static String thumbnailUrl(CandidateArticle candidate) {
        List<ScoredImage> thumbnails = candidate.classifiedImages().thumbnail();
        return thumbnails.isEmpty() ? null : thumbnails.get(0).url();
    }
}
