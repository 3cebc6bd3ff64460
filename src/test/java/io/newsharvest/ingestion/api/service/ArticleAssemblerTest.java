package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.TestFixtures;
import io.newsharvest.ingestion.api.dto.ArticleImage;
import io.newsharvest.ingestion.api.dto.ArticleRecord;
import io.newsharvest.ingestion.api.dto.Author;
import io.newsharvest.ingestion.api.dto.CandidateArticle;
import io.newsharvest.ingestion.api.dto.Category;
import io.newsharvest.ingestion.api.dto.ClassifiedImages;
import io.newsharvest.ingestion.api.dto.ExtractedContent;
import io.newsharvest.ingestion.api.dto.ExtractionStrategy;
import io.newsharvest.ingestion.api.dto.FeedItem;
import io.newsharvest.ingestion.api.dto.ImageUsage;
import io.newsharvest.ingestion.api.dto.QualityRating;
import io.newsharvest.ingestion.api.dto.ScoredImage;
import io.newsharvest.ingestion.api.dto.StructuredArticle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArticleAssemblerTest {

    private static final String LINK = "https://wire.example.com/telescope";
    private static final Category SCIENCE = new Category("cat-science", "Science");
    private static final Author DESK = new Author("author-1", TestFixtures.AUTHOR);

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private final ArticleAssembler assembler = new ArticleAssembler(clock);

    private final FeedItem item = TestFixtures.feedItem("Telescope captures the deepest image of the early universe", LINK);
    private final ScoredImage hero = new ScoredImage("https://cdn.example.com/hero.jpg", "Hero", 1200, 675, 60, ImageUsage.HERO);
    private final ScoredImage thumb = new ScoredImage("https://cdn.example.com/thumb.jpg", "", 100, 100, 15, ImageUsage.THUMBNAIL);

    private CandidateArticle candidate(ExtractedContent content, StructuredArticle rewritten) {
        return new CandidateArticle(LINK, item, content, List.of(hero, thumb),
                new ClassifiedImages(List.of(hero), List.of(thumb), List.of()), hero, QualityRating.GOOD, rewritten, SCIENCE);
    }

    @Test
    @DisplayName("Should build the record from raw content when there is no rewrite")
    void shouldAssembleFromRawContent() {
        ExtractedContent content = ExtractedContent.succeeded(TestFixtures.longText(6), List.of(),
                ExtractionStrategy.PRIMARY_EXTRACTION);

        ArticleRecord record = assembler.toRecord(candidate(content, null), DESK);

        assertThat(record.id()).isNull();
        assertThat(record.title()).isEqualTo(item.title());
        assertThat(record.slug()).startsWith("telescope-captures-the-deepest-image-of-the-early-20240501-");
        assertThat(record.excerpt().length()).isLessThanOrEqualTo(300);
        assertThat(record.content()).startsWith("<p>Researchers confirmed").contains("href=\"" + LINK + "\"");
        assertThat(record.seoTitle()).hasSizeLessThanOrEqualTo(60);
        assertThat(record.seoDescription()).hasSizeLessThanOrEqualTo(160);
        assertThat(record.tags()).containsExactly("science");
        assertThat(record.location()).isEmpty();
        assertThat(record.categoryId()).isEqualTo("cat-science");
        assertThat(record.authorId()).isEqualTo("author-1");
        assertThat(record.featuredImageUrl()).isEqualTo("https://cdn.example.com/hero.jpg");
        assertThat(record.thumbnailImageUrl()).isEqualTo("https://cdn.example.com/thumb.jpg");
        assertThat(record.images()).containsExactly(
                new ArticleImage("https://cdn.example.com/hero.jpg", "Hero", ImageUsage.HERO),
                new ArticleImage("https://cdn.example.com/thumb.jpg", "", ImageUsage.THUMBNAIL));
        assertThat(record.extractionStrategy()).isEqualTo(ExtractionStrategy.PRIMARY_EXTRACTION);
        assertThat(record.readTimeMinutes()).isEqualTo(1);
        assertThat(record.importedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 12, 0));
    }

    @Test
    @DisplayName("Should prefer rewritten fields over raw content")
    void shouldPreferRewrittenFields() {
        ExtractedContent content = ExtractedContent.succeeded("Raw text of the story.", List.of(),
                ExtractionStrategy.META_DESCRIPTION_FALLBACK);
        StructuredArticle rewritten = new StructuredArticle("Rewritten headline", "Rewritten excerpt.",
                "<p>Rewritten body.</p>", "rewritten-headline-20240501-000000", "SEO headline", "SEO description",
                List.of("space", "telescope"), "Geneva");

        ArticleRecord record = assembler.toRecord(candidate(content, rewritten), DESK);

        assertThat(record.title()).isEqualTo("Rewritten headline");
        assertThat(record.slug()).isEqualTo("rewritten-headline-20240501-000000");
        assertThat(record.content()).isEqualTo("<p>Rewritten body.</p>");
        assertThat(record.tags()).containsExactly("space", "telescope");
        assertThat(record.location()).isEqualTo("Geneva");
        assertThat(record.sourceUrl()).isEqualTo(LINK);
        assertThat(record.extractionStrategy()).isEqualTo(ExtractionStrategy.META_DESCRIPTION_FALLBACK);
    }

    @Test
    @DisplayName("Should leave the thumbnail empty when no image was classified as one")
    void shouldLeaveThumbnailEmptyWithoutThumbnailImages() {
        ExtractedContent content = ExtractedContent.succeeded(TestFixtures.longText(6), List.of(),
                ExtractionStrategy.PRIMARY_EXTRACTION);
        CandidateArticle candidate = new CandidateArticle(LINK, item, content, List.of(hero),
                new ClassifiedImages(List.of(hero), List.of(), List.of()), hero, QualityRating.GOOD, null, SCIENCE);

        ArticleRecord record = assembler.toRecord(candidate, DESK);

        assertThat(record.featuredImageUrl()).isEqualTo("https://cdn.example.com/hero.jpg");
        assertThat(record.thumbnailImageUrl()).isNull();
    }

    @Test
    @DisplayName("Should refuse a candidate whose source URL differs from the feed link")
    void shouldRejectMismatchedSourceUrl() {
        ExtractedContent content = ExtractedContent.succeeded("Text", List.of(), ExtractionStrategy.TITLE_ONLY_FALLBACK);

        assertThatThrownBy(() -> new CandidateArticle("https://elsewhere.example.com", item, content,
                List.of(), null, null, QualityRating.POOR, null, SCIENCE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
