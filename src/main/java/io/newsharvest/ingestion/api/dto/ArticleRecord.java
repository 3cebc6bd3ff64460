package io.newsharvest.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;
import java.util.List;

public record ArticleRecord(
        String id,
        String title,
        String slug,
        String excerpt,
        String content,
        String sourceUrl,
        String categoryId,
        String categoryName,
        String authorId,
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime publishedDate,
        String seoTitle,
        String seoDescription,
        List<String> tags,
        String location,
        String featuredImageUrl,
        String thumbnailImageUrl,
        List<ArticleImage> images,
        ExtractionStrategy extractionStrategy,
        QualityRating quality,
        int readTimeMinutes,
        @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime importedAt
) {
    public ArticleRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public ArticleRecord withId(String newId) {
        return new ArticleRecord(newId, title, slug, excerpt, content, sourceUrl, categoryId, categoryName,
                authorId, publishedDate, seoTitle, seoDescription, tags, location, featuredImageUrl,
                thumbnailImageUrl, images, extractionStrategy, quality, readTimeMinutes, importedAt);
    }
}
