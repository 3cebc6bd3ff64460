package io.newsharvest.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ArticleImportedEvent(
        @JsonProperty("articleId") String articleId,
        @JsonProperty("title") String title,
        @JsonProperty("sourceUrl") String sourceUrl,
        @JsonProperty("category") String category,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("quality") String quality,
        @JsonProperty("importedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime importedAt
) {
    public static ArticleImportedEvent create(String articleId, String title, String sourceUrl,
                                              String category, String strategy, String quality) {
        return new ArticleImportedEvent(
                articleId, title, sourceUrl, category, strategy, quality, LocalDateTime.now()
        );
    }
}
