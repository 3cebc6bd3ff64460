package io.newsharvest.ingestion.api.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One normalised feed entry. {@code link} is the canonical source URL used for de-duplication.
 */
public record FeedItem(
        String title,
        String link,
        LocalDateTime publishedAt,
        String rawContent,
        String description,
        String guid,
        String sourceLabel,
        List<String> categories,
        String enclosureUrl
) {
    public FeedItem {
        title = title == null ? "" : title;
        link = link == null ? "" : link;
        rawContent = rawContent == null ? "" : rawContent;
        description = description == null ? "" : description;
        guid = guid == null ? link : guid;
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public boolean hasDescription() {
        return !description.isBlank();
    }
}
