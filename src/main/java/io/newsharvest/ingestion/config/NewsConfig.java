package io.newsharvest.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Optional;

@ConfigurationProperties(prefix = "news")
public record NewsConfig(
        List<CategoryFeed> categories,
        HttpConfig http,
        RetryConfig retry,
        QualityFilterConfig quality,
        ExtractionConfig extraction,
        RewriteConfig rewrite,
        SchedulingConfig scheduling,
        StorageConfig storage
) {

    public List<CategoryFeed> getEnabledCategories() {
        return categories.stream()
                .filter(CategoryFeed::enabled)
                .toList();
    }

    public Optional<CategoryFeed> findEnabledCategory(String name) {
        if (name == null) return Optional.empty();

        return getEnabledCategories().stream()
                .filter(category -> category.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }
}
