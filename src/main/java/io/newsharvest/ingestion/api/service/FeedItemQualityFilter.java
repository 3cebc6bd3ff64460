package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.FeedItem;
import io.newsharvest.ingestion.config.NewsConfig;
import io.newsharvest.ingestion.config.QualityFilterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Discards low-value feed items before any page fetch.
 * A missing description is accepted; only a present but short one disqualifies an item.
 */
@Service
public class FeedItemQualityFilter {

    private static final Logger logger = LoggerFactory.getLogger(FeedItemQualityFilter.class);

    private final QualityFilterConfig config;

    @Autowired
    public FeedItemQualityFilter(NewsConfig newsConfig) {
        this(newsConfig.quality());
    }

    FeedItemQualityFilter(QualityFilterConfig config) {
        this.config = config;
    }

    public List<FeedItem> filter(List<FeedItem> items) {
        List<FeedItem> accepted = items.stream()
                .filter(this::accept)
                .toList();

        if (accepted.size() < items.size()) {
            logger.debug("Quality filter kept {} of {} items", accepted.size(), items.size());
        }
        return accepted;
    }

    public boolean accept(FeedItem item) {
        Optional<String> reason = rejectionReason(item);
        reason.ifPresent(r -> logger.debug("Rejected '{}' ({}): {}", item.title(), item.link(), r));
        return reason.isEmpty();
    }

    public Optional<String> rejectionReason(FeedItem item) {
        String path = linkPath(item.link()).toLowerCase(Locale.ROOT);
        String title = item.title().trim().toLowerCase(Locale.ROOT);

        for (String suffix : config.nonArticleSuffixes()) {
            String lowerSuffix = suffix.toLowerCase(Locale.ROOT);
            if (path.endsWith(lowerSuffix) || title.endsWith(lowerSuffix)) {
                return Optional.of("non-article resource " + suffix);
            }
        }

        if (item.title().trim().length() < config.minTitleLength()) {
            return Optional.of("title shorter than " + config.minTitleLength());
        }

        if (item.hasDescription() && item.description().trim().length() < config.minDescriptionLength()) {
            return Optional.of("description shorter than " + config.minDescriptionLength());
        }

        return Optional.empty();
    }

    /**
     * Path of the link without query or fragment. A link that is not a valid URI is cut at its
     * first {@code ?} or {@code #} instead.
     */
    static String linkPath(String link) {
        try {
            String path = URI.create(link.trim()).getPath();
            return path != null ? path : "";
        } catch (IllegalArgumentException e) {
            logger.debug("Cannot parse link {}: {}", link, e.getMessage());
            return link.trim().split("[?#]", 2)[0];
        }
    }
}
