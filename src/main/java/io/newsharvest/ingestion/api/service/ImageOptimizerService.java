package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ClassifiedImages;
import io.newsharvest.ingestion.api.dto.ImageUsage;
import io.newsharvest.ingestion.api.dto.RawImage;
import io.newsharvest.ingestion.api.dto.ScoredImage;
import io.newsharvest.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deduplicates and scores raw images, assigns each one a usage class and picks the best one.
 */
@Service
public class ImageOptimizerService {

    private static final Logger logger = LoggerFactory.getLogger(ImageOptimizerService.class);

    static final int HERO_MIN_SCORE = 50;
    static final int THUMBNAIL_MAX_SCORE = 20;

    private final ImageScorer imageScorer;
    private final int maxImages;

    @Autowired
    public ImageOptimizerService(ImageScorer imageScorer, NewsConfig newsConfig) {
        this(imageScorer, newsConfig.extraction().maxImages());
    }

    ImageOptimizerService(ImageScorer imageScorer, int maxImages) {
        this.imageScorer = imageScorer;
        this.maxImages = maxImages > 0 ? maxImages : Integer.MAX_VALUE;
    }

    /**
     * Scores images in discovery order. Data URIs, non-http sources and repeated URLs
     * (ignoring fragments) are dropped; the result is capped at the configured maximum.
     */
    public List<ScoredImage> optimize(List<RawImage> rawImages) {
        if (rawImages == null || rawImages.isEmpty()) return List.of();

        Set<String> seen = new LinkedHashSet<>();
        List<ScoredImage> result = new ArrayList<>();

        for (RawImage raw : rawImages) {
            if (result.size() >= maxImages) break;
            if (raw == null || raw.url() == null) continue;

            String url = raw.url().trim();
            String lower = url.toLowerCase(Locale.ROOT);
            if (lower.startsWith("data:") || !(lower.startsWith("http://") || lower.startsWith("https://"))) {
                continue;
            }
            if (!seen.add(withoutFragment(url))) continue;

            RawImage normalized = new RawImage(url, raw.alt(), raw.width(), raw.height());
            int score = imageScorer.score(normalized);
            String alt = raw.alt() == null || raw.alt().isBlank() ? altFromFileName(url) : raw.alt().trim();

            ScoredImage scored = new ScoredImage(url, alt, raw.width(), raw.height(), score, null);
            result.add(scored.withUsage(usageFor(scored)));
        }

        logger.debug("Optimised {} raw images into {}", rawImages.size(), result.size());
        return result;
    }

    /**
     * Highest-scored image; ties go to the one discovered first.
     */
    public Optional<ScoredImage> bestImage(List<ScoredImage> images) {
        if (images == null || images.isEmpty()) return Optional.empty();

        ScoredImage best = images.get(0);
        for (ScoredImage image : images) {
            if (image.score() > best.score()) {
                best = image;
            }
        }
        return Optional.of(best);
    }

    public ClassifiedImages classify(List<ScoredImage> images) {
        List<ScoredImage> hero = new ArrayList<>();
        List<ScoredImage> thumbnail = new ArrayList<>();
        List<ScoredImage> gallery = new ArrayList<>();

        for (ScoredImage image : images) {
            ImageUsage usage = image.usageClass() != null ? image.usageClass() : usageFor(image);
            switch (usage) {
                case HERO -> hero.add(image);
                case THUMBNAIL -> thumbnail.add(image);
                case GALLERY -> gallery.add(image);
            }
        }

        Comparator<ScoredImage> byScore = Comparator.comparingInt(ScoredImage::score).reversed();
        hero.sort(byScore);
        thumbnail.sort(byScore);
        gallery.sort(byScore);

        return new ClassifiedImages(hero, thumbnail, gallery);
    }

    ImageUsage usageFor(ScoredImage image) {
        OptionalDouble ratio = image.aspectRatio();

        if (image.score() >= HERO_MIN_SCORE && (ratio.isEmpty() || ratio.getAsDouble() >= 1.2)) {
            return ImageUsage.HERO;
        }
        if ((ratio.isPresent() && ratio.getAsDouble() >= 0.8 && ratio.getAsDouble() < 1.2)
                || image.score() < THUMBNAIL_MAX_SCORE) {
            return ImageUsage.THUMBNAIL;
        }
        return ImageUsage.GALLERY;
    }

    /**
     * {@code city-hall_fire.jpg} becomes {@code City Hall Fire}. Names of three characters or
     * fewer give an empty alt.
     */
    static String altFromFileName(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            logger.debug("Cannot derive alt text from {}: {}", url, e.getMessage());
            return "";
        }
        if (path == null || path.isEmpty()) return "";

        String fileName = path.substring(path.lastIndexOf('/') + 1);
        String stem = fileName.replaceFirst("\\.[^/.]+$", "");
        if (stem.length() <= 3) return "";

        return Arrays.stream(stem.split("[-_]+"))
                .filter(word -> !word.isEmpty())
                .map(word -> Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static String withoutFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
