package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.RawImage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic desirability score for an image, computed from its URL and declared
 * dimensions only. Never performs network access; the result is never negative.
 */
@Component
public class ImageScorer {

    private static final Pattern BBC_WIDTH = Pattern.compile("/news/(\\d{2,4})/");
    private static final Pattern URL_DIMENSIONS = Pattern.compile("[-_/](\\d{2,4})x(\\d{2,4})(?:[-_./]|$)");

    private static final List<String> PENALTY_KEYWORDS = List.of("thumb", "icon", "logo", "avatar");
    private static final List<String> HIGH_RES_KEYWORDS = List.of("high-res", "highres", "hi-res", "original", "large");
    private static final List<String> WIRE_SERVICE_KEYWORDS = List.of("gettyimages", "reuters", "apnews", "afp");

    public int score(RawImage image) {
        String url = image.url() == null ? "" : image.url().toLowerCase(Locale.ROOT);

        Integer width = image.width();
        Integer height = image.height();

        if (width == null || height == null) {
            Matcher dims = URL_DIMENSIONS.matcher(url);
            if (dims.find()) {
                width = Integer.valueOf(dims.group(1));
                height = Integer.valueOf(dims.group(2));
            }
        }

        int score = 0;

        score += dimensionScore(width, height);
        score += urlWidthScore(url, width);
        score += aspectRatioScore(width, height);
        score += formatScore(url);
        score += keywordScore(url);

        return Math.max(0, score);
    }

    private int dimensionScore(Integer width, Integer height) {
        if (width == null || height == null) return 0;

        if (width > 300 && height > 200) return 30;
        if (width > 200 && height > 150) return 20;
        if (width > 100 && height > 100) return 10;
        return 0;
    }

    /**
     * Width encoded in CDN paths such as {@code /news/976/cpsprodpb/...}. Used only when the
     * image carries no usable width of its own.
     */
    private int urlWidthScore(String url, Integer knownWidth) {
        if (knownWidth != null) return 0;

        Matcher matcher = BBC_WIDTH.matcher(url);
        if (!matcher.find()) return 0;

        int width = Integer.parseInt(matcher.group(1));
        if (width > 600) return 25;
        if (width > 400) return 20;
        if (width > 200) return 15;
        return 0;
    }

    private int aspectRatioScore(Integer width, Integer height) {
        if (width == null || height == null || width <= 0 || height <= 0) return 0;

        double ratio = (double) width / height;
        if (ratio >= 1.2 && ratio <= 2.0) return 20;
        if (ratio >= 0.8 && ratio < 1.2) return 15;
        return 0;
    }

    private int formatScore(String url) {
        String path = stripQuery(url);

        if (path.endsWith(".webp") || path.contains(".webp")) return 12;
        if (path.endsWith(".jpg") || path.endsWith(".jpeg") || path.contains(".jpg")) return 10;
        if (path.endsWith(".png") || path.contains(".png")) return 8;
        return 0;
    }

    private int keywordScore(String url) {
        int score = 0;

        if (PENALTY_KEYWORDS.stream().anyMatch(url::contains)) score -= 20;
        if (url.contains("small")) score -= 10;

        if (HIGH_RES_KEYWORDS.stream().anyMatch(url::contains)) score += 15;
        if (url.contains("production")) score += 5;
        if (WIRE_SERVICE_KEYWORDS.stream().anyMatch(url::contains)) score += 10;

        return score;
    }

    private static String stripQuery(String url) {
        int query = url.indexOf('?');
        return query >= 0 ? url.substring(0, query) : url;
    }
}
