package io.newsharvest.ingestion.api.util;

import java.text.Normalizer;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * URL slugs with a date and time suffix so repeated titles never collide.
 */
public final class SlugGenerator {

    private static final int MAX_BASE_LENGTH = 50;
    private static final int MIN_BASE_LENGTH = 3;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private SlugGenerator() {
    }

    public static String generate(String title, Clock clock) {
        String base = base(title);

        long millis = clock.millis();
        String date = LocalDate.now(clock).format(DATE);
        String millisTail = String.valueOf(millis);
        millisTail = millisTail.substring(Math.max(0, millisTail.length() - 6));

        return base + "-" + date + "-" + millisTail;
    }

    static String base(String title) {
        String text = title == null ? "" : title;
        String ascii = Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");

        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9\\s-]", "")
                .trim()
                .replaceAll("[\\s_]+", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+|-+$", "");

        if (slug.length() > MAX_BASE_LENGTH) {
            slug = slug.substring(0, MAX_BASE_LENGTH).replaceAll("-+$", "");
        }

        return slug.length() < MIN_BASE_LENGTH ? "article" : slug;
    }
}
