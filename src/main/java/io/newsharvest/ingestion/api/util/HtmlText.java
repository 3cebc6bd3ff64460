package io.newsharvest.ingestion.api.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Entities;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Plain-text helpers shared by the extraction stages and the article assembler.
 */
public final class HtmlText {

    private static final Pattern MULTI_WS = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n|\\n");
    private static final Pattern WORD = Pattern.compile("\\s+");

    private HtmlText() {
    }

    /**
     * Strips markup and decodes entities, collapsing whitespace to single spaces.
     */
    public static String toPlainText(String html) {
        if (html == null || html.isBlank()) return "";

        return Jsoup.parse(html).text().trim();
    }

    /**
     * Collapses runs of horizontal whitespace and trims every line, dropping empty ones.
     */
    public static String normalize(String text) {
        if (text == null) return "";

        StringBuilder sb = new StringBuilder(text.length());
        for (String line : text.split("\\R")) {
            String cleaned = MULTI_WS.matcher(line).replaceAll(" ").trim();
            if (cleaned.isEmpty()) continue;
            if (!sb.isEmpty()) sb.append("\n\n");
            sb.append(cleaned);
        }
        return sb.toString();
    }

    public static List<String> paragraphs(String text) {
        if (text == null || text.isBlank()) return List.of();

        return Arrays.stream(PARAGRAPH_BREAK.split(text.trim()))
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .toList();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) return "";
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    /**
     * Excerpt of at most {@code maxLength} characters. Cuts at the last sentence end if that lies
     * beyond 70% of the limit, otherwise at the last word boundary followed by "...".
     */
    public static String excerpt(String text, int maxLength) {
        if (text == null) return "";

        String flat = WORD.matcher(text).replaceAll(" ").trim();
        if (flat.length() <= maxLength) return flat;

        String cut = flat.substring(0, maxLength);
        int sentenceEnd = Math.max(cut.lastIndexOf(". "), Math.max(cut.lastIndexOf("! "), cut.lastIndexOf("? ")));
        if (sentenceEnd < 0 && (cut.endsWith(".") || cut.endsWith("!") || cut.endsWith("?"))) {
            sentenceEnd = cut.length() - 1;
        }
        if (sentenceEnd > maxLength * 0.7) {
            return cut.substring(0, sentenceEnd + 1);
        }

        int lastSpace = cut.lastIndexOf(' ');
        String base = lastSpace > 0 ? cut.substring(0, lastSpace) : cut.substring(0, maxLength - 3);
        if (base.length() + 3 > maxLength) {
            base = base.substring(0, maxLength - 3);
        }
        return base + "...";
    }

    public static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return WORD.split(text.trim()).length;
    }

    /**
     * Reading time at 200 words per minute, never below one minute.
     */
    public static int readTimeMinutes(String text) {
        return Math.max(1, (int) Math.ceil(wordCount(text) / 200.0));
    }

    /**
     * Renders plain text as escaped {@code <p>} paragraphs followed by a link to the source.
     */
    public static String toHtmlBody(String text, String sourceUrl) {
        StringBuilder html = new StringBuilder();
        for (String paragraph : paragraphs(text)) {
            html.append("<p>").append(Entities.escape(paragraph)).append("</p>\n");
        }
        if (sourceUrl != null && !sourceUrl.isBlank()) {
            html.append("<p><a href=\"")
                    .append(Entities.escape(sourceUrl))
                    .append("\" target=\"_blank\" rel=\"noopener noreferrer\">Read full article</a></p>");
        }
        return html.toString().trim();
    }
}
