package io.newsharvest.ingestion.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlTextTest {

    @Test
    @DisplayName("Should strip markup and decode entities")
    void shouldStripMarkup() {
        assertThat(HtmlText.toPlainText("<p>Rates &amp; prices <b>rise</b></p>\n<p>again</p>"))
                .isEqualTo("Rates & prices rise again");
        assertThat(HtmlText.toPlainText(null)).isEmpty();
    }

    @Test
    @DisplayName("Should cut excerpt at a late sentence end")
    void shouldCutExcerptAtSentenceEnd() {
        String text = "a".repeat(250) + ". " + "b".repeat(100);

        String excerpt = HtmlText.excerpt(text, 300);

        assertThat(excerpt).hasSize(251).endsWith(".");
    }

    @Test
    @DisplayName("Should cut excerpt at a word boundary with ellipsis when no late sentence end exists")
    void shouldCutExcerptAtWordBoundary() {
        String text = "Short start. " + "word ".repeat(100);

        String excerpt = HtmlText.excerpt(text, 300);

        assertThat(excerpt).endsWith("...");
        assertThat(excerpt.length()).isLessThanOrEqualTo(300);
        assertThat(excerpt).doesNotContain("wor...");
    }

    @Test
    @DisplayName("Should keep short text as is")
    void shouldKeepShortText() {
        assertThat(HtmlText.excerpt("  Brief   note. ", 300)).isEqualTo("Brief note.");
    }

    @Test
    @DisplayName("Should compute read time at 200 words per minute with a minimum of one")
    void shouldComputeReadTime() {
        assertThat(HtmlText.readTimeMinutes("")).isEqualTo(1);
        assertThat(HtmlText.readTimeMinutes("word ".repeat(200))).isEqualTo(1);
        assertThat(HtmlText.readTimeMinutes("word ".repeat(201))).isEqualTo(2);
    }

    @Test
    @DisplayName("Should render escaped paragraphs followed by a source link")
    void shouldRenderHtmlBody() {
        String html = HtmlText.toHtmlBody("First <para>\n\nSecond para", "https://x/2");

        assertThat(html).startsWith("<p>First &lt;para&gt;</p>\n<p>Second para</p>");
        assertThat(html).contains("<a href=\"https://x/2\"").contains("Read full article");
    }
}
