package io.newsharvest.ingestion.api.service;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.newsharvest.ingestion.InMemoryArticleRepository;
import io.newsharvest.ingestion.TestFixtures;
import io.newsharvest.ingestion.api.dto.ArticleRecord;
import io.newsharvest.ingestion.api.dto.Author;
import io.newsharvest.ingestion.api.dto.Category;
import io.newsharvest.ingestion.api.dto.ExtractionStrategy;
import io.newsharvest.ingestion.api.dto.ImportRunResult;
import io.newsharvest.ingestion.api.dto.QualityRating;
import io.newsharvest.ingestion.api.repository.AuthorRepository;
import io.newsharvest.ingestion.api.repository.CategoryRepository;
import io.newsharvest.ingestion.api.util.RetryPolicies;
import io.newsharvest.ingestion.config.CategoryFeed;
import io.newsharvest.ingestion.config.NewsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Feed, pages and extraction run for real against a local HTTP server; only storage
 * lookups, rewriting and event publishing are stubbed.
 */
@ExtendWith(MockitoExtension.class)
class NewsImportPipelineTest {

    @RegisterExtension
    static WireMockExtension wireMockServer = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final Category SCIENCE = new Category("cat-science", "Science");
    private static final Author DESK = new Author("author-1", TestFixtures.AUTHOR);

    private static final String ARTICLE_HTML = """
            <html>
            <head><title>Science story</title></head>
            <body>
              <article>
                <p>The new space telescope has returned the deepest infrared image ever taken of the early universe.</p>
                <p>Astronomers say the picture contains thousands of galaxies, some formed soon after the Big Bang.</p>
                <p>Researchers will spend the coming months measuring the distance to each of the faint objects.</p>
                <img src="/images/galaxy.jpg" alt="Galaxy cluster" width="800" height="450">
              </article>
            </body>
            </html>
            """;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private AuthorRepository authorRepository;

    @Mock
    private ArticleRewriteService rewriteService;

    @Mock
    private EventPublisherService eventPublisher;

    private InMemoryArticleRepository articleRepository;
    private CategoryFeed science;
    private NewsImportService service;

    @BeforeEach
    void setUp() {
        articleRepository = new InMemoryArticleRepository();
        science = new CategoryFeed("Science", List.of(url("/science.rss")), true);
        NewsConfig config = TestFixtures.newsConfig(List.of(science), List.of(), 1);

        PageFetcher pageFetcher = new PageFetcher(config);
        ContentExtractorService extractor = new ContentExtractorService(
                pageFetcher, RetryPolicies.none(), TestFixtures.extractionConfig());

        service = new NewsImportService(
                new FeedFetcherService(pageFetcher, RetryPolicies.none()),
                new FeedItemQualityFilter(TestFixtures.qualityConfig()),
                new ContentFallbackService(extractor, TestFixtures.extractionConfig()),
                new ImageOptimizerService(new ImageScorer(), 10),
                new ContentQualityAssessor(),
                rewriteService,
                new ArticleDeduplicationService(articleRepository),
                new ArticleAssembler(Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC)),
                articleRepository,
                categoryRepository,
                authorRepository,
                eventPublisher,
                config,
                Runnable::run
        );

        when(categoryRepository.findByName("Science")).thenReturn(Optional.of(SCIENCE));
        when(authorRepository.findByName(TestFixtures.AUTHOR)).thenReturn(Optional.of(DESK));
        when(rewriteService.isEnabled()).thenReturn(false);
    }

    private static String url(String path) {
        return "http://localhost:" + wireMockServer.getPort() + path;
    }

    private static String item(String title, String path) {
        return """
                <item>
                  <title>%s</title>
                  <link>%s</link>
                  <guid>%s</guid>
                  <pubDate>Wed, 01 May 2024 10:00:00 GMT</pubDate>
                </item>
                """.formatted(title, url(path), url(path));
    }

    private void serveFeed(String... items) {
        String feed = """
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0">
                  <channel>
                    <title>Science Wire</title>
                    <link>https://wire.example.com</link>
                    <description>Science news</description>
                    %s
                  </channel>
                </rss>
                """.formatted(String.join("", items));

        wireMockServer.stubFor(get(urlEqualTo("/science.rss"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/rss+xml")
                        .withBody(feed)));
    }

    private void servePage(String path) {
        wireMockServer.stubFor(get(urlEqualTo(path))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "text/html; charset=utf-8")
                        .withBody(ARTICLE_HTML)));
    }

    @Test
    @DisplayName("Should import a server-error page through the title fallback next to healthy pages")
    void shouldImportServerErrorPageAsTitleOnly() {
        serveFeed(
                item("Telescope captures the deepest image yet", "/articles/1"),
                item("Mission control confirms a safe landing", "/articles/2"),
                item("Broken page about a solar storm warning", "/articles/broken"),
                item("Researchers map the far side of the moon", "/articles/3")
        );
        servePage("/articles/1");
        servePage("/articles/2");
        servePage("/articles/3");
        wireMockServer.stubFor(get(urlEqualTo("/articles/broken"))
                .willReturn(aResponse().withStatus(500).withBody("Internal Server Error")));

        ImportRunResult result = service.importCategory(science, 10);

        assertThat(result.imported()).isEqualTo(4);
        assertThat(result.errors()).isZero();
        assertThat(result.errorDetails()).isEmpty();

        Map<String, ArticleRecord> bySourceUrl = articleRepository.all().stream()
                .collect(Collectors.toMap(ArticleRecord::sourceUrl, record -> record));

        ArticleRecord broken = bySourceUrl.get(url("/articles/broken"));
        assertThat(broken.extractionStrategy()).isEqualTo(ExtractionStrategy.TITLE_ONLY_FALLBACK);
        assertThat(broken.quality()).isEqualTo(QualityRating.POOR);
        assertThat(broken.images()).isEmpty();
        assertThat(bySourceUrl.get(url("/articles/1")).extractionStrategy())
                .isEqualTo(ExtractionStrategy.PRIMARY_EXTRACTION);

        // primary attempt and the meta description retry
        wireMockServer.verify(2, getRequestedFor(urlEqualTo("/articles/broken")));
    }

    @Test
    @DisplayName("Should skip every item on a second run, the server-error page included")
    void shouldSkipEverythingOnSecondRunIncludingServerErrorPage() {
        serveFeed(
                item("Telescope captures the deepest image yet", "/articles/1"),
                item("Broken page about a solar storm warning", "/articles/broken")
        );
        servePage("/articles/1");
        wireMockServer.stubFor(get(urlEqualTo("/articles/broken"))
                .willReturn(aResponse().withStatus(500)));

        ImportRunResult first = service.importCategory(science, 10);
        ImportRunResult second = service.importCategory(science, 10);

        assertThat(first.imported()).isEqualTo(2);
        assertThat(second.imported()).isZero();
        assertThat(second.skipped()).isEqualTo(2);
        assertThat(articleRepository.all()).hasSize(2);
    }
}
