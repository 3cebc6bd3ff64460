package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ArticleRecord;
import io.newsharvest.ingestion.api.dto.Author;
import io.newsharvest.ingestion.api.dto.CandidateArticle;
import io.newsharvest.ingestion.api.dto.Category;
import io.newsharvest.ingestion.api.dto.ClassifiedImages;
import io.newsharvest.ingestion.api.dto.ExtractedContent;
import io.newsharvest.ingestion.api.dto.FeedItem;
import io.newsharvest.ingestion.api.dto.ImportRunResult;
import io.newsharvest.ingestion.api.dto.ItemOutcome;
import io.newsharvest.ingestion.api.dto.QualityRating;
import io.newsharvest.ingestion.api.dto.RewriteRequest;
import io.newsharvest.ingestion.api.dto.RewriteResult;
import io.newsharvest.ingestion.api.dto.ScoredImage;
import io.newsharvest.ingestion.api.dto.StructuredArticle;
import io.newsharvest.ingestion.api.exception.DuplicateArticleException;
import io.newsharvest.ingestion.api.exception.ExtractionExhaustedException;
import io.newsharvest.ingestion.api.exception.FeedUnavailableException;
import io.newsharvest.ingestion.api.exception.PersistenceException;
import io.newsharvest.ingestion.api.exception.RepositoryLookupException;
import io.newsharvest.ingestion.api.exception.UnknownCategoryException;
import io.newsharvest.ingestion.api.repository.ArticleRepository;
import io.newsharvest.ingestion.api.repository.AuthorRepository;
import io.newsharvest.ingestion.api.repository.CategoryRepository;
import io.newsharvest.ingestion.config.CategoryFeed;
import io.newsharvest.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs the import pipeline for one or more categories:
 * fetch, filter, then per item dedupe, extract, optimise images, assess, rewrite,
 * dedupe again and persist.
 * <p>
 * Items are processed in feed order, at most {@code itemConcurrency} at a time. A failing item
 * is counted as an error and never aborts the rest of the run. Once the item executor stops
 * accepting work (application shutdown) the rejected items are counted as errors and the
 * category ends early.
 */
@Service
public class NewsImportService {

    private static final Logger logger = LoggerFactory.getLogger(NewsImportService.class);

    private final FeedFetcherService feedFetcher;
    private final FeedItemQualityFilter qualityFilter;
    private final ContentFallbackService contentService;
    private final ImageOptimizerService imageOptimizer;
    private final ContentQualityAssessor qualityAssessor;
    private final ArticleRewriteService rewriteService;
    private final ArticleDeduplicationService deduplicationService;
    private final ArticleAssembler assembler;
    private final ArticleRepository articleRepository;
    private final CategoryRepository categoryRepository;
    private final AuthorRepository authorRepository;
    private final EventPublisherService eventPublisher;
    private final NewsConfig newsConfig;
    private final Executor itemExecutor;

    public NewsImportService(FeedFetcherService feedFetcher,
                             FeedItemQualityFilter qualityFilter,
                             ContentFallbackService contentService,
                             ImageOptimizerService imageOptimizer,
                             ContentQualityAssessor qualityAssessor,
                             ArticleRewriteService rewriteService,
                             ArticleDeduplicationService deduplicationService,
                             ArticleAssembler assembler,
                             ArticleRepository articleRepository,
                             CategoryRepository categoryRepository,
                             AuthorRepository authorRepository,
                             EventPublisherService eventPublisher,
                             NewsConfig newsConfig,
                             @Qualifier("importItemExecutor") Executor itemExecutor) {
        this.feedFetcher = feedFetcher;
        this.qualityFilter = qualityFilter;
        this.contentService = contentService;
        this.imageOptimizer = imageOptimizer;
        this.qualityAssessor = qualityAssessor;
        this.rewriteService = rewriteService;
        this.deduplicationService = deduplicationService;
        this.assembler = assembler;
        this.articleRepository = articleRepository;
        this.categoryRepository = categoryRepository;
        this.authorRepository = authorRepository;
        this.eventPublisher = eventPublisher;
        this.newsConfig = newsConfig;
        this.itemExecutor = itemExecutor;
    }

    /**
     * Resolve category names against the enabled configuration. An empty or null list means
     * every enabled category.
     *
     * @throws UnknownCategoryException if any name is unknown or disabled
     */
    public List<CategoryFeed> resolveCategories(List<String> names) {
        if (names == null || names.isEmpty()) {
            return newsConfig.getEnabledCategories();
        }

        List<CategoryFeed> resolved = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String name : names) {
            newsConfig.findEnabledCategory(name).ifPresentOrElse(resolved::add, () -> unknown.add(name));
        }

        if (!unknown.isEmpty()) {
            throw new UnknownCategoryException(unknown);
        }
        return resolved.stream().distinct().toList();
    }

    /**
     * Import each category in turn and merge the per-category results.
     */
    public ImportRunResult runImport(List<CategoryFeed> categories, int maxArticlesPerCategory) {
        long startTime = System.currentTimeMillis();
        ImportRunResult total = ImportRunResult.empty();

        for (CategoryFeed category : categories) {
            total = total.merge(importCategory(category, maxArticlesPerCategory));
        }

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Import run completed for {} categories: {} imported, {} skipped, {} errors in {}ms",
                categories.size(), total.imported(), total.skipped(), total.errors(), duration);

        return total.withDuration(duration);
    }

    public ImportRunResult importCategory(CategoryFeed categoryFeed, int maxArticlesPerCategory) {
        long startTime = System.currentTimeMillis();
        String name = categoryFeed.name();

        Category category;
        Author author;
        try {
            category = categoryRepository.findByName(name)
                    .orElseThrow(() -> new RepositoryLookupException("Category not found: " + name));
            String authorName = newsConfig.storage().defaultAuthor();
            author = authorRepository.findByName(authorName)
                    .orElseThrow(() -> new RepositoryLookupException("Author not found: " + authorName));
        } catch (RepositoryLookupException e) {
            logger.error("Cannot import category {}: {}", name, e.getMessage());
            return ImportRunResult.runFailure(name, e.getMessage())
                    .withDuration(System.currentTimeMillis() - startTime);
        }

        List<FeedItem> items = qualityFilter.filter(fetchAll(categoryFeed));
        logger.info("Category {}: {} candidate items after filtering", name, items.size());

        RunTally tally = new RunTally();
        int index = 0;
        int concurrency = Math.max(1, newsConfig.scheduling().itemConcurrency());
        boolean executorRejected = false;

        while (!executorRejected && tally.imported < maxArticlesPerCategory && index < items.size()) {
            int window = Math.min(concurrency, maxArticlesPerCategory - tally.imported);
            List<FeedItem> batch = items.subList(index, Math.min(index + window, items.size()));
            index += batch.size();

            List<CompletableFuture<ItemOutcome>> futures = new ArrayList<>(batch.size());
            for (FeedItem item : batch) {
                try {
                    futures.add(CompletableFuture.supplyAsync(() -> processItem(item, category, author), itemExecutor));
                } catch (RejectedExecutionException e) {
                    logger.error("Item executor rejected {}: {}", item.link(), e.getMessage());
                    futures.add(CompletableFuture.completedFuture(
                            ItemOutcome.error(item.link(), "rejected by item executor")));
                    executorRejected = true;
                }
            }

            for (int i = 0; i < futures.size(); i++) {
                tally.record(await(futures.get(i), batch.get(i)));
            }
        }

        if (executorRejected) {
            logger.warn("Category {} stopped early: item executor no longer accepts work", name);
        }

        ImportRunResult result = new ImportRunResult(
                List.of(name),
                tally.imported,
                tally.skipped,
                tally.errors,
                tally.articleIds,
                List.of(),
                tally.errorDetails,
                System.currentTimeMillis() - startTime
        );

        logger.info("Category {} completed: {} imported, {} skipped, {} errors in {}ms",
                name, result.imported(), result.skipped(), result.errors(), result.durationMs());
        if (!result.errorDetails().isEmpty()) {
            logger.warn("Category {} item errors: {}", name, result.errorDetails());
        }
        return result;
    }

    private List<FeedItem> fetchAll(CategoryFeed categoryFeed) {
        Map<String, FeedItem> byLink = new LinkedHashMap<>();

        for (String feedUrl : categoryFeed.feedUrls()) {
            try {
                for (FeedItem item : feedFetcher.fetch(feedUrl)) {
                    byLink.putIfAbsent(item.link(), item);
                }
            } catch (FeedUnavailableException e) {
                logger.warn("Feed unavailable for {} ({}): {} (category: {})",
                        categoryFeed.name(), feedUrl, e.getMessage(), e.getCategory());
            }
        }
        return new ArrayList<>(byLink.values());
    }

    ItemOutcome processItem(FeedItem item, Category category, Author author) {
        String sourceUrl = item.link();

        try {
            if (deduplicationService.exists(sourceUrl)) {
                logger.debug("Skipping duplicate {}", sourceUrl);
                return ItemOutcome.skipped(sourceUrl, "duplicate");
            }

            ExtractedContent content = contentService.acquire(item);
            if (!content.success()) {
                throw new ExtractionExhaustedException(sourceUrl);
            }

            List<ScoredImage> images = imageOptimizer.optimize(content.rawImages());
            ClassifiedImages classified = imageOptimizer.classify(images);
            ScoredImage bestImage = imageOptimizer.bestImage(images).orElse(null);
            QualityRating quality = qualityAssessor.assess(content.textLength(), images.size(), content.strategyUsed());

            CandidateArticle candidate = new CandidateArticle(
                    sourceUrl, item, content, images, classified, bestImage, quality, rewrite(item, content, category), category);

            if (deduplicationService.exists(sourceUrl)) {
                logger.debug("Skipping {} stored by a concurrent run", sourceUrl);
                return ItemOutcome.skipped(sourceUrl, "duplicate");
            }

            ArticleRecord record = assembler.toRecord(candidate, author);
            String id = articleRepository.create(record);

            eventPublisher.publishArticleImported(record.withId(id));

            logger.info("Imported '{}' [{}] via {} (quality: {}, rewritten: {})",
                    record.title(), category.name(), content.strategyUsed().id(), quality.id(), candidate.isRewritten());
            return ItemOutcome.imported(sourceUrl, id);

        } catch (DuplicateArticleException e) {
            logger.debug("Skipping {}: {}", sourceUrl, e.getMessage());
            return ItemOutcome.skipped(sourceUrl, "duplicate");

        } catch (ExtractionExhaustedException | PersistenceException e) {
            logger.error("Failed to import {}: {}", sourceUrl, e.getMessage());
            return ItemOutcome.error(sourceUrl, e.getMessage());

        } catch (RuntimeException e) {
            logger.error("Unexpected error importing {}: {}", sourceUrl, e.getMessage(), e);
            return ItemOutcome.error(sourceUrl, e.getMessage());
        }
    }

    private StructuredArticle rewrite(FeedItem item, ExtractedContent content, Category category) {
        if (!rewriteService.isEnabled()) {
            return null;
        }

        RewriteResult result = rewriteService.rewrite(
                new RewriteRequest(content.bodyText(), item.link(), item.title(), category.name()));

        if (result instanceof RewriteResult.Success success) {
            return success.article();
        }
        logger.warn("Rewrite failed for {}, storing raw content: {}",
                item.link(), ((RewriteResult.Failure) result).reason());
        return null;
    }

    private ItemOutcome await(CompletableFuture<ItemOutcome> future, FeedItem item) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Item pipeline failed for {}: {}", item.link(), cause.getMessage(), cause);
            return ItemOutcome.error(item.link(), cause.getMessage());
        } catch (CancellationException e) {
            logger.error("Item pipeline cancelled for {}", item.link());
            return ItemOutcome.error(item.link(), "cancelled");
        }
    }

    private static final class RunTally {
        private int imported;
        private int skipped;
        private int errors;
        private final List<String> articleIds = new ArrayList<>();
        private final List<String> errorDetails = new ArrayList<>();

        void record(ItemOutcome outcome) {
            switch (outcome.status()) {
                case IMPORTED -> {
                    imported++;
                    articleIds.add(outcome.articleId());
                }
                case SKIPPED -> skipped++;
                case ERROR -> {
                    errors++;
                    errorDetails.add(outcome.sourceUrl() + ": " + outcome.reason());
                }
            }
        }
    }
}
