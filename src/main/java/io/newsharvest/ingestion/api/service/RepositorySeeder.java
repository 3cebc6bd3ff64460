package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.Author;
import io.newsharvest.ingestion.api.dto.Category;
import io.newsharvest.ingestion.api.repository.AuthorRepository;
import io.newsharvest.ingestion.api.repository.CategoryRepository;
import io.newsharvest.ingestion.config.CategoryFeed;
import io.newsharvest.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Makes sure every configured category and the default author exist before the first run.
 */
@Component
@Order(0)
public class RepositorySeeder implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(RepositorySeeder.class);

    private final CategoryRepository categoryRepository;
    private final AuthorRepository authorRepository;
    private final NewsConfig newsConfig;

    public RepositorySeeder(CategoryRepository categoryRepository, AuthorRepository authorRepository,
                            NewsConfig newsConfig) {
        this.categoryRepository = categoryRepository;
        this.authorRepository = authorRepository;
        this.newsConfig = newsConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (CategoryFeed feed : newsConfig.categories()) {
            Category category = categoryRepository.saveIfAbsent(feed.name());
            logger.debug("Category {} -> {}", category.name(), category.id());
        }

        String authorName = newsConfig.storage().defaultAuthor();
        if (authorName != null && !authorName.isBlank()) {
            Author author = authorRepository.saveIfAbsent(authorName);
            logger.debug("Default author {} -> {}", author.name(), author.id());
        }

        logger.info("Seeded {} categories and default author '{}'", newsConfig.categories().size(), authorName);
    }
}
