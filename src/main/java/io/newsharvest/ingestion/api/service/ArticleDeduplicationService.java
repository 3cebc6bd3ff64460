package io.newsharvest.ingestion.api.service;

import io.newsharvest.ingestion.api.dto.ArticleFilter;
import io.newsharvest.ingestion.api.repository.ArticleRepository;
import org.springframework.stereotype.Service;

/**
 * Answers whether an article with a given canonical source URL is already stored.
 */
@Service
public class ArticleDeduplicationService {

    private final ArticleRepository articleRepository;

    public ArticleDeduplicationService(ArticleRepository articleRepository) {
        this.articleRepository = articleRepository;
    }

    public boolean exists(String sourceUrl) {
        if (sourceUrl == null || sourceUrl.isBlank()) return false;

        return !articleRepository.findByFilter(ArticleFilter.bySourceUrl(sourceUrl)).isEmpty();
    }
}
