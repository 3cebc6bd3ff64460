package io.newsharvest.ingestion.api.repository;

import io.newsharvest.ingestion.api.dto.ArticleFilter;
import io.newsharvest.ingestion.api.dto.ArticleRecord;

import java.util.List;

/**
 * Article store. Implementations must serialise conflicting creates for the same source URL:
 * exactly one succeeds, the others fail with
 * {@link io.newsharvest.ingestion.api.exception.DuplicateArticleException}.
 */
public interface ArticleRepository {

    /**
     * @return the id assigned to the stored article
     */
    String create(ArticleRecord article);

    List<ArticleRecord> findByFilter(ArticleFilter filter);

    void delete(String id);
}
