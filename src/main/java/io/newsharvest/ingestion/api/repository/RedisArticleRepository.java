package io.newsharvest.ingestion.api.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.newsharvest.ingestion.api.dto.ArticleFilter;
import io.newsharvest.ingestion.api.dto.ArticleRecord;
import io.newsharvest.ingestion.api.exception.DuplicateArticleException;
import io.newsharvest.ingestion.api.exception.PersistenceException;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Articles as JSON strings under {@code news:article:{id}}, with a source-URL index
 * {@code news:article:source:{md5(url)}} claimed by SET NX before the article is written.
 */
@Repository
public class RedisArticleRepository implements ArticleRepository {

    private static final Logger logger = LoggerFactory.getLogger(RedisArticleRepository.class);

    static final String ARTICLE_PREFIX = "news:article:";
    static final String SOURCE_PREFIX = "news:article:source:";
    static final String CATEGORY_INDEX_PREFIX = "news:article:category:";
    static final String ALL_IDS_KEY = "news:article:ids";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisArticleRepository(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public String create(ArticleRecord article) {
        Objects.requireNonNull(article.sourceUrl(), "sourceUrl");

        String id = UUID.randomUUID().toString();
        String sourceKey = sourceKey(article.sourceUrl());

        try {
            Boolean claimed = redisTemplate.opsForValue().setIfAbsent(sourceKey, id);
            if (!Boolean.TRUE.equals(claimed)) {
                throw new DuplicateArticleException(article.sourceUrl());
            }

            try {
                ArticleRecord stored = article.withId(id);
                redisTemplate.opsForValue().set(ARTICLE_PREFIX + id, objectMapper.writeValueAsString(stored));
                redisTemplate.opsForSet().add(ALL_IDS_KEY, id);
                if (article.categoryId() != null) {
                    redisTemplate.opsForSet().add(CATEGORY_INDEX_PREFIX + article.categoryId(), id);
                }
            } catch (JsonProcessingException | DataAccessException e) {
                redisTemplate.delete(sourceKey);
                throw e;
            }

            logger.debug("Stored article {} for {}", id, article.sourceUrl());
            return id;

        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialise article for " + article.sourceUrl(), e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Redis write failed for " + article.sourceUrl(), e);
        }
    }

    @Override
    public List<ArticleRecord> findByFilter(ArticleFilter filter) {
        try {
            Collection<String> ids;
            if (filter.sourceUrl() != null) {
                String id = redisTemplate.opsForValue().get(sourceKey(filter.sourceUrl()));
                ids = id == null ? List.of() : List.of(id);
            } else if (filter.categoryId() != null) {
                ids = nullToEmpty(redisTemplate.opsForSet().members(CATEGORY_INDEX_PREFIX + filter.categoryId()));
            } else {
                ids = nullToEmpty(redisTemplate.opsForSet().members(ALL_IDS_KEY));
            }

            if (ids.isEmpty()) return List.of();

            List<String> keys = ids.stream().map(id -> ARTICLE_PREFIX + id).toList();
            List<String> values = redisTemplate.opsForValue().multiGet(keys);
            if (values == null) return List.of();

            List<ArticleRecord> result = new ArrayList<>();
            for (String value : values) {
                if (value == null) continue;
                ArticleRecord article = objectMapper.readValue(value, ArticleRecord.class);
                if (filter.matches(article)) {
                    result.add(article);
                }
            }
            return result;

        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt article record in Redis", e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Redis lookup failed", e);
        }
    }

    @Override
    public void delete(String id) {
        try {
            String value = redisTemplate.opsForValue().get(ARTICLE_PREFIX + id);
            if (value == null) {
                logger.debug("Article {} not found, nothing to delete", id);
                return;
            }

            ArticleRecord article = objectMapper.readValue(value, ArticleRecord.class);
            redisTemplate.delete(List.of(ARTICLE_PREFIX + id, sourceKey(article.sourceUrl())));
            redisTemplate.opsForSet().remove(ALL_IDS_KEY, id);
            if (article.categoryId() != null) {
                redisTemplate.opsForSet().remove(CATEGORY_INDEX_PREFIX + article.categoryId(), id);
            }

        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt article record " + id, e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Redis delete failed for " + id, e);
        }
    }

    static String sourceKey(String sourceUrl) {
        return SOURCE_PREFIX + DigestUtils.md5Hex(sourceUrl);
    }

    private static Collection<String> nullToEmpty(Set<String> members) {
        return members == null ? List.of() : members;
    }
}
