package io.newsharvest.ingestion.api.repository;

import io.newsharvest.ingestion.api.dto.Category;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class RedisCategoryRepository implements CategoryRepository {

    static final String CATEGORIES_KEY = "news:categories";

    private final RedisNamedEntityStore store;

    public RedisCategoryRepository(RedisTemplate<String, String> redisTemplate) {
        this.store = new RedisNamedEntityStore(redisTemplate, CATEGORIES_KEY);
    }

    @Override
    public Optional<Category> findByName(String name) {
        return store.find(name).map(parts -> new Category(parts[0], parts[1]));
    }

    @Override
    public Category saveIfAbsent(String name) {
        String[] parts = store.saveIfAbsent(name);
        return new Category(parts[0], parts[1]);
    }
}
