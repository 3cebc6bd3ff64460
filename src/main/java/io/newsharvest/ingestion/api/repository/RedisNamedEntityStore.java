package io.newsharvest.ingestion.api.repository;

import io.newsharvest.ingestion.api.exception.PersistenceException;
import io.newsharvest.ingestion.api.exception.RepositoryLookupException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis hash of {@code lower(name) -> id|name}, shared by the category and author stores.
 */
class RedisNamedEntityStore {

    private static final String SEPARATOR = "|";

    private final RedisTemplate<String, String> redisTemplate;
    private final String hashKey;

    RedisNamedEntityStore(RedisTemplate<String, String> redisTemplate, String hashKey) {
        this.redisTemplate = redisTemplate;
        this.hashKey = hashKey;
    }

    Optional<String[]> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();

        try {
            Object value = redisTemplate.opsForHash().get(hashKey, normalize(name));
            return Optional.ofNullable(value).map(Object::toString).map(this::split);
        } catch (DataAccessException e) {
            throw new RepositoryLookupException("Lookup of '" + name + "' in " + hashKey + " failed", e);
        }
    }

    String[] saveIfAbsent(String name) {
        String entry = UUID.randomUUID() + SEPARATOR + name.trim();
        try {
            redisTemplate.opsForHash().putIfAbsent(hashKey, normalize(name), entry);
            Object stored = redisTemplate.opsForHash().get(hashKey, normalize(name));
            return split(stored == null ? entry : stored.toString());
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot store '" + name + "' in " + hashKey, e);
        }
    }

    private String[] split(String value) {
        int index = value.indexOf(SEPARATOR);
        return new String[]{value.substring(0, index), value.substring(index + 1)};
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
