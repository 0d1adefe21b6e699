package com.sanctions.screening.core;

import com.sanctions.screening.domain.ScreeningResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.serializer.SerializationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * Result cache shared by all instances of the service. TTL and memory eviction are enforced by Redis.
 * Connection failures surface as {@link ScreeningCacheException}; unreadable entries count as a miss.
 */
@Slf4j
public class RedisScreeningCache implements ScreeningCache {

    static final String KEY_PREFIX = "screening:result:";
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    static final int SCAN_BATCH = 500;

    private final RedisTemplate<String, ScreeningResult> redisTemplate;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public RedisScreeningCache(RedisTemplate<String, ScreeningResult> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<ScreeningResult> get(String key) {
        ScreeningResult cached;
        try {
            cached = redisTemplate.opsForValue().get(KEY_PREFIX + key);
        } catch (SerializationException e) {
            log.error("Screening cache entry unreadable for key={}. Treating as miss; "
                    + "consider flushing entries written by an older schema.", key, e);
            misses.increment();
            return Optional.empty();
        } catch (Exception e) {
            throw new ScreeningCacheException("Redis read failed for key=" + key, e);
        }
        if (cached == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(cached.toBuilder().cacheHit(true).build());
    }

    @Override
    public void put(String key, ScreeningResult value, Duration ttl) {
        ScreeningResult stored = value.isCacheHit() ? value.toBuilder().cacheHit(false).build() : value;
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + key, stored, ttl != null ? ttl : DEFAULT_TTL);
            log.debug("Stored screening result for key={}", key);
        } catch (Exception e) {
            throw new ScreeningCacheException("Redis write failed for key=" + key, e);
        }
    }

    @Override
    public CacheMetrics metrics() {
        long h = hits.sum();
        long m = misses.sum();
        long size;
        try {
            size = forEachKeyBatch(batch -> { });
        } catch (Exception e) {
            log.warn("Could not count screening cache entries: {}", e.getMessage());
            size = -1L;
        }
        double rate = h + m == 0 ? 0.0 : (double) h / (h + m);
        return new CacheMetrics("redis", rate, size, 0L, h, m);
    }

    @Override
    public void invalidateAll() {
        try {
            long deleted = forEachKeyBatch(redisTemplate::delete);
            log.info("Invalidated {} screening cache entries", deleted);
        } catch (Exception e) {
            throw new ScreeningCacheException("Redis invalidate failed", e);
        }
    }

    /**
     * Walks the result keys with SCAN so a large keyspace never blocks the server the way KEYS does.
     *
     * @return number of keys visited
     */
    long forEachKeyBatch(Consumer<List<String>> action) {
        ScanOptions options = ScanOptions.scanOptions().match(KEY_PREFIX + "*").count(SCAN_BATCH).build();
        long visited = 0;
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            List<String> batch = new ArrayList<>(SCAN_BATCH);
            while (cursor.hasNext()) {
                batch.add(cursor.next());
                visited++;
                if (batch.size() == SCAN_BATCH) {
                    action.accept(batch);
                    batch = new ArrayList<>(SCAN_BATCH);
                }
            }
            if (!batch.isEmpty()) {
                action.accept(batch);
            }
        }
        return visited;
    }
}
