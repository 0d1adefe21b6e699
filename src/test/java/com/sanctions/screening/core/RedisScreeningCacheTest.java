package com.sanctions.screening.core;

import com.sanctions.screening.domain.ScreeningResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.serializer.SerializationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisScreeningCacheTest {

    @Mock
    private RedisTemplate<String, ScreeningResult> redisTemplate;

    @Mock
    private ValueOperations<String, ScreeningResult> valueOps;

    private RedisScreeningCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisScreeningCache(redisTemplate);
    }

    @Test
    void getHitReturnsCopyFlaggedAsHit() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("screening:result:abc")).thenReturn(ScreeningResults.result("req-1"));

        Optional<ScreeningResult> hit = cache.get("abc");

        assertThat(hit).isPresent();
        assertThat(hit.get().isCacheHit()).isTrue();
        assertThat(cache.metrics().getHits()).isEqualTo(1);
    }

    @Test
    void getMissReturnsEmpty() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenReturn(null);

        assertThat(cache.get("abc")).isEmpty();
        assertThat(cache.metrics().getMisses()).isEqualTo(1);
    }

    @Test
    void unreadableEntryCountsAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenThrow(new SerializationException("old schema"));

        assertThat(cache.get("abc")).isEmpty();
        assertThat(cache.metrics().getMisses()).isEqualTo(1);
    }

    @Test
    void connectionFailureOnGetRaisesCacheException() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> cache.get("abc"))
                .isInstanceOf(ScreeningCacheException.class)
                .hasMessageContaining("abc");
    }

    @Test
    void putStoresUnderPrefixWithTtlAndWithoutHitFlag() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        ScreeningResult hit = ScreeningResults.result("req-1").toBuilder().cacheHit(true).build();

        cache.put("abc", hit, Duration.ofMinutes(3));

        verify(valueOps).set(eq("screening:result:abc"), argThat(r -> !r.isCacheHit()), eq(Duration.ofMinutes(3)));
    }

    @Test
    void connectionFailureOnPutRaisesCacheException() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOps).set(anyString(), any(ScreeningResult.class), any(Duration.class));

        assertThatThrownBy(() -> cache.put("abc", ScreeningResults.result("req-1"), Duration.ofMinutes(1)))
                .isInstanceOf(ScreeningCacheException.class);
    }

    @Test
    void invalidateAllScansPrefixAndDeletesMatches() {
        Cursor<String> cursor = cursorOf("screening:result:a", "screening:result:b");
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        cache.invalidateAll();

        verify(redisTemplate).scan(argThat(o -> "screening:result:*".equals(o.getPattern())));
        verify(redisTemplate).delete(List.of("screening:result:a", "screening:result:b"));
        verify(redisTemplate, never()).keys(anyString());
    }

    @Test
    void invalidateAllWithNothingStoredDeletesNothing() {
        Cursor<String> cursor = cursorOf();
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        cache.invalidateAll();

        verify(redisTemplate, never()).delete(anyCollection());
    }

    @Test
    void invalidateAllDeletesInBatches() {
        String[] keys = new String[RedisScreeningCache.SCAN_BATCH + 1];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = "screening:result:" + i;
        }
        Cursor<String> cursor = cursorOf(keys);
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        cache.invalidateAll();

        verify(redisTemplate, times(2)).delete(anyCollection());
    }

    @Test
    void sizeCountsOnlyResultKeys() {
        Cursor<String> cursor = cursorOf("screening:result:a", "screening:result:b");
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        assertThat(cache.metrics().getSize()).isEqualTo(2);
    }

    @Test
    void sizeIsUnknownWhenRedisIsDown() {
        when(redisTemplate.scan(any(ScanOptions.class))).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(cache.metrics().getSize()).isEqualTo(-1);
    }

    @SuppressWarnings("unchecked")
    private static Cursor<String> cursorOf(String... keys) {
        Iterator<String> it = Arrays.asList(keys).iterator();
        Cursor<String> cursor = mock(Cursor.class);
        lenient().when(cursor.hasNext()).thenAnswer(inv -> it.hasNext());
        lenient().when(cursor.next()).thenAnswer(inv -> it.next());
        return cursor;
    }
}
