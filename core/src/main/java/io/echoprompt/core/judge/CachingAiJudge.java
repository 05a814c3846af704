package io.echoprompt.core.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.echoprompt.core.spi.AiJudge;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Decorates an {@link AiJudge} with an in-memory cache keyed by (value,
 * question). Entries expire a fixed time after they are written; failed
 * judgements are not cached.
 *
 * <p>
 * The cache belongs to the instance, so its lifetime is the caller's choice.
 * Thread-safe.
 */
public final class CachingAiJudge implements AiJudge {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AiJudge delegate;
    private final Cache<Key, Boolean> cache;

    private record Key(String value, String question) {}

    public CachingAiJudge(AiJudge delegate) {
        this(delegate, DEFAULT_TTL, Ticker.systemTicker());
    }

    public CachingAiJudge(AiJudge delegate, Duration ttl) {
        this(delegate, ttl, Ticker.systemTicker());
    }

    CachingAiJudge(AiJudge delegate, Duration ttl, Ticker ticker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.cache = Caffeine.newBuilder().expireAfterWrite(ttl).ticker(ticker).build();
    }

    @Override
    public CompletionStage<Boolean> judge(Object value, String question) {
        Key key = new Key(fingerprint(value), question);
        Boolean cached = cache.getIfPresent(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return delegate.judge(value, question).thenApply(result -> {
            boolean answer = Boolean.TRUE.equals(result);
            cache.put(key, answer);
            return answer;
        });
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clear() {
        cache.invalidateAll();
    }

    private static String fingerprint(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
