package com.signaldesk.pipeline.fetch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public class ResponseCache {
    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final String name;
    private final Clock clock;
    private final Cache<String, CacheEntry> store;

    public ResponseCache(String name, Clock clock, long maximumSize) {
        this.name = name;
        this.clock = clock;
        Ticker ticker = () -> clock.millis() * 1_000_000L;
        this.store = Caffeine.newBuilder()
            .ticker(ticker)
            .executor(Runnable::run)
            .maximumSize(Math.max(1, maximumSize))
            .expireAfter(new EntryExpiry())
            .build();
    }

    public Optional<FetchResponse> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry entry = store.getIfPresent(key);
        if (entry == null) {
            log.debug("Cache {} miss key={}", name, key);
            return Optional.empty();
        }
        if (clock.instant().isAfter(entry.expiresAt())) {
            log.debug("Cache {} expired key={}", name, key);
            return Optional.empty();
        }
        log.debug("Cache {} hit key={}", name, key);
        return Optional.of(entry.value());
    }

    public void put(String key, FetchResponse value, Duration ttl) {
        if (key == null || value == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        store.put(key, new CacheEntry(key, value, clock.instant().plus(ttl)));
    }

    public void invalidate(String key) {
        if (key != null) {
            store.invalidate(key);
        }
    }

    public void clear() {
        store.invalidateAll();
    }

    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }

    public String name() {
        return name;
    }

    record CacheEntry(String key, FetchResponse value, Instant expiresAt) {
    }

    private final class EntryExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry entry) {
            long millis = Duration.between(clock.instant(), entry.expiresAt()).toMillis();
            // an entry read exactly at expiresAt is still live
            return Math.max(0, millis) * 1_000_000L + 1;
        }
    }
}
