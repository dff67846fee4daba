package me.golemcore.hrms.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.domain.model.CachedReply;
import me.golemcore.hrms.infrastructure.config.HrmsProperties;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Time-bound store of final answers keyed by a fingerprint of the normalized
 * query.
 *
 * <p>
 * Queries that differ only in case, punctuation or whitespace runs share a
 * fingerprint. {@link #set} is an upsert. Expired entries are never returned:
 * they are dropped lazily on read and by a periodic purge. Consistency is
 * best-effort; a concurrent {@link #invalidateAll()} may race with reads from
 * unrelated turns.
 */
@Component
@Slf4j
public class QueryCache {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, CachedReply> entries = new ConcurrentHashMap<>();
    private final HrmsProperties.CacheProperties settings;
    private final Clock clock;

    private ScheduledExecutorService purgeExecutor;

    public QueryCache(HrmsProperties properties, Clock clock) {
        this.settings = properties.getCache();
        this.clock = clock;
    }

    @PostConstruct
    public void startPurge() {
        long intervalMs = settings.getPurgeInterval().toMillis();
        if (intervalMs <= 0) {
            return;
        }
        purgeExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "query-cache-purge");
            t.setDaemon(true);
            return t;
        });
        purgeExecutor.scheduleAtFixedRate(this::purgeExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void destroy() {
        if (purgeExecutor != null) {
            purgeExecutor.shutdownNow();
        }
    }

    /**
     * Lowercase, strip everything that is neither a word character nor
     * whitespace, collapse whitespace runs to a single space and trim.
     */
    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String text = query.toLowerCase(Locale.ROOT);
        text = NON_WORD.matcher(text).replaceAll("");
        text = WHITESPACE_RUN.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * SHA-256 hex digest of the normalized query.
     */
    public static String fingerprint(String query) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalize(query).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Optional<CachedReply> get(String query) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        String key = fingerprint(query);
        CachedReply entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            log.debug("[Cache] Expired entry dropped: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void set(String query, String reply) {
        set(query, reply, null, null);
    }

    public void set(String query, String reply, String toolUsed, Object data) {
        if (!settings.isEnabled()) {
            return;
        }
        String key = fingerprint(query);
        Instant now = clock.instant();
        Instant expiresAt = now.plus(settings.getTtl());
        entries.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                existing.setReply(reply);
                existing.setToolUsed(toolUsed);
                existing.setData(data);
                existing.setCreatedAt(now);
                existing.setExpiresAt(expiresAt);
                return existing;
            }
            return CachedReply.builder()
                    .fingerprint(k)
                    .originalQuery(query)
                    .reply(reply)
                    .toolUsed(toolUsed)
                    .data(data)
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .build();
        });
    }

    /**
     * Removes every entry unconditionally.
     *
     * @return number of entries removed
     */
    public int invalidateAll() {
        int removed = 0;
        for (String key : entries.keySet()) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        log.info("[Cache] Invalidated {} entries", removed);
        return removed;
    }

    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = Math.max(0, before - entries.size());
        if (purged > 0) {
            log.debug("[Cache] Purged {} expired entries", purged);
        }
        return purged;
    }

    public int size() {
        return entries.size();
    }
}
