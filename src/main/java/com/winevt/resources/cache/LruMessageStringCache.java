package com.winevt.resources.cache;

import com.winevt.resources.core.model.ResolutionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used message string cache.
 *
 * <p>Entries live in a hash map and in a doubly linked recency list whose head is the
 * most recently used entry. A write or a successful read moves the entry to the head;
 * a write into a full cache first evicts the tail entry. Each resolution is written under
 * up to two keys, which are evicted independently. Message and parameter strings with the
 * same identifier are held under distinct keys.</p>
 *
 * <p>Not thread-safe: each resolver owns its own cache.</p>
 */
public class LruMessageStringCache implements MessageStringCache {
    private static final Logger log = LoggerFactory.getLogger(LruMessageStringCache.class);

    private final int maxSize;
    private final Map<CacheKey, Node> entries = new HashMap<>();
    private final Node head = new Node(null, null);
    private final Node tail = new Node(null, null);

    private long hitCount;
    private long missCount;
    private long evictionCount;

    public LruMessageStringCache(CacheConfig config) {
        this.maxSize = config.maxSize();
        head.next = tail;
        tail.previous = head;
        log.debug("LruMessageStringCache initialized: maxSize={}", maxSize);
    }

    @Override
    public Optional<String> get(ResolutionKind resolutionKind, String providerIdentifier, String logSource,
                                long messageIdentifier, Integer eventVersion) {
        Node node = null;
        if (isPresent(providerIdentifier)) {
            node = entries.get(CacheKey.forProvider(
                    resolutionKind, providerIdentifier, messageIdentifier, eventVersion));
        }
        if (node == null && isPresent(logSource)) {
            node = entries.get(CacheKey.forLogSource(resolutionKind, logSource, messageIdentifier, eventVersion));
        }
        if (node == null) {
            missCount++;
            return Optional.empty();
        }
        hitCount++;
        moveToHead(node);
        return Optional.of(node.value);
    }

    @Override
    public void put(ResolutionKind resolutionKind, String providerIdentifier, String logSource,
                    long messageIdentifier, Integer eventVersion, String messageString) {
        if (messageString == null || messageString.isEmpty()) {
            return;
        }
        if (isPresent(providerIdentifier)) {
            put(CacheKey.forProvider(resolutionKind, providerIdentifier, messageIdentifier, eventVersion),
                    messageString);
        }
        if (isPresent(logSource)) {
            put(CacheKey.forLogSource(resolutionKind, logSource, messageIdentifier, eventVersion), messageString);
        }
    }

    private void put(CacheKey key, String value) {
        Node node = entries.get(key);
        if (node != null) {
            node.value = value;
            moveToHead(node);
            return;
        }
        if (entries.size() >= maxSize) {
            evictLeastRecentlyUsed();
        }
        node = new Node(key, value);
        entries.put(key, node);
        linkAfterHead(node);
    }

    private void evictLeastRecentlyUsed() {
        Node eldest = tail.previous;
        if (eldest == head) {
            return;
        }
        unlink(eldest);
        entries.remove(eldest.key);
        evictionCount++;
    }

    @Override
    public void invalidateAll() {
        entries.clear();
        head.next = tail;
        tail.previous = head;
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hitCount, missCount, evictionCount, entries.size());
    }

    public int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Returns the cached keys from most to least recently used.
     */
    List<CacheKey> keysByRecency() {
        List<CacheKey> keys = new ArrayList<>(entries.size());
        for (Node node = head.next; node != tail; node = node.next) {
            keys.add(node.key);
        }
        return keys;
    }

    private void moveToHead(Node node) {
        unlink(node);
        linkAfterHead(node);
    }

    private void linkAfterHead(Node node) {
        node.previous = head;
        node.next = head.next;
        head.next.previous = node;
        head.next = node;
    }

    private static void unlink(Node node) {
        node.previous.next = node.next;
        node.next.previous = node.previous;
        node.previous = null;
        node.next = null;
    }

    private static boolean isPresent(String identifier) {
        return identifier != null && !identifier.isEmpty();
    }

    private static final class Node {
        private final CacheKey key;
        private String value;
        private Node previous;
        private Node next;

        private Node(CacheKey key, String value) {
            this.key = key;
            this.value = value;
        }
    }
}
