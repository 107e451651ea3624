package com.github.rudygunawan.tiercache.tag;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reverse index from tag to the keys carrying it, used for bulk invalidation.
 *
 * <p>A forward map from key to tags is kept alongside the buckets so {@link #remove(String)} only
 * visits the buckets the key is actually in. Writers take the write lock, so a scan through
 * {@link #keysForTags(Collection)} never observes a bucket half-updated; it returns a copy of
 * the membership at scan time.
 */
public class TagIndex {
    private final Map<String, Set<String>> keysByTag = new HashMap<>();
    private final Map<String, Set<String>> tagsByKey = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Registers {@code key} under each of {@code tags}, in addition to any tags it already has.
     *
     * @param key the cache key
     * @param tags the tags to register, may be empty
     */
    void add(String key, Collection<String> tags) {
        Objects.requireNonNull(key, "key cannot be null");
        if (tags == null || tags.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            Set<String> keyTags = tagsByKey.computeIfAbsent(key, k -> new LinkedHashSet<>());
            for (String tag : tags) {
                Objects.requireNonNull(tag, "tag cannot be null");
                keysByTag.computeIfAbsent(tag, t -> new LinkedHashSet<>()).add(key);
                keyTags.add(tag);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Makes {@code tags} the exact tag set of {@code key}, dropping any tag it had before.
     */
    public void replace(String key, Collection<String> tags) {
        lock.writeLock().lock();
        try {
            remove(key);
            add(key, tags);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes {@code key} from every bucket it appears in, deleting buckets that become empty.
     *
     * @param key the cache key
     * @return true if the key carried at least one tag
     */
    public boolean remove(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.writeLock().lock();
        try {
            Set<String> keyTags = tagsByKey.remove(key);
            if (keyTags == null) {
                return false;
            }
            for (String tag : keyTags) {
                Set<String> bucket = keysByTag.get(tag);
                if (bucket != null) {
                    bucket.remove(key);
                    if (bucket.isEmpty()) {
                        keysByTag.remove(tag);
                    }
                }
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the union of the keys registered under any of {@code tags}, as of the call.
     *
     * @param tags the tags to look up
     * @return a new, modifiable set in registration order
     */
    public Set<String> keysForTags(Collection<String> tags) {
        Objects.requireNonNull(tags, "tags cannot be null");
        lock.readLock().lock();
        try {
            Set<String> keys = new LinkedHashSet<>();
            for (String tag : tags) {
                Set<String> bucket = keysByTag.get(tag);
                if (bucket != null) {
                    keys.addAll(bucket);
                }
            }
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the tags currently registered for {@code key}.
     */
    Set<String> tagsFor(String key) {
        lock.readLock().lock();
        try {
            Set<String> keyTags = tagsByKey.get(key);
            return keyTags == null ? Collections.emptySet() : new HashSet<>(keyTags);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of non-empty tag buckets.
     */
    int tagCount() {
        lock.readLock().lock();
        try {
            return keysByTag.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            keysByTag.clear();
            tagsByKey.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
