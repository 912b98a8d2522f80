package com.edgeroute.proxy.core.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Store kept in process memory, for local runs without Redis and for tests.
 * Write methods stand in for the control plane; the decision layer only reads.
 */
public class InMemoryConfigStore implements ConfigStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();
    private final Map<String, List<String>> lists = new ConcurrentHashMap<>();

    /**
     * Sets a string value.
     *
     * @param key   Value key.
     * @param value The value.
     * @return This store.
     */
    public InMemoryConfigStore put(String key, String value) {
        values.put(key, value);
        return this;
    }

    /**
     * Adds members to a set.
     *
     * @param key     Set key.
     * @param members Members to add.
     * @return This store.
     */
    public InMemoryConfigStore addMembers(String key, String... members) {
        sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).addAll(List.of(members));
        return this;
    }

    /**
     * Appends elements to a list.
     *
     * @param key      List key.
     * @param elements Elements to append in order.
     * @return This store.
     */
    public InMemoryConfigStore append(String key, String... elements) {
        lists.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).addAll(List.of(elements));
        return this;
    }

    /**
     * Removes a key of any type.
     *
     * @param key The key to delete.
     * @return This store.
     */
    public InMemoryConfigStore delete(String key) {
        values.remove(key);
        sets.remove(key);
        lists.remove(key);
        return this;
    }

    @Override
    public StoreSession openSession() {
        return new StoreSession() {
            @Override
            public Set<String> members(String key) {
                Set<String> members = sets.get(key);
                return members == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(members));
            }

            @Override
            public Optional<String> get(String key) {
                return Optional.ofNullable(values.get(key));
            }

            @Override
            public List<String> range(String key) {
                List<String> list = lists.get(key);
                return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
            }

            @Override
            public void close() {
                // Nothing borrowed
            }
        };
    }

    @Override
    public void close() {
        values.clear();
        sets.clear();
        lists.clear();
    }
}
