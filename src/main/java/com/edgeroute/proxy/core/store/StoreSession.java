package com.edgeroute.proxy.core.store;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the configuration store, valid for one phase invocation.
 * Every method is a round-trip and throws
 * {@link com.edgeroute.proxy.core.exceptions.StoreUnavailableException} when the
 * store fails or exceeds its timeout. A missing key is never an error.
 */
public interface StoreSession extends AutoCloseable {

    /**
     * Reads all members of a set.
     *
     * @param key Set key.
     * @return The members; empty if the key does not exist.
     */
    Set<String> members(String key);

    /**
     * Reads a string value.
     *
     * @param key Value key.
     * @return The value, or empty if absent.
     */
    Optional<String> get(String key);

    /**
     * Reads a whole list in order.
     *
     * @param key List key.
     * @return The elements; empty if the key does not exist.
     */
    List<String> range(String key);

    /**
     * Returns the session's connection to the store.
     */
    @Override
    void close();
}
