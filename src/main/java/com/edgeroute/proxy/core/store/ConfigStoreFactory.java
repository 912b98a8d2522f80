package com.edgeroute.proxy.core.store;

import com.edgeroute.proxy.config.StoreConfig;
import com.edgeroute.proxy.core.exceptions.ConfigException;

/**
 * Factory for creating the {@link ConfigStore} named by configuration.
 */
public final class ConfigStoreFactory {

    private ConfigStoreFactory() {
        // Utility class
    }

    /**
     * Creates the store implementation for the configured backend.
     *
     * @param config The store configuration.
     * @return A new, unconnected store.
     * @throws ConfigException if the backend is unknown.
     */
    public static ConfigStore create(StoreConfig config) {
        String backend = config.getBackend();
        if (backend == null || "redis".equalsIgnoreCase(backend)) {
            return new RedisConfigStore(config);
        } else if ("memory".equalsIgnoreCase(backend)) {
            return new InMemoryConfigStore();
        }
        throw new ConfigException("Unsupported store backend: " + backend);
    }
}
