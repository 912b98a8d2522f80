package com.edgeroute.proxy.core.store;

import com.edgeroute.proxy.config.StoreConfig;
import com.edgeroute.proxy.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigStoreFactoryTest {

    @Test
    void create_memoryBackend() {
        StoreConfig config = new StoreConfig();
        config.setBackend("memory");

        try (ConfigStore store = ConfigStoreFactory.create(config)) {
            assertThat(store).isInstanceOf(InMemoryConfigStore.class);
        }
    }

    @Test
    void create_redisBackendIsDefault() {
        StoreConfig config = new StoreConfig();
        config.setBackend(null);

        try (ConfigStore store = ConfigStoreFactory.create(config)) {
            assertThat(store).isInstanceOf(RedisConfigStore.class);
        }
        try (ConfigStore store = ConfigStoreFactory.create(new StoreConfig())) {
            assertThat(store).isInstanceOf(RedisConfigStore.class);
        }
    }

    @Test
    void create_unknownBackend_throwsConfigException() {
        StoreConfig config = new StoreConfig();
        config.setBackend("etcd");

        assertThatThrownBy(() -> ConfigStoreFactory.create(config))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("etcd");
    }
}
