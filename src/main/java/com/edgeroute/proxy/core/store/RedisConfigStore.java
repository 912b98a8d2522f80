package com.edgeroute.proxy.core.store;

import com.edgeroute.proxy.config.StoreConfig;
import com.edgeroute.proxy.core.exceptions.StoreUnavailableException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Redis-backed store using a Jedis connection pool.
 * The pool lives as long as this object; each {@link StoreSession} borrows one
 * connection and hands it back on close.
 */
public class RedisConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(RedisConfigStore.class);

    private final JedisPool pool;
    private final String description;

    /**
     * Creates the pool from configuration. No connection is opened until the first
     * session is requested.
     *
     * @param config Store settings.
     */
    public RedisConfigStore(StoreConfig config) {
        this(createPool(config), config.getHost() + ":" + config.getPort() + "/" + config.getDatabase());
    }

    /**
     * Wraps an existing pool.
     *
     * @param pool        The Jedis pool to borrow from.
     * @param description Human readable location used in log and error messages.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RedisConfigStore(JedisPool pool, String description) {
        this.pool = pool;
        this.description = description;
        log.info("Redis config store configured for {}", description);
    }

    private static JedisPool createPool(StoreConfig config) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getMaxTotal());
        poolConfig.setMaxIdle(config.getMaxIdle());
        poolConfig.setMaxWait(Duration.ofMillis(config.getMaxWait()));
        poolConfig.setTestWhileIdle(true);
        poolConfig.setJmxEnabled(false);
        String password = config.getPassword() == null || config.getPassword().isEmpty() ? null
                : config.getPassword();
        return new JedisPool(poolConfig, config.getHost(), config.getPort(), config.getTimeout(), password,
                config.getDatabase());
    }

    @Override
    public StoreSession openSession() {
        try {
            return new RedisSession(pool.getResource());
        } catch (JedisException e) {
            throw new StoreUnavailableException("Redis unavailable at " + description + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        log.info("Closing Redis connection pool for {}", description);
        pool.close();
    }

    /**
     * Session bound to a single pooled connection.
     */
    private final class RedisSession implements StoreSession {
        private final Jedis jedis;

        private RedisSession(Jedis jedis) {
            this.jedis = jedis;
        }

        @Override
        public Set<String> members(String key) {
            return execute("SMEMBERS", key, j -> j.smembers(key));
        }

        @Override
        public Optional<String> get(String key) {
            return Optional.ofNullable(execute("GET", key, j -> j.get(key)));
        }

        @Override
        public List<String> range(String key) {
            return execute("LRANGE", key, j -> j.lrange(key, 0, -1));
        }

        private <T> T execute(String command, String key, Function<Jedis, T> operation) {
            try {
                return operation.apply(jedis);
            } catch (JedisException e) {
                throw new StoreUnavailableException(
                        "Redis " + command + " " + key + " failed at " + description + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            // Returns the connection to the pool (or discards it if broken)
            jedis.close();
        }
    }
}
