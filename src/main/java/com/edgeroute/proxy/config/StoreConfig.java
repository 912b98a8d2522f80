package com.edgeroute.proxy.config;

import java.util.Objects;

/**
 * Connection settings for the configuration store.
 */
public class StoreConfig {
    /** Store backend: {@code redis} or {@code memory}. */
    private String backend = "redis";

    private String host = "127.0.0.1";

    private int port = 6379;

    /** Optional password. Null or empty disables AUTH. */
    private String password;

    private int database = 0;

    /** Connect and read timeout of a single round-trip, in milliseconds. */
    private int timeout = 1000;

    /** Maximum pooled connections. */
    private int maxTotal = 100;

    /** Maximum idle pooled connections. */
    private int maxIdle = 100;

    /** Maximum time to wait for a pooled connection, in milliseconds. */
    private int maxWait = 1000;

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getDatabase() {
        return database;
    }

    public void setDatabase(int database) {
        this.database = database;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    public int getMaxTotal() {
        return maxTotal;
    }

    public void setMaxTotal(int maxTotal) {
        this.maxTotal = maxTotal;
    }

    public int getMaxIdle() {
        return maxIdle;
    }

    public void setMaxIdle(int maxIdle) {
        this.maxIdle = maxIdle;
    }

    public int getMaxWait() {
        return maxWait;
    }

    public void setMaxWait(int maxWait) {
        this.maxWait = maxWait;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        StoreConfig that = (StoreConfig) o;
        return port == that.port &&
               database == that.database &&
               timeout == that.timeout &&
               maxTotal == that.maxTotal &&
               maxIdle == that.maxIdle &&
               maxWait == that.maxWait &&
               Objects.equals(backend, that.backend) &&
               Objects.equals(host, that.host) &&
               Objects.equals(password, that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backend, host, port, password, database, timeout, maxTotal, maxIdle, maxWait);
    }
}
