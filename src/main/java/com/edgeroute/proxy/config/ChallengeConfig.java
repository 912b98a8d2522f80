package com.edgeroute.proxy.config;

/**
 * Configuration for the ACME HTTP-01 challenge listener.
 */
public class ChallengeConfig {
    private boolean enabled = true;
    private int port = 8080;
    /** Bind address for the listener. Null means all interfaces. */
    private String bindAddress;

    /**
     * Checks if the challenge listener is enabled.
     * 
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sets whether the challenge listener is enabled.
     * 
     * @param enabled true to enable, false to disable.
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Gets the port for the challenge listener.
     * 
     * @return the port number.
     */
    public int getPort() {
        return port;
    }

    /**
     * Sets the port for the challenge listener.
     * 
     * @param port the port number.
     */
    public void setPort(int port) {
        this.port = port;
    }

    /**
     * Gets the bind address for the challenge listener.
     * 
     * @return the bind address string, or null for all interfaces.
     */
    public String getBindAddress() {
        return bindAddress;
    }

    /**
     * Sets the bind address for the challenge listener.
     * 
     * @param bindAddress the bind address string.
     */
    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }
}
