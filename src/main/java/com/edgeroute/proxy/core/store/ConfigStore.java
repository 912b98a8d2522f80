package com.edgeroute.proxy.core.store;

/**
 * Process-wide handle on the external configuration store.
 * Owns connection resources between {@link #close()} calls; request handling
 * only ever sees short-lived {@link StoreSession}s.
 */
public interface ConfigStore extends AutoCloseable {

    /**
     * Borrows a session for the duration of one phase invocation.
     * Callers must close it before the phase returns.
     *
     * @return An open session.
     * @throws com.edgeroute.proxy.core.exceptions.StoreUnavailableException if no
     *                                                                       connection
     *                                                                       can be
     *                                                                       obtained.
     */
    StoreSession openSession();

    /**
     * Releases all connection resources held by the store.
     */
    @Override
    void close();
}
