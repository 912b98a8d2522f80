package com.edgeroute.proxy.core.engine;

import com.edgeroute.proxy.core.acme.ChallengeResponse;

/**
 * Result of the access phase: either continue to the balancer phase or answer
 * the request directly.
 */
public final class AccessOutcome {

    /** Route resolved; proceed to backend selection. */
    public static final AccessOutcome CONTINUE = new AccessOutcome(true, 0, null, null);

    private final boolean proceed;
    private final int status;
    private final String contentType;
    private final String body;

    private AccessOutcome(boolean proceed, int status, String contentType, String body) {
        this.proceed = proceed;
        this.status = status;
        this.contentType = contentType;
        this.body = body;
    }

    /**
     * Answers with a bare status code.
     *
     * @param status HTTP status.
     * @return The outcome.
     */
    public static AccessOutcome respond(int status) {
        return new AccessOutcome(false, status, null, null);
    }

    public static AccessOutcome from(ChallengeResponse response) {
        return new AccessOutcome(false, response.status(), response.contentType(), response.body());
    }

    public boolean isContinue() {
        return proceed;
    }

    public int getStatus() {
        return status;
    }

    public String getContentType() {
        return contentType;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return proceed ? "AccessOutcome{CONTINUE}" : "AccessOutcome{status=" + status + "}";
    }
}
