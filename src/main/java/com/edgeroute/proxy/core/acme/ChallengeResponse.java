package com.edgeroute.proxy.core.acme;

/**
 * Answer to an ACME HTTP-01 request.
 *
 * @param status      HTTP status code.
 * @param contentType Content type of the body; null when there is no body.
 * @param body        Response body; null when there is no body.
 */
public record ChallengeResponse(int status, String contentType, String body) {

    public static final String TEXT_PLAIN = "text/plain";

    public static ChallengeResponse found(String keyAuthorization) {
        return new ChallengeResponse(200, TEXT_PLAIN, keyAuthorization);
    }

    public static ChallengeResponse status(int status) {
        return new ChallengeResponse(status, null, null);
    }

    public boolean hasBody() {
        return body != null;
    }
}
