package com.edgeroute.proxy.core.acme;

import com.edgeroute.proxy.core.constants.StoreKeys;
import com.edgeroute.proxy.core.exceptions.StoreUnavailableException;
import com.edgeroute.proxy.core.services.DecisionMetrics;
import com.edgeroute.proxy.core.store.ConfigStore;
import com.edgeroute.proxy.core.store.StoreSession;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers ACME HTTP-01 challenges from key authorizations the control plane
 * publishes in the store.
 */
public class ChallengeResponder {

    private static final Logger log = LoggerFactory.getLogger(ChallengeResponder.class);

    public static final String PATH_PREFIX = "/.well-known/acme-challenge/";

    private static final Pattern CHALLENGE_PATH = Pattern.compile("^/\\.well-known/acme-challenge/(.+)$");

    private final ConfigStore store;
    private final DecisionMetrics metrics;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ChallengeResponder(ConfigStore store, DecisionMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Tells whether a path belongs to the challenge namespace.
     *
     * @param path Request path.
     * @return True for {@code /.well-known/acme-challenge/...}.
     */
    public static boolean isChallengePath(String path) {
        return path != null && path.startsWith(PATH_PREFIX);
    }

    /**
     * Extracts the token from a challenge path.
     *
     * @param path Request path.
     * @return The token, or empty if the path is not a challenge path or the token is empty.
     */
    public static Optional<String> token(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = CHALLENGE_PATH.matcher(path);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Answers a challenge request.
     *
     * @param path Request path.
     * @return 200 with the exact stored key authorization, 404 when the path or
     *         token is unknown, 500 when the store is unavailable.
     */
    public ChallengeResponse respond(String path) {
        Optional<String> token = token(path);
        if (token.isEmpty()) {
            metrics.challengeAnswered("not_found");
            return ChallengeResponse.status(404);
        }
        try (StoreSession session = store.openSession()) {
            Optional<String> keyAuthorization = session.get(StoreKeys.ACME_CHALLENGE.key(token.get()));
            if (keyAuthorization.isEmpty()) {
                log.debug("Unknown ACME token {}", token.get());
                metrics.challengeAnswered("not_found");
                return ChallengeResponse.status(404);
            }
            metrics.challengeAnswered("served");
            return ChallengeResponse.found(keyAuthorization.get());
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable for ACME challenge {}: {}", token.get(), e.getMessage());
            metrics.challengeAnswered("store_error");
            return ChallengeResponse.status(500);
        }
    }
}
