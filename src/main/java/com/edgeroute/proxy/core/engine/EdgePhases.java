package com.edgeroute.proxy.core.engine;

import com.edgeroute.proxy.core.acme.ChallengeResponder;
import com.edgeroute.proxy.core.acme.ChallengeResponse;
import com.edgeroute.proxy.core.constants.LoadBalancingType;
import com.edgeroute.proxy.core.exceptions.NoUpstreamException;
import com.edgeroute.proxy.core.exceptions.StoreUnavailableException;
import com.edgeroute.proxy.core.loadbalancer.LoadBalancerSelector;
import com.edgeroute.proxy.core.loadbalancer.SelectionContext;
import com.edgeroute.proxy.core.routing.BackendTarget;
import com.edgeroute.proxy.core.routing.RouteResolver;
import com.edgeroute.proxy.core.routing.RoutingDecision;
import com.edgeroute.proxy.core.services.DecisionMetrics;
import com.edgeroute.proxy.core.tls.CertificateMaterial;
import com.edgeroute.proxy.core.tls.CertificateSelector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points the transport engine calls for each phase of a request.
 *
 * <p>
 * The access phase does all store reads for routing and leaves an immutable
 * {@link RoutingDecision} in the request context. The balancer phase only
 * reads that decision; it has no store handle.
 * </p>
 */
public class EdgePhases {

    private static final Logger log = LoggerFactory.getLogger(EdgePhases.class);

    public static final int NOT_FOUND = 404;
    public static final int BAD_GATEWAY = 502;

    private final RouteResolver routeResolver;
    private final LoadBalancerSelector selector;
    private final CertificateSelector certificateSelector;
    private final ChallengeResponder challengeResponder;
    private final DecisionMetrics metrics;
    private final int workerId;

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public EdgePhases(RouteResolver routeResolver, LoadBalancerSelector selector,
            CertificateSelector certificateSelector, ChallengeResponder challengeResponder,
            DecisionMetrics metrics, int workerId) {
        this.routeResolver = routeResolver;
        this.selector = selector;
        this.certificateSelector = certificateSelector;
        this.challengeResponder = challengeResponder;
        this.metrics = metrics;
        this.workerId = workerId;
    }

    /**
     * Certificate phase: picks the certificate for the handshake's SNI name.
     *
     * @param serverName Raw server name, null without SNI.
     * @return Material to install, or empty to keep the default certificate.
     */
    public Optional<CertificateMaterial> onCertificate(String serverName) {
        return certificateSelector.selectCertificate(serverName);
    }

    /**
     * Access phase. Challenge paths are answered directly; everything else is
     * routed and, on success, the context carries the decision and the
     * rewritten path.
     *
     * @param context The request context.
     * @return CONTINUE, or the status to answer with.
     */
    public AccessOutcome onAccess(RequestContext context) {
        if (ChallengeResponder.isChallengePath(context.getPath())) {
            return AccessOutcome.from(challengeResponder.respond(context.getPath()));
        }

        Optional<RoutingDecision> decision;
        try {
            decision = routeResolver.resolve(context.getHost(), context.getPath());
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while routing {}{}: {}", context.getHost(), context.getPath(),
                    e.getMessage());
            metrics.routeResolved("store_error");
            return AccessOutcome.respond(BAD_GATEWAY);
        }

        if (decision.isEmpty()) {
            log.debug("No route for {}{}", context.getHost(), context.getPath());
            metrics.routeResolved("not_found");
            return AccessOutcome.respond(NOT_FOUND);
        }

        context.setDecision(decision.get());
        context.setPath(decision.get().getForwardPath());
        metrics.routeResolved("matched");
        return AccessOutcome.CONTINUE;
    }

    /**
     * Balancer phase: selects the backend from the precomputed pool.
     *
     * @param context Context that passed the access phase.
     * @return The backend to connect to.
     * @throws NoUpstreamException if the pool is empty; the engine answers 502.
     * @throws IllegalStateException if the access phase did not produce a decision.
     */
    public BackendTarget onBalance(RequestContext context) {
        RoutingDecision decision = context.getDecision();
        if (decision == null) {
            throw new IllegalStateException("Balancer phase reached without a routing decision");
        }
        LoadBalancingType strategy = decision.getRoute().getLoadBalancingType();
        SelectionContext selection = new SelectionContext(context.getRemoteAddr(),
                context.getConnectionSequence(), workerId);
        try {
            BackendTarget target = selector.select(decision.getPool(), strategy, selection);
            metrics.upstreamSelected(strategy.getValue());
            return target;
        } catch (NoUpstreamException e) {
            log.warn("No healthy upstream for route {} ({}{})", decision.getRouteId(), context.getHost(),
                    context.getOriginalPath());
            metrics.upstreamUnavailable();
            throw e;
        }
    }

    /**
     * Content phase for deployments that route the challenge path to a
     * dedicated handler.
     *
     * @param path Request path.
     * @return The challenge answer.
     */
    public ChallengeResponse onChallenge(String path) {
        return challengeResponder.respond(path);
    }
}
