package gatekeeper.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for responses the gateway produces itself.
 *
 * <p>Every method returns an {@link HttpProblem} from quarkus-resteasy-problem, which
 * renders it as {@code application/problem+json} when thrown from a resource.
 */
public final class GatewayProblem {

    static final String BEARER_CHALLENGE = "Bearer error=\"invalid_token\"";

    private GatewayProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Authentication/Authorization Errors ==========

    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .withHeader("WWW-Authenticate", BEARER_CHALLENGE)
                .build();
    }

    public static HttpProblem forbidden(String detail) {
        return HttpProblem.builder()
                .withTitle("Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(detail)
                .build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem routeNotFound(String path) {
        return HttpProblem.builder()
                .withTitle("Route Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail("No route matches path '%s'".formatted(path))
                .build();
    }

    // ========== Gateway Errors ==========

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem gatewayTimeout(String detail) {
        return HttpProblem.builder()
                .withTitle("Gateway Timeout")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
