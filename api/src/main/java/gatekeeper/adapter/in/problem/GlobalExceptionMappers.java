package gatekeeper.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>{@link HttpProblem} instances thrown by resources are rendered by quarkus-resteasy-problem
 * itself. This class covers the failures nobody turned into a problem.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapRuntimeException(RuntimeException e) {
        if (e instanceof HttpProblem problem) {
            return toResponse(problem);
        }
        if (e instanceof WebApplicationException webException) {
            return webException.getResponse();
        }
        LOG.errorv(e, "Unhandled error: {0}", e.getMessage());
        return toResponse(GatewayProblem.internalError("The gateway could not process the request"));
    }

    static Response toResponse(HttpProblem problem) {
        var builder = Response.status(problem.getStatus()).type(PROBLEM_JSON).entity(problem);
        problem.getHeaders().forEach(builder::header);
        return builder.build();
    }
}
