package gatekeeper.adapter.in.rest;

import java.util.LinkedHashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import gatekeeper.adapter.in.problem.GatewayProblem;
import gatekeeper.core.model.gateway.GatewayRequest;
import gatekeeper.core.model.gateway.GatewayResult;
import gatekeeper.core.port.in.GatewayUseCase;

/**
 * Catch-all entry point: every request on every path goes through the gateway pipeline.
 */
@Path("/")
@ApplicationScoped
public class GatewayResource {

    private final GatewayUseCase gatewayUseCase;

    @Inject
    public GatewayResource(GatewayUseCase gatewayUseCase) {
        this.gatewayUseCase = gatewayUseCase;
    }

    @GET
    @Path("{path:.*}")
    public Uni<Response> proxyGet(@PathParam("path") String path, @Context ContainerRequestContext requestContext) {
        return proxyRequest(path, requestContext, null);
    }

    @POST
    @Path("{path:.*}")
    public Uni<Response> proxyPost(
            @PathParam("path") String path, @Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @PUT
    @Path("{path:.*}")
    public Uni<Response> proxyPut(
            @PathParam("path") String path, @Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @DELETE
    @Path("{path:.*}")
    public Uni<Response> proxyDelete(
            @PathParam("path") String path, @Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @PATCH
    @Path("{path:.*}")
    public Uni<Response> proxyPatch(
            @PathParam("path") String path, @Context ContainerRequestContext requestContext, byte[] body) {
        return proxyRequest(path, requestContext, body);
    }

    @HEAD
    @Path("{path:.*}")
    public Uni<Response> proxyHead(@PathParam("path") String path, @Context ContainerRequestContext requestContext) {
        return proxyRequest(path, requestContext, null);
    }

    @OPTIONS
    @Path("{path:.*}")
    public Uni<Response> proxyOptions(@PathParam("path") String path, @Context ContainerRequestContext requestContext) {
        return proxyRequest(path, requestContext, null);
    }

    private Uni<Response> proxyRequest(String path, ContainerRequestContext requestContext, byte[] body) {
        var gatewayRequest = toGatewayRequest("/" + path, requestContext, body);
        return gatewayUseCase.forward(gatewayRequest).map(GatewayResource::toResponse);
    }

    private GatewayRequest toGatewayRequest(String path, ContainerRequestContext requestContext, byte[] body) {
        var headers = new LinkedHashMap<String, List<String>>();
        for (var entry : requestContext.getHeaders().entrySet()) {
            headers.put(entry.getKey(), List.copyOf(entry.getValue()));
        }

        var requestUri = requestContext.getUriInfo().getRequestUri();
        return new GatewayRequest(
                requestContext.getMethod(), path, requestUri.getRawQuery(), headers, requestUri, body);
    }

    static Response toResponse(GatewayResult result) {
        if (result instanceof GatewayResult.Success success) {
            var responseBuilder = Response.status(success.statusCode());
            for (var entry : success.headers().entrySet()) {
                for (var value : entry.getValue()) {
                    responseBuilder.header(entry.getKey(), value);
                }
            }
            if (success.body().length > 0) {
                responseBuilder.entity(success.body());
            }
            return responseBuilder.build();
        }
        if (result instanceof GatewayResult.Unauthenticated u) {
            throw GatewayProblem.unauthorized(u.reason());
        }
        if (result instanceof GatewayResult.Forbidden f) {
            throw GatewayProblem.forbidden(f.reason());
        }
        if (result instanceof GatewayResult.RouteNotFound r) {
            throw GatewayProblem.routeNotFound(r.path());
        }
        var upstream = (GatewayResult.UpstreamError) result;
        throw upstream.timedOut()
                ? GatewayProblem.gatewayTimeout(upstream.message())
                : GatewayProblem.badGateway(upstream.message());
    }
}
