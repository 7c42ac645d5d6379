package gatekeeper.adapter.out.http;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.context.propagation.TextMapSetter;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.core.http.HttpClient;
import io.vertx.mutiny.core.http.HttpClientRequest;
import io.vertx.mutiny.core.http.HttpClientResponse;
import org.jboss.logging.Logger;

import gatekeeper.adapter.out.telemetry.SpanAttributes;
import gatekeeper.core.config.UpstreamConfig;
import gatekeeper.core.model.gateway.PreparedProxyRequest;
import gatekeeper.core.model.gateway.ProxyResponse;
import gatekeeper.core.port.out.ProxyClient;
import gatekeeper.core.service.gateway.ProxyRequestPreparer;

/**
 * HTTP adapter for forwarding prepared proxy requests using the Vert.x HTTP client.
 * All header preparation logic is handled by {@link ProxyRequestPreparer} in core.
 *
 * <p>This adapter propagates W3C Trace Context headers (traceparent, tracestate)
 * to backends for distributed tracing. Cancelling a forward resets the
 * in-flight backend request.
 */
@ApplicationScoped
public class ProxyHttpClient implements ProxyClient {

    private static final Logger LOG = Logger.getLogger(ProxyHttpClient.class);

    private static final TextMapSetter<RequestOptions> HEADER_SETTER =
            (carrier, key, value) -> carrier.putHeader(key, value);

    private final Vertx vertx;
    private final UpstreamConfig config;
    private final Tracer tracer;
    private final TextMapPropagator propagator;
    private HttpClient httpClient;

    @Inject
    public ProxyHttpClient(Vertx vertx, UpstreamConfig config, Tracer tracer, TextMapPropagator propagator) {
        this.vertx = vertx;
        this.config = config;
        this.tracer = tracer;
        this.propagator = propagator;
    }

    @PostConstruct
    void init() {
        this.httpClient = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout((int) config.connectTimeout().toMillis())
                .setMaxPoolSize(config.maxConnectionsPerHost()));
    }

    @PreDestroy
    void close() {
        if (httpClient != null) {
            httpClient.closeAndAwait();
        }
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest preparedRequest) {
        return Uni.createFrom().deferred(() -> send(preparedRequest));
    }

    private Uni<ProxyResponse> send(PreparedProxyRequest preparedRequest) {
        var targetUri = preparedRequest.targetUri();

        // Create a client span for the outgoing request
        var span = tracer.spanBuilder("HTTP " + preparedRequest.method())
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, preparedRequest.method())
                .setAttribute(SpanAttributes.HTTP_URL, targetUri.toString())
                .setAttribute(SpanAttributes.NET_PEER_NAME, targetUri.getHost())
                .setAttribute(SpanAttributes.NET_PEER_PORT, (long) getPort(targetUri))
                .startSpan();

        var options = createOptions(preparedRequest, targetUri);

        // Propagate trace context (W3C Trace Context headers)
        propagator.inject(Context.current().with(span), options, HEADER_SETTER);

        var inFlight = new AtomicReference<HttpClientRequest>();
        return httpClient
                .request(options)
                .invoke(inFlight::set)
                .flatMap(request -> executeRequest(request, preparedRequest.body()))
                .invoke(response -> {
                    span.setAttribute(SpanAttributes.HTTP_STATUS_CODE, (long) response.statusCode());
                    if (response.statusCode() >= 500) {
                        span.setStatus(StatusCode.ERROR, "HTTP " + response.statusCode());
                    }
                    span.end();
                })
                .onFailure()
                .invoke(error -> {
                    span.setStatus(StatusCode.ERROR, error.getMessage());
                    span.recordException(error);
                    span.end();
                })
                .onCancellation()
                .invoke(() -> {
                    var request = inFlight.get();
                    if (request != null) {
                        LOG.debugv("Resetting cancelled request to {0}", targetUri);
                        request.reset();
                    }
                    span.setStatus(StatusCode.ERROR, "cancelled");
                    span.end();
                });
    }

    private int getPort(URI uri) {
        var port = uri.getPort();
        if (port == -1) {
            port = "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
        }
        return port;
    }

    private RequestOptions createOptions(PreparedProxyRequest preparedRequest, URI targetUri) {
        var path = targetUri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (targetUri.getRawQuery() != null) {
            path += "?" + targetUri.getRawQuery();
        }

        var options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(preparedRequest.method()))
                .setHost(targetUri.getHost())
                .setPort(getPort(targetUri))
                .setSsl("https".equalsIgnoreCase(targetUri.getScheme()))
                .setURI(path);

        for (var entry : preparedRequest.headers().entrySet()) {
            for (var value : entry.getValue()) {
                options.addHeader(entry.getKey(), value);
            }
        }
        return options;
    }

    private Uni<ProxyResponse> executeRequest(HttpClientRequest request, byte[] body) {
        var response = body != null && body.length > 0 ? request.send(Buffer.buffer(body)) : request.send();
        return response.flatMap(this::toProxyResponse);
    }

    private Uni<ProxyResponse> toProxyResponse(HttpClientResponse response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (var name : response.headers().names()) {
            headers.computeIfAbsent(name, k -> new ArrayList<>()).addAll(response.headers().getAll(name));
        }

        return response.body()
                .map(buffer -> new ProxyResponse(
                        response.statusCode(), headers, buffer != null ? buffer.getBytes() : new byte[0]));
    }
}
