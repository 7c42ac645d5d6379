package gatekeeper.core.service.auth;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import gatekeeper.core.config.AuthConfig;
import gatekeeper.core.model.auth.SigningKey;
import gatekeeper.core.port.out.JwksClient;
import gatekeeper.core.port.out.Metrics;
import gatekeeper.core.port.out.SigningKeyResolver;

/**
 * Caches the identity provider's signing keys and resolves them by key id.
 *
 * <p>Features:
 * <ul>
 *   <li>Per-key TTL, refreshed lazily on the first use after expiry</li>
 *   <li>Request coalescing: concurrent misses for one key id share a single fetch</li>
 *   <li>Bounded fetch time; a fetch that times out or fails resolves to empty</li>
 *   <li>Fetches triggered by unknown key ids are rate limited</li>
 * </ul>
 *
 * <p>Thread-safety: readers see an immutable snapshot of the key set that is
 * replaced atomically after each successful fetch.
 */
@ApplicationScoped
public class KeyResolverService implements SigningKeyResolver {

    private static final Logger LOG = Logger.getLogger(KeyResolverService.class);

    private final JwksClient jwksClient;
    private final AuthConfig.JwksConfig jwksConfig;
    private final Metrics metrics;
    private final Clock clock;
    private final AtomicReference<KeySnapshot> snapshot = new AtomicReference<>(KeySnapshot.EMPTY);
    private final Map<String, Uni<Optional<SigningKey>>> inFlightFetches = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastFetchAt = new AtomicReference<>();

    @Inject
    public KeyResolverService(JwksClient jwksClient, AuthConfig authConfig, Metrics metrics, Clock clock) {
        this.jwksClient = jwksClient;
        this.jwksConfig = authConfig.jwks();
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<Optional<SigningKey>> resolve(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }

        var cached = snapshot.get().find(keyId);
        if (cached.isPresent() && !cached.get().isExpired(clock.instant(), jwksConfig.cacheTtl())) {
            LOG.debugv("Using cached signing key {0}", keyId);
            return Uni.createFrom().item(cached);
        }
        if (cached.isEmpty() && recentlyFetched()) {
            LOG.debugv("Signing key {0} is unknown and keys were fetched recently, not refetching", keyId);
            return Uni.createFrom().item(Optional.empty());
        }
        return getOrCreateFetch(keyId);
    }

    /**
     * Key ids currently held, fresh or expired.
     */
    public Set<String> cachedKeyIds() {
        return snapshot.get().keys().keySet();
    }

    /**
     * Drop every cached key. The next resolution fetches the key set again.
     */
    void invalidate() {
        LOG.info("Invalidating cached signing keys");
        snapshot.set(KeySnapshot.EMPTY);
        lastFetchAt.set(null);
    }

    /**
     * Get an existing in-flight fetch or create a new one.
     * This prevents thundering herd by coalescing concurrent requests.
     */
    private Uni<Optional<SigningKey>> getOrCreateFetch(String keyId) {
        return Uni.createFrom().deferred(() -> {
            // Another caller may have completed a fetch since resolve() looked at the snapshot
            var fresh = freshKey(keyId);
            if (fresh.isPresent()) {
                return Uni.createFrom().item(fresh);
            }
            return inFlightFetches.computeIfAbsent(keyId, this::createFetch);
        });
    }

    private Uni<Optional<SigningKey>> createFetch(String keyId) {
        return fetchAndCache(keyId)
                .onTermination()
                .invoke(() -> inFlightFetches.remove(keyId))
                .memoize()
                .indefinitely();
    }

    private Uni<Optional<SigningKey>> fetchAndCache(String keyId) {
        LOG.infov("Fetching signing keys for key id {0}", keyId);

        return jwksClient
                .fetchKeys()
                .ifNoItem()
                .after(jwksConfig.fetchTimeout())
                .failWith(() -> new TimeoutException("Timeout fetching signing keys after " + jwksConfig.fetchTimeout()))
                .map(keys -> {
                    var installed = KeySnapshot.of(keys, clock.instant());
                    snapshot.set(installed);
                    lastFetchAt.set(clock.instant());
                    metrics.recordKeyFetch("success");
                    LOG.infov("Cached {0} signing keys", installed.keys().size());
                    var key = installed.find(keyId);
                    if (key.isEmpty()) {
                        LOG.warnv("Signing key {0} is not published by the identity provider", keyId);
                    }
                    return key;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    lastFetchAt.set(clock.instant());
                    if (error instanceof TimeoutException) {
                        LOG.warnv("Signing key fetch timed out after {0}", jwksConfig.fetchTimeout());
                        metrics.recordKeyFetch("timeout");
                    } else {
                        LOG.errorv(error, "Failed to fetch signing keys");
                        metrics.recordKeyFetch("failure");
                    }
                    return Optional.empty();
                });
    }

    private Optional<SigningKey> freshKey(String keyId) {
        return snapshot.get().find(keyId).filter(key -> !key.isExpired(clock.instant(), jwksConfig.cacheTtl()));
    }

    private boolean recentlyFetched() {
        var last = lastFetchAt.get();
        return last != null && clock.instant().isBefore(last.plus(jwksConfig.minRefreshInterval()));
    }

    private record KeySnapshot(Map<String, SigningKey> keys) {

        static final KeySnapshot EMPTY = new KeySnapshot(Map.of());

        static KeySnapshot of(List<SigningKey> keys, Instant fetchedAt) {
            var byId = new LinkedHashMap<String, SigningKey>();
            for (var key : keys) {
                byId.put(key.keyId(), key.withFetchedAt(fetchedAt));
            }
            return new KeySnapshot(Map.copyOf(byId));
        }

        Optional<SigningKey> find(String keyId) {
            return Optional.ofNullable(keys.get(keyId));
        }
    }
}
