package gatekeeper.core.service.routing;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import gatekeeper.core.model.routing.RouteMatch;
import gatekeeper.core.model.routing.RouteTable;
import gatekeeper.core.util.RequestPaths;

/**
 * Maps request paths to backends by longest matching prefix.
 */
@ApplicationScoped
public class Router {

    private static final Logger LOG = Logger.getLogger(Router.class);

    private final AtomicReference<RouteTable> routeTable = new AtomicReference<>(RouteTable.EMPTY);

    public Optional<RouteMatch> route(String path) {
        var normalized = RequestPaths.normalize(path);
        var match = routeTable.get()
                .longestMatch(normalized)
                .map(route -> new RouteMatch(route, route.rewritePath(normalized)));
        if (match.isEmpty()) {
            LOG.debugv("No route for {0}", normalized);
        }
        return match;
    }

    /**
     * Atomically replace the routing table.
     *
     * @throws IllegalArgumentException if the table is empty
     */
    public void reload(RouteTable routes) {
        if (routes == null || routes.size() == 0) {
            throw new IllegalArgumentException("Refusing to install an empty routing table");
        }
        routeTable.set(routes);
        LOG.infov("Installed {0} routes", routes.size());
    }

    public RouteTable currentRoutes() {
        return routeTable.get();
    }
}
