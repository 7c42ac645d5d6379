package gatekeeper.core.model.routing;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of the routing table, ordered longest prefix first.
 */
public record RouteTable(List<Route> routes) {

    public static final RouteTable EMPTY = new RouteTable(List.of());

    public RouteTable {
        routes = routes == null
                ? List.of()
                : routes.stream()
                        .sorted(Comparator.comparingInt((Route r) -> r.prefix().length())
                                .reversed())
                        .toList();
        var prefixes = new HashSet<String>();
        for (var route : routes) {
            if (!prefixes.add(route.prefix())) {
                throw new IllegalArgumentException("Duplicate route prefix: " + route.prefix());
            }
        }
    }

    /**
     * Find the route with the longest prefix covering the path.
     */
    public Optional<Route> longestMatch(String normalizedPath) {
        return routes.stream().filter(r -> r.matches(normalizedPath)).findFirst();
    }

    public int size() {
        return routes.size();
    }
}
