package com.watchflixx.gateway.service;

import com.watchflixx.gateway.core.model.RouteDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 静态路由表，按最长前缀匹配
 */
public class RouteTable {
    private final List<RouteDefinition> routes;

    public RouteTable(List<RouteDefinition> routes) {
        List<RouteDefinition> sorted = new ArrayList<>(routes);
        sorted.sort(Comparator.comparingInt((RouteDefinition r) -> r.getPathPrefix().length()).reversed());
        this.routes = Collections.unmodifiableList(sorted);
    }

    public Optional<RouteDefinition> resolve(String path) {
        for (RouteDefinition route : routes) {
            if (route.matches(path)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    public List<RouteDefinition> getRoutes() {
        return routes;
    }
}
