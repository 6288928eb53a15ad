package com.purchasingpower.flowlint.graph;

import com.purchasingpower.flowlint.model.flow.RouteGroup;

import java.util.Optional;

/**
 * Resolves the different ways flow documents point at pages and route groups.
 *
 * <p>A page may be referenced by bare identifier, by full resource path
 * ({@code projects/.../flows/<flow>/pages/<id>}) or by display name. All forms
 * resolve to the same page identifier. An unresolvable reference yields
 * {@link Optional#empty()}; callers drop the edge.
 *
 * @since 1.0.0
 */
public interface ReferenceResolver {

    /**
     * Resolves a page reference inside one flow.
     *
     * <p>Order: exact identifier, then whole-reference match against canonical or
     * display name, then the reference's last path segment against identifier
     * segment or display name. First match wins. {@code "Start"} is not a stored
     * page and never resolves.
     *
     * @param flowId owning flow identifier
     * @param pageRef reference as written in the document
     * @return page identifier if found
     */
    Optional<String> resolvePage(String flowId, String pageRef);

    /**
     * Resolves a route group reference by identifier or name equality only.
     *
     * @param flowId owning flow identifier
     * @param groupRef reference as written in the document
     * @return the route group if found
     */
    Optional<RouteGroup> resolveRouteGroup(String flowId, String groupRef);
}
