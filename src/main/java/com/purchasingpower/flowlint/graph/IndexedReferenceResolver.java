package com.purchasingpower.flowlint.graph;

import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.RouteGroup;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ReferenceResolver} over lookup tables built once per flow.
 *
 * <p>Tables are filled in page load order with {@code putIfAbsent}, so when two
 * pages share a display name or trailing segment the first loaded one wins.
 */
@Slf4j
class IndexedReferenceResolver implements ReferenceResolver {

    private final Map<String, FlowIndex> indexes = new HashMap<>();

    IndexedReferenceResolver(List<FlowGraph> flows) {
        for (FlowGraph flow : flows) {
            indexes.put(flow.getId(), FlowIndex.of(flow));
        }
    }

    @Override
    public Optional<String> resolvePage(String flowId, String pageRef) {
        FlowIndex index = indexes.get(flowId);
        if (index == null || pageRef == null || pageRef.isBlank()) {
            return Optional.empty();
        }
        // Start is the flow itself, never a stored page even if one is named that way
        if (FlowGraph.START_PAGE.equals(pageRef)) {
            return Optional.empty();
        }

        if (index.pagesById.containsKey(pageRef)) {
            return Optional.of(pageRef);
        }

        String byName = index.pagesByDisplayName.get(pageRef);
        if (byName != null) {
            return Optional.of(byName);
        }

        String segment = lastSegment(pageRef);
        String bySegment = index.pagesBySegment.get(segment);
        if (bySegment == null) {
            bySegment = index.pagesByDisplayName.get(segment);
        }
        if (bySegment == null) {
            log.debug("Unresolved page reference '{}' in flow {}", pageRef, flowId);
        }
        return Optional.ofNullable(bySegment);
    }

    @Override
    public Optional<RouteGroup> resolveRouteGroup(String flowId, String groupRef) {
        FlowIndex index = indexes.get(flowId);
        if (index == null || groupRef == null || groupRef.isBlank()) {
            return Optional.empty();
        }

        RouteGroup group = index.groupsById.get(groupRef);
        if (group == null) {
            group = index.groupsByDisplayName.get(groupRef);
        }
        if (group == null) {
            log.debug("Unresolved route group reference '{}' in flow {}", groupRef, flowId);
        }
        return Optional.ofNullable(group);
    }

    static String lastSegment(String reference) {
        int slash = reference.lastIndexOf('/');
        return slash >= 0 ? reference.substring(slash + 1) : reference;
    }

    private static final class FlowIndex {
        private final Map<String, Page> pagesById;
        private final Map<String, String> pagesByDisplayName = new HashMap<>();
        private final Map<String, String> pagesBySegment = new HashMap<>();
        private final Map<String, RouteGroup> groupsById;
        private final Map<String, RouteGroup> groupsByDisplayName = new HashMap<>();

        private FlowIndex(FlowGraph flow) {
            this.pagesById = flow.getPages();
            this.groupsById = flow.getRouteGroups();
        }

        static FlowIndex of(FlowGraph flow) {
            FlowIndex index = new FlowIndex(flow);
            for (Page page : flow.pageList()) {
                if (page.getDisplayName() != null) {
                    index.pagesByDisplayName.putIfAbsent(page.getDisplayName(), page.getName());
                }
                index.pagesBySegment.putIfAbsent(lastSegment(page.getName()), page.getName());
            }
            for (RouteGroup group : flow.getRouteGroups().values()) {
                if (group.getDisplayName() != null) {
                    index.groupsByDisplayName.putIfAbsent(group.getDisplayName(), group);
                }
            }
            return index;
        }
    }
}
