package com.purchasingpower.flowlint.graph;

import com.google.common.base.Preconditions;
import com.purchasingpower.flowlint.model.flow.Flow;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.RouteGroup;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One flow with its pages and route groups, keyed by identifier in load order.
 *
 * <p>Every flow has an implicit {@value #START_PAGE} page that is never stored as a
 * {@link Page}; its edges come from the {@link Flow} document itself.
 * Immutable once constructed.
 *
 * @since 1.0.0
 */
@Getter
public final class FlowGraph {

    public static final String START_PAGE = "Start";

    private final String id;
    private final Flow flow;
    private final Map<String, Page> pages;
    private final Map<String, RouteGroup> routeGroups;

    public FlowGraph(String id, Flow flow, List<Page> pages, List<RouteGroup> routeGroups) {
        Preconditions.checkNotNull(id, "Flow id cannot be null");
        Preconditions.checkNotNull(flow, "Flow document cannot be null");

        Map<String, Page> pagesById = new LinkedHashMap<>();
        for (Page page : pages) {
            Preconditions.checkArgument(page.getName() != null, "Page without identifier in flow %s", id);
            Preconditions.checkArgument(pagesById.put(page.getName(), page) == null,
                    "Duplicate page identifier %s in flow %s", page.getName(), id);
        }

        Map<String, RouteGroup> groupsById = new LinkedHashMap<>();
        for (RouteGroup group : routeGroups) {
            Preconditions.checkArgument(group.getName() != null, "Route group without identifier in flow %s", id);
            Preconditions.checkArgument(groupsById.put(group.getName(), group) == null,
                    "Duplicate route group identifier %s in flow %s", group.getName(), id);
        }

        this.id = id;
        this.flow = flow;
        this.pages = Collections.unmodifiableMap(pagesById);
        this.routeGroups = Collections.unmodifiableMap(groupsById);
    }

    public String getDisplayName() {
        String label = flow.label();
        return label != null ? label : id;
    }

    public Optional<Page> findPage(String pageId) {
        return Optional.ofNullable(pages.get(pageId));
    }

    public Collection<Page> pageList() {
        return pages.values();
    }

    /**
     * Display label of an address: "Start" for the implicit page, the page label otherwise.
     */
    public String labelOf(String address) {
        if (START_PAGE.equals(address)) {
            return START_PAGE;
        }
        Page page = pages.get(address);
        return page != null ? page.label() : address;
    }
}
