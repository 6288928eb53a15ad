package com.purchasingpower.flowlint.loader;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.flowlint.exception.AgentLoadException;
import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.flow.Flow;
import com.purchasingpower.flowlint.model.flow.Page;
import com.purchasingpower.flowlint.model.flow.RouteGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads an unpacked agent export into an {@link AgentGraph}.
 *
 * <p>Expected layout:
 * <pre>
 * &lt;root&gt;/flows/&lt;flow&gt;/&lt;flow&gt;.json
 * &lt;root&gt;/flows/&lt;flow&gt;/pages/*.json
 * &lt;root&gt;/flows/&lt;flow&gt;/transitionRouteGroups/*.json
 * </pre>
 *
 * <p>Missing subdirectories mean zero resources of that kind. A missing root, an
 * unreadable or malformed document, a {@code null} list element or two flows with the
 * same identifier fail the whole load with {@link AgentLoadException}.
 * Directory listings are sorted by file name so repeated runs see the same order.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class AgentDirectoryLoader {

    static final String FLOWS_DIR = "flows";
    static final String PAGES_DIR = "pages";
    static final String ROUTE_GROUPS_DIR = "transitionRouteGroups";
    private static final String JSON = ".json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setDefaultSetterInfo(JsonSetter.Value.construct(Nulls.SKIP, Nulls.FAIL));

    /**
     * Reads the whole directory tree. Nothing is analyzed until this returns.
     *
     * @param agentDir root of the unpacked export
     * @return populated, immutable graph
     * @throws AgentLoadException if the root is missing or a document cannot be parsed
     */
    public AgentGraph load(Path agentDir) {
        Preconditions.checkNotNull(agentDir, "Agent directory cannot be null");

        if (!Files.isDirectory(agentDir)) {
            throw new AgentLoadException("Agent directory does not exist", agentDir);
        }

        Path flowsDir = agentDir.resolve(FLOWS_DIR);
        if (!Files.isDirectory(flowsDir)) {
            log.info("No {} directory under {}, nothing to analyze", FLOWS_DIR, agentDir);
            return AgentGraph.empty();
        }

        List<FlowGraph> flows = new ArrayList<>();
        Map<String, Path> flowDirsById = new HashMap<>();
        for (Path flowDir : listSorted(flowsDir, Files::isDirectory)) {
            Optional<FlowGraph> loaded = loadFlow(flowDir);
            if (loaded.isEmpty()) {
                continue;
            }
            Path previous = flowDirsById.putIfAbsent(loaded.get().getId(), flowDir);
            if (previous != null) {
                throw new AgentLoadException("Duplicate flow identifier " + loaded.get().getId()
                        + " (already defined by " + previous.getFileName() + ")", flowDir);
            }
            flows.add(loaded.get());
        }

        AgentGraph graph = new AgentGraph(flows);
        log.info("Loaded agent from {}: {} flows, {} pages, {} route groups",
                agentDir, graph.getFlows().size(), graph.pageCount(), graph.routeGroupCount());
        return graph;
    }

    private Optional<FlowGraph> loadFlow(Path flowDir) {
        String dirName = flowDir.getFileName().toString();
        Path flowFile = flowDir.resolve(dirName + JSON);
        if (!Files.isRegularFile(flowFile)) {
            log.warn("Skipping {}: no flow document {}", flowDir, flowFile.getFileName());
            return Optional.empty();
        }

        Flow flow = read(flowFile, Flow.class);
        String flowId = flow.getName() != null ? flow.getName() : dirName;
        if (flow.getDisplayName() == null) {
            flow = flow.toBuilder().displayName(dirName).build();
        }

        List<Page> pages = new ArrayList<>();
        for (Path pageFile : listJson(flowDir.resolve(PAGES_DIR))) {
            Page page = read(pageFile, Page.class);
            if (page.getName() == null) {
                page = page.toBuilder().name(baseName(pageFile)).build();
            }
            pages.add(page);
        }

        List<RouteGroup> groups = new ArrayList<>();
        for (Path groupFile : listJson(flowDir.resolve(ROUTE_GROUPS_DIR))) {
            RouteGroup group = read(groupFile, RouteGroup.class);
            if (group.getName() == null) {
                group = group.toBuilder().name(baseName(groupFile)).build();
            }
            groups.add(group);
        }

        try {
            FlowGraph graph = new FlowGraph(flowId, flow, pages, groups);
            log.debug("Loaded flow '{}': {} pages, {} route groups", graph.getDisplayName(), pages.size(), groups.size());
            return Optional.of(graph);
        } catch (IllegalArgumentException e) {
            throw new AgentLoadException("Inconsistent flow definition (" + e.getMessage() + ")", flowDir, e);
        }
    }

    private <T> T read(Path file, Class<T> type) {
        T value;
        try {
            value = objectMapper.readValue(file.toFile(), type);
        } catch (IOException e) {
            log.error("Failed to parse {}: {}", file, e.getMessage());
            throw new AgentLoadException("Malformed " + type.getSimpleName() + " document", file, e);
        }
        if (value == null) {
            throw new AgentLoadException("Empty " + type.getSimpleName() + " document", file);
        }
        return value;
    }

    private List<Path> listJson(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        return listSorted(dir, p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(JSON));
    }

    private List<Path> listSorted(Path dir, Predicate<Path> filter) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(filter)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new AgentLoadException("Cannot list directory", dir, e);
        }
    }

    private static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - JSON.length());
    }
}
