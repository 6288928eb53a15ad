package com.purchasingpower.flowlint.loader;

import com.purchasingpower.flowlint.exception.AgentLoadException;
import com.purchasingpower.flowlint.graph.AgentGraph;
import com.purchasingpower.flowlint.graph.FlowGraph;
import com.purchasingpower.flowlint.model.flow.Page;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Agent Directory Loader Tests")
class AgentDirectoryLoaderTest {

    private final AgentDirectoryLoader loader = new AgentDirectoryLoader();

    @TempDir
    Path agentDir;

    private Path write(String relative, String json) throws IOException {
        Path file = agentDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, json);
    }

    @Test
    @DisplayName("Should load flows, pages and route groups")
    void testLoadFullLayout() throws IOException {
        // Given
        write("flows/Support/Support.json", """
                {"name": "flow-support", "displayName": "Support",
                 "transitionRoutes": [{"condition": "true", "targetPage": "Ask"}],
                 "transitionRouteGroups": ["Common"], "unknownField": 42}
                """);
        write("flows/Support/pages/Ask.json", """
                {"name": "page-ask", "displayName": "Ask",
                 "entryFulfillment": {"messages": [{"text": {"text": ["Hi"]}}]},
                 "form": {"parameters": [{"displayName": "city",
                   "fillBehavior": {"repromptEventHandlers": [{"event": "sys.no-match-1"}]}}]},
                 "eventHandlers": [{"event": "sys.no-input-default", "targetPage": "Ask"}]}
                """);
        write("flows/Support/transitionRouteGroups/Common.json", """
                {"name": "group-common", "displayName": "Common",
                 "transitionRoutes": [{"intent": "help", "targetPage": "Ask"}]}
                """);

        // When
        AgentGraph graph = loader.load(agentDir);

        // Then
        assertThat(graph.getFlows()).hasSize(1);
        FlowGraph flow = graph.getFlows().get(0);
        assertThat(flow.getId()).isEqualTo("flow-support");
        assertThat(flow.getDisplayName()).isEqualTo("Support");
        assertThat(flow.getRouteGroups()).containsOnlyKeys("group-common");

        Page ask = flow.findPage("page-ask").orElseThrow();
        assertThat(ask.hasEntryAction()).isTrue();
        assertThat(ask.acceptsInput()).isTrue();
        assertThat(ask.handledEvents()).containsExactly("sys.no-input-default", "sys.no-match-1");
        assertThat(graph.getResolver().resolvePage("flow-support", "Ask")).contains("page-ask");
    }

    @Test
    @DisplayName("Should fall back to file and directory names for missing identifiers")
    void testIdentifierFallbacks() throws IOException {
        write("flows/Orders/Orders.json", "{}");
        write("flows/Orders/pages/Checkout.json", "{\"transitionRoutes\": null}");

        FlowGraph flow = loader.load(agentDir).getFlows().get(0);

        assertThat(flow.getId()).isEqualTo("Orders");
        assertThat(flow.getDisplayName()).isEqualTo("Orders");
        Page checkout = flow.findPage("Checkout").orElseThrow();
        assertThat(checkout.label()).isEqualTo("Checkout");
        assertThat(checkout.getTransitionRoutes()).isEmpty();
    }

    @Test
    @DisplayName("Should treat missing subdirectories as empty")
    void testMissingSubdirectories() throws IOException {
        assertThat(loader.load(agentDir).getFlows()).isEmpty();

        write("flows/Lonely/Lonely.json", "{\"displayName\": \"Lonely\"}");
        Files.createDirectories(agentDir.resolve("flows/NoDocument/pages"));

        AgentGraph graph = loader.load(agentDir);

        assertThat(graph.getFlows()).extracting(FlowGraph::getDisplayName).containsExactly("Lonely");
        assertThat(graph.pageCount()).isZero();
    }

    @Test
    @DisplayName("Should load flows in a stable, sorted order")
    void testDeterministicOrder() throws IOException {
        write("flows/Zeta/Zeta.json", "{}");
        write("flows/Alpha/Alpha.json", "{}");
        write("flows/Alpha/pages/b.json", "{}");
        write("flows/Alpha/pages/a.json", "{}");

        AgentGraph graph = loader.load(agentDir);

        assertThat(graph.getFlows()).extracting(FlowGraph::getId).containsExactly("Alpha", "Zeta");
        assertThat(graph.getFlows().get(0).getPages()).containsOnlyKeys("a", "b");
        assertThat(graph.getFlows().get(0).getPages().keySet()).containsExactly("a", "b");
    }

    @Test
    @DisplayName("Should fail with the offending path on malformed JSON")
    void testMalformedDocument() throws IOException {
        write("flows/Broken/Broken.json", "{}");
        Path bad = write("flows/Broken/pages/Bad.json", "{\"displayName\": ");

        assertThatThrownBy(() -> loader.load(agentDir))
                .isInstanceOf(AgentLoadException.class)
                .satisfies(e -> assertThat(((AgentLoadException) e).getPath()).isEqualTo(bad));
    }

    @Test
    @DisplayName("Should fail when the root directory does not exist")
    void testMissingRoot() {
        Path missing = agentDir.resolve("nope");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(AgentLoadException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    @DisplayName("Should fail when two pages share an identifier")
    void testDuplicatePageIdentifier() throws IOException {
        write("flows/Dup/Dup.json", "{}");
        write("flows/Dup/pages/one.json", "{\"name\": \"same\"}");
        write("flows/Dup/pages/two.json", "{\"name\": \"same\"}");

        assertThatThrownBy(() -> loader.load(agentDir))
                .isInstanceOf(AgentLoadException.class)
                .hasMessageContaining("Duplicate page identifier same");
    }

    @Test
    @DisplayName("Should fail with the offending path on null list elements")
    void testNullListElements() throws IOException {
        write("flows/Holes/Holes.json", "{}");
        Path bad = write("flows/Holes/pages/P.json", "{\"transitionRoutes\": [null], \"eventHandlers\": [null]}");

        assertThatThrownBy(() -> loader.load(agentDir))
                .isInstanceOf(AgentLoadException.class)
                .hasMessageContaining("Malformed Page document")
                .satisfies(e -> assertThat(((AgentLoadException) e).getPath()).isEqualTo(bad));
    }

    @Test
    @DisplayName("Should fail on a document that is just null")
    void testNullDocument() throws IOException {
        Path bad = write("flows/Void/Void.json", "null");

        assertThatThrownBy(() -> loader.load(agentDir))
                .isInstanceOf(AgentLoadException.class)
                .satisfies(e -> assertThat(((AgentLoadException) e).getPath()).isEqualTo(bad));
    }

    @Test
    @DisplayName("Should fail when two flow directories share an identifier")
    void testDuplicateFlowIdentifier() throws IOException {
        write("flows/One/One.json", "{\"name\": \"same\"}");
        write("flows/Two/Two.json", "{\"name\": \"same\"}");
        write("flows/Two/pages/Orphan.json", "{}");

        assertThatThrownBy(() -> loader.load(agentDir))
                .isInstanceOf(AgentLoadException.class)
                .hasMessageContaining("Duplicate flow identifier same")
                .satisfies(e -> assertThat(((AgentLoadException) e).getPath()).isEqualTo(agentDir.resolve("flows/Two")));
    }
}
