package com.purchasingpower.flowlint;

import com.purchasingpower.flowlint.exception.AgentLoadException;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.FindingCategory;
import com.purchasingpower.flowlint.model.finding.LintReport;
import com.purchasingpower.flowlint.model.finding.Severity;
import com.purchasingpower.flowlint.service.AgentLintService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Full pipeline against the sample agent export under src/test/resources.
 *
 * The sample has two flows:
 * - Billing: Start -> Step A <-> Step B, an unconditional cycle
 * - Default Start Flow: an orphan page, a form without no-input handling,
 *   a lookup page with only conditional routes and an unused route group
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Agent Lint Service Integration Tests")
class AgentLintServiceIntegrationTest {

    @Autowired
    private AgentLintService lintService;

    private Path sampleAgent;

    @BeforeEach
    void setUp() throws IOException {
        sampleAgent = new ClassPathResource("agents/sample-agent").getFile().toPath();
    }

    @Test
    @DisplayName("Should report every defect in the sample agent in pass order")
    void testSampleAgent() {
        // When
        LintReport report = lintService.lint(sampleAgent);

        // Then
        assertThat(report.getFindings())
                .extracting(Finding::getFlow, Finding::getPage, Finding::getCategory, Finding::getSeverity)
                .containsExactly(
                        tuple("Default Start Flow", "Orphan", FindingCategory.UNREACHABLE_PAGE, Severity.WARNING),
                        tuple("Default Start Flow", "Collect Details", FindingCategory.MISSING_EVENT_HANDLER, Severity.WARNING),
                        tuple("Default Start Flow", "Lookup", FindingCategory.STUCK_PAGE, Severity.ERROR),
                        tuple("Default Start Flow", "N/A", FindingCategory.UNUSED_ROUTE_GROUP, Severity.INFO),
                        tuple("Billing", "Start", FindingCategory.INFINITE_LOOP, Severity.WARNING),
                        tuple("Default Start Flow", "Collect Details", FindingCategory.INFINITE_LOOP, Severity.WARNING));

        assertThat(report.getFindings()).extracting(Finding::getMessage).contains(
                "Missing Event Handler: no-input",
                "Unused Route Group: Legacy Routes",
                "Infinite Loop Detected: Step A -> Step B -> Step A",
                "Infinite Loop Detected: Collect Details -> Lookup -> Collect Details");

        assertThat(report.summary()).isEqualTo("Found 6 issues (1 errors, 4 warnings, 1 info)");
    }

    @Test
    @DisplayName("Should produce identical findings on repeated runs")
    void testIdempotence() {
        LintReport first = lintService.lint(sampleAgent);
        LintReport second = lintService.lint(sampleAgent);

        assertThat(second.getFindings()).containsExactlyInAnyOrderElementsOf(first.getFindings());
    }

    @Test
    @DisplayName("Should fail before analysis when the agent directory is missing")
    void testMissingAgentDirectory() {
        assertThatThrownBy(() -> lintService.lint(sampleAgent.resolve("does-not-exist")))
                .isInstanceOf(AgentLoadException.class);
    }
}
