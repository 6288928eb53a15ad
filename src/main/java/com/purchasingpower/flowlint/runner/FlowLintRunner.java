package com.purchasingpower.flowlint.runner;

import com.purchasingpower.flowlint.configuration.FlowLintProperties;
import com.purchasingpower.flowlint.model.finding.Finding;
import com.purchasingpower.flowlint.model.finding.LintReport;
import com.purchasingpower.flowlint.service.AgentLintService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Lints {@code flowlint.agent-dir} once at startup and logs every finding.
 *
 * <p>Only registered when the property is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "flowlint", name = "agent-dir")
public class FlowLintRunner implements CommandLineRunner {

    private final AgentLintService lintService;
    private final FlowLintProperties properties;

    @Override
    public void run(String... args) {
        LintReport report = lintService.lint(Paths.get(properties.getAgentDir()));

        for (Finding finding : report.getFindings()) {
            switch (finding.getSeverity()) {
                case ERROR -> log.error("{}", finding);
                case WARNING -> log.warn("{}", finding);
                case INFO -> log.info("{}", finding);
            }
        }
        log.info(report.summary());
    }
}
