package com.purchasingpower.flowlint.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "flowlint")
public class FlowLintProperties {

    /**
     * Unpacked agent export to analyze on startup. Unset means no startup run.
     */
    private String agentDir;

    /**
     * Run the analysis passes concurrently on the analysis executor.
     */
    private boolean parallel = true;

    @Min(1)
    private int analysisThreads = 5;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LoopDetectionProperties loop = new LoopDetectionProperties();
}
