package com.purchasingpower.flowlint.model.finding;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How bad a finding is. Declared from least to most severe.
 */
@Getter
@RequiredArgsConstructor
public enum Severity {
    INFO("Info"),
    WARNING("Warning"),
    ERROR("Error");

    private final String label;
}
