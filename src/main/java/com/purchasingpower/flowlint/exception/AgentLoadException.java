package com.purchasingpower.flowlint.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Raised when an exported agent directory cannot be loaded.
 *
 * <p>Fatal for the whole run: no partially loaded agent is ever analyzed.
 */
@Getter
public class AgentLoadException extends RuntimeException {

    private final Path path;

    public AgentLoadException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public AgentLoadException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

}
