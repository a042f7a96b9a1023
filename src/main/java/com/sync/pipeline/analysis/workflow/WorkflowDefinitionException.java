package com.sync.pipeline.analysis.workflow;

/**
 * Thrown when a node list runs a node before the capabilities it requires are provided.
 */
public class WorkflowDefinitionException extends RuntimeException {

    public WorkflowDefinitionException(String message) {
        super(message);
    }

    public WorkflowDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
