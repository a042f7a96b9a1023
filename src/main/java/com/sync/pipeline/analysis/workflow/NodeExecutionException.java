package com.sync.pipeline.analysis.workflow;

/**
 * A node failed; the batch of the workflow run was discarded without being flushed.
 */
public class NodeExecutionException extends RuntimeException {

    private final String nodeName;

    public NodeExecutionException(String nodeName, String message) {
        super(message);
        this.nodeName = nodeName;
    }

    public NodeExecutionException(String nodeName, String message, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
