package com.conduit.runtime;

/**
 * A container runtime call failed: engine unreachable, unknown container, rejected update.
 */
public class ContainerRuntimeException extends RuntimeException {

    private final String containerId;

    public ContainerRuntimeException(String containerId, String message) {
        super(message);
        this.containerId = containerId;
    }

    public ContainerRuntimeException(String containerId, String message, Throwable cause) {
        super(message, cause);
        this.containerId = containerId;
    }

    public String getContainerId() {
        return containerId;
    }
}
