package com.proxyhub.common.exception;

public class ProviderException extends RuntimeException {
    private final Long configId;

    public ProviderException(Long configId, String message) {
        super(prefix(configId) + message);
        this.configId = configId;
    }

    public ProviderException(Long configId, String message, Throwable cause) {
        super(prefix(configId) + message, cause);
        this.configId = configId;
    }

    public ProviderException(String message) {
        this(null, message);
    }

    public ProviderException(String message, Throwable cause) {
        this(null, message, cause);
    }

    /** May be {@code null} when the failure is not tied to a single configuration. */
    public Long getConfigId() {
        return configId;
    }

    private static String prefix(Long configId) {
        return configId == null ? "" : "[config " + configId + "] ";
    }
}
