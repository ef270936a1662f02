package com.careerpath.orchestrator.provider;

/**
 * Thrown by the completion and search adapters.
 *
 * statusCode is the HTTP status when the provider answered, {@link #IO_ERROR}
 * for timeouts and connection failures, {@link #NO_STATUS} for everything
 * else (missing key, interrupted, unreadable response).
 */
public class ProviderException extends RuntimeException {

    public static final int IO_ERROR = -1;
    public static final int NO_STATUS = 0;

    private final String provider;
    private final int statusCode;

    public ProviderException(String provider, int statusCode, String message) {
        super("%s error %d: %s".formatted(provider, statusCode, message));
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public ProviderException(String provider, int statusCode, String message, Throwable cause) {
        super("%s error %d: %s".formatted(provider, statusCode, message), cause);
        this.provider = provider;
        this.statusCode = statusCode;
    }

    public String provider()  { return provider; }
    public int statusCode()   { return statusCode; }

    /** 429, any 5xx, and timeouts / IO failures are worth another attempt. */
    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= 500 || statusCode == IO_ERROR;
    }
}
