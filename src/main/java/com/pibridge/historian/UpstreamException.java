package com.pibridge.historian;

import com.pibridge.domain.StreamLeg;

import java.util.concurrent.TimeoutException;

/**
 * A historian read failed: non-success status, transport failure, timeout or open circuit.
 *
 * Carries the leg it happened on, the request URL and the HTTP status when one was received.
 */
public class UpstreamException extends RuntimeException {

    private final StreamLeg leg;
    private final String url;
    private final Integer status;

    public UpstreamException(String message, String url, Integer status, Throwable cause) {
        this(message, null, url, status, cause);
    }

    public UpstreamException(String message, StreamLeg leg, String url, Integer status, Throwable cause) {
        super(message, cause);
        this.leg = leg;
        this.url = url;
        this.status = status;
    }

    /**
     * Non-2xx response.
     */
    public static UpstreamException httpStatus(String url, int status, String body) {
        String detail = body != null && !body.isBlank() ? ": " + abbreviate(body) : "";
        return new UpstreamException("Historian returned HTTP " + status + detail, url, status, null);
    }

    /**
     * Failure before or while reading a response.
     */
    public static UpstreamException transport(String url, Throwable cause) {
        return new UpstreamException("Historian request failed: " + cause.getMessage(), url, null, cause);
    }

    /**
     * Attribute any error to a leg, keeping the status and cause of an existing
     * {@code UpstreamException}.
     */
    public static UpstreamException forLeg(StreamLeg leg, String url, Throwable error) {
        if (error instanceof UpstreamException) {
            UpstreamException upstream = (UpstreamException) error;
            return new UpstreamException(upstream.getBaseMessage(), leg,
                upstream.url != null ? upstream.url : url, upstream.status, upstream.getCause());
        }
        if (error instanceof TimeoutException) {
            return new UpstreamException("Historian request timed out", leg, url, null, error);
        }
        return new UpstreamException("Historian request failed: " + error.getMessage(), leg, url, null, error);
    }

    public StreamLeg getLeg() {
        return leg;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatus() {
        return status;
    }

    private String getBaseMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (leg != null) {
            sb.append(" [leg=").append(leg.getValue());
            if (status != null) {
                sb.append(", status=").append(status);
            }
            sb.append("]");
        } else if (status != null) {
            sb.append(" [status=").append(status).append("]");
        }
        return sb.toString();
    }

    private static String abbreviate(String body) {
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() > 200 ? flat.substring(0, 200) + "..." : flat;
    }
}
