package ua.beengoo.rolink.core.service;

import ua.beengoo.rolink.api.model.LinkFailure;

/** Thrown when an OAuth callback cannot complete; {@link #failure()} decides the HTTP response. */
public class LinkFlowException extends RuntimeException {
    private final LinkFailure failure;

    public LinkFlowException(LinkFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public LinkFlowException(LinkFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public LinkFailure failure() {
        return failure;
    }
}
