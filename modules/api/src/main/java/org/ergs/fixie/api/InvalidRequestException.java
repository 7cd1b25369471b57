package org.ergs.fixie.api;

import jakarta.ws.rs.core.Response;

/**
 * A request rejected before any registry work: missing or malformed fields,
 * or a user/token pair that does not verify.
 */
public class InvalidRequestException extends RuntimeException {

    private final Response.Status status;

    public InvalidRequestException(String message) {
        this(Response.Status.BAD_REQUEST, message);
    }

    public InvalidRequestException(Response.Status status, String message) {
        super(message);
        this.status = status;
    }

    public Response.Status status() {
        return status;
    }
}
