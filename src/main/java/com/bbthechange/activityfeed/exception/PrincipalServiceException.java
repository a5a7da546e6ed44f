package com.bbthechange.activityfeed.exception;

/**
 * Exception thrown when the principal service cannot answer a visibility or membership query.
 */
public class PrincipalServiceException extends RuntimeException {

    private final Integer statusCode;

    public PrincipalServiceException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PrincipalServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Factory method for a principal the service does not know.
     */
    public static PrincipalServiceException notFound(String principalId) {
        return new PrincipalServiceException("Principal not found: " + principalId, 404);
    }

    /**
     * Factory method for an unreachable or failing principal service.
     */
    public static PrincipalServiceException unavailable(String path, Throwable cause) {
        return new PrincipalServiceException("Principal service unavailable for " + path, cause);
    }
}
