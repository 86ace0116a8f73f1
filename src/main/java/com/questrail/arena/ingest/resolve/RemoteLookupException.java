package com.questrail.arena.ingest.resolve;

/**
 * A remote lookup failed for a reason other than the id being unknown.
 */
public class RemoteLookupException extends RuntimeException {
    public RemoteLookupException(String message) {
        super(message);
    }

    public RemoteLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
