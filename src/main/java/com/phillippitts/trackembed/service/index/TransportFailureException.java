package com.phillippitts.trackembed.service.index;

import com.phillippitts.trackembed.exception.TrackEmbedException;

/**
 * Failure of a single call on a {@link VectorIndexTransport}, classified for the retry policy.
 */
public class TransportFailureException extends TrackEmbedException {

    /**
     * Failure classes. Everything except {@link #REJECTED} is worth retrying.
     */
    public enum Kind {
        /** Service answered with a 5xx status. */
        SERVICE_UNAVAILABLE(true),
        /** Response body could not be parsed. */
        MALFORMED_RESPONSE(true),
        /** I/O error, reset or timeout; the handle must be recreated. */
        CONNECTION(true),
        /** Service refused the request (4xx). */
        REJECTED(false);

        private final boolean transientFailure;

        Kind(boolean transientFailure) {
            this.transientFailure = transientFailure;
        }

        public boolean isTransient() {
            return transientFailure;
        }
    }

    private final Kind kind;

    public TransportFailureException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TransportFailureException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
