package org.dxworks.vbframe.ingest;

/**
 * Raised when source bytes are invalid under the declared charset and every fallback.
 */
public class UndecodableSourceException extends Exception {

    public UndecodableSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
