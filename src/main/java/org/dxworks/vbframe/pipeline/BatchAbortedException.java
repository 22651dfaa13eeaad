package org.dxworks.vbframe.pipeline;

/**
 * The whole conversion stopped because an output sink could not be acquired or written.
 */
public class BatchAbortedException extends RuntimeException {

    public BatchAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
