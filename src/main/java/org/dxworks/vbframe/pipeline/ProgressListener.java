package org.dxworks.vbframe.pipeline;

/**
 * Called from worker threads as files finish, in completion order.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (completed, total, result) -> { };

    void fileConverted(int completed, int total, FileResult result);
}
