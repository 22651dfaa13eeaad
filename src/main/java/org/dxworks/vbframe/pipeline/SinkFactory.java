package org.dxworks.vbframe.pipeline;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Opens output streams by relative name. The converter closes every stream it opens.
 */
@FunctionalInterface
public interface SinkFactory {

    OutputStream open(String name) throws IOException;
}
