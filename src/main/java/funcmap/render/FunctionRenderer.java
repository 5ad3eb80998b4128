package funcmap.render;

import funcmap.base.function.FunctionRecord;

import java.io.File;
import java.io.IOException;

/**
 * Turns a function's transition graph into a visual artifact.
 * Layout and drawing belong to the implementation, the function record only
 * supplies the graph data.
 */
public interface FunctionRenderer {

    /** File name extension of the produced artifacts, without the dot. */
    String getFileExtension();

    void render(FunctionRecord func, File outputFile) throws IOException;
}
