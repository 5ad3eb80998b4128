package funcmap.render;

import funcmap.base.Address;
import funcmap.base.function.FunctionRecord;
import funcmap.base.graph.TransitionGraph;
import funcmap.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;

/**
 * Writes a function's transition graph as a Graphviz DOT file.
 * Call-site blocks are marked [Call] and return sites [Ret].
 */
public class DotFunctionRenderer implements FunctionRenderer {

    @Override
    public String getFileExtension() {
        return "dot";
    }

    @Override
    public void render(FunctionRecord func, File outputFile) throws IOException {
        FileUtils.writeStringToFile(outputFile, toGraphviz(func), StandardCharsets.UTF_8);
        Logging.debug("DotFunctionRenderer", "Write " + outputFile);
    }

    public String toGraphviz(FunctionRecord func) {
        StringBuilder builder = new StringBuilder();
        builder.append("digraph \"function_").append(func.getAddress()).append("\" {\n");
        // Isolated blocks have no edge to show up in
        for (Address block : func.getBasicBlocks()) {
            builder.append("  \"").append(label(func, block)).append("\";\n");
        }
        for (TransitionGraph.TransitionEdge edge : func.getTransitionGraph().getEdges()) {
            builder.append("  \"").append(label(func, edge.src)).append("\" -> \"")
                    .append(label(func, edge.dst)).append("\" [label=\"")
                    .append(edge.edgeType).append("\"];\n");
        }
        builder.append("}\n");
        return builder.toString();
    }

    private String label(FunctionRecord func, Address block) {
        String res = block.toString();
        if (func.getCallSite(block).isPresent()) {
            res += "[Call]";
        }
        if (func.getReturnSites().contains(block)) {
            res += "[Ret]";
        }
        return res;
    }
}
