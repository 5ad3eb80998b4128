package funcmap.report;

import funcmap.base.Address;
import funcmap.base.function.CallSite;
import funcmap.base.function.FunctionRecord;
import funcmap.base.function.FunctionRegistry;
import funcmap.base.graph.TransitionGraph;
import funcmap.utils.Logging;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Dumps a registry as a JSON summary for inspection.
 * The report is write-only, nothing reads it back into a registry.
 */
public class RegistryReporter {

    public static final String REPORT_FILE_NAME = "functions.json";

    private final ObjectMapper mapper = new ObjectMapper();

    public RegistryReporter() {
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write the report into {@code outputDir}.
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public File dump(FunctionRegistry registry, File outputDir) throws IOException {
        File reportFile = new File(outputDir, REPORT_FILE_NAME);
        mapper.writeValue(reportFile, generateRegistryJson(registry));
        Logging.info("RegistryReporter", String.format("Dumped %d functions to %s", registry.size(), reportFile));
        return reportFile;
    }

    public ObjectNode generateRegistryJson(FunctionRegistry registry) {
        var jsonRoot = mapper.createObjectNode();

        var functions = mapper.createArrayNode();
        for (FunctionRecord func : registry.getFunctions().values()) {
            functions.add(generateFunctionJson(func));
        }
        jsonRoot.set("functions", functions);

        var callGraph = mapper.createArrayNode();
        var cg = registry.getCallGraph();
        for (Address caller : cg.getNodes()) {
            for (Address callee : cg.getCallees(caller)) {
                var edge = mapper.createObjectNode();
                edge.put("caller", caller.toString());
                edge.put("callee", callee.toString());
                callGraph.add(edge);
            }
        }
        jsonRoot.set("callGraph", callGraph);
        return jsonRoot;
    }

    public ObjectNode generateFunctionJson(FunctionRecord func) {
        var jsonRoot = mapper.createObjectNode();
        jsonRoot.put("entry", func.getAddress().toString());
        if (func.getName() != null) {
            jsonRoot.put("name", func.getName());
        } else {
            jsonRoot.putNull("name");
        }
        jsonRoot.set("blocks", addressArray(func.getBasicBlocks()));

        var edges = mapper.createArrayNode();
        for (TransitionGraph.TransitionEdge edge : func.getTransitionGraph().getEdges()) {
            var edgeJson = mapper.createObjectNode();
            edgeJson.put("from", edge.src.toString());
            edgeJson.put("to", edge.dst.toString());
            edgeJson.put("type", edge.edgeType.name());
            edges.add(edgeJson);
        }
        jsonRoot.set("edges", edges);

        var callSites = mapper.createArrayNode();
        for (CallSite cs : func.getCallSites()) {
            var csJson = mapper.createObjectNode();
            csJson.put("site", cs.callSiteAddr.toString());
            csJson.put("target", cs.targetAddr.toString());
            csJson.put("return", cs.returnAddr.toString());
            callSites.add(csJson);
        }
        jsonRoot.set("callSites", callSites);
        jsonRoot.set("returnSites", addressArray(func.getReturnSites()));
        jsonRoot.put("hasReturn", func.hasReturn());

        var arguments = mapper.createObjectNode();
        var registers = arguments.putArray("registers");
        func.getArgumentRegisters().forEach(registers::add);
        var stack = arguments.putArray("stack");
        func.getArgumentStackVariables().forEach(stack::add);
        jsonRoot.set("arguments", arguments);

        var frame = mapper.createObjectNode();
        frame.put("bpOnStack", func.isBpOnStack());
        frame.put("retaddrOnStack", func.isRetaddrOnStack());
        frame.put("spDifference", func.getSpDifference());
        jsonRoot.set("frame", frame);
        return jsonRoot;
    }

    private ArrayNode addressArray(Iterable<Address> addrs) {
        var res = mapper.createArrayNode();
        for (Address addr : addrs) {
            res.add(addr.toString());
        }
        return res;
    }
}
