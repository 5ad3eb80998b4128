package funcmap.base.function;

import funcmap.base.Address;
import funcmap.base.graph.CallGraph;
import funcmap.base.graph.CallGraphView;
import funcmap.render.FunctionRenderer;
import funcmap.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The function map of the binary under analysis.
 * It takes in intermediate results while the control flow recovery walks the
 * binary and routes each of them to the function it belongs to. A function is
 * created the first time any event names its entry address and lives as long
 * as the registry.
 *
 * One registry holds the state of one analysis session. It is not thread-safe.
 */
public class FunctionRegistry {

    /** Map from function entry address to function */
    private final Map<Address, FunctionRecord> functionMap = new LinkedHashMap<>();

    private final CallGraph interFunctionGraph = new CallGraph();

    /**
     * Get the function at {@code functionAddr}, creating it if needed.
     * A new function starts with its entry registered as one of its blocks.
     */
    private FunctionRecord ensure(Address functionAddr) {
        Objects.requireNonNull(functionAddr, "function address");
        return functionMap.computeIfAbsent(functionAddr, addr -> {
            FunctionRecord func = new FunctionRecord(addr);
            func.addBlock(addr);
            Logging.debug("FunctionRegistry", "Create function " + func.toShortString());
            return func;
        });
    }

    /**
     * A call from a block of {@code functionAddr} to {@code toAddr}.
     * @param functionAddr entry of the calling function
     * @param fromAddr the block ending in the call
     * @param toAddr the call target
     * @param retnAddr where control is expected to resume after the call
     */
    public void callTo(Address functionAddr, Address fromAddr, Address toAddr, Address retnAddr) {
        ensure(functionAddr).addCallSite(fromAddr, toAddr, retnAddr);
        interFunctionGraph.addCall(functionAddr, toAddr);
    }

    /**
     * A block of {@code functionAddr} returning to its caller.
     */
    public void returnFrom(Address functionAddr, Address fromAddr) {
        ensure(functionAddr).addReturnSite(fromAddr);
    }

    public void transitTo(Address functionAddr, Address fromAddr, Address toAddr) {
        ensure(functionAddr).transitTo(fromAddr, toAddr);
    }

    public void returnFromCall(Address functionAddr, Address firstBlockAddr, Address toAddr) {
        ensure(functionAddr).returnFromCall(firstBlockAddr, toAddr);
    }

    /**
     * Look a function up without creating it.
     * @param addr the entry address
     * @return the function, or empty if no event has named it yet
     */
    public Optional<FunctionRecord> lookup(Address addr) {
        return Optional.ofNullable(functionMap.get(addr));
    }

    public boolean contains(Address addr) {
        return functionMap.containsKey(addr);
    }

    /**
     * All functions, in the order they were first seen.
     */
    public Map<Address, FunctionRecord> getFunctions() {
        return Collections.unmodifiableMap(functionMap);
    }

    public int size() {
        return functionMap.size();
    }

    public CallGraphView getCallGraph() {
        return interFunctionGraph;
    }

    /**
     * Returns the block list of every function.
     */
    public String dbgPrint() {
        StringBuilder builder = new StringBuilder();
        for (var entry : functionMap.entrySet()) {
            builder.append("Function ").append(entry.getKey()).append('\n')
                    .append(entry.getValue().dbgPrint()).append('\n');
        }
        return builder.toString();
    }

    /**
     * Render every function into {@code outputDir}, one file per function
     * named after its entry address.
     * @param renderer the renderer producing the files
     * @param outputDir an existing directory
     * @throws IOException if the renderer fails to write a file
     */
    public void dbgDraw(FunctionRenderer renderer, File outputDir) throws IOException {
        for (var entry : functionMap.entrySet()) {
            String fileName = String.format("dbg_function_%s.%s", entry.getKey(), renderer.getFileExtension());
            renderer.render(entry.getValue(), new File(outputDir, fileName));
        }
        Logging.info("FunctionRegistry", String.format("Rendered %d functions into %s", functionMap.size(), outputDir));
    }
}
