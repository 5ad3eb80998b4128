package funcmap;

import funcmap.base.function.FunctionRegistry;
import funcmap.render.DotFunctionRenderer;
import funcmap.replay.EventReplay;
import funcmap.replay.TraceFormatException;
import funcmap.report.RegistryReporter;
import funcmap.utils.Logging;
import funcmap.utils.Options;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;

/**
 * Replays a control flow recovery trace and dumps the recovered functions.
 * Usage: {@code FuncMap trace=<file> output=<dir> [draw=true|false] [report=true|false]}
 */
public class FuncMap {

    public static void main(String[] args) {
        System.out.println("====================== FuncMap ======================");

        if (!Logging.init()) {
            return;
        }

        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            Logging.error("FuncMap", e.getMessage());
            System.exit(1);
            return;
        }

        try {
            run(options);
        } catch (TraceFormatException e) {
            Logging.error("FuncMap", "Invalid trace " + options.traceFile + ", " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            Logging.error("FuncMap", "I/O failure: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Replay the trace into a fresh registry and write the requested outputs.
     * @return the populated registry
     */
    public static FunctionRegistry run(Options options) throws IOException, TraceFormatException {
        File outputDir = options.outputDirectory;
        FileUtils.forceMkdir(outputDir);

        long startTime = System.currentTimeMillis();
        FunctionRegistry registry = new FunctionRegistry();
        new EventReplay(registry).replay(options.traceFile);
        Logging.info("FuncMap", "Number of functions: " + registry.size());
        Logging.info("FuncMap", "Recursive groups: " + registry.getCallGraph().getRecursiveGroups());
        Logging.info("FuncMap", "Functions:\n" + registry.dbgPrint());

        if (options.report) {
            new RegistryReporter().dump(registry, outputDir);
        }
        if (options.draw) {
            registry.dbgDraw(new DotFunctionRenderer(), outputDir);
        }
        Logging.info("FuncMap", "Total time: " + (System.currentTimeMillis() - startTime) / 1000.00 + "s");
        return registry;
    }
}
