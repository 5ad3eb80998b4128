package funcmap.replay;

import funcmap.base.Address;
import funcmap.base.function.FunctionRegistry;
import funcmap.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import org.apache.commons.io.FileUtils;

/**
 * Feeds a textual trace of control flow recovery events into a registry.
 * One event per line:
 * <pre>
 * transit_to       function from to
 * call_to          function from to return
 * return_from      function from
 * return_from_call function first_block to
 * </pre>
 * Blank lines and lines starting with '#' are skipped.
 */
public class EventReplay {

    private final FunctionRegistry registry;
    private int eventCount = 0;

    public EventReplay(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    public void replay(File traceFile) throws IOException, TraceFormatException {
        Logging.info("EventReplay", "Replay trace " + traceFile);
        replay(FileUtils.readLines(traceFile, StandardCharsets.UTF_8));
    }

    /**
     * Apply the events in order. Events before a malformed line stay applied.
     * @param lines the trace lines
     * @throws TraceFormatException on the first malformed line
     */
    public void replay(List<String> lines) throws TraceFormatException {
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            apply(lineNumber, trimmed.split("\\s+"));
        }
        Logging.info("EventReplay", String.format("Applied %d events, %d functions", eventCount, registry.size()));
    }

    private void apply(int lineNumber, String[] parts) throws TraceFormatException {
        String event = parts[0];
        switch (event) {
            case "transit_to" -> {
                Address[] args = operands(lineNumber, parts, 3);
                registry.transitTo(args[0], args[1], args[2]);
            }
            case "call_to" -> {
                Address[] args = operands(lineNumber, parts, 4);
                registry.callTo(args[0], args[1], args[2], args[3]);
            }
            case "return_from" -> {
                Address[] args = operands(lineNumber, parts, 2);
                registry.returnFrom(args[0], args[1]);
            }
            case "return_from_call" -> {
                Address[] args = operands(lineNumber, parts, 3);
                registry.returnFromCall(args[0], args[1], args[2]);
            }
            default -> throw new TraceFormatException(lineNumber, "Unknown event: " + event);
        }
        eventCount++;
    }

    private Address[] operands(int lineNumber, String[] parts, int expected) throws TraceFormatException {
        if (parts.length - 1 != expected) {
            throw new TraceFormatException(lineNumber, String.format(
                    "%s expects %d operands, got %d", parts[0], expected, parts.length - 1));
        }
        Address[] res = new Address[expected];
        for (int i = 0; i < expected; i++) {
            try {
                res[i] = Address.parse(parts[i + 1]);
            } catch (IllegalArgumentException e) {
                throw new TraceFormatException(lineNumber, e.getMessage(), e);
            }
        }
        return res;
    }

    public int getEventCount() {
        return eventCount;
    }
}
