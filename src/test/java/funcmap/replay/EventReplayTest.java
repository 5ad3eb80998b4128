package funcmap.replay;

import static org.junit.jupiter.api.Assertions.*;

import funcmap.base.Address;
import funcmap.base.function.FunctionRegistry;
import funcmap.base.graph.TransitionGraph.EdgeType;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EventReplayTest {
    @TempDir
    File tempDir;

    @Test
    public void testReplayAllEvents() throws TraceFormatException {
        var registry = new FunctionRegistry();
        var replay = new EventReplay(registry);
        replay.replay(List.of(
                "# main",
                "transit_to 0x1000 0x1000 0x1010",
                "",
                "call_to    0x1000 0x1010 0x2000 0x1020",
                "return_from_call 0x1000 0x1010 0x1020",
                "return_from 0x1000 0x1020",
                "return_from 8192 8208"));

        assertEquals(5, replay.getEventCount());
        assertEquals(2, registry.size());
        var func = registry.lookup(Address.of(0x1000)).orElseThrow();
        assertEquals(Set.of(Address.of(0x1000), Address.of(0x1010), Address.of(0x1020)), func.getBasicBlocks());
        assertEquals(Optional.of(Address.of(0x2000)), func.getCallTarget(Address.of(0x1010)));
        assertEquals(EdgeType.RETURN_FROM_CALL,
                func.getTransitionGraph().getEdge(Address.of(0x1010), Address.of(0x1020)).orElseThrow().edgeType);
        assertTrue(func.hasReturn());
        assertTrue(registry.lookup(Address.of(0x2000)).orElseThrow().hasReturn());
    }

    @Test
    public void testUnknownEvent() {
        var replay = new EventReplay(new FunctionRegistry());
        var e = assertThrows(TraceFormatException.class,
                () -> replay.replay(List.of("transit_to 0x1 0x1 0x2", "jump_to 0x1 0x2")));
        assertEquals(2, e.getLineNumber());
        assertEquals(1, replay.getEventCount());
    }

    @Test
    public void testOperandCount() {
        var replay = new EventReplay(new FunctionRegistry());
        var e = assertThrows(TraceFormatException.class,
                () -> replay.replay(List.of("return_from 0x1000 0x1020 0x3000")));
        assertEquals(1, e.getLineNumber());
        assertTrue(e.getMessage().contains("expects 2 operands"));
    }

    @Test
    public void testMalformedAddress() {
        var registry = new FunctionRegistry();
        var e = assertThrows(TraceFormatException.class,
                () -> new EventReplay(registry).replay(List.of("call_to 0x1000 0x1010 nowhere 0x1020")));
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertEquals(0, registry.size());
    }

    @Test
    public void testReplayFile() throws IOException, TraceFormatException {
        File trace = new File(tempDir, "trace.txt");
        Files.writeString(trace.toPath(), "call_to 0x1000 0x1010 0x2000 0x1020\n", StandardCharsets.UTF_8);

        var registry = new FunctionRegistry();
        new EventReplay(registry).replay(trace);
        assertTrue(registry.getCallGraph().hasEdge(Address.of(0x1000), Address.of(0x2000)));
    }
}
