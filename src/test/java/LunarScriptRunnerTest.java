import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lunar.debug.Debug;
import com.lunar.debug.DebugLevel;
import com.lunar.script.LineError;
import com.lunar.script.LunarScript;
import com.lunar.script.RunReport;
import com.lunar.script.ScriptRunner;
import com.lunar.script.parser.Value;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class LunarScriptRunnerTest {

    private static LunarScript recordingEngine(List<String> seen) {
        LunarScript engine = new LunarScript();
        engine.setOutput(s -> { });
        engine.registerFunction("record", args -> {
            seen.add(args.get(0).toString());
            return Value.nil();
        });
        return engine;
    }

    @Test
    void failing_line_is_skipped_and_the_run_continues() {
        List<String> seen = new ArrayList<>();
        LunarScript engine = recordingEngine(seen);

        RunReport r = engine.run(String.join("\n",
                "a = 1",
                "record(\"one\")",
                "x = = 2",
                "record(\"three\")"
        ));

        assertEquals(List.of("one", "three"), seen);
        assertEquals(4, r.executed());
        assertFalse(r.cancelled());
        assertFalse(r.ok());
        assertEquals(1, r.errors().size());

        LineError err = r.errors().get(0);
        assertEquals(2, err.index());
        assertEquals("parse", err.kind());
        assertEquals("x = = 2", err.source());
        assertEquals(1.0, r.get("a").asNumber(), 1e-9);
    }

    @Test
    void error_inside_a_block_discards_only_that_logical_line() {
        List<String> seen = new ArrayList<>();
        LunarScript engine = recordingEngine(seen);

        RunReport r = engine.run(String.join("\n",
                "if true then",
                "   record(\"before\")",
                "   y = nil + 1",
                "   record(\"never\")",
                "end",
                "record(\"after\")"
        ));

        assertEquals(List.of("before", "after"), seen);
        assertEquals(2, r.executed());
        assertEquals("type_coercion", r.errors().get(0).kind());
        assertEquals(0, r.errors().get(0).index());
    }

    @Test
    void lexical_errors_are_isolated_too() {
        RunReport r = new LunarScript().run("a = 1\nb = 2 @ 3\nc = 3");
        assertEquals(1, r.errors().size());
        assertEquals("lexical", r.errors().get(0).kind());
        assertEquals(3.0, r.get("c").asNumber(), 1e-9);
    }

    @Test
    void synchronous_cancellation_is_checked_before_each_line() {
        List<String> seen = new ArrayList<>();
        LunarScript engine = recordingEngine(seen);
        AtomicInteger checks = new AtomicInteger();

        try (ScriptRunner runner = engine.newRunner()) {
            RunReport r = runner.runLines(List.of(
                    "record(\"1\")",
                    "record(\"2\")",
                    "record(\"3\")"
            ), () -> checks.incrementAndGet() > 2);

            assertTrue(r.cancelled());
            assertEquals(2, r.executed());
            assertEquals(List.of("1", "2"), seen);
        }
    }

    @Test
    void cancel_before_start_runs_nothing() throws Exception {
        List<String> seen = new ArrayList<>();
        LunarScript engine = recordingEngine(seen);
        AtomicBoolean cancel = new AtomicBoolean(true);

        try (ScriptRunner runner = engine.newRunner()) {
            RunReport r = runner.runScript(List.of("record(\"x\")"), cancel).get(5, TimeUnit.SECONDS);
            assertTrue(r.cancelled());
            assertEquals(0, r.executed());
            assertTrue(seen.isEmpty());
        }
    }

    @Test
    void background_run_stops_after_cancel_flag_is_raised() throws Exception {
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        AtomicBoolean cancel = new AtomicBoolean(false);
        LunarScript engine = new LunarScript();
        engine.registerFunction("stop", args -> {
            threads.add(Thread.currentThread().getName());
            cancel.set(true);
            return Value.nil();
        });

        try (ScriptRunner runner = engine.newRunner()) {
            Future<RunReport> run = runner.runScript(List.of(
                    "a = 1",
                    "stop()",
                    "b = 2"
            ), cancel);
            RunReport r = run.get(5, TimeUnit.SECONDS);

            assertTrue(r.cancelled());
            assertEquals(2, r.executed());
            assertEquals(1.0, r.get("a").asNumber(), 1e-9);
            assertTrue(r.get("b").isNil());
            assertEquals(List.of("lunar-script"), threads);
        }
    }

    @Test
    void preprocessing_of_a_background_run_happens_on_the_worker() throws Exception {
        List<String> readers = Collections.synchronizedList(new ArrayList<>());
        List<String> source = List.of("a = 1", "b = 2");
        List<String> watched = new AbstractList<String>() {
            @Override
            public String get(int index) {
                readers.add(Thread.currentThread().getName());
                return source.get(index);
            }

            @Override
            public int size() { return source.size(); }
        };

        try (ScriptRunner runner = new LunarScript().newRunner()) {
            RunReport r = runner.runScript(watched, new AtomicBoolean(false)).get(5, TimeUnit.SECONDS);
            assertEquals(2, r.executed());
        }
        assertFalse(readers.isEmpty());
        assertTrue(readers.stream().allMatch("lunar-script"::equals), readers::toString);
    }

    @Test
    void deeply_nested_line_fails_alone() {
        String deep = "x = " + "(".repeat(20000) + "1" + ")".repeat(20000);
        String negations = "n = " + "not ".repeat(20000) + "true";
        RunReport r = new LunarScript().run(deep + "\n" + negations + "\ny = 2");

        assertEquals(3, r.executed());
        assertEquals(2, r.errors().size());
        assertEquals("parse", r.errors().get(0).kind());
        assertTrue(r.errors().get(0).message().contains("Nesting too deep"));
        assertEquals("parse", r.errors().get(1).kind());
        assertEquals(2.0, r.get("y").asNumber(), 1e-9);
    }

    @Test
    void moderate_nesting_is_still_accepted() {
        String nested = "x = " + "(".repeat(100) + "1 + 1" + ")".repeat(100);
        RunReport r = new LunarScript().run(nested);
        assertTrue(r.ok(), () -> r.errors().toString());
        assertEquals(2.0, r.get("x").asNumber(), 1e-9);
    }

    @Test
    void stack_overflow_is_reported_as_a_line_error() {
        LunarScript engine = new LunarScript();
        engine.setMaxCallDepth(Integer.MAX_VALUE);
        RunReport r = engine.run(String.join("\n",
                "function loop(n)",
                "   return loop(n + 1)",
                "end",
                "loop(1)",
                "after = 1"
        ));

        assertEquals(1, r.errors().size());
        assertEquals("stack_overflow", r.errors().get(0).kind());
        assertEquals(1.0, r.get("after").asNumber(), 1e-9);
    }

    @Test
    void error_listener_sees_every_failure_and_its_own_failure_is_contained() {
        LunarScript engine = new LunarScript();
        List<LineError> heard = new ArrayList<>();
        engine.setErrorListener(err -> {
            heard.add(err);
            throw new IllegalStateException("listener broke");
        });

        RunReport r = engine.run("x = nil + 1\nnope()\nz = 1");

        assertEquals(2, heard.size());
        assertEquals("type_coercion", heard.get(0).kind());
        assertEquals("not_callable", heard.get(1).kind());
        assertEquals(3, r.executed());
        assertEquals(1.0, r.get("z").asNumber(), 1e-9);
    }

    @Test
    void failures_and_cancellation_are_logged_through_debug_sink() {
        List<String> logged = Collections.synchronizedList(new ArrayList<>());
        Debug.get().setSink((level, tag, message, error) -> logged.add(level + " " + tag + " " + message));
        try {
            LunarScript engine = new LunarScript();
            engine.run("x = (1");

            try (ScriptRunner runner = engine.newRunner()) {
                runner.runLines(List.of("y = 1"), () -> true);
            }
        } finally {
            Debug.get().setSink(null);
        }

        assertTrue(logged.stream().anyMatch(s ->
                s.startsWith(DebugLevel.WARN + " lunar.runner Error executing line 'x = (1'")), logged::toString);
        assertTrue(logged.stream().anyMatch(s ->
                s.startsWith(DebugLevel.INFO + " lunar.runner Script execution cancelled")), logged::toString);
    }

    @Test
    void report_serializes_to_json() throws Exception {
        LunarScript engine = new LunarScript();
        engine.setOutput(s -> { });
        RunReport r = engine.run(String.join("\n",
                "a = 1",
                "s = \"hi\"",
                "bad(",
                "function f()",
                "end"
        ));

        ObjectMapper om = new ObjectMapper();
        JsonNode root = om.readTree(om.writeValueAsString(r));

        assertEquals(4, root.get("executed").asInt());
        assertFalse(root.get("cancelled").asBoolean());
        assertEquals(1, root.get("errors").size());
        JsonNode err = root.get("errors").get(0);
        assertEquals(2, err.get("index").asInt());
        assertEquals("parse", err.get("kind").asText());
        assertEquals("bad(", err.get("source").asText());

        JsonNode globals = root.get("globals");
        assertEquals("1", globals.get("a").asText());
        assertEquals("hi", globals.get("s").asText());
        assertEquals("function: f", globals.get("f").asText());
        assertFalse(globals.has("print"));
        assertFalse(globals.has("sqrt"));
    }

    @Test
    void split_lines_handles_crlf() {
        assertEquals(List.of("a = 1", "b = 2", ""), LunarScript.splitLines("a = 1\r\nb = 2\r\n"));
        assertTrue(LunarScript.splitLines("").isEmpty());
    }
}
