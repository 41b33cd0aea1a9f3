package com.lunar.script;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import com.lunar.debug.Debug;
import com.lunar.script.LunarScript.LineErrorListener;
import com.lunar.script.parser.Completion;
import com.lunar.script.parser.Interpreter;
import com.lunar.script.parser.Lexer;
import com.lunar.script.parser.LinePreprocessor;
import com.lunar.script.parser.Parser;
import com.lunar.script.parser.ScriptError;
import com.lunar.script.parser.Statement.Stmt;
import com.lunar.script.parser.Token;

/**
 * Feeds logical lines through lexer, parser and interpreter one at a time.
 *
 * A failing line is reported and skipped; cancellation is checked before
 * every line. {@link #runScript} executes on the runner's own worker thread, so
 * runs submitted to one runner never overlap.
 */
public final class ScriptRunner implements Closeable {
    private static final String TAG = "lunar.runner";

    private final Interpreter interpreter;
    private final LineErrorListener errorListener;
    private final ExecutorService worker;

    public ScriptRunner(Interpreter interpreter, LineErrorListener errorListener) {
        this.interpreter = interpreter;
        this.errorListener = errorListener;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "lunar-script");
            t.setDaemon(true);
            return t;
        });
    }

    public Interpreter interpreter() { return interpreter; }

    /**
     * Runs the raw lines in the background; setting {@code cancel} stops before the
     * next logical line. Preprocessing happens on the worker too, so the caller must
     * not modify {@code rawLines} until the returned future completes.
     */
    public Future<RunReport> runScript(List<String> rawLines, AtomicBoolean cancel) {
        return worker.submit(() -> execute(LinePreprocessor.process(rawLines), cancel::get));
    }

    /** Runs the raw lines on the calling thread. */
    public RunReport runLines(List<String> rawLines, BooleanSupplier cancelled) {
        return execute(LinePreprocessor.process(rawLines), cancelled);
    }

    /** Lexes, parses and executes one logical line. Errors propagate to the caller. */
    public Completion runLine(String logicalLine) {
        List<Token> tokens = new Lexer(logicalLine).tokenize();
        Stmt stmt = new Parser(tokens).parse();
        return interpreter.execute(stmt);
    }

    private RunReport execute(List<String> logical, BooleanSupplier cancelled) {
        List<LineError> errors = new ArrayList<>();
        int executed = 0;
        boolean wasCancelled = false;

        for (int i = 0; i < logical.size(); i++) {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                Debug.get().i(TAG, "Script execution cancelled after " + executed + " of " + logical.size() + " lines");
                wasCancelled = true;
                break;
            }

            String line = logical.get(i);
            try {
                runLine(line);
            } catch (RuntimeException e) {
                errors.add(report(i, line, e));
            } catch (StackOverflowError e) {
                errors.add(report(i, line, new ScriptError(ScriptError.Kind.STACK_OVERFLOW,
                        "Stack overflow while executing line", e)));
            }
            executed++;
        }

        Debug.get().d(TAG, "Run finished: " + executed + " lines, " + errors.size() + " errors");
        return new RunReport(executed, wasCancelled, errors, interpreter.globals().snapshot());
    }

    private LineError report(int index, String line, RuntimeException e) {
        LineError err = LineError.of(index, line, e);
        Debug.get().w(TAG, "Error executing line '" + line + "': " + err.message());
        notifyListener(err);
        return err;
    }

    private void notifyListener(LineError err) {
        if (errorListener == null) return;
        try {
            errorListener.onLineError(err);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "Line error listener failed for line " + err.index(), e);
        }
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
