package com.lunar.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lunar.debug.Debug;

/**
 * Runs a script file.
 *
 * Usage:
 *   java com.lunar.script.LunarCli [--json] [--quiet] <script-file>
 *
 * --json   print the run report as JSON on stdout (script output goes to stderr)
 * --quiet  do not install the console debug sink
 *
 * Ctrl-C cancels the run before the next logical line. Exit code is 1 when any
 * line failed.
 */
public final class LunarCli {

    public static void main(String[] args) {
        boolean json = false;
        boolean quiet = false;
        String file = null;
        for (String a : args) {
            if ("--json".equals(a)) json = true;
            else if ("--quiet".equals(a)) quiet = true;
            else if (file == null && !a.startsWith("--")) file = a;
            else usage();
        }
        if (file == null) usage();

        final Path scriptPath = Path.of(file);
        final List<String> lines;
        try {
            lines = Files.readAllLines(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        if (!quiet) Debug.useSysOut();

        LunarScript engine = new LunarScript();
        if (json) engine.setOutput(System.err::println);

        AtomicBoolean cancel = new AtomicBoolean(false);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> cancel.set(true), "lunar-cancel"));

        RunReport report;
        try (ScriptRunner runner = engine.newRunner()) {
            Future<RunReport> run = runner.runScript(lines, cancel);
            report = run.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            System.exit(130);
            return;
        } catch (ExecutionException e) {
            System.err.println("Script run failed:");
            e.getCause().printStackTrace(System.err);
            System.exit(1);
            return;
        }

        if (json) {
            try {
                ObjectMapper om = new ObjectMapper();
                System.out.println(om.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (IOException e) {
                System.err.println("Failed to write report: " + e.getMessage());
                System.exit(1);
            }
        } else {
            for (LineError err : report.errors()) {
                System.err.println(err);
            }
            if (report.cancelled()) System.err.println("(cancelled)");
        }

        System.exit(report.errors().isEmpty() ? 0 : 1);
    }

    private static void usage() {
        System.err.println("Usage: LunarCli [--json] [--quiet] <script-file>");
        System.exit(2);
    }

    private LunarCli() {}
}
