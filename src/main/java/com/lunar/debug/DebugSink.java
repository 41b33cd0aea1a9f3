package com.lunar.debug;

/** Pluggable debug output target (console, test capture, host log, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
