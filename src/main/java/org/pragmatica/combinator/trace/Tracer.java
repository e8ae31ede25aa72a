package org.pragmatica.combinator.trace;

import java.io.PrintStream;
import java.util.List;

/**
 * Diagnostic sink receiving one {@link TraceEvent} per traced parser invocation.
 * Tracing never affects parse results.
 */
@FunctionalInterface
public interface Tracer {
    Tracer NONE = event -> {};

    void trace(TraceEvent event);

    /**
     * Tracer writing one indented line per event.
     */
    static Tracer printing(PrintStream out) {
        return event -> out.println(event.format());
    }

    /**
     * Tracer appending every event to the given list.
     */
    static Tracer collecting(List<TraceEvent> events) {
        return events::add;
    }
}
