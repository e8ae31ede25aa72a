package org.pragmatica.combinator.trace;

/**
 * One traced parser invocation.
 *
 * @param name     parser name ({@code seq}, {@code any}, {@code exact 'x'}, ...)
 * @param depth    nesting depth of the invocation, 0 for the outermost traced parser
 * @param position cursor offset at entry
 * @param preview  input slice starting at {@code position}
 * @param matched  whether the invocation succeeded
 * @param detail   matched token on success, error message on failure
 */
public record TraceEvent(String name, int depth, int position, String preview, boolean matched, String detail) {

    public String format() {
        return "  ".repeat(depth)
               + name
               + " @" + position
               + " '" + preview.replace("\n", "\\n") + "'"
               + (matched ? " matched '" + detail + "'" : " failed: " + detail);
    }
}
