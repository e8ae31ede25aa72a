package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.trace.Tracer;

import java.util.Objects;

/**
 * Per-run configuration.
 */
public record RunConfig(
    Whitespace whitespace,
    Tracer tracer
) {
    public static final RunConfig DEFAULT = new RunConfig(
        Whitespace.UNICODE,
        Tracer.NONE
    );

    public RunConfig {
        Objects.requireNonNull(whitespace, "whitespace");
        Objects.requireNonNull(tracer, "tracer");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Whitespace whitespace = Whitespace.UNICODE;
        private Tracer tracer = Tracer.NONE;

        private Builder() {}

        public Builder whitespace(Whitespace whitespace) {
            this.whitespace = whitespace;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public RunConfig build() {
            return new RunConfig(whitespace, tracer);
        }
    }
}
