package org.pragmatica.parsec.parser;

import org.pragmatica.parsec.error.ParseError;
import org.pragmatica.parsec.lang.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide debug trace of parser invocations.
 *
 * <p>When enabled, every {@link Parser#parse(Input)} call logs the parser name and an input
 * preview on entry and success or failure on exit, indented by nesting depth. Output goes to
 * this class's logger at DEBUG. Tracing never changes parse results.
 */
public final class ParserTrace {
    private static final Logger log = LoggerFactory.getLogger(ParserTrace.class);
    private static final int PREVIEW_LENGTH = 20;

    private static volatile boolean enabled;
    private static int depth;

    private ParserTrace() {}

    public static void enable() {
        enabled = true;
        depth = 0;
    }

    public static void disable() {
        enabled = false;
        depth = 0;
    }

    public static boolean isEnabled() {
        return enabled;
    }

    static void enter(String name, Input input) {
        log.debug("{}Trying {} on: {}", indent(), name, input.preview(PREVIEW_LENGTH));
        depth++;
    }

    static void exit(String name, Outcome<?, ParseError> outcome) {
        depth = Math.max(0, depth - 1);
        if (outcome.isSuccess()) {
            log.debug("{}{} succeeded", indent(), name);
        } else {
            log.debug("{}{} failed: {}", indent(), name, outcome.error().message());
        }
    }

    private static String indent() {
        return "  ".repeat(depth);
    }
}
