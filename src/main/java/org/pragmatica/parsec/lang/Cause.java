package org.pragmatica.parsec.lang;

/**
 * Error description carried by a failed {@link Outcome}.
 */
public interface Cause {
    String message();
}
