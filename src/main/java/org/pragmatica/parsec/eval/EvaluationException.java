package org.pragmatica.parsec.eval;

import org.pragmatica.parsec.error.EvalError;

/**
 * Carries a fatal {@link EvalError} out of the recursive evaluator.
 * Never escapes {@link Interpreter}; callers receive the error as a failed outcome.
 */
final class EvaluationException extends RuntimeException {
    private final EvalError error;

    EvaluationException(EvalError error) {
        super(error.message(), null, false, false);
        this.error = error;
    }

    EvalError error() {
        return error;
    }
}
