package org.pragmatica.parsec.error;

import org.pragmatica.parsec.lang.Cause;

/**
 * Fatal evaluation errors. Any of them aborts the whole run.
 */
public sealed interface EvalError extends Cause {

    record UndefinedVariable(String name) implements EvalError {
        @Override
        public String message() {
            return "Undefined variable '" + name + "'";
        }
    }

    record UndefinedFunction(String name) implements EvalError {
        @Override
        public String message() {
            return "Undefined function '" + name + "'";
        }
    }

    /**
     * Only a bare function name can be called.
     */
    record InvalidCallee(String callee) implements EvalError {
        @Override
        public String message() {
            return "Invalid callee '" + callee + "', expected a function name";
        }
    }

    record UnknownOperator(String operator) implements EvalError {
        @Override
        public String message() {
            return "Unknown operator '" + operator + "'";
        }
    }

    record DivisionByZero(String expression) implements EvalError {
        @Override
        public String message() {
            return "Division by zero in " + expression;
        }
    }

    /**
     * A call that produced no value (print, or a function without return) was used as an integer.
     */
    record VoidValue(String call) implements EvalError {
        @Override
        public String message() {
            return "Call " + call + " produces no value, but an integer is required";
        }
    }

    record ArityMismatch(String function, int expected, int actual) implements EvalError {
        @Override
        public String message() {
            return "Function '" + function + "' expects " + expected + " argument(s), got " + actual;
        }
    }

    record DuplicateParameter(String function, String parameter) implements EvalError {
        @Override
        public String message() {
            return "Function '" + function + "' declares parameter '" + parameter + "' more than once";
        }
    }

    record CallDepthExceeded(int limit) implements EvalError {
        @Override
        public String message() {
            return "Call depth exceeded the limit of " + limit;
        }
    }
}
