package org.pragmatica.parsec.eval;

import org.junit.jupiter.api.Test;
import org.pragmatica.parsec.error.EvalError;
import org.pragmatica.parsec.grammar.LanguageGrammar;
import org.pragmatica.parsec.lang.Outcome;
import org.pragmatica.parsec.tree.Expression.BinaryExpression;
import org.pragmatica.parsec.tree.Expression.Identifier;
import org.pragmatica.parsec.tree.Expression.NumberLiteral;
import org.pragmatica.parsec.tree.Statement.Return;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InterpreterTest {

    private static final LanguageGrammar GRAMMAR = LanguageGrammar.create();

    private final List<String> output = new ArrayList<>();
    private final Interpreter interpreter = Interpreter.create(InterpreterConfig.DEFAULT.withOutput(output::add));

    private Outcome<Integer, EvalError> evaluate(String expression) {
        return interpreter.evaluate(GRAMMAR.parseExpression(expression).unwrap());
    }

    private Outcome<Optional<Integer>, EvalError> run(String program) {
        return interpreter.run(GRAMMAR.parseProgram(program).unwrap());
    }

    private int result(String program) {
        return run(program).unwrap().orElseThrow();
    }

    // === Arithmetic ===

    @Test
    void arithmetic_followsPrecedence() {
        assertEquals(14, evaluate("2 + 3 * 4").unwrap());
        assertEquals(20, evaluate("(2 + 3) * 4").unwrap());
        assertEquals(5, evaluate("10 - 3 - 2").unwrap());
        assertEquals(3, evaluate("24 / 4 / 2").unwrap());
    }

    @Test
    void unaryMinus_negatesOperand() {
        assertEquals(3, evaluate("- - 3").unwrap());
        assertEquals(-6, evaluate("-3 * 2").unwrap());
        assertEquals(4, evaluate("1 - -3").unwrap());
    }

    @Test
    void division_truncatesTowardZero() {
        assertEquals(3, evaluate("7 / 2").unwrap());
        assertEquals(-3, evaluate("-7 / 2").unwrap());
    }

    @Test
    void division_byZero_isFatal() {
        assertEquals(new EvalError.DivisionByZero("(1 / (2 - 2))"), evaluate("1 / (2 - 2)").error());
    }

    @Test
    void addition_overflow_wrapsAround() {
        assertEquals(Integer.MIN_VALUE, evaluate("2147483647 + 1").unwrap());
    }

    @Test
    void comparisons_produceOneOrZero() {
        assertEquals(1, evaluate("3 < 4").unwrap());
        assertEquals(0, evaluate("3 > 4").unwrap());
        assertEquals(1, evaluate("4 <= 4").unwrap());
        assertEquals(0, evaluate("3 >= 4").unwrap());
        assertEquals(1, evaluate("2 + 2 == 4").unwrap());
        assertEquals(0, evaluate("2 + 2 != 4").unwrap());
    }

    @Test
    void unknownOperator_isFatal() {
        var expression = new BinaryExpression(new NumberLiteral(1), "%", new NumberLiteral(2));

        assertEquals(new EvalError.UnknownOperator("%"), interpreter.evaluate(expression).error());
    }

    // === Name resolution ===

    @Test
    void undefinedVariable_andUndefinedFunction_areDistinct() {
        assertEquals(new EvalError.UndefinedVariable("x"), evaluate("x + 1").error());
        assertEquals(new EvalError.UndefinedFunction("f"), evaluate("f(1)").error());
    }

    @Test
    void call_onNonIdentifier_isInvalidCallee() {
        assertEquals(new EvalError.InvalidCallee("(1 + 2)"), evaluate("(1 + 2)(3)").error());
    }

    @Test
    void evaluate_withEnvironment_readsBindings() {
        var environment = Environment.root();
        environment.assign("x", 6);

        var outcome = interpreter.evaluate(GRAMMAR.parseExpression("x * 7").unwrap(), FunctionTable.EMPTY, environment);

        assertEquals(42, outcome.unwrap());
    }

    @Test
    void execute_return_completesWithValue() {
        var completion = interpreter.execute(new Return(new NumberLiteral(3)), FunctionTable.EMPTY, Environment.root())
                                    .unwrap();

        assertEquals(Completion.returning(3), completion);
    }

    // === Calls ===

    @Test
    void run_recursiveFactorial_returnsValue() {
        assertEquals(120, result("""
            fn fact(n) {
                if n {
                    return n * fact(n - 1);
                } else {
                    return 1;
                }
            }
            fn main() { return fact(5); }
            """));
    }

    @Test
    void run_mainWithoutReturn_yieldsNoValue() {
        assertEquals(Optional.empty(), run("fn main() { x = 1; }").unwrap());
    }

    @Test
    void run_missingEntryPoint_isUndefinedFunction() {
        assertEquals(new EvalError.UndefinedFunction("main"), run("fn other() { return 1; }").error());
    }

    @Test
    void run_redeclaredFunction_usesLastDeclaration() {
        assertEquals(2, result("""
            fn pick() { return 1; }
            fn pick() { return 2; }
            fn main() { return pick(); }
            """));
    }

    @Test
    void call_wrongArgumentCount_isArityMismatch() {
        var error = run("""
            fn add(a, b) { return a + b; }
            fn main() { return add(1); }
            """).error();

        assertEquals(new EvalError.ArityMismatch("add", 2, 1), error);
    }

    @Test
    void call_duplicateParameter_isRejectedBeforeRunning() {
        var error = run("""
            fn add(a, a) { return a; }
            fn main() { print(1); return 0; }
            """).error();

        assertEquals(new EvalError.DuplicateParameter("add", "a"), error);
        assertTrue(output.isEmpty());
    }

    @Test
    void call_unboundedRecursion_exceedsDepthLimit() {
        var limited = Interpreter.create(new InterpreterConfig("main", 50, output::add));
        var program = GRAMMAR.parseProgram("""
            fn down(n) { return down(n + 1); }
            fn main() { return down(0); }
            """).unwrap();

        assertEquals(new EvalError.CallDepthExceeded(50), limited.run(program).error());
    }

    @Test
    void call_deepRecursionWithDefaultConfig_failsWithDepthLimit() {
        var program = GRAMMAR.parseProgram(countdown(990)).unwrap();

        var outcome = assertDoesNotThrow(() -> Interpreter.create().run(program));

        assertEquals(new EvalError.CallDepthExceeded(InterpreterConfig.DEFAULT.maxCallDepth()), outcome.error());
    }

    @Test
    void call_recursionBelowDefaultLimit_completes() {
        var program = GRAMMAR.parseProgram(countdown(150)).unwrap();

        assertEquals(Optional.of(150), Interpreter.create().run(program).unwrap());
    }

    @Test
    void call_stackExhaustedBeforeLimit_reportsDepthLimit() {
        var unlimited = Interpreter.create(new InterpreterConfig("main", Integer.MAX_VALUE, output::add));
        var program = GRAMMAR.parseProgram("fn down(n) { return down(n + 1); } fn main() { return down(0); }")
                             .unwrap();

        var outcome = assertDoesNotThrow(() -> unlimited.run(program));

        assertEquals(new EvalError.CallDepthExceeded(Integer.MAX_VALUE), outcome.error());
    }

    private static String countdown(int depth) {
        return "fn down(n) { if n { x = 1 + down(n - 1); return x; } else { return 0; } }"
               + " fn main() { return down(" + depth + "); }";
    }

    @Test
    void call_functionWithoutReturnUsedAsValue_isVoidValue() {
        var error = run("""
            fn nothing() { x = 1; }
            fn main() { return nothing() + 1; }
            """).error();

        assertEquals(new EvalError.VoidValue("nothing()"), error);
    }

    // === Control flow ===

    @Test
    void return_insideNestedLoop_unwindsToCaller() {
        assertEquals(50, result("""
            fn main() {
                i = 0;
                while 1 {
                    i = i + 1;
                    if i == 5 {
                        return i * 10;
                    }
                }
                return 0;
            }
            """));
    }

    @Test
    void return_stopsRemainingStatements() {
        assertEquals(1, result("fn main() { return 1; print(2); return 3; }"));
        assertTrue(output.isEmpty());
    }

    @Test
    void while_loopCarriedVariables_persist() {
        assertEquals(55, result("""
            fn main() {
                i = 1;
                sum = 0;
                while i <= 10 {
                    sum = sum + i;
                    i = i + 1;
                }
                return sum;
            }
            """));
    }

    @Test
    void if_zeroCondition_takesElseBranch() {
        assertEquals(2, result("fn main() { if 0 { return 1; } else { return 2; } }"));
        assertEquals(Optional.empty(), run("fn main() { if 0 { return 1; } }").unwrap());
    }

    // === Scoping ===

    @Test
    void functions_haveIndependentLocals() {
        assertEquals(3, result("""
            fn f() { x = 1; return x; }
            fn g() { x = 2; return f() + x; }
            fn main() { return g(); }
            """));
    }

    @Test
    void callee_seesCallerVariables() {
        assertEquals(7, result("""
            fn show() { return y; }
            fn main() { y = 7; return show(); }
            """));
    }

    @Test
    void callee_writesDoNotReachCaller() {
        assertEquals(1, result("""
            fn bump() { y = 100; return 0; }
            fn main() { y = 1; bump(); return y; }
            """));
    }

    @Test
    void parameter_shadowsCallerVariable() {
        assertEquals(1002, result("""
            fn inc(x) { x = x + 1; return x; }
            fn main() { x = 10; y = inc(1); return x * 100 + y; }
            """));
    }

    @Test
    void block_assignmentToOuterVariable_writesThrough() {
        assertEquals(2, result("fn main() { x = 1; if 1 { x = 2; } return x; }"));
        assertEquals(3, result("fn main() { x = 1; { x = 3; } return x; }"));
    }

    @Test
    void block_newVariable_vanishesOnExit() {
        assertEquals(new EvalError.UndefinedVariable("t"), run("fn main() { if 1 { t = 5; } return t; }").error());
        assertEquals(new EvalError.UndefinedVariable("u"), run("fn main() { { u = 5; } return u; }").error());
    }

    // === print ===

    @Test
    void print_writesOneLinePerCall() {
        var outcome = run("""
            fn main() {
                i = 0;
                while i < 3 {
                    print(i * 10);
                    i = i + 1;
                }
            }
            """);

        assertEquals(Optional.empty(), outcome.unwrap());
        assertEquals(List.of("0", "10", "20"), output);
    }

    @Test
    void print_usedAsValue_isVoidValue() {
        var error = run("fn main() { return 1 + print(2); }").error();

        assertEquals(new EvalError.VoidValue("print(2)"), error);
        assertEquals(List.of("2"), output);
    }

    @Test
    void print_wrongArgumentCount_isArityMismatch() {
        assertEquals(new EvalError.ArityMismatch("print", 1, 2), run("fn main() { print(1, 2); }").error());
        assertTrue(output.isEmpty());
    }

    @Test
    void print_builtin_takesPrecedenceOverUserFunction() {
        run("""
            fn print(x) { return 0; }
            fn main() { print(5); }
            """).unwrap();

        assertEquals(List.of("5"), output);
    }
}
