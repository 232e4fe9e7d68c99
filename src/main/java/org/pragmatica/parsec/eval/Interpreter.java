package org.pragmatica.parsec.eval;

import org.pragmatica.parsec.error.EvalError;
import org.pragmatica.parsec.lang.Outcome;
import org.pragmatica.parsec.tree.Expression;
import org.pragmatica.parsec.tree.Expression.BinaryExpression;
import org.pragmatica.parsec.tree.Expression.CallExpression;
import org.pragmatica.parsec.tree.Expression.Identifier;
import org.pragmatica.parsec.tree.Expression.NumberLiteral;
import org.pragmatica.parsec.tree.Program;
import org.pragmatica.parsec.tree.Statement;
import org.pragmatica.parsec.tree.Statement.Block;
import org.pragmatica.parsec.tree.Statement.ExpressionStatement;
import org.pragmatica.parsec.tree.Statement.If;
import org.pragmatica.parsec.tree.Statement.Return;
import org.pragmatica.parsec.tree.Statement.VarSet;
import org.pragmatica.parsec.tree.Statement.While;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Tree-walking interpreter.
 *
 * <p>Scoping:
 * <ul>
 *   <li>a call runs in a snapshot of the caller's visible variables with the parameters bound on top;
 *       the callee can read caller variables but its writes never reach the caller</li>
 *   <li>a block ({@code if}/{@code while} body, nested block) runs in a child scope; assigning an
 *       existing outer variable updates it, new variables disappear when the block exits</li>
 * </ul>
 *
 * <p>{@code return} unwinds as a {@link Completion.Returning} up to the enclosing call.
 * Fatal errors abort the run and are reported as a failed {@link Outcome}.
 */
public final class Interpreter {
    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);
    private static final Identifier PRINT = new Identifier("print");

    private final InterpreterConfig config;

    private Interpreter(InterpreterConfig config) {
        this.config = config;
    }

    public static Interpreter create() {
        return create(InterpreterConfig.DEFAULT);
    }

    public static Interpreter create(InterpreterConfig config) {
        return new Interpreter(config);
    }

    /**
     * Register the program's functions and invoke the entry function.
     *
     * @return the entry function's return value, empty if it finished without {@code return}
     */
    public Outcome<Optional<Integer>, EvalError> run(Program program) {
        return FunctionTable.register(program.functions())
                            .flatMap(this::runEntryPoint);
    }

    private Outcome<Optional<Integer>, EvalError> runEntryPoint(FunctionTable functions) {
        var entry = new CallExpression(new Identifier(config.entryPoint()), List.of());
        log.debug("Registered functions {}, invoking {}", functions.names(), entry);

        var outcome = guarded(() -> new Evaluation(functions).call(entry, Environment.root()));
        log.debug("{} finished: {}", entry, outcome);
        return outcome;
    }

    /**
     * Evaluate a standalone expression with no variables and no user functions.
     */
    public Outcome<Integer, EvalError> evaluate(Expression expression) {
        return evaluate(expression, FunctionTable.EMPTY, Environment.root());
    }

    public Outcome<Integer, EvalError> evaluate(Expression expression, FunctionTable functions, Environment environment) {
        return guarded(() -> new Evaluation(functions).value(expression, environment));
    }

    /**
     * Execute a single statement in the given environment.
     */
    public Outcome<Completion, EvalError> execute(Statement statement, FunctionTable functions, Environment environment) {
        return guarded(() -> new Evaluation(functions).execute(statement, environment));
    }

    /**
     * Run an evaluation, turning fatal errors into a failed outcome. Running out of JVM stack
     * before {@link InterpreterConfig#maxCallDepth()} is reached is reported as exceeding the call depth.
     */
    private <T> Outcome<T, EvalError> guarded(Supplier<T> evaluation) {
        try {
            return Outcome.success(evaluation.get());
        } catch (EvaluationException e) {
            log.debug("Evaluation aborted: {}", e.getMessage());
            return Outcome.failure(e.error());
        } catch (StackOverflowError e) {
            log.debug("Evaluation ran out of stack below the call depth limit of {}", config.maxCallDepth());
            return Outcome.failure(new EvalError.CallDepthExceeded(config.maxCallDepth()));
        }
    }

    private static EvaluationException fatal(EvalError error) {
        return new EvaluationException(error);
    }

    /**
     * State of a single run: the function table and the current call depth.
     */
    private final class Evaluation {
        private final FunctionTable functions;
        private int depth;

        private Evaluation(FunctionTable functions) {
            this.functions = functions;
        }

        // === Statements ===

        Completion execute(Statement statement, Environment environment) {
            if (statement instanceof VarSet varSet) {
                environment.assign(varSet.name().name(), value(varSet.rhs(), environment));
                return Completion.NORMAL;
            }
            if (statement instanceof Return ret) {
                return Completion.returning(value(ret.expression(), environment));
            }
            if (statement instanceof ExpressionStatement expressionStatement) {
                evaluate(expressionStatement.expression(), environment);
                return Completion.NORMAL;
            }
            if (statement instanceof Block block) {
                return executeBlock(block, environment.child());
            }
            if (statement instanceof If ifStatement) {
                var branch = isTrue(ifStatement.condition(), environment)
                             ? ifStatement.thenBlock()
                             : ifStatement.elseBlock();
                return executeBlock(branch, environment.child());
            }
            if (statement instanceof While whileStatement) {
                while (isTrue(whileStatement.condition(), environment)) {
                    var completion = executeBlock(whileStatement.block(), environment.child());
                    if (completion.isReturning()) {
                        return completion;
                    }
                }
                return Completion.NORMAL;
            }
            throw new IllegalStateException("Unsupported statement " + statement);
        }

        private Completion executeBlock(Block block, Environment scope) {
            for (var statement : block.statements()) {
                var completion = execute(statement, scope);
                if (completion.isReturning()) {
                    return completion;
                }
            }
            return Completion.NORMAL;
        }

        private boolean isTrue(Expression condition, Environment environment) {
            return value(condition, environment) != 0;
        }

        // === Expressions ===

        /**
         * Evaluate an expression that must produce an integer.
         */
        int value(Expression expression, Environment environment) {
            return evaluate(expression, environment)
                .orElseThrow(() -> fatal(new EvalError.VoidValue(expression.toString())));
        }

        /**
         * Evaluate an expression; only calls can come back empty.
         */
        private Optional<Integer> evaluate(Expression expression, Environment environment) {
            if (expression instanceof NumberLiteral literal) {
                return Optional.of(literal.value());
            }
            if (expression instanceof Identifier identifier) {
                return Optional.of(environment.lookup(identifier.name())
                                              .orElseThrow(() -> fatal(new EvalError.UndefinedVariable(identifier.name()))));
            }
            if (expression instanceof BinaryExpression binary) {
                return Optional.of(binary(binary, environment));
            }
            if (expression instanceof CallExpression call) {
                return call(call, environment);
            }
            throw new IllegalStateException("Unsupported expression " + expression);
        }

        private int binary(BinaryExpression binary, Environment environment) {
            var left = value(binary.left(), environment);
            var right = value(binary.right(), environment);

            return switch (binary.operator()) {
                case "+" -> left + right;
                case "-" -> left - right;
                case "*" -> left * right;
                case "/" -> {
                    if (right == 0) {
                        throw fatal(new EvalError.DivisionByZero(binary.toString()));
                    }
                    yield left / right;
                }
                case "==" -> flag(left == right);
                case "!=" -> flag(left != right);
                case "<" -> flag(left < right);
                case ">" -> flag(left > right);
                case "<=" -> flag(left <= right);
                case ">=" -> flag(left >= right);
                default -> throw fatal(new EvalError.UnknownOperator(binary.operator()));
            };
        }

        private int flag(boolean condition) {
            return condition ? 1 : 0;
        }

        // === Calls ===

        Optional<Integer> call(CallExpression call, Environment environment) {
            if (!(call.callee() instanceof Identifier callee)) {
                throw fatal(new EvalError.InvalidCallee(call.callee().toString()));
            }

            var arguments = new ArrayList<Integer>();
            for (var argument : call.arguments()) {
                arguments.add(value(argument, environment));
            }

            if (callee.equals(PRINT)) {
                return print(arguments);
            }

            var declaration = functions.lookup(callee)
                                       .orElseThrow(() -> fatal(new EvalError.UndefinedFunction(callee.name())));
            if (declaration.arity() != arguments.size()) {
                throw fatal(new EvalError.ArityMismatch(callee.name(), declaration.arity(), arguments.size()));
            }
            if (depth >= config.maxCallDepth()) {
                throw fatal(new EvalError.CallDepthExceeded(config.maxCallDepth()));
            }

            var frame = environment.snapshot();
            for (int i = 0; i < arguments.size(); i++) {
                frame.define(declaration.parameters().get(i).name(), arguments.get(i));
            }

            depth++;
            try {
                var completion = executeBlock(declaration.body(), frame);
                return completion instanceof Completion.Returning returning
                       ? Optional.of(returning.value())
                       : Optional.empty();
            } finally {
                depth--;
            }
        }

        private Optional<Integer> print(List<Integer> arguments) {
            if (arguments.size() != 1) {
                throw fatal(new EvalError.ArityMismatch(PRINT.name(), 1, arguments.size()));
            }
            config.output().accept(Integer.toString(arguments.get(0)));
            return Optional.empty();
        }
    }
}
