package org.pragmatica.parsec.grammar;

import org.pragmatica.parsec.error.ParseError;
import org.pragmatica.parsec.lang.Outcome;
import org.pragmatica.parsec.lang.Pair;
import org.pragmatica.parsec.parser.Input;
import org.pragmatica.parsec.parser.Parsed;
import org.pragmatica.parsec.parser.Parser;
import org.pragmatica.parsec.tree.Expression;
import org.pragmatica.parsec.tree.Expression.BinaryExpression;
import org.pragmatica.parsec.tree.Expression.CallExpression;
import org.pragmatica.parsec.tree.Expression.NumberLiteral;
import org.pragmatica.parsec.tree.FunctionDeclaration;
import org.pragmatica.parsec.tree.Program;
import org.pragmatica.parsec.tree.Statement;
import org.pragmatica.parsec.tree.Statement.Block;
import org.pragmatica.parsec.tree.Statement.ExpressionStatement;
import org.pragmatica.parsec.tree.Statement.If;
import org.pragmatica.parsec.tree.Statement.Return;
import org.pragmatica.parsec.tree.Statement.VarSet;
import org.pragmatica.parsec.tree.Statement.While;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.pragmatica.parsec.grammar.Tokens.identifier;
import static org.pragmatica.parsec.grammar.Tokens.keyword;
import static org.pragmatica.parsec.grammar.Tokens.token;

/**
 * Grammar of the language, built from parser combinators.
 *
 * <pre>
 * Program     &lt;- Function* EOF
 * Function    &lt;- 'fn' Identifier '(' (Identifier (',' Identifier)*)? ')' Block
 * Block       &lt;- '{' Statement* '}'
 * Statement   &lt;- 'return' Expression ';'
 *              / 'if' Expression Block ('else' Block)? ';'?
 *              / 'while' Expression Block ';'?
 *              / Block ';'?
 *              / Identifier '=' Expression ';'
 *              / Expression ';'
 * Expression  &lt;- Sum (('==' / '!=' / '&lt;=' / '&gt;=' / '&lt;' / '&gt;') Sum)*
 * Sum         &lt;- Product (('+' / '-') Product)*
 * Product     &lt;- Unary (('*' / '/') Unary)*
 * Unary       &lt;- '-'* Call
 * Call        &lt;- Atom ('(' (Expression (',' Expression)*)? ')')?
 * Atom        &lt;- Number / Identifier / '(' Expression ')'
 * </pre>
 *
 * <p>Binary operators are left-associative. Unary minus applies to a call or atom only,
 * so {@code -2 * 2} is {@code (-2) * 2}.
 */
public final class LanguageGrammar {
    private final Parser<Expression> expression;
    private final Parser<Block> block;
    private final Parser<Statement> statement;
    private final Parser<FunctionDeclaration> functionDeclaration;
    private final Parser<Program> program;

    private LanguageGrammar() {
        expression = Parser.recursive(LanguageGrammar::expressionRule);
        block = Parser.recursive(self -> token("{").ignoreThen(statementRule(expression, self).repeatedUntil(token("}")))
                                                   .map(Block::new)
                                                   .label("block"));
        statement = statementRule(expression, block);
        functionDeclaration = keyword("fn").ignoreThen(identifier())
                                           .then(identifier().sepBy(token(","))
                                                             .between(token("("), token(")")))
                                           .then(block)
                                           .map(parts -> new FunctionDeclaration(parts.first().first(),
                                                                                 parts.first().second(),
                                                                                 parts.second()))
                                           .label("function");
        program = functionDeclaration.repeatedUntil(Parser.whitespace().eof())
                                     .map(Program::new)
                                     .label("program");
    }

    public static LanguageGrammar create() {
        return new LanguageGrammar();
    }

    public Parser<Expression> expression() {
        return expression;
    }

    public Parser<Block> block() {
        return block;
    }

    public Parser<Statement> statement() {
        return statement;
    }

    public Parser<FunctionDeclaration> functionDeclaration() {
        return functionDeclaration;
    }

    public Parser<Program> program() {
        return program;
    }

    /**
     * Parse a whole program. The entire input must be consumed.
     */
    public Outcome<Program, ParseError> parseProgram(String source) {
        return guarded(source, "Program nested too deeply", () -> program.parse(source));
    }

    /**
     * Parse a single expression. The entire input, apart from trailing whitespace, must be consumed.
     */
    public Outcome<Expression, ParseError> parseExpression(String source) {
        return guarded(source,
                       "Expression nested too deeply",
                       () -> expression.thenIgnore(Parser.whitespace())
                                       .eof()
                                       .parse(source));
    }

    /**
     * Nesting deep enough to exhaust the JVM stack is reported as a failure at the start of the source.
     */
    private static <T> Outcome<T, ParseError> guarded(String source,
                                                      String reason,
                                                      Supplier<Outcome<Parsed<T>, ParseError>> parsing) {
        try {
            return parsing.get()
                          .map(Parsed::value);
        } catch (StackOverflowError e) {
            return Outcome.failure(ParseError.semantic(Input.of(source), reason));
        }
    }

    // === Expressions ===

    private static Parser<Expression> expressionRule(Parser<Expression> self) {
        var number = Parser.number()
                           .padded()
                           .<Expression>map(NumberLiteral::new)
                           .label("number");
        var parenthesized = self.between(token("("), token(")"));
        var atom = Parser.<Expression>choice(number, identifier(), parenthesized)
                         .label("atom");

        var arguments = self.sepBy(token(","))
                            .between(token("("), token(")"));
        var call = atom.then(arguments.orNot())
                       .map(LanguageGrammar::toCall)
                       .label("call");

        var unary = token("-").repeated()
                              .then(call)
                              .map(LanguageGrammar::negate)
                              .label("unary");

        var product = leftAssociative(unary, Parser.choice(token("*"), token("/")), "product");
        var sum = leftAssociative(product, Parser.choice(token("+"), token("-")), "sum");

        return leftAssociative(sum,
                               Parser.choice(token("=="), token("!="), token("<="), token(">="), token("<"), token(">")),
                               "comparison");
    }

    private static Expression toCall(Pair<Expression, Optional<List<Expression>>> parts) {
        return parts.second()
                    .<Expression>map(arguments -> new CallExpression(parts.first(), arguments))
                    .orElse(parts.first());
    }

    /**
     * An odd number of minus signs becomes a multiplication by -1; an even number cancels out.
     */
    private static Expression negate(Pair<List<String>, Expression> parts) {
        return parts.first().size() % 2 == 0
               ? parts.second()
               : new BinaryExpression(new NumberLiteral(-1), "*", parts.second());
    }

    private static Parser<Expression> leftAssociative(Parser<Expression> operand, Parser<String> operator, String name) {
        return operand.then(operator.then(operand).repeated())
                      .map(LanguageGrammar::foldLeft)
                      .label(name);
    }

    private static Expression foldLeft(Pair<Expression, List<Pair<String, Expression>>> chain) {
        var result = chain.first();
        for (var link : chain.second()) {
            result = new BinaryExpression(result, link.first(), link.second());
        }
        return result;
    }

    // === Statements ===

    private static Parser<Statement> statementRule(Parser<Expression> expression, Parser<Block> block) {
        var semicolon = token(";");
        var optionalSemicolon = semicolon.orNot();

        var returnStatement = keyword("return").ignoreThen(expression)
                                               .map(Return::new);
        var ifStatement = keyword("if").ignoreThen(expression)
                                       .then(block)
                                       .then(keyword("else").ignoreThen(block).orNot())
                                       .map(parts -> new If(parts.first().first(),
                                                            parts.first().second(),
                                                            parts.second().orElse(Block.EMPTY)));
        var whileStatement = keyword("while").ignoreThen(expression)
                                             .then(block)
                                             .map(parts -> new While(parts.first(), parts.second()));
        var assignment = identifier().thenIgnore(token("="))
                                     .then(expression)
                                     .map(parts -> new VarSet(parts.first(), parts.second()));
        var expressionStatement = expression.map(ExpressionStatement::new);

        return Parser.<Statement>choice(returnStatement.thenIgnore(semicolon),
                                        ifStatement.thenIgnore(optionalSemicolon),
                                        whileStatement.thenIgnore(optionalSemicolon),
                                        block.thenIgnore(optionalSemicolon),
                                        assignment.thenIgnore(semicolon),
                                        expressionStatement.thenIgnore(semicolon))
                     .label("statement");
    }
}
