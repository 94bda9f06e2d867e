package tome.lang;

import static tome.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;

/**
 * Recursive descent parser for tome scripts, with precedence climbing for expressions.
 *
 * <p>A syntax error inside a statement discards the rest of that line and parsing resumes with
 * the next statement of the same node; any other error discards tokens up to the next
 * {@code node} keyword. Errors are collected in {@link #getErrors()} so one pass reports every
 * independent problem.
 *
 * <p>A parser is good for one pass, either {@link #parse()} or {@link #nodes()}.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final Set<Token.Type> COMPARISON = EnumSet.of(
        EQUALS_EQUALS, NOT_EQUALS, GREATER, GREATER_EQUALS, LESS, LESS_EQUALS);

    @AllArgsConstructor
    @Getter
    private static class ParseError extends RuntimeException {
        private final ParserError parserError;
    }

    private final TokenStream tokens;
    private final List<String> sourceLines;

    @Getter
    private final List<ParserError> errors = new ArrayList<>();

    private boolean started = false;

    public Parser(@NonNull Iterator<Token> tokens) {
        this(tokens, null);
    }

    public Parser(@NonNull Iterator<Token> tokens, String source) {
        this.tokens = new TokenStream(tokens);
        this.sourceLines = source != null ? List.of(source.split("\r\n|\r|\n", -1)) : List.of();
    }

    /** Parses the whole program. Never throws for malformed input. */
    public ParseResult parse() {
        var nodes = ImmutableList.<DialogueNode>builder();
        for (var node : nodes()) {
            nodes.add(node);
        }
        var valid = errors.isEmpty();
        LOG.debug("parsed program with {} errors", errors.size());
        return new ParseResult(valid, valid ? new Program(nodes.build()) : null, ImmutableList.copyOf(errors));
    }

    /**
     * Lazily parses one node at a time. The sequence can be iterated once; syntax errors met
     * along the way accumulate in {@link #getErrors()}.
     */
    public Iterable<DialogueNode> nodes() {
        if (started) {
            throw new IllegalStateException("parser has already been used");
        }
        started = true;
        var iterator = new NodeIterator();
        return () -> iterator;
    }

    private final class NodeIterator implements Iterator<DialogueNode> {
        private DialogueNode next;

        @Override
        public boolean hasNext() {
            while (next == null) {
                skipNewlines();
                if (isAtEnd()) {
                    return false;
                }
                try {
                    next = node();
                } catch (ParseError ex) {
                    errors.add(ex.getParserError());
                    synchronize();
                }
            }
            return true;
        }

        @Override
        public DialogueNode next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            var node = next;
            next = null;
            return node;
        }
    }

    //// grammar rules ////

    /**
     * <pre>
     *  node        :: NODE IDENTIFIER NEWLINE ( INDENT statement* DEDENT )? END
     * </pre>
     */
    private DialogueNode node() {
        consume(NODE, "Expected 'node' keyword at the beginning of a node");
        var name = consume(IDENTIFIER, "Expected node identifier");
        consume(NEWLINE, "Expected newline after node declaration");
        skipNewlines();

        var statements = ImmutableList.<Statement>builder();
        if (match(INDENT)) {
            while (!check(DEDENT) && !check(END) && !isAtEnd()) {
                skipNewlines();
                if (check(DEDENT) || check(END) || isAtEnd()) {
                    break;
                }
                try {
                    statements.add(statement());
                } catch (ParseError ex) {
                    errors.add(ex.getParserError());
                    synchronizeStatement();
                }
            }
            match(DEDENT);
            skipNewlines();
        }
        consume(END, "Expected 'end' keyword to close node");

        return new DialogueNode(name.text(), statements.build(), name.line(), name.column());
    }

    /**
     * <pre>
     *  statement   :: assignment | say | choice | goto
     * </pre>
     */
    private Statement statement() {
        var token = peek();
        switch (token.type()) {
        case AT_SIGN:
            return assignment();
        case SAY:
            return say();
        case CHOICE:
            return choice();
        case GOTO:
            return jump();
        case INDENT:
            throw error(token, "Unexpected indentation");
        default:
            throw error(token, "Unexpected token '" + token.describe()
                + "'. Expected one of: @variable (assignment), say, choice, goto");
        }
    }

    /**
     * <pre>
     *  assignment  :: "@" IDENTIFIER ( "=" | "+=" | "-=" | "*=" | "/=" ) expression NEWLINE
     * </pre>
     */
    private Statement.Assignment assignment() {
        consume(AT_SIGN, "Expected '@' at the beginning of variable");
        var variable = consume(IDENTIFIER, "Expected variable name");
        var operator = peek();
        if (!operator.type().isAssignment()) {
            throw error(operator, "Invalid assignment operator '" + operator.describe()
                + "'. Expected one of: =, +=, -=, *=, /=");
        }
        advance();
        var value = expression();
        consume(NEWLINE, "Expected newline after assignment statement");
        return new Statement.Assignment(variable.text(), operator.text(), value, variable.line(), variable.column());
    }

    /**
     * <pre>
     *  say         :: SAY ( STRING | "#{" expression "}" )+ NEWLINE
     * </pre>
     */
    private Statement.Say say() {
        var keyword = consume(SAY, "Expected 'say' keyword");

        var text = new StringBuilder();
        var interpolations = ImmutableList.<Interpolation>builder();
        var parts = 0;
        while (match(STRING, INTERPOLATION_START)) {
            parts++;
            if (previous().type() == STRING) {
                text.append(previous().text());
            } else {
                var expression = expression();
                consume(INTERPOLATION_END, "Expected '}' to close interpolation");
                var start = text.length();
                text.append(Interpolation.PLACEHOLDER);
                interpolations.add(new Interpolation(expression, start, text.length()));
            }
        }
        if (parts == 0) {
            throw error(peek(), "Expected string after 'say' keyword");
        }
        consume(NEWLINE, "Expected newline after say statement");

        return new Statement.Say(text.toString(), interpolations.build(), keyword.line(), keyword.column());
    }

    /**
     * <pre>
     *  choice      :: CHOICE STRING "," ":" IDENTIFIER ( "," IF ":" expression )? NEWLINE
     * </pre>
     */
    private Statement.Choice choice() {
        consume(CHOICE, "Expected 'choice' keyword");
        var text = consume(STRING, "Expected choice text");
        consume(COMMA, "Expected ',' after choice text");
        var colon = consume(COLON, "Expected ':' before target node identifier");
        var target = target();

        Expression condition = null;
        if (match(COMMA)) {
            consume(IF, "Expected 'if' keyword for choice condition");
            consume(COLON, "Expected ':' after 'if' keyword");
            condition = expression();
        }
        consume(NEWLINE, "Expected newline after choice statement");

        return new Statement.Choice(text.text(), target.text(), condition,
            colon.line(), colon.column(), text.line(), text.column());
    }

    /**
     * <pre>
     *  goto        :: GOTO ":" IDENTIFIER NEWLINE
     * </pre>
     */
    private Statement.Goto jump() {
        consume(GOTO, "Expected 'goto' keyword");
        var colon = consume(COLON, "Expected ':' before node identifier");
        var target = target();
        consume(NEWLINE, "Expected newline after goto statement");
        return new Statement.Goto(target.text(), colon.line(), colon.column());
    }

    private Token target() {
        var target = peek();
        if (target.type() != IDENTIFIER) {
            var hint = target.isKeyword()
                ? " (Note: '" + target.text() + "' is a keyword, use a different node name)"
                : "";
            throw error(target, "Expected target node identifier after ':'" + hint);
        }
        return advance();
    }

    /**
     * <pre>
     *  expression  :: logicalOr
     * </pre>
     */
    private Expression expression() {
        return logicalOr();
    }

    /**
     * <pre>
     *  logicalOr   :: logicalAnd ( "||" logicalAnd )*
     * </pre>
     */
    private Expression logicalOr() {
        var expr = logicalAnd();
        while (match(OR)) {
            var operator = previous();
            expr = binary(expr, operator, logicalAnd());
        }
        return expr;
    }

    /**
     * <pre>
     *  logicalAnd  :: comparison ( "&&" comparison )*
     * </pre>
     */
    private Expression logicalAnd() {
        var expr = comparison();
        while (match(AND)) {
            var operator = previous();
            expr = binary(expr, operator, comparison());
        }
        return expr;
    }

    /**
     * Left associative, so {@code 1 < 2 == true} is {@code (1 < 2) == true}.
     *
     * <pre>
     *  comparison  :: term ( ( "==" | "!=" | ">" | ">=" | "<" | "<=" ) term )*
     * </pre>
     */
    private Expression comparison() {
        var expr = term();
        while (COMPARISON.contains(peek().type())) {
            var operator = advance();
            expr = binary(expr, operator, term());
        }
        return expr;
    }

    /**
     * <pre>
     *  term        :: factor ( ( "+" | "-" ) factor )*
     * </pre>
     */
    private Expression term() {
        var expr = factor();
        while (match(PLUS, MINUS)) {
            var operator = previous();
            expr = binary(expr, operator, factor());
        }
        return expr;
    }

    /**
     * <pre>
     *  factor      :: unary ( ( "*" | "/" ) unary )*
     * </pre>
     */
    private Expression factor() {
        var expr = unary();
        while (match(STAR, SLASH)) {
            var operator = previous();
            expr = binary(expr, operator, unary());
        }
        return expr;
    }

    /**
     * <pre>
     *  unary       :: ( "!" | "-" ) unary | primary
     * </pre>
     */
    private Expression unary() {
        if (match(NOT, MINUS)) {
            var operator = previous();
            var operand = unary();
            return new Expression.UnaryOp(operator.text(), operand,
                operator.line(), operator.column(), endColumn(operand));
        }
        return primary();
    }

    /**
     * <pre>
     *  primary     :: NUMBER | STRING | TRUE | FALSE
     *              | "@" IDENTIFIER
     *              | IDENTIFIER "(" ( expression ( "," expression )* )? ")"
     *              | "(" expression ")"
     * </pre>
     */
    private Expression primary() {
        if (match(TRUE, FALSE, NUMBER, STRING)) {
            var token = previous();
            Object value;
            switch (token.type()) {
            case TRUE:
                value = Boolean.TRUE;
                break;
            case FALSE:
                value = Boolean.FALSE;
                break;
            default:
                value = token.value();
            }
            return new Expression.Literal(value, token.line(), token.column(), token.endColumn());
        }
        if (match(AT_SIGN)) {
            var at = previous();
            var name = consume(IDENTIFIER, "Expected variable name after '@'");
            return new Expression.Variable(name.text(), at.line(), at.column(), name.endColumn());
        }
        if (check(IDENTIFIER) && peekNext().type() == LEFT_PAREN) {
            return call();
        }
        if (match(LEFT_PAREN)) {
            var open = previous();
            var expression = expression();
            var close = consume(RIGHT_PAREN, "Expected ')' after expression");
            return widen(expression, open, close);
        }
        throw error(peek(), "Expected an expression, got '" + peek().describe()
            + "'. Valid expressions: variable (@name), number, string, true/false, function call,"
            + " parenthesized expression");
    }

    private Expression call() {
        var name = consume(IDENTIFIER, "Expected function name");
        consume(LEFT_PAREN, "Expected '(' after function name");
        var args = ImmutableList.<Expression>builder();
        if (!check(RIGHT_PAREN)) {
            args.add(expression());
            while (match(COMMA)) {
                if (check(RIGHT_PAREN)) {
                    throw error(peek(), "Expected expression after ',' in function arguments");
                }
                args.add(expression());
            }
        }
        var close = consume(RIGHT_PAREN, "Expected ')' after function arguments");
        return new Expression.FunctionCall(name.text(), args.build(),
            name.line(), name.column(), close.endColumn());
    }

    //// utility methods ////

    /** The same expression, spanning its enclosing parentheses. */
    private static Expression widen(Expression expression, Token open, Token close) {
        int line = open.line();
        int column = open.column();
        int end = close.endColumn();
        if (expression instanceof Expression.Literal e) {
            return new Expression.Literal(e.value(), line, column, end);
        } else if (expression instanceof Expression.Variable e) {
            return new Expression.Variable(e.name(), line, column, end);
        } else if (expression instanceof Expression.BinaryOp e) {
            return new Expression.BinaryOp(e.operator(), e.left(), e.right(), line, column, end);
        } else if (expression instanceof Expression.UnaryOp e) {
            return new Expression.UnaryOp(e.operator(), e.operand(), line, column, end);
        } else if (expression instanceof Expression.FunctionCall e) {
            return new Expression.FunctionCall(e.name(), e.args(), line, column, end);
        }
        throw new IllegalArgumentException("unknown expression " + expression);
    }

    private static Expression binary(Expression left, Token operator, Expression right) {
        return new Expression.BinaryOp(operator.text(), left, right,
            left.line(), left.column(), endColumn(right));
    }

    private static int endColumn(Expression expression) {
        return expression.endColumn();
    }

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return advance();
        }

        var token = peek();
        var hint = "";
        if (type == COLON && token.type() == IDENTIFIER) {
            hint = ". Did you forget ':' before the node name?";
        } else if (type == COMMA && token.type() == COLON) {
            hint = ". Did you forget ',' between parameters?";
        } else if (type == IDENTIFIER && token.isKeyword()) {
            hint = ". '" + token.text() + "' is a keyword and cannot be used as an identifier";
        } else if (type == NEWLINE) {
            hint = ". Got '" + token.describe() + "' instead. Check for missing operators or extra text";
        } else if (token.type() != EOF) {
            hint = ", got '" + token.describe() + "'";
        }
        throw error(token, message + hint);
    }

    private ParseError error(Token token, String message) {
        var line = token.line();
        var sourceLine = line >= 1 && line <= sourceLines.size() ? sourceLines.get(line - 1) : null;
        return new ParseError(new ParserError(message, line, token.column(), sourceLine));
    }

    /** Discards tokens up to the next {@code node} keyword. */
    private void synchronize() {
        while (!isAtEnd() && !check(NODE)) {
            advance();
        }
    }

    /**
     * Discards the rest of the current line, including a nested indented block, and the
     * newline ending it.
     */
    private void synchronizeStatement() {
        var depth = 0;
        while (!isAtEnd()) {
            var token = advance();
            if (token.type() == INDENT) {
                depth++;
            } else if (token.type() == DEDENT) {
                depth--;
                if (depth <= 0 && !check(INDENT)) {
                    if (depth < 0) {
                        // the block we were in has ended
                        return;
                    }
                    if (!check(NEWLINE)) {
                        return;
                    }
                }
            } else if (token.type() == NEWLINE && depth == 0 && !check(INDENT)) {
                return;
            }
        }
    }

    private void skipNewlines() {
        while (check(NEWLINE)) {
            advance();
        }
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(Token.Type type) {
        return peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }

    private Token previous() {
        return tokens.previous();
    }
}
