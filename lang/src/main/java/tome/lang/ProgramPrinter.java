package tome.lang;

import java.util.stream.Collectors;

/**
 * Renders a {@link Program} back to canonical source: two-space indentation, one blank line
 * between nodes, nested operators parenthesized. Parsing the output yields the same tree apart from
 * source positions.
 */
public final class ProgramPrinter implements Statement.Visitor<String>, Expression.Visitor<String> {

    private static final String INDENT = "  ";

    public String print(Program program) {
        return program.nodes().stream()
            .map(this::print)
            .collect(Collectors.joining("\n"));
    }

    public String print(DialogueNode node) {
        var out = new StringBuilder();
        out.append("node ").append(node.id()).append('\n');
        for (var statement : node.statements()) {
            out.append(INDENT).append(statement.accept(this)).append('\n');
        }
        out.append("end\n");
        return out.toString();
    }

    public String print(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public String visitAssignmentStatement(Statement.Assignment statement) {
        return "@" + statement.variable() + " " + statement.operator() + " " + print(statement.value());
    }

    @Override
    public String visitSayStatement(Statement.Say statement) {
        var text = statement.text();
        var out = new StringBuilder("say \"");
        var position = 0;
        for (var interpolation : statement.interpolations()) {
            out.append(escape(text.substring(position, interpolation.start())));
            out.append("#{").append(print(interpolation.expression())).append('}');
            position = interpolation.end();
        }
        out.append(escape(text.substring(position))).append('"');
        return out.toString();
    }

    @Override
    public String visitChoiceStatement(Statement.Choice statement) {
        var out = new StringBuilder();
        out.append("choice \"").append(escape(statement.text())).append("\", :").append(statement.target());
        statement.getCondition().ifPresent(condition -> out.append(", if: ").append(print(condition)));
        return out.toString();
    }

    @Override
    public String visitGotoStatement(Statement.Goto statement) {
        return "goto :" + statement.target();
    }

    @Override
    public String visitLiteralExpression(Expression.Literal expression) {
        var value = expression.value();
        if (value instanceof Double number) {
            return Literals.formatNumber(number);
        }
        if (value instanceof String string) {
            return '"' + escape(string) + '"';
        }
        return String.valueOf(value);
    }

    @Override
    public String visitVariableExpression(Expression.Variable expression) {
        return "@" + expression.name();
    }

    @Override
    public String visitBinaryOpExpression(Expression.BinaryOp expression) {
        return operand(expression.left()) + " " + expression.operator() + " " + operand(expression.right());
    }

    @Override
    public String visitUnaryOpExpression(Expression.UnaryOp expression) {
        return expression.operator() + operand(expression.operand());
    }

    @Override
    public String visitFunctionCallExpression(Expression.FunctionCall expression) {
        return expression.name() + "(" + expression.args().stream()
            .map(this::print)
            .collect(Collectors.joining(", ")) + ")";
    }

    private String operand(Expression expression) {
        if (expression instanceof Expression.BinaryOp || expression instanceof Expression.UnaryOp) {
            return "(" + print(expression) + ")";
        }
        return print(expression);
    }

    private static String escape(String text) {
        var out = new StringBuilder();
        for (var i = 0; i < text.length(); i++) {
            var c = text.charAt(i);
            switch (c) {
            case '"':
                out.append("\\\"");
                break;
            case '\\':
                out.append("\\\\");
                break;
            case '\n':
                out.append("\\n");
                break;
            case '\t':
                out.append("\\t");
                break;
            case '\r':
                out.append("\\r");
                break;
            default:
                out.append(c);
            }
        }
        return out.toString();
    }
}
