package tome.lang;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.IntPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

/**
 * Static analysis over the dialogue graph.
 *
 * <p>Feed every parsed node to {@link #analyzeNode(DialogueNode)}, in source order, then call
 * {@link #finalizeAnalysis()}. Node-local checks run as nodes arrive; program-wide checks run on
 * finalization and are recomputed from the collected nodes on every call, so finalizing twice
 * yields the same result. An analyzer instance belongs to a single program.
 */
public final class Analyzer {

    private static final Logger LOG = LoggerFactory.getLogger(Analyzer.class);

    static final String ENTRY_POINT = "start";

    /** Built-in functions by name, with their arity. */
    private static final Map<String, Integer> BUILTINS = ImmutableMap.of("random", 2);

    private enum ReferenceKind { CHOICE, GOTO }

    private record Reference(String source, String target, int line, int column, ReferenceKind kind) {}

    private record VariableDefinition(String node, Statement.Assignment assignment) {}

    /** First definition wins. */
    private final Map<String, DialogueNode> definitions = new LinkedHashMap<>();
    /** Every node seen, duplicates included. */
    private final List<DialogueNode> analyzed = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();
    private final Map<String, VariableDefinition> variables = new LinkedHashMap<>();

    private final List<AnalysisError> nodeErrors = new ArrayList<>();
    private final List<AnalysisWarning> nodeWarnings = new ArrayList<>();

    /** Analyzes a complete program in one go. */
    public static AnalysisResult analyze(Program program) {
        var analyzer = new Analyzer();
        program.nodes().forEach(analyzer::analyzeNode);
        return analyzer.finalizeAnalysis();
    }

    public void analyzeNode(DialogueNode node) {
        LOG.trace("analyzing node '{}'", node.id());
        checkEmptyNode(node);
        checkDuplicateNode(node);
        checkFunctionCalls(node);
        checkDeadEnd(node);
        collectVariableDefinitions(node);
        checkSuspiciousConditions(node);
        checkIdenticalChoices(node);

        definitions.putIfAbsent(node.id(), node);
        analyzed.add(node);
        collectReferences(node);
    }

    public AnalysisResult finalizeAnalysis() {
        var run = new ProgramChecks();
        run.inferVariableTypes();
        run.checkNodeReferences();
        run.checkReachability();
        run.checkCircularReferences();
        run.checkEntryPoint();
        run.checkUndefinedVariables();
        run.checkTypeMismatches();
        run.checkUnusedVariables();

        var result = AnalysisResult.of(run.errors.build(), run.warnings.build(), run.suggestions.build());
        LOG.debug("analyzed {} nodes: {} errors, {} warnings, {} suggestions", definitions.size(),
            result.errors().size(), result.warnings().size(), result.suggestions().size());
        return result;
    }

    //// node checks ////

    private void checkEmptyNode(DialogueNode node) {
        if (node.statements().isEmpty()) {
            nodeErrors.add(new AnalysisError(AnalysisError.Type.EMPTY_NODE,
                "Node '" + node.id() + "' is empty and has no statements",
                node.line(), node.column(), endOf(node), node.id()));
        }
    }

    private void checkDuplicateNode(DialogueNode node) {
        var original = definitions.get(node.id());
        if (original != null) {
            nodeErrors.add(new AnalysisError(AnalysisError.Type.DUPLICATE_NODE,
                "Duplicate node definition for '" + node.id() + "'. It was first defined on line "
                    + original.line() + ".",
                node.line(), node.column(), endOf(node), node.id()));
        }
    }

    private void checkFunctionCalls(DialogueNode node) {
        for (var statement : node.statements()) {
            for (var expression : expressionsOf(statement)) {
                walk(expression, e -> {
                    if (e instanceof Expression.FunctionCall call) {
                        checkFunctionCall(node, call);
                    }
                });
            }
        }
    }

    private void checkFunctionCall(DialogueNode node, Expression.FunctionCall call) {
        var arity = BUILTINS.get(call.name());
        if (arity == null) {
            nodeErrors.add(new AnalysisError(AnalysisError.Type.INVALID_FUNCTION,
                "Unknown function called: '" + call.name() + "'.",
                call.line(), call.column(), call.endColumn(), node.id()));
        } else if (call.args().size() != arity) {
            nodeErrors.add(new AnalysisError(AnalysisError.Type.INVALID_FUNCTION_ARGS,
                "Function '" + call.name() + "' expects exactly " + arity + " arguments, but got "
                    + call.args().size() + ".",
                call.line(), call.column(), call.endColumn(), node.id()));
        }
    }

    private void checkDeadEnd(DialogueNode node) {
        if (node.statements().isEmpty()) {
            return;
        }
        var navigates = node.statements().stream()
            .anyMatch(s -> s instanceof Statement.Choice || s instanceof Statement.Goto);
        if (!navigates) {
            nodeWarnings.add(new AnalysisWarning(AnalysisWarning.Type.DEAD_END,
                "Node '" + node.id() + "' is a dead end; it has no choices or goto statements to continue"
                    + " the dialogue.",
                node.line(), node.column(), endOf(node), node.id()));
        }
    }

    private void collectVariableDefinitions(DialogueNode node) {
        for (var statement : node.statements()) {
            if (statement instanceof Statement.Assignment assignment) {
                variables.putIfAbsent(assignment.variable(), new VariableDefinition(node.id(), assignment));
            }
        }
    }

    private void checkSuspiciousConditions(DialogueNode node) {
        for (var statement : node.statements()) {
            if (statement instanceof Statement.Choice choice && choice.condition() != null) {
                var condition = choice.condition();
                var value = condition.accept(new ConstantFolder());
                if (value != null && !Literals.isTruthy(value)) {
                    nodeWarnings.add(new AnalysisWarning(AnalysisWarning.Type.SUSPICIOUS_CONDITION,
                        "The condition for this choice is always false, making it unreachable.",
                        condition.line(), condition.column(), condition.endColumn(), node.id()));
                }
            }
        }
    }

    private void checkIdenticalChoices(DialogueNode node) {
        var seen = new HashSet<String>();
        for (var statement : node.statements()) {
            if (statement instanceof Statement.Choice choice && !seen.add(choice.text())) {
                nodeWarnings.add(new AnalysisWarning(AnalysisWarning.Type.IDENTICAL_CHOICE,
                    "Node '" + node.id() + "' has duplicate choices with the text: \"" + choice.text() + "\"",
                    choice.textLine(), choice.textColumn(), choice.textColumn() + choice.text().length(),
                    node.id()));
            }
        }
    }

    private void collectReferences(DialogueNode node) {
        for (var statement : node.statements()) {
            if (statement instanceof Statement.Choice choice) {
                references.add(new Reference(node.id(), choice.target(),
                    choice.line(), choice.column(), ReferenceKind.CHOICE));
            } else if (statement instanceof Statement.Goto jump) {
                references.add(new Reference(node.id(), jump.target(),
                    jump.line(), jump.column(), ReferenceKind.GOTO));
            }
        }
    }

    //// program checks ////

    /** State of one finalization; discarded afterwards. */
    private final class ProgramChecks {
        final ImmutableList.Builder<AnalysisError> errors = ImmutableList.<AnalysisError>builder().addAll(nodeErrors);
        final ImmutableList.Builder<AnalysisWarning> warnings = ImmutableList.<AnalysisWarning>builder().addAll(nodeWarnings);
        final ImmutableList.Builder<AnalysisSuggestion> suggestions = ImmutableList.builder();

        final Map<String, InferredType> variableTypes = new HashMap<>();
        final Set<String> usedVariables = new HashSet<>();

        void inferVariableTypes() {
            var inference = new TypeInference(variableTypes, null);
            for (var node : analyzed) {
                for (var statement : node.statements()) {
                    if (statement instanceof Statement.Assignment assignment) {
                        variableTypes.put(assignment.variable(), assignment.value().accept(inference));
                    }
                }
            }
        }

        void checkNodeReferences() {
            for (var ref : references) {
                if (!definitions.containsKey(ref.target())) {
                    errors.add(new AnalysisError(AnalysisError.Type.MISSING_NODE,
                        "Node '" + ref.target() + "' does not exist (referenced from '" + ref.source() + "')",
                        ref.line(), ref.column(), ref.column() + 1 + ref.target().length(), ref.source()));
                }
            }
        }

        void checkReachability() {
            // without an entry point there is nothing to measure from; checkEntryPoint reports it
            if (!definitions.containsKey(ENTRY_POINT)) {
                return;
            }
            ListMultimap<String, String> edges = MultimapBuilder.hashKeys().arrayListValues().build();
            for (var ref : references) {
                edges.put(ref.source(), ref.target());
            }

            var reachable = new HashSet<String>();
            var queue = new ArrayDeque<String>();
            reachable.add(ENTRY_POINT);
            queue.add(ENTRY_POINT);
            while (!queue.isEmpty()) {
                for (var target : edges.get(queue.remove())) {
                    if (reachable.add(target)) {
                        queue.add(target);
                    }
                }
            }

            for (var node : definitions.values()) {
                if (!reachable.contains(node.id())) {
                    warnings.add(new AnalysisWarning(AnalysisWarning.Type.UNREACHABLE_NODE,
                        "Node '" + node.id() + "' is unreachable from the '" + ENTRY_POINT + "' node.",
                        node.line(), node.column(), endOf(node), node.id()));
                }
            }
        }

        /**
         * Warns every node that sits on a cycle of {@code goto} edges, once. Cycle members are the
         * strongly connected components of the goto graph with more than one node, plus nodes that
         * jump to themselves.
         */
        void checkCircularReferences() {
            ListMultimap<String, String> gotos = MultimapBuilder.hashKeys().arrayListValues().build();
            for (var ref : references) {
                if (ref.kind() == ReferenceKind.GOTO && definitions.containsKey(ref.target())) {
                    gotos.put(ref.source(), ref.target());
                }
            }

            var components = new GotoComponents(gotos);
            for (var id : definitions.keySet()) {
                components.connect(id);
            }

            for (var id : definitions.keySet()) {
                var component = components.of(id);
                if (component.size() == 1 && !gotos.containsEntry(id, id)) {
                    continue;
                }
                var cycle = shortestCycle(id, component, gotos);
                var first = definitions.keySet().stream().filter(component::contains).findFirst().orElseThrow();
                var rotation = cycle.indexOf(first);
                if (rotation > 0) {
                    var rotated = new ArrayList<>(cycle.subList(rotation, cycle.size()));
                    rotated.addAll(cycle.subList(0, rotation));
                    cycle = rotated;
                }

                var description = String.join(" -> ", cycle) + " -> " + cycle.get(0);
                var node = definitions.get(id);
                warnings.add(new AnalysisWarning(AnalysisWarning.Type.CIRCULAR_REFERENCE,
                    "Node '" + id + "' is part of an inescapable 'goto' loop: " + description,
                    node.line(), node.column(), endOf(node), id));
            }
        }

        /** Shortest goto path from {@code origin} back to itself, staying inside {@code component}. */
        private List<String> shortestCycle(String origin, Set<String> component, ListMultimap<String, String> gotos) {
            var parents = new HashMap<String, String>();
            var queue = new ArrayDeque<String>();
            queue.add(origin);
            while (!queue.isEmpty()) {
                var id = queue.remove();
                for (var next : gotos.get(id)) {
                    if (next.equals(origin)) {
                        var path = new ArrayList<String>();
                        for (var at = id; at != null; at = parents.get(at)) {
                            path.add(0, at);
                        }
                        return path;
                    }
                    if (component.contains(next) && !parents.containsKey(next)) {
                        parents.put(next, id);
                        queue.add(next);
                    }
                }
            }
            return List.of(origin);
        }

        void checkEntryPoint() {
            if (!definitions.isEmpty() && !definitions.containsKey(ENTRY_POINT)) {
                errors.add(new AnalysisError(AnalysisError.Type.MISSING_ENTRY_POINT,
                    "The script is missing a '" + ENTRY_POINT + "' node, which is required as the entry point.",
                    1, 1, 2, null));
            }
        }

        void checkUndefinedVariables() {
            forEachExpression((node, expression) -> walk(expression, e -> {
                if (e instanceof Expression.Variable variable && !variables.containsKey(variable.name())) {
                    warnings.add(new AnalysisWarning(AnalysisWarning.Type.UNDEFINED_VARIABLE,
                        "Variable '@" + variable.name() + "' is used but never assigned a value.",
                        variable.line(), variable.column(), variable.endColumn(), node.id()));
                }
            }));
        }

        void checkTypeMismatches() {
            forEachExpression((node, expression) ->
                expression.accept(new TypeInference(variableTypes, mismatch -> warnings.add(
                    new AnalysisWarning(AnalysisWarning.Type.TYPE_MISMATCH, mismatch.message(),
                        mismatch.line(), mismatch.column(), mismatch.endColumn(), node.id())))));
        }

        void checkUnusedVariables() {
            forEachExpression((node, expression) -> walk(expression, e -> {
                if (e instanceof Expression.Variable variable) {
                    usedVariables.add(variable.name());
                }
            }));

            for (var entry : variables.entrySet()) {
                var name = entry.getKey();
                if (usedVariables.contains(name)) {
                    continue;
                }
                var assignment = entry.getValue().assignment();
                suggestions.add(new AnalysisSuggestion(AnalysisSuggestion.Type.UNUSED_VARIABLE,
                    "Variable '@" + name + "' is assigned a value but is never used.",
                    assignment.line(), assignment.column(), assignment.column() + name.length(),
                    entry.getValue().node(),
                    "Remove the assignment to '@" + name + "' or read it in a condition or interpolation."));
            }
        }

        private void forEachExpression(NodeExpressionConsumer action) {
            for (var node : analyzed) {
                for (var statement : node.statements()) {
                    for (var expression : expressionsOf(statement)) {
                        action.accept(node, expression);
                    }
                }
            }
        }
    }

    /** Tarjan's strongly connected components over the goto graph. */
    private static final class GotoComponents {
        private final ListMultimap<String, String> gotos;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final Map<String, Set<String>> components = new HashMap<>();

        GotoComponents(ListMultimap<String, String> gotos) {
            this.gotos = gotos;
        }

        Set<String> of(String id) {
            return components.get(id);
        }

        void connect(String id) {
            if (index.containsKey(id)) {
                return;
            }
            index.put(id, index.size());
            lowLink.put(id, index.get(id));
            stack.push(id);
            onStack.add(id);

            for (var next : gotos.get(id)) {
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(id, Math.min(lowLink.get(id), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(id, Math.min(lowLink.get(id), index.get(next)));
                }
            }

            if (lowLink.get(id).equals(index.get(id))) {
                var component = new HashSet<String>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(id));
                component.forEach(m -> components.put(m, component));
            }
        }
    }

    @FunctionalInterface
    private interface NodeExpressionConsumer {
        void accept(DialogueNode node, Expression expression);
    }

    //// expression helpers ////

    private static int endOf(DialogueNode node) {
        return node.column() + node.id().length();
    }

    /** The expressions a statement evaluates, in source order. */
    private static List<Expression> expressionsOf(Statement statement) {
        return statement.accept(new Statement.Visitor<List<Expression>>() {
            @Override
            public List<Expression> visitAssignmentStatement(Statement.Assignment statement) {
                return List.of(statement.value());
            }

            @Override
            public List<Expression> visitSayStatement(Statement.Say statement) {
                var expressions = new ArrayList<Expression>();
                statement.interpolations().forEach(i -> expressions.add(i.expression()));
                return expressions;
            }

            @Override
            public List<Expression> visitChoiceStatement(Statement.Choice statement) {
                return statement.condition() != null ? List.of(statement.condition()) : List.of();
            }

            @Override
            public List<Expression> visitGotoStatement(Statement.Goto statement) {
                return List.of();
            }
        });
    }

    /** Visits {@code expression} and every sub-expression, parents before children. */
    private static void walk(Expression expression, Consumer<Expression> action) {
        action.accept(expression);
        if (expression instanceof Expression.BinaryOp binary) {
            walk(binary.left(), action);
            walk(binary.right(), action);
        } else if (expression instanceof Expression.UnaryOp unary) {
            walk(unary.operand(), action);
        } else if (expression instanceof Expression.FunctionCall call) {
            call.args().forEach(arg -> walk(arg, action));
        }
    }

    /**
     * Folds expressions made only of literals. Returns {@code null} when the value is not
     * statically known: any variable, function call or arithmetic makes the whole expression
     * unknown. Equality is loose, so {@code "1" == 1} folds to true.
     */
    private static final class ConstantFolder implements Expression.Visitor<Object> {

        @Override
        public Object visitLiteralExpression(Expression.Literal expression) {
            return expression.value();
        }

        @Override
        public Object visitVariableExpression(Expression.Variable expression) {
            return null;
        }

        @Override
        public Object visitBinaryOpExpression(Expression.BinaryOp expression) {
            var left = expression.left().accept(this);
            var right = expression.right().accept(this);
            if (left == null || right == null) {
                return null;
            }
            switch (expression.operator()) {
            case "==":
                return Literals.looseEquals(left, right);
            case "!=":
                return !Literals.looseEquals(left, right);
            case ">":
                return compare(left, right, c -> c > 0);
            case "<":
                return compare(left, right, c -> c < 0);
            case ">=":
                return compare(left, right, c -> c >= 0);
            case "<=":
                return compare(left, right, c -> c <= 0);
            case "&&":
                return Literals.isTruthy(left) && Literals.isTruthy(right);
            case "||":
                return Literals.isTruthy(left) || Literals.isTruthy(right);
            default:
                return null;
            }
        }

        private static Boolean compare(Object left, Object right, IntPredicate test) {
            var comparison = Literals.compare(left, right);
            return comparison != null && test.test(comparison);
        }

        @Override
        public Object visitUnaryOpExpression(Expression.UnaryOp expression) {
            if (!"!".equals(expression.operator())) {
                return null;
            }
            var operand = expression.operand().accept(this);
            return operand != null ? !Literals.isTruthy(operand) : null;
        }

        @Override
        public Object visitFunctionCallExpression(Expression.FunctionCall expression) {
            return null;
        }
    }

    private record Mismatch(String message, int line, int column, int endColumn) {}

    /**
     * Flow-insensitive type inference. With a listener attached, operator misuse is reported and
     * the offending expression becomes {@link InferredType#ANY} so that one mistake is reported once.
     */
    private static final class TypeInference implements Expression.Visitor<InferredType> {

        private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/");
        private static final Set<String> ORDERING = Set.of(">", "<", ">=", "<=");
        private static final Set<String> LOGICAL = Set.of("&&", "||");

        private final Map<String, InferredType> variableTypes;
        private final Consumer<Mismatch> listener;

        TypeInference(Map<String, InferredType> variableTypes, Consumer<Mismatch> listener) {
            this.variableTypes = variableTypes;
            this.listener = listener;
        }

        @Override
        public InferredType visitLiteralExpression(Expression.Literal expression) {
            return InferredType.of(expression.value());
        }

        @Override
        public InferredType visitVariableExpression(Expression.Variable expression) {
            return variableTypes.getOrDefault(expression.name(), InferredType.ANY);
        }

        @Override
        public InferredType visitBinaryOpExpression(Expression.BinaryOp expression) {
            var left = expression.left().accept(this);
            var right = expression.right().accept(this);
            if (left == InferredType.ANY || right == InferredType.ANY) {
                return InferredType.ANY;
            }

            var operator = expression.operator();
            InferredType required;
            InferredType produced;
            if (ARITHMETIC.contains(operator)) {
                required = InferredType.NUMBER;
                produced = InferredType.NUMBER;
            } else if (ORDERING.contains(operator)) {
                required = InferredType.NUMBER;
                produced = InferredType.BOOLEAN;
            } else if (LOGICAL.contains(operator)) {
                required = InferredType.BOOLEAN;
                produced = InferredType.BOOLEAN;
            } else {
                return InferredType.BOOLEAN;
            }

            if (left != required || right != required) {
                if (listener != null) {
                    listener.accept(new Mismatch(
                        "Cannot apply operator '" + operator + "' to types '" + left.label() + "' and '"
                            + right.label() + "'.",
                        expression.line(), expression.column(), expression.endColumn()));
                }
                return InferredType.ANY;
            }
            return produced;
        }

        @Override
        public InferredType visitUnaryOpExpression(Expression.UnaryOp expression) {
            var operand = expression.operand().accept(this);
            return "!".equals(expression.operator()) ? InferredType.BOOLEAN : operand;
        }

        @Override
        public InferredType visitFunctionCallExpression(Expression.FunctionCall expression) {
            expression.args().forEach(arg -> arg.accept(this));
            return "random".equals(expression.name()) ? InferredType.NUMBER : InferredType.ANY;
        }
    }
}
