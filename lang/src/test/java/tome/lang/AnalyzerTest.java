package tome.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class AnalyzerTest {

    private static Program parse(String... lines) {
        var source = String.join("\n", lines) + "\n";
        var result = new Parser(new Lexer(source).tokenize(), source).parse();
        assertTrue(result.valid(), () -> "unexpected syntax errors: " + result.errors());
        return result.value();
    }

    private static AnalysisResult analyze(String... lines) {
        return Analyzer.analyze(parse(lines));
    }

    private static <D extends Diagnostic> List<D> ofType(List<D> diagnostics, String tag) {
        return diagnostics.stream().filter(d -> d.tag().equals(tag)).collect(Collectors.toList());
    }

    private static List<String> messages(List<? extends Diagnostic> diagnostics, String tag) {
        return diagnostics.stream()
            .filter(d -> d.tag().equals(tag))
            .map(Diagnostic::message)
            .collect(Collectors.toList());
    }

    @Test
    void cleanProgram() {
        var result = analyze(
            "node start",
            "  @gold = 10",
            "  say \"You have #{@gold} gold\"",
            "  choice \"Shop\", :shop, if: @gold > 5",
            "  choice \"Leave\", :end_game",
            "end",
            "node shop",
            "  @gold -= 5",
            "  goto :start",
            "end",
            "node end_game",
            "  say \"Bye\"",
            "  choice \"Again\", :start",
            "end");

        assertTrue(result.valid());
        assertTrue(result.isEmpty(), result::toString);
    }

    @Test
    void missingNode() {
        var result = analyze(
            "node start",
            "  goto :nowhere",
            "end");

        assertFalse(result.valid());
        var errors = ofType(result.errors(), "missing_node");
        assertEquals(1, errors.size());
        var error = errors.get(0);
        assertEquals("Node 'nowhere' does not exist (referenced from 'start')", error.message());
        assertEquals(2, error.line());
        assertEquals(8, error.column());
        assertEquals(16, error.endColumn());
        assertEquals("start", error.node());
    }

    @Test
    void unreachableNode() {
        var result = analyze(
            "node start",
            "  goto :start",
            "end",
            "node orphan",
            "  goto :start",
            "end");

        var warnings = ofType(result.warnings(), "unreachable_node");
        assertEquals(1, warnings.size());
        assertEquals("Node 'orphan' is unreachable from the 'start' node.", warnings.get(0).message());
        assertEquals(4, warnings.get(0).line());
        assertEquals(6, warnings.get(0).column());
        assertEquals(12, warnings.get(0).endColumn());
    }

    @Test
    void gotoCycle() {
        var result = analyze(
            "node start",
            "  choice \"Enter\", :a",
            "end",
            "node a",
            "  goto :b",
            "end",
            "node b",
            "  goto :a",
            "end");

        assertEquals(List.of(
                "Node 'a' is part of an inescapable 'goto' loop: a -> b -> a",
                "Node 'b' is part of an inescapable 'goto' loop: a -> b -> a"),
            messages(result.warnings(), "circular_reference"));
        assertTrue(result.valid());
    }

    @Test
    void gotoCycleThroughFinishedNode() {
        var result = analyze(
            "node start",
            "  say \"begin\"",
            "  goto :t",
            "  goto :w",
            "end",
            "node t",
            "  goto :start",
            "end",
            "node w",
            "  goto :t",
            "end");

        var cycles = ofType(result.warnings(), "circular_reference");
        assertEquals(List.of("start", "t", "w"),
            cycles.stream().map(Diagnostic::node).collect(Collectors.toList()));
        assertEquals("Node 'w' is part of an inescapable 'goto' loop: start -> w -> t -> start",
            cycles.get(2).message());
    }

    @Test
    void gotoIntoCycleIsNotPartOfIt() {
        var result = analyze(
            "node start",
            "  goto :a",
            "end",
            "node a",
            "  goto :b",
            "end",
            "node b",
            "  goto :a",
            "end");

        assertEquals(List.of("a", "b"), ofType(result.warnings(), "circular_reference").stream()
            .map(Diagnostic::node).collect(Collectors.toList()));
    }

    @Test
    void choiceCycleIsNotCircular() {
        var result = analyze(
            "node start",
            "  choice \"Next\", :other",
            "end",
            "node other",
            "  choice \"Back\", :start",
            "end");

        assertTrue(result.isEmpty(), result::toString);
    }

    @Test
    void selfLoop() {
        var result = analyze(
            "node start",
            "  say \"again\"",
            "  goto :start",
            "end");

        assertEquals(List.of("Node 'start' is part of an inescapable 'goto' loop: start -> start"),
            messages(result.warnings(), "circular_reference"));
    }

    @Test
    void missingEntryPoint() {
        var result = analyze(
            "node intro",
            "  goto :intro",
            "end");

        var errors = ofType(result.errors(), "missing_entry_point");
        assertEquals(1, errors.size());
        assertEquals("The script is missing a 'start' node, which is required as the entry point.",
            errors.get(0).message());
        assertEquals(1, errors.get(0).line());
        assertEquals(1, errors.get(0).column());
        assertTrue(ofType(result.warnings(), "unreachable_node").isEmpty());
    }

    @Test
    void emptyProgram() {
        var result = Analyzer.analyze(new Program(ImmutableList.of()));
        assertTrue(result.valid());
        assertTrue(result.isEmpty());
    }

    @Test
    void emptyNode() {
        var result = analyze(
            "node start",
            "  goto :hollow",
            "end",
            "node hollow",
            "end");

        assertEquals(List.of("Node 'hollow' is empty and has no statements"),
            messages(result.errors(), "empty_node"));
        assertTrue(ofType(result.warnings(), "dead_end").isEmpty());
    }

    @Test
    void duplicateNode() {
        var result = analyze(
            "node start",
            "  goto :a",
            "end",
            "node a",
            "  goto :start",
            "end",
            "node a",
            "  say \"second\"",
            "end");

        var errors = ofType(result.errors(), "duplicate_node");
        assertEquals(1, errors.size());
        assertEquals("Duplicate node definition for 'a'. It was first defined on line 4.", errors.get(0).message());
        assertEquals(7, errors.get(0).line());
        assertTrue(ofType(result.warnings(), "dead_end").stream().allMatch(w -> w.line() == 7));
    }

    @Test
    void functionCalls() {
        var result = analyze(
            "node start",
            "  @a = random(1)",
            "  @b = dice(6)",
            "  @c = random(1, random(2, 3, 4))",
            "  say \"#{@a} #{@b} #{@c}\"",
            "  goto :start",
            "end");

        assertEquals(List.of(
                "Function 'random' expects exactly 2 arguments, but got 1.",
                "Function 'random' expects exactly 2 arguments, but got 3."),
            messages(result.errors(), "invalid_function_args"));
        var unknown = ofType(result.errors(), "invalid_function");
        assertEquals(1, unknown.size());
        assertEquals("Unknown function called: 'dice'.", unknown.get(0).message());
        assertEquals(3, unknown.get(0).line());
        assertEquals(8, unknown.get(0).column());
        assertEquals(15, unknown.get(0).endColumn());
    }

    @Test
    void deadEnd() {
        var result = analyze(
            "node start",
            "  say \"The end.\"",
            "end");

        assertEquals(List.of("Node 'start' is a dead end; it has no choices or goto statements to continue the"
                + " dialogue."),
            messages(result.warnings(), "dead_end"));
        assertTrue(result.valid());
    }

    @Test
    void undefinedVariable() {
        var result = analyze(
            "node start",
            "  say \"Hello #{@ghost}\"",
            "  choice \"Go\", :start, if: @ghost > 1",
            "end");

        var warnings = ofType(result.warnings(), "undefined_variable");
        assertEquals(2, warnings.size());
        assertEquals("Variable '@ghost' is used but never assigned a value.", warnings.get(0).message());
        assertEquals("start", warnings.get(0).node());
        assertEquals(2, warnings.get(0).line());
    }

    @Test
    void variableAssignedInAnotherNodeIsDefined() {
        var result = analyze(
            "node start",
            "  choice \"Go\", :later, if: @seen",
            "end",
            "node later",
            "  @seen = true",
            "  goto :start",
            "end");

        assertTrue(ofType(result.warnings(), "undefined_variable").isEmpty());
        assertTrue(result.suggestions().isEmpty());
    }

    @Test
    void typeMismatch() {
        var result = analyze(
            "node start",
            "  @name = \"Ann\"",
            "  @flag = true",
            "  @n = @name + 1",
            "  choice \"Go\", :start, if: @flag > 1",
            "  choice \"Fine\", :start, if: @n > 1 && @flag",
            "end");

        var warnings = ofType(result.warnings(), "type_mismatch");
        assertEquals(List.of(
                "Cannot apply operator '+' to types 'string' and 'number'.",
                "Cannot apply operator '>' to types 'boolean' and 'number'."),
            warnings.stream().map(Diagnostic::message).collect(Collectors.toList()));
        assertEquals(4, warnings.get(0).line());
        assertEquals(8, warnings.get(0).column());
        assertEquals(17, warnings.get(0).endColumn());
    }

    @Test
    void typeMismatchInsideFunctionArguments() {
        var result = analyze(
            "node start",
            "  @r = random(true + 1, 2)",
            "  say \"#{@r}\"",
            "  goto :start",
            "end");

        assertEquals(List.of("Cannot apply operator '+' to types 'boolean' and 'number'."),
            messages(result.warnings(), "type_mismatch"));
    }

    @Test
    void suspiciousConditions() {
        var result = analyze(
            "node start",
            "  @x = 1",
            "  choice \"Never\", :start, if: 1 > 2",
            "  choice \"Zero\", :start, if: 0",
            "  choice \"Loose\", :start, if: \"1\" == 1",
            "  choice \"Unknown\", :start, if: false || @x",
            "  choice \"Negated\", :start, if: !true",
            "end");

        var warnings = ofType(result.warnings(), "suspicious_condition");
        assertEquals(3, warnings.size());
        assertEquals("The condition for this choice is always false, making it unreachable.",
            warnings.get(0).message());
        assertEquals(List.of(3, 4, 7),
            warnings.stream().map(Diagnostic::line).collect(Collectors.toList()));
        assertEquals(31, warnings.get(0).column());
        assertEquals(36, warnings.get(0).endColumn());
    }

    @Test
    void identicalChoices() {
        var result = analyze(
            "node start",
            "  choice \"Go\", :start",
            "  choice \"Go\", :start",
            "end");

        var warnings = ofType(result.warnings(), "identical_choice");
        assertEquals(1, warnings.size());
        assertEquals("Node 'start' has duplicate choices with the text: \"Go\"", warnings.get(0).message());
        assertEquals(3, warnings.get(0).line());
        assertEquals(11, warnings.get(0).column());
    }

    @Test
    void unusedVariable() {
        var result = analyze(
            "node start",
            "  @unused = 1",
            "  goto :start",
            "end");

        assertEquals(1, result.suggestions().size());
        var suggestion = result.suggestions().get(0);
        assertEquals("unused_variable", suggestion.tag());
        assertEquals("Variable '@unused' is assigned a value but is never used.", suggestion.message());
        assertEquals(2, suggestion.line());
        assertEquals(4, suggestion.column());
        assertEquals(10, suggestion.endColumn());
        assertEquals(Severity.INFO, suggestion.severity());
        assertNotNull(suggestion.fix());
    }

    @Test
    void variableUsedInDuplicateNodeIsUsed() {
        var result = analyze(
            "node start",
            "  goto :start",
            "end",
            "node start",
            "  @x = 1",
            "  say \"#{@x}\"",
            "end");

        assertTrue(result.suggestions().isEmpty(), result::toString);
        assertTrue(ofType(result.warnings(), "undefined_variable").isEmpty());
    }

    @Test
    void finalizeIsIdempotent() {
        var analyzer = new Analyzer();
        parse(
            "node start",
            "  say \"#{@ghost}\"",
            "  goto :a",
            "end",
            "node a",
            "  goto :start",
            "end",
            "node a",
            "end",
            "node lost",
            "  @x = 1",
            "  goto :nowhere",
            "end").nodes().forEach(analyzer::analyzeNode);

        var first = analyzer.finalizeAnalysis();
        var second = analyzer.finalizeAnalysis();
        assertEquals(first, second);
        assertFalse(first.valid());
    }

    @Test
    void analyzesNodesAsTheyStream() {
        var source = "node start\n  goto :next\nend\nnode start\n  goto :next\nend\nnode next\n  goto :start\nend\n";
        var analyzer = new Analyzer();
        for (var node : new Parser(new Lexer(source).tokenize(), source).nodes()) {
            analyzer.analyzeNode(node);
        }

        var result = analyzer.finalizeAnalysis();
        assertEquals(List.of("Duplicate node definition for 'start'. It was first defined on line 1."),
            messages(result.errors(), "duplicate_node"));
        assertEquals(List.of("Node 'start' is part of an inescapable 'goto' loop: start -> next -> start",
                "Node 'next' is part of an inescapable 'goto' loop: start -> next -> start"),
            messages(result.warnings(), "circular_reference"));
    }

    @Test
    void filtersBySeverity() {
        var result = analyze(
            "node start",
            "  @unused = 1",
            "  say \"stuck\"",
            "end",
            "node gone",
            "end");

        assertEquals(List.of("empty_node"), tags(result.diagnostics(Severity.ERROR)));
        assertEquals(List.of("empty_node", "dead_end", "unreachable_node"), tags(result.diagnostics(Severity.WARNING)));
        assertEquals(List.of("empty_node", "dead_end", "unreachable_node", "unused_variable"),
            tags(result.diagnostics(Severity.INFO)));
    }

    private static List<String> tags(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::tag).collect(Collectors.toList());
    }
}
