package tome.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

public class ProgramTest {

    @Test
    void network() {
        var source = String.join("\n",
            "node start",
            "  say \"hello\"",
            "  choice \"Go to a\", :a",
            "  goto :b",
            "end",
            "node a",
            "  goto :missing",
            "end",
            "");
        var program = new Parser(new Lexer(source).tokenize()).parse().program().orElseThrow();

        var network = program.network();
        assertEquals(ImmutableSet.of("start", "a"), network.nodes());
        assertEquals(List.of(
                new NodeNetwork.Link("start", "a"),
                new NodeNetwork.Link("start", "b"),
                new NodeNetwork.Link("a", "missing")),
            network.links());
    }
}
