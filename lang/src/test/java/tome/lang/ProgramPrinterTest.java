package tome.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class ProgramPrinterTest {

    private final ProgramPrinter printer = new ProgramPrinter();

    private static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize(), source).parse().program().orElseThrow();
    }

    @Test
    void canonicalForm() {
        var source = String.join("\n",
            "node start",
            "    @gold=10",
            "    say \"Hi #{@name}, you have #{@gold*2} \\\"coins\\\"\"   # greeting",
            "    choice \"Buy\" , :shop , if: @gold >= 5 && !@broke",
            "    goto :shop",
            "end",
            "node shop",
            "end");

        assertEquals(String.join("\n",
            "node start",
            "  @gold = 10",
            "  say \"Hi #{@name}, you have #{@gold * 2} \\\"coins\\\"\"",
            "  choice \"Buy\", :shop, if: (@gold >= 5) && (!@broke)",
            "  goto :shop",
            "end",
            "",
            "node shop",
            "end",
            ""), printer.print(parse(source)));
    }

    @Test
    void literals() {
        var program = parse("node a\n  @x = 1.5 + 2\n  @y = \"tab\\there\"\n  @z = false\nend\n");
        assertEquals(String.join("\n",
            "node a",
            "  @x = 1.5 + 2",
            "  @y = \"tab\\there\"",
            "  @z = false",
            "end",
            ""), printer.print(program));
    }

    @Test
    void numbersPrintWithoutExponents() {
        var printed = printer.print(parse("node a\n  @big = 10000000000000000\n  @tiny = 0.0000001\nend\n"));
        assertEquals(String.join("\n",
            "node a",
            "  @big = 10000000000000000",
            "  @tiny = 0.0000001",
            "end",
            ""), printed);
        assertEquals(printed, printer.print(parse(printed)));
    }

    @Test
    void printedSourceParsesToTheSameProgram() {
        var source = String.join("\n",
            "node start",
            "  @n = random(1, 6) * (2 + -@bonus)",
            "  say \"Rolled #{@n}!\"",
            "  choice \"\", :start, if: !(@n > 3 || @n == 1)",
            "  @n /= 2",
            "end");

        var printed = printer.print(parse(source));
        assertEquals(printed, printer.print(parse(printed)));
    }
}
