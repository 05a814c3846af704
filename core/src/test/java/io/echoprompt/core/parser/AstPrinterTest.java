package io.echoprompt.core.parser;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AstPrinterTest {

    private final EchoParser parser = new EchoParser();

    @Test
    void printsIfElseOutline() {
        String outline = AstPrinter.print(parser.parse(
                        "[#IF {{genre}} #equals(Horror)]Suggest scary movies.[ELSE]Suggest popular movies.[END IF]")
                .ast());

        assertThat(outline).isEqualTo("""
                IF {{genre}} #equals(Horror)
                  TEXT "Suggest scary movies."
                ELSE
                  TEXT "Suggest popular movies."
                """);
    }

    @Test
    void printsElseIfChainAtTheSameDepth() {
        String outline = AstPrinter.print(parser.parse(
                        "[#IF {{x}} #equals(a)]A[ELSE IF {{x}} #gt(2)]B[END IF]")
                .ast());

        assertThat(outline).isEqualTo("""
                IF {{x}} #equals(a)
                  TEXT "A"
                ELSE IF {{x}} #gt(2.0)
                  TEXT "B"
                """);
    }

    @Test
    void flagsAsyncConditions() {
        String outline = AstPrinter.print(
                parser.parse("[#IF {{content}} #ai_gate(Is it safe?)]ok[END IF]").ast());

        assertThat(outline).startsWith("IF {{content}} #ai_gate(Is it safe?) [async]\n");
    }

    @Test
    void truncatesLongTextAndEscapesNewlines() {
        String text = "a".repeat(AstPrinter.MAX_TEXT + 10);

        assertThat(AstPrinter.print(parser.parse(text).ast()))
                .isEqualTo("TEXT \"" + "a".repeat(AstPrinter.MAX_TEXT) + "...\"\n");
        assertThat(AstPrinter.print(parser.parse("one\ntwo").ast())).isEqualTo("TEXT \"one\\ntwo\"\n");
    }

    @Test
    void printsDirectivesAndVariables() {
        String outline = AstPrinter.print(parser.parse(
                        "[#IMPORT \"base.echo\"]{{name ?? \"friend\"}}#context(logo.png)"
                                + "[#SECTION name=\"s\"]x[END SECTION][#INCLUDE s]")
                .ast());

        assertThat(outline).isEqualTo("""
                IMPORT "base.echo"
                VAR {{name ?? "friend"}}
                CONTEXT logo.png
                SECTION s
                  TEXT "x"
                INCLUDE s
                """);
    }
}
