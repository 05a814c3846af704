package io.echoprompt.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.echoprompt.core.model.Alternate;
import io.echoprompt.core.model.ConditionExpr;
import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.EchoDiagnostic;
import io.echoprompt.core.model.ImportNode;
import io.echoprompt.core.model.IncludeNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.ParseResult;
import io.echoprompt.core.model.SectionNode;
import io.echoprompt.core.model.TextNode;
import io.echoprompt.core.model.VariableNode;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for AST construction, ELSE-IF folding, argument classification and error recovery. */
@DisplayName("EchoParserTest")
class EchoParserTest {

    private final EchoParser parser = new EchoParser();

    private List<Node> parseOk(String template) {
        ParseResult result = parser.parse(template);
        assertThat(result.errors()).as("parse errors for %s", template).isEmpty();
        assertThat(result.success()).isTrue();
        return result.ast();
    }

    @Nested
    @DisplayName("Variables and text")
    class VariablesAndText {

        @Test
        @DisplayName("text and variable nodes in source order")
        void textAndVariables() {
            List<Node> ast = parseOk("Hello {{user.name}}!");

            assertThat(ast).hasSize(3);
            assertThat(ast.get(0)).isEqualTo(new TextNode("Hello ", ast.get(0).location()));
            assertThat(((VariableNode) ast.get(1)).path()).isEqualTo("user.name");
            assertThat(((VariableNode) ast.get(1)).hasDefault()).isFalse();
            assertThat(((TextNode) ast.get(2)).value()).isEqualTo("!");
        }

        @Test
        @DisplayName("default value is unquoted")
        void stringDefault() {
            VariableNode node = (VariableNode) parseOk("{{name ?? \"friend\"}}").get(0);

            assertThat(node.defaultValue()).isEqualTo("friend");
        }

        @Test
        @DisplayName("numeric default keeps its literal text")
        void numericDefault() {
            VariableNode node = (VariableNode) parseOk("{{count ?? 0}}").get(0);

            assertThat(node.defaultValue()).isEqualTo("0");
        }

        @Test
        @DisplayName("variable location spans the braces")
        void variableLocation() {
            Node node = parseOk("intro\n  {{x}}").get(1);

            assertThat(node.location().startLine()).isEqualTo(2);
            assertThat(node.location().startColumn()).isEqualTo(3);
            assertThat(node.location().endColumn()).isEqualTo(7);
            assertThat(node.location().sourceText()).isEqualTo("{{x}}");
        }

        @Test
        @DisplayName("context reference path")
        void contextReference() {
            ContextNode node = (ContextNode) parseOk("#context(plp://logo-v2)").get(0);

            assertThat(node.path()).isEqualTo("plp://logo-v2");
        }

        @Test
        @DisplayName("empty context reference yields an empty path")
        void emptyContextReference() {
            ContextNode node = (ContextNode) parseOk("#context()").get(0);

            assertThat(node.path()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        @Test
        @DisplayName("IF without alternate")
        void simpleIf() {
            ConditionalNode node = (ConditionalNode) parseOk("[#IF {{genre}} #equals(Horror)]Scary[END IF]").get(0);

            assertThat(node.condition()).isEqualTo(new ConditionExpr("genre", "equals", "Horror", false));
            assertThat(node.consequent()).extracting(n -> ((TextNode) n).value()).containsExactly("Scary");
            assertThat(node.alternate()).isSameAs(Alternate.NONE);
        }

        @Test
        @DisplayName("operator without argument")
        void operatorWithoutArgument() {
            ConditionalNode node = (ConditionalNode) parseOk("[#IF {{prefs}} #exists]yes[END IF]").get(0);

            assertThat(node.condition().operator()).isEqualTo("exists");
            assertThat(node.condition().argument()).isNull();
        }

        @Test
        @DisplayName("ELSE-IF run folds into a right-nested chain ending in ELSE")
        void elseIfChain() {
            ConditionalNode first = (ConditionalNode) parseOk(
                            "[#IF {{x}} #equals(a)]A[ELSE IF {{x}} #equals(b)]B[ELSE IF {{x}} #equals(c)]C[ELSE]D[END IF]")
                    .get(0);

            assertThat(first.condition().argument()).isEqualTo("a");
            assertThat(first.alternate()).isInstanceOf(Alternate.ElseIf.class);

            ConditionalNode second = ((Alternate.ElseIf) first.alternate()).conditional();
            assertThat(second.condition().argument()).isEqualTo("b");
            assertThat(second.alternate()).isInstanceOf(Alternate.ElseIf.class);

            ConditionalNode third = ((Alternate.ElseIf) second.alternate()).conditional();
            assertThat(third.condition().argument()).isEqualTo("c");
            assertThat(third.alternate()).isInstanceOf(Alternate.Else.class);
            assertThat(((Alternate.Else) third.alternate()).body())
                    .extracting(n -> ((TextNode) n).value())
                    .containsExactly("D");
        }

        @Test
        @DisplayName("last ELSE IF without ELSE has no alternate")
        void elseIfWithoutElse() {
            ConditionalNode first =
                    (ConditionalNode) parseOk("[#IF {{x}} #equals(a)]A[ELSE IF {{x}} #equals(b)]B[END IF]").get(0);

            ConditionalNode second = ((Alternate.ElseIf) first.alternate()).conditional();
            assertThat(second.alternate()).isSameAs(Alternate.NONE);
        }

        @Test
        @DisplayName("nested conditionals")
        void nested() {
            ConditionalNode outer =
                    (ConditionalNode) parseOk("[#IF {{a}} #exists]<[#IF {{b}} #exists]in[END IF]>[END IF]").get(0);

            assertThat(outer.consequent()).hasSize(3);
            assertThat(outer.consequent().get(1)).isInstanceOf(ConditionalNode.class);
        }

        @Test
        @DisplayName("async flag follows the operator predicate")
        void asyncFlag() {
            ConditionalNode gate =
                    (ConditionalNode) parseOk("[#IF {{c}} #ai_gate(Is it safe?)]ok[END IF]").get(0);
            ConditionalNode plain = (ConditionalNode) parseOk("[#IF {{c}} #exists]ok[END IF]").get(0);

            assertThat(gate.condition().async()).isTrue();
            assertThat(plain.condition().async()).isFalse();

            EchoParser custom = new EchoParser(name -> name.equals("slow_check"));
            ConditionalNode slow = (ConditionalNode)
                    custom.parse("[#IF {{c}} #slow_check]ok[END IF]").ast().get(0);
            assertThat(slow.condition().async()).isTrue();
        }

        @Test
        @DisplayName("list argument is classified at parse time")
        void listArgument() {
            ConditionalNode node = (ConditionalNode)
                    parseOk("[#IF {{status}} #one_of(active, pending,completed)]x[END IF]").get(0);

            assertThat(node.condition().argument()).isEqualTo(List.of("active", "pending", "completed"));
        }
    }

    @Nested
    @DisplayName("Sections, imports and includes")
    class SectionsImportsIncludes {

        @Test
        @DisplayName("section with a quoted name")
        void section() {
            SectionNode node = (SectionNode) parseOk("[#SECTION name=\"greeting\"]Hi {{name}}[END SECTION]").get(0);

            assertThat(node.name()).isEqualTo("greeting");
            assertThat(node.body()).hasSize(2);
        }

        @Test
        @DisplayName("import path and include name")
        void importAndInclude() {
            List<Node> ast = parseOk("[#IMPORT \"shared/header.echo\"][#INCLUDE greeting]");

            assertThat(((ImportNode) ast.get(0)).path()).isEqualTo("shared/header.echo");
            assertThat(((IncludeNode) ast.get(1)).name()).isEqualTo("greeting");
        }

        @Test
        @DisplayName("section key other than name is an error")
        void wrongSectionKey() {
            ParseResult result = parser.parse("[#SECTION title=\"x\"]body[END SECTION]");

            assertThat(result.success()).isFalse();
            assertThat(result.errors().get(0).message()).contains("Expected 'name' but found 'title'");
        }
    }

    @Nested
    @DisplayName("Argument classification")
    class ArgumentClassification {

        static Stream<Arguments> arguments() {
            return Stream.of(
                    Arguments.of("18", 18.0),
                    Arguments.of("-3.5", -3.5),
                    Arguments.of("My Girlfriend", "My Girlfriend"),
                    Arguments.of("\"quoted\"", "quoted"),
                    Arguments.of("'single'", "single"),
                    Arguments.of("active,pending,completed", List.of("active", "pending", "completed")),
                    Arguments.of("\"a\", 'b' , c", List.of("a", "b", "c")),
                    Arguments.of("\"Hello, world\"", "Hello, world"),
                    Arguments.of("18 years", "18 years"));
        }

        @ParameterizedTest(name = "[{index}] {0}")
        @MethodSource("arguments")
        @DisplayName("raw text is classified as number, list or string")
        void classifies(String raw, Object expected) {
            assertThat(EchoParser.classifyArgument(raw)).isEqualTo(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("blank text has no argument")
        void blankIsNull(String raw) {
            assertThat(EchoParser.classifyArgument(raw)).isNull();
        }
    }

    @Nested
    @DisplayName("Errors and recovery")
    class Errors {

        @Test
        @DisplayName("lex errors are returned as-is")
        void lexErrors() {
            ParseResult result = parser.parse("Hi {{name");

            assertThat(result.success()).isFalse();
            assertThat(result.ast()).isNull();
            assertThat(result.errors())
                    .extracting(EchoDiagnostic::code)
                    .containsExactly(EchoDiagnostic.UNTERMINATED_VARIABLE);
        }

        @Test
        @DisplayName("unclosed IF is reported at its opening location")
        void unclosedIf() {
            ParseResult result = parser.parse("intro\n[#IF {{x}} #exists]content");

            assertThat(result.success()).isFalse();
            EchoDiagnostic error = result.errors().get(0);
            assertThat(error.code()).isEqualTo(EchoDiagnostic.UNCLOSED_BLOCK);
            assertThat(error.location().startLine()).isEqualTo(2);
            assertThat(error.location().startColumn()).isEqualTo(1);
        }

        @Test
        @DisplayName("unclosed SECTION is reported")
        void unclosedSection() {
            ParseResult result = parser.parse("[#SECTION name=\"s\"]body");

            assertThat(result.errors())
                    .extracting(EchoDiagnostic::code)
                    .containsExactly(EchoDiagnostic.UNCLOSED_BLOCK);
            assertThat(result.errors().get(0).message()).contains("[END SECTION]");
        }

        @Test
        @DisplayName("several errors surface from one pass")
        void multipleErrors() {
            ParseResult result = parser.parse("a [END IF] b [ELSE] c [END SECTION] d");

            assertThat(result.errors())
                    .extracting(EchoDiagnostic::code)
                    .containsOnly(EchoDiagnostic.UNEXPECTED_TOKEN)
                    .hasSize(3);
        }

        @Test
        @DisplayName("missing operator is reported and parsing continues")
        void missingOperator() {
            ParseResult result = parser.parse("[#IF {{x}}]A[END IF] then [END IF]");

            assertThat(result.errors()).hasSize(2);
            assertThat(result.errors().get(0).message()).startsWith("Expected an operator such as #equals after {{x}}");
            assertThat(result.errors().get(1).message()).isEqualTo("[END IF] without a matching [#IF]");
        }

        @Test
        @DisplayName("ELSE after ELSE is an error")
        void elseAfterElse() {
            ParseResult result = parser.parse("[#IF {{x}} #exists]A[ELSE]B[ELSE]C[END IF]");

            assertThat(result.errors()).hasSize(1);
            assertThat(result.errors().get(0).message()).isEqualTo("[ELSE] after [ELSE]");
        }

        @Test
        @DisplayName("missing default value after ??")
        void missingDefault() {
            ParseResult result = parser.parse("{{name ?? }}");

            assertThat(result.errors().get(0).message()).startsWith("Expected a default value after '??'");
        }

        @Test
        @DisplayName("null source is rejected")
        void nullSource() {
            assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(NullPointerException.class);
        }
    }
}
