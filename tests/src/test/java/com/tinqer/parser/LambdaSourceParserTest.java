package com.tinqer.parser;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.ast.AstNode;
import com.tinqer.ast.BinaryNode;
import com.tinqer.ast.BlockNode;
import com.tinqer.ast.CallNode;
import com.tinqer.ast.LiteralNode;
import com.tinqer.ast.MemberNode;
import com.tinqer.ast.ObjectNode;
import com.tinqer.exception.ParseStructureException;
import com.tinqer.test.TestBase;
import com.tinqer.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Unit
@TestCategories.Tier1
@DisplayName("Lambda source parser")
public class LambdaSourceParserTest extends TestBase {

    private final LambdaSourceParser parser = LambdaSourceParser.getInstance();

    @Nested
    @DisplayName("Arrow functions")
    class ArrowFunctions {

        @Test
        @DisplayName("Single bare parameter")
        void testBareParameter() {
            ArrowFunctionNode lambda = parser.parseLambda("u => u.age > 18");

            assertThat(lambda.params()).containsExactly("u");
            assertThat(lambda.body()).isInstanceOf(BinaryNode.class);
            BinaryNode body = (BinaryNode) lambda.body();
            assertThat(body.operator()).isEqualTo(">");
            assertThat(body.left()).isInstanceOf(MemberNode.class);
            assertThat(((MemberNode) body.left()).propertyName()).isEqualTo("age");
            assertThat(body.right()).isInstanceOf(LiteralNode.class);
        }

        @Test
        @DisplayName("Parenthesized parameter list")
        void testParameterList() {
            ArrowFunctionNode lambda = parser.parseLambda("(q, p, h) => q.from('users')");

            assertThat(lambda.params()).containsExactly("q", "p", "h");
            assertThat(lambda.param(3)).isNull();
            assertThat(lambda.body()).isInstanceOf(CallNode.class);
            assertThat(((CallNode) lambda.body()).methodName()).isEqualTo("from");
        }

        @Test
        @DisplayName("Block body returns its first return expression")
        void testBlockBody() {
            ArrowFunctionNode lambda = parser.parseLambda("u => { return u.name; }");

            assertThat(lambda.body()).isInstanceOf(BlockNode.class);
            assertThat(lambda.returnedExpression()).isInstanceOf(MemberNode.class);
        }

        @Test
        @DisplayName("Parenthesized object literal body")
        void testObjectBody() {
            ArrowFunctionNode lambda = parser.parseLambda("u => ({ id: u.id, name: u.name })");

            assertThat(lambda.returnedExpression()).isInstanceOf(ObjectNode.class);
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Integers parse as Long and decimals as Double")
        void testNumbers() {
            BinaryNode integer = (BinaryNode) parser.parseLambda("u => u.age > 18").body();
            BinaryNode decimal = (BinaryNode) parser.parseLambda("u => u.price > 9.5").body();

            assertThat(((LiteralNode) integer.right()).value()).isEqualTo(18L);
            assertThat(((LiteralNode) decimal.right()).value()).isEqualTo(9.5);
        }

        @Test
        @DisplayName("Small and large integers share the Long type")
        void testIntegerWidth() {
            BinaryNode small = (BinaryNode) parser.parseLambda("u => u.id == 0").body();
            BinaryNode large = (BinaryNode) parser.parseLambda("u => u.id == 9007199254740993").body();

            assertThat(((LiteralNode) small.right()).value()).isInstanceOf(Long.class).isEqualTo(0L);
            assertThat(((LiteralNode) large.right()).value()).isEqualTo(9007199254740993L);
            assertThat(LambdaAstBuilder.parseNumber("1e3")).isEqualTo(1000.0);
        }

        @Test
        @DisplayName("Single, double and backtick quoted strings")
        void testStrings() {
            for (String quoted : new String[] {"'Bob'", "\"Bob\"", "`Bob`"}) {
                BinaryNode body = (BinaryNode) parser.parseLambda("u => u.name == " + quoted).body();
                assertThat(((LiteralNode) body.right()).value()).isEqualTo("Bob");
            }
        }

        @Test
        @DisplayName("Escape sequences are decoded")
        void testEscapes() {
            BinaryNode body = (BinaryNode) parser.parseLambda("u => u.name == 'it\\'s'").body();

            assertThat(((LiteralNode) body.right()).value()).isEqualTo("it's");
        }

        @Test
        @DisplayName("null literal")
        void testNull() {
            BinaryNode body = (BinaryNode) parser.parseLambda("u => u.email === null").body();

            assertThat(body.operator()).isEqualTo("===");
            assertThat(((LiteralNode) body.right()).literalKind()).isEqualTo(LiteralNode.Kind.NULL);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Blank source is rejected")
        void testBlank() {
            assertThatThrownBy(() -> parser.parse("   "))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("must not be null or empty");
        }

        @Test
        @DisplayName("Syntax errors report a position")
        void testSyntaxError() {
            assertThatThrownBy(() -> parser.parse("u => u.age >"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("Syntax error at line 1");
        }

        @Test
        @DisplayName("parseLambda rejects non-function expressions")
        void testNotALambda() {
            AstNode node = parser.parse("a + b");
            assertThat(node).isInstanceOf(BinaryNode.class);

            assertThatThrownBy(() -> parser.parseLambda("a + b"))
                .isInstanceOf(ParseStructureException.class)
                .hasMessageContaining("Expected an arrow function but found Binary");
        }
    }
}
