package com.novafmt.parser;

import com.novafmt.SyntaxException;
import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private SyntaxNode parse(String source) {
        return Parser.parse(source);
    }

    /** 解析单个顶层声明 */
    private SyntaxNode parseDecl(String source) {
        SyntaxNode file = parse(source);
        assertEquals(1, file.childCount(), "Expected one declaration: " + file);
        return file.child(0);
    }

    /** 解析 val x = expr 并返回初始化表达式 */
    private SyntaxNode parseExpr(String expr) {
        SyntaxNode property = parseDecl("val x = " + expr);
        assertEquals(NodeKind.PROPERTY, property.getKind());
        return property.child(property.childCount() - 1);
    }

    @Nested
    @DisplayName("文件结构")
    class FileTests {

        @Test
        @DisplayName("package 与 import")
        void testHeader() {
            SyntaxNode file = parse("package a.b\n\nimport c.D\nimport e.*\nimport f.G as H\n\nfun main() {}\n");
            assertEquals(NodeKind.PACKAGE_HEADER, file.child(0).getKind());
            SyntaxNode imports = file.child(1);
            assertEquals(NodeKind.IMPORT_LIST, imports.getKind());
            assertEquals(3, imports.childCount());
            assertEquals("IMPORT_DIRECTIVE[import NAME_PATH[e . *]]", imports.child(1).toString());
            assertEquals("IMPORT_DIRECTIVE[import NAME_PATH[f . G] as H]", imports.child(2).toString());
            assertEquals(NodeKind.FUNCTION, file.child(2).getKind());
        }

        @Test
        @DisplayName("叶子覆盖全部代码 Token")
        void testLeavesCoverTokens() {
            String source = "class A(val x: Int) : B() {\n  fun f() = x?.let { it + 1 } ?: 0\n}\n";
            SyntaxNode file = parse(source);
            List<Token> leaves = file.tokens();
            StringBuilder sb = new StringBuilder();
            for (Token token : leaves) {
                sb.append(token.getText());
            }
            assertEquals("classA(valx:Int):B(){funf()=x?.let{it+1}?:0}", sb.toString());
        }

        @Test
        @DisplayName("同一行的两个声明之间缺少分隔")
        void testMissingSeparator() {
            SyntaxException e = assertThrows(SyntaxException.class, () -> parse("val a = 1 val b = 2"));
            assertEquals(1, e.getLine());
            assertEquals(11, e.getColumn());
        }

        @Test
        @DisplayName("分号分隔同一行的声明")
        void testSemicolonSeparator() {
            SyntaxNode file = parse("val a = 1; val b = 2");
            assertEquals(3, file.childCount());
            assertTrue(file.child(1).isToken(TokenType.SEMICOLON));
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            assertEquals("BINARY[1 + BINARY[2 * 3]]", parseExpr("1 + 2 * 3").toString());
        }

        @Test
        @DisplayName("左结合")
        void testLeftAssociative() {
            assertEquals("BINARY[BINARY[a - b] - c]", parseExpr("a - b - c").toString());
        }

        @Test
        @DisplayName("成员访问链")
        void testDotChain() {
            assertEquals("DOT_QUALIFIED[DOT_QUALIFIED[a . CALL[b VALUE_ARGUMENTS[( )]]] ?. c]",
                    parseExpr("a.b()?.c").toString());
        }

        @Test
        @DisplayName("尾随 lambda")
        void testTrailingLambda() {
            SyntaxNode call = parseExpr("run { 1 }");
            assertEquals(NodeKind.CALL, call.getKind());
            assertEquals(NodeKind.LAMBDA, call.child(1).getKind());
        }

        @Test
        @DisplayName("Elvis 可以在运算符前换行")
        void testElvisContinuation() {
            SyntaxNode value = parseExpr("a\n    ?: b");
            assertEquals("BINARY[a ?: b]", value.toString());
        }

        @Test
        @DisplayName("加号不能在运算符前换行")
        void testPlusEndsAtNewline() {
            SyntaxNode file = parse("val x = a\n+b");
            assertEquals(2, file.childCount());
            assertEquals(NodeKind.PREFIX, file.child(1).getKind());
        }

        @Test
        @DisplayName("括号内换行不敏感")
        void testNewlineInsideParens() {
            SyntaxNode value = parseExpr("(a\n+ b)");
            assertEquals("PARENTHESIZED[( BINARY[a + b] )]", value.toString());
        }

        @Test
        @DisplayName("is 与 as")
        void testTypeChecks() {
            assertEquals(NodeKind.IS_EXPRESSION, parseExpr("a is String").getKind());
            assertEquals(NodeKind.AS_EXPRESSION, parseExpr("a as? String").getKind());
        }

        @Test
        @DisplayName("中缀调用")
        void testInfixCall() {
            assertEquals("BINARY[1 to 2]", parseExpr("1 to 2").toString());
        }
    }

    @Nested
    @DisplayName("语句")
    class StatementTests {

        private SyntaxNode body(String statements) {
            SyntaxNode function = parseDecl("fun f() {\n" + statements + "\n}");
            SyntaxNode block = function.findChild(NodeKind.BLOCK);
            assertNotNull(block, "No block in " + function);
            return block;
        }

        @Test
        @DisplayName("if-else")
        void testIfElse() {
            SyntaxNode block = body("if (a) b() else c()");
            SyntaxNode ifNode = block.child(1);
            assertEquals(NodeKind.IF, ifNode.getKind());
            assertNotNull(ifNode.findToken(TokenType.KW_ELSE));
        }

        @Test
        @DisplayName("else 可以另起一行")
        void testElseOnNextLine() {
            SyntaxNode block = body("if (a) {\n}\nelse {\n}");
            assertEquals(NodeKind.IF, block.child(1).getKind());
            assertNotNull(block.child(1).findToken(TokenType.KW_ELSE));
        }

        @Test
        @DisplayName("for 与 while")
        void testLoops() {
            SyntaxNode block = body("for (i in 0..10) println(i)\nwhile (true) {}");
            assertEquals(NodeKind.FOR, block.child(1).getKind());
            assertEquals(NodeKind.WHILE, block.child(2).getKind());
        }

        @Test
        @DisplayName("when 表达式")
        void testWhen() {
            SyntaxNode block = body("when (x) {\n  1, 2 -> a()\n  else -> b()\n}");
            SyntaxNode when = block.child(1);
            assertEquals(NodeKind.WHEN, when.getKind());
            assertEquals(2, when.childrenOf(NodeKind.WHEN_ENTRY).size());
        }

        @Test
        @DisplayName("赋值语句")
        void testAssignment() {
            SyntaxNode block = body("x += 1");
            assertEquals(NodeKind.ASSIGNMENT, block.child(1).getKind());
        }

        @Test
        @DisplayName("try-catch-finally")
        void testTry() {
            SyntaxNode block = body("try {\n} catch (e: Exception) {\n} finally {\n}");
            SyntaxNode tryNode = block.child(1);
            assertEquals(NodeKind.TRY, tryNode.getKind());
            assertNotNull(tryNode.findChild(NodeKind.CATCH));
            assertNotNull(tryNode.findChild(NodeKind.FINALLY));
        }
    }

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("带主构造器与父类型的类")
        void testClass() {
            SyntaxNode cls = parseDecl("open class A<T>(val x: T) : B(), C {\n  fun f() {}\n}");
            assertEquals(NodeKind.CLASS, cls.getKind());
            assertNotNull(cls.findChild(NodeKind.MODIFIER_LIST));
            assertNotNull(cls.findChild(NodeKind.TYPE_PARAMETERS));
            assertNotNull(cls.findChild(NodeKind.PRIMARY_CONSTRUCTOR));
            assertEquals(2, cls.findChild(NodeKind.SUPER_TYPE_LIST).childrenOf(NodeKind.SUPER_TYPE).size());
            assertEquals(1, cls.findChild(NodeKind.CLASS_BODY).childrenOf(NodeKind.FUNCTION).size());
        }

        @Test
        @DisplayName("枚举类")
        void testEnum() {
            SyntaxNode cls = parseDecl("enum class Color { RED, GREEN; fun f() {} }");
            SyntaxNode body = cls.findChild(NodeKind.CLASS_BODY);
            assertEquals(2, body.childrenOf(NodeKind.ENUM_ENTRY).size());
            assertNotNull(body.findToken(TokenType.SEMICOLON));
        }

        @Test
        @DisplayName("表达式体函数")
        void testExpressionBody() {
            SyntaxNode function = parseDecl("fun twice(x: Int): Int = x * 2");
            assertEquals(NodeKind.FUNCTION, function.getKind());
            assertNotNull(function.findToken(TokenType.ASSIGN));
            assertEquals(NodeKind.BINARY, function.child(function.childCount() - 1).getKind());
        }

        @Test
        @DisplayName("属性访问器")
        void testAccessors() {
            SyntaxNode property = parseDecl("var x: Int = 0\n  get() = field\n  set(value) { field = value }");
            assertEquals(2, property.childrenOf(NodeKind.PROPERTY_ACCESSOR).size());
        }

        @Test
        @DisplayName("文件注解")
        void testFileAnnotation() {
            SyntaxNode file = parse("@file:JvmName(\"X\")\npackage a\n");
            assertEquals(NodeKind.MODIFIER_LIST, file.child(0).getKind());
            assertEquals(NodeKind.PACKAGE_HEADER, file.child(1).getKind());
        }
    }
}
