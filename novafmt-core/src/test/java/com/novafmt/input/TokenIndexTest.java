package com.novafmt.input;

import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenIndex 单元测试
 */
class TokenIndexTest {

    private Token code(TokenIndex index, String text) {
        for (Token token : index.getCodeTokens()) {
            if (token.getText().equals(text)) {
                return token;
            }
        }
        throw new AssertionError("No code token " + text);
    }

    @Nested
    @DisplayName("查找")
    class LookupTests {

        @Test
        @DisplayName("按偏移与区间反查 Token")
        void testTokenAt() {
            TokenIndex index = TokenIndex.of("val abc = 1");
            Token abc = index.tokenAt(5);
            assertEquals("abc", abc.getText());
            assertSame(abc, index.tokenForRange(4, 7));
            assertNull(index.tokenForRange(4, 6));
        }

        @Test
        @DisplayName("文本末尾对应零宽 EOF")
        void testEofRange() {
            TokenIndex index = TokenIndex.of("x");
            assertSame(index.getEof(), index.tokenForRange(1, 1));
            assertEquals(TokenType.EOF, index.getEof().getType());
        }

        @Test
        @DisplayName("代码 Token 序号不含空白与注释")
        void testCodeIndex() {
            TokenIndex index = TokenIndex.of("a /* c */ b");
            assertEquals(0, index.codeIndexOf(code(index, "a")));
            assertEquals(1, index.codeIndexOf(code(index, "b")));
            assertEquals(3, index.getCodeTokens().size());
            assertEquals(-1, index.codeIndexOf(index.getTokens().get(1)));
        }

        @Test
        @DisplayName("偏移换算行列")
        void testLineColumn() {
            String text = "ab\ncd\r\nef";
            assertArrayEquals(new int[] {1, 1}, TokenIndex.lineColumn(text, 0));
            assertArrayEquals(new int[] {2, 2}, TokenIndex.lineColumn(text, 4));
            assertArrayEquals(new int[] {3, 1}, TokenIndex.lineColumn(text, 7));
        }
    }

    @Nested
    @DisplayName("注释归属")
    class CommentTests {

        @Test
        @DisplayName("同行注释是前一个 Token 的尾随注释")
        void testTrailing() {
            TokenIndex index = TokenIndex.of("foo() // note\nbar()");
            List<Token> trailing = index.trailingComments(code(index, ")"));
            assertEquals(1, trailing.size());
            assertEquals("// note", trailing.get(0).getText());
            assertTrue(index.leadingComments(code(index, "bar")).isEmpty());
        }

        @Test
        @DisplayName("独占一行的注释是下一个 Token 的前置注释")
        void testLeading() {
            TokenIndex index = TokenIndex.of("a\n// one\n/* two */\nb");
            List<Token> leading = index.leadingComments(code(index, "b"));
            assertEquals(2, leading.size());
            assertEquals("// one", leading.get(0).getText());
            assertTrue(index.trailingComments(code(index, "a")).isEmpty());
        }

        @Test
        @DisplayName("文件末尾的注释归属 EOF")
        void testEofComments() {
            TokenIndex index = TokenIndex.of("a\n// end\n");
            assertEquals(1, index.leadingComments(index.getEof()).size());
        }

        @Test
        @DisplayName("两个 Token 之间是否有注释")
        void testCommentsBetween() {
            TokenIndex index = TokenIndex.of("a /* x */ b c");
            assertTrue(index.hasCommentsBetween(code(index, "a"), code(index, "b")));
            assertFalse(index.hasCommentsBetween(code(index, "b"), code(index, "c")));
        }
    }

    @Nested
    @DisplayName("空白")
    class WhitespaceTests {

        @Test
        @DisplayName("换行计数")
        void testNewlines() {
            TokenIndex index = TokenIndex.of("a\n\n\nb c");
            assertEquals(3, index.newlinesBefore(code(index, "b")));
            assertEquals(3, index.newlinesAfter(code(index, "a")));
            assertEquals(0, index.newlinesBefore(code(index, "c")));
        }

        @Test
        @DisplayName("行注释也算换行")
        void testLineBreakThroughComment() {
            TokenIndex index = TokenIndex.of("a // x\nb c");
            assertTrue(index.lineBreakBefore(code(index, "b")));
            assertTrue(index.lineBreakAfter(code(index, "a")));
            assertFalse(index.lineBreakBefore(code(index, "c")));
        }

        @Test
        @DisplayName("相邻空白")
        void testAdjacentWhitespace() {
            TokenIndex index = TokenIndex.of("a(b)");
            assertFalse(index.whitespaceBefore(code(index, "b")));
            assertFalse(index.whitespaceAfter(code(index, "a")));
        }
    }
}
