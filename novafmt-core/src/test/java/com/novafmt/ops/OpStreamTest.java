package com.novafmt.ops;

import com.novafmt.StructuralException;
import com.novafmt.doc.DocBuilder;
import com.novafmt.doc.Group;
import com.novafmt.input.TokenIndex;
import com.novafmt.layout.BreakEngine;
import com.novafmt.lexer.Token;
import com.novafmt.output.OutputWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OpStream 单元测试
 */
class OpStreamTest {

    private Token code(TokenIndex index, int i) {
        return index.getCodeTokens().get(i);
    }

    private List<BreakOp> breaks(List<Op> ops) {
        List<BreakOp> result = new ArrayList<BreakOp>();
        for (Op op : ops) {
            if (op.is(OpKind.BREAK)) {
                result.add((BreakOp) op);
            }
        }
        return result;
    }

    private String render(TokenIndex index, List<Op> ops, int width) {
        Group root = new DocBuilder(index).build(ops);
        return OutputWriter.render(new OutputWriter(new BreakEngine(width).layout(root), "\n")
                .write(root, index.getText().length()));
    }

    @Nested
    @DisplayName("顺序校验")
    class OrderTests {

        @Test
        @DisplayName("跳过 Token 报结构错误")
        void testSkippedToken() {
            TokenIndex index = TokenIndex.of("a b");
            OpStream stream = new OpStream(index);
            StructuralException e = assertThrows(StructuralException.class, () -> stream.token(code(index, 1)));
            assertEquals(1, e.getLine());
            assertEquals(1, e.getColumn());
        }

        @Test
        @DisplayName("重复输出 Token 报结构错误")
        void testDuplicateToken() {
            TokenIndex index = TokenIndex.of("a b");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            assertThrows(StructuralException.class, () -> stream.token(code(index, 0)));
        }

        @Test
        @DisplayName("结束时仍有未输出的 Token")
        void testUnfinished() {
            TokenIndex index = TokenIndex.of("a b");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            assertThrows(StructuralException.class, stream::finish);
        }

        @Test
        @DisplayName("结束时仍有未关闭的组")
        void testUnclosedGroup() {
            TokenIndex index = TokenIndex.of("a");
            OpStream stream = new OpStream(index);
            stream.openGroup();
            stream.token(code(index, 0));
            assertThrows(StructuralException.class, stream::finish);
        }

        @Test
        @DisplayName("多余的 closeGroup")
        void testExtraClose() {
            OpStream stream = new OpStream(TokenIndex.of(""));
            assertThrows(StructuralException.class, stream::closeGroup);
        }

        @Test
        @DisplayName("结束后不能再追加")
        void testFinished() {
            OpStream stream = new OpStream(TokenIndex.of(""));
            stream.finish();
            assertThrows(StructuralException.class, stream::space);
        }
    }

    @Nested
    @DisplayName("注释")
    class CommentTests {

        @Test
        @DisplayName("行注释之后的断点强制换行")
        void testLineCommentForcesBreak() {
            TokenIndex index = TokenIndex.of("a // x\nb");
            OpStream stream = new OpStream(index);
            stream.openGroup();
            stream.token(code(index, 0));
            stream.lineBreak(" ");
            stream.token(code(index, 1));
            stream.closeGroup();
            List<Op> ops = stream.finish();

            List<BreakOp> breaks = breaks(ops);
            assertEquals(2, breaks.size());
            assertEquals(BreakKind.SPACE, breaks.get(0).getBreakKind());
            assertEquals(BreakKind.FORCED_LINE, breaks.get(1).getBreakKind());
            assertEquals("a // x\nb\n", render(index, ops, 100));
        }

        @Test
        @DisplayName("独占一行的注释没有断点可用时插入强制换行")
        void testOwnLineComment() {
            TokenIndex index = TokenIndex.of("a\n// c\nb");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            stream.token(code(index, 1));
            List<Op> ops = stream.finish();
            assertEquals("a\n// c\nb\n", render(index, ops, 100));
        }

        @Test
        @DisplayName("行内块注释保留两侧空格")
        void testInlineBlockComment() {
            TokenIndex index = TokenIndex.of("a /* c */ b");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            stream.lineBreak("");
            stream.token(code(index, 1));
            List<Op> ops = stream.finish();
            assertEquals("a /* c */ b\n", render(index, ops, 100));
        }

        @Test
        @DisplayName("commentsBefore 提前输出前置注释")
        void testCommentsBefore() {
            TokenIndex index = TokenIndex.of("{\n// inside\n}");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            stream.indent(2);
            stream.commentsBefore(code(index, 1));
            stream.dedent();
            stream.forcedBreak(false);
            stream.token(code(index, 1));
            List<Op> ops = stream.finish();
            assertEquals("{\n  // inside\n}\n", render(index, ops, 100));
        }

        @Test
        @DisplayName("文件末尾的注释在 finish 时输出")
        void testEofComment() {
            TokenIndex index = TokenIndex.of("a\n// end\n");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            List<Op> ops = stream.finish();
            assertEquals("a\n// end\n", render(index, ops, 100));
        }
    }

    @Nested
    @DisplayName("空行")
    class BlankLineTests {

        @Test
        @DisplayName("允许空行的强制断点保留原文中的一个空行")
        void testBlankLinePreserved() {
            TokenIndex index = TokenIndex.of("a\n\n\n\nb");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            stream.forcedBreak(true);
            stream.token(code(index, 1));
            List<Op> ops = stream.finish();
            assertEquals(1, breaks(ops).get(0).getBlankLines());
            assertEquals("a\n\nb\n", render(index, ops, 100));
        }

        @Test
        @DisplayName("不允许空行时丢弃原文空行")
        void testBlankLineDropped() {
            TokenIndex index = TokenIndex.of("a\n\nb");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            stream.forcedBreak(false);
            stream.token(code(index, 1));
            assertEquals("a\nb\n", render(index, stream.finish(), 100));
        }

        @Test
        @DisplayName("blankLine 总是输出一个空行")
        void testForcedBlankLine() {
            TokenIndex index = TokenIndex.of("a b");
            OpStream stream = new OpStream(index);
            stream.token(code(index, 0));
            stream.blankLine();
            stream.token(code(index, 1));
            assertEquals("a\n\nb\n", render(index, stream.finish(), 100));
        }
    }

    @Nested
    @DisplayName("调试输出")
    class PrinterTests {

        @Test
        @DisplayName("指令流序列化为 JSON 数组")
        void testToJson() {
            TokenIndex index = TokenIndex.of("a");
            OpStream stream = new OpStream(index);
            stream.openGroup();
            stream.token(code(index, 0));
            stream.closeGroup();
            List<Op> ops = stream.finish();
            String json = new OpsPrinter().toJson(ops);
            assertEquals(4, new OpsPrinter().toJsonArray(ops).size());
            assertTrue(json.contains("\"OPEN_GROUP\""));
            assertTrue(json.contains("\"text\": \"a\""));
        }
    }
}
