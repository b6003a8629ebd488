package com.novafmt.doc;

import com.novafmt.StructuralException;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.ops.BreakKind;
import com.novafmt.ops.BreakOp;
import com.novafmt.ops.CloseGroupOp;
import com.novafmt.ops.DedentOp;
import com.novafmt.ops.IndentOp;
import com.novafmt.ops.LiteralOp;
import com.novafmt.ops.Op;
import com.novafmt.ops.OpenGroupOp;
import com.novafmt.ops.TokenAnchorOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DocBuilder 单元测试
 */
class DocBuilderTest {

    private final TokenIndex index = TokenIndex.of("ab cd");

    private Token code(int i) {
        return index.getCodeTokens().get(i);
    }

    private List<Op> anchored(Token token) {
        return Arrays.<Op>asList(new TokenAnchorOp(token.getStart(), token.getEnd()),
                new LiteralOp(token.getText(), token));
    }

    private List<Op> ops(Object... parts) {
        List<Op> ops = new ArrayList<Op>();
        for (Object part : parts) {
            if (part instanceof Token) {
                ops.addAll(anchored((Token) part));
            } else {
                ops.add((Op) part);
            }
        }
        return ops;
    }

    private BreakOp line(String flat) {
        return new BreakOp(BreakKind.LINE, flat, false, 0, false);
    }

    @Nested
    @DisplayName("树结构")
    class StructureTests {

        @Test
        @DisplayName("组与缩进按指令嵌套")
        void testNesting() {
            Group root = new DocBuilder(index).build(ops(
                    new OpenGroupOp(0, false), code(0), new IndentOp(4), line(" "), code(1), new DedentOp(),
                    new CloseGroupOp(0)));
            assertEquals(1, root.getChildren().size());
            Group group = (Group) root.getChildren().get(0);
            assertEquals(2, group.getChildren().size());
            Indent indent = (Indent) group.getChildren().get(1);
            assertEquals(4, indent.getAmount());
            assertEquals("ab cd", root.flatText());
            assertEquals(5, root.getFlatWidth());
        }

        @Test
        @DisplayName("强制换行使外层不可平铺")
        void testForcedBreakWidth() {
            Group root = new DocBuilder(index).build(ops(
                    new OpenGroupOp(0, false), code(0),
                    new BreakOp(BreakKind.FORCED_LINE, "", false, 0, false), code(1), new CloseGroupOp(0)));
            assertFalse(root.isFlatPossible());
            assertFalse(root.getChildren().get(0).isFlatPossible());
        }

        @Test
        @DisplayName("合成文本不需要锚点")
        void testSyntheticLiteral() {
            Group root = new DocBuilder(index).build(ops(code(0), new LiteralOp(",", null), code(1)));
            Text comma = (Text) root.getChildren().get(1);
            assertFalse(comma.isAnchored());
            assertEquals("ab,cd", root.flatText());
        }

        @Test
        @DisplayName("fill 组")
        void testFill() {
            Group root = new DocBuilder(index).build(ops(new OpenGroupOp(3, true), code(0), new CloseGroupOp(3)));
            assertTrue(((Group) root.getChildren().get(0)).isFill());
        }
    }

    @Nested
    @DisplayName("结构错误")
    class ErrorTests {

        @Test
        @DisplayName("组 id 不匹配")
        void testMismatchedGroup() {
            assertThrows(StructuralException.class, () -> new DocBuilder(index).build(ops(
                    new OpenGroupOp(0, false), new OpenGroupOp(1, false), new CloseGroupOp(0), new CloseGroupOp(1))));
        }

        @Test
        @DisplayName("组与缩进交错")
        void testInterleaved() {
            assertThrows(StructuralException.class, () -> new DocBuilder(index).build(ops(
                    new OpenGroupOp(0, false), new IndentOp(2), new CloseGroupOp(0), new DedentOp())));
        }

        @Test
        @DisplayName("未关闭的缩进")
        void testUnclosedIndent() {
            assertThrows(StructuralException.class, () -> new DocBuilder(index).build(ops(new IndentOp(2), code(0))));
        }

        @Test
        @DisplayName("锚点区间不是 Token")
        void testBadAnchor() {
            List<Op> ops = new ArrayList<Op>();
            ops.add(new TokenAnchorOp(0, 1));
            ops.add(new LiteralOp("a", null));
            assertThrows(StructuralException.class, () -> new DocBuilder(index).build(ops));
        }

        @Test
        @DisplayName("锚点之后不是对应的 Literal")
        void testAnchorWithoutLiteral() {
            List<Op> ops = new ArrayList<Op>();
            ops.add(new TokenAnchorOp(code(0).getStart(), code(0).getEnd()));
            ops.add(new LiteralOp("cd", code(1)));
            assertThrows(StructuralException.class, () -> new DocBuilder(index).build(ops));
        }

        @Test
        @DisplayName("Token 的 Literal 缺少锚点")
        void testLiteralWithoutAnchor() {
            List<Op> ops = new ArrayList<Op>();
            ops.add(new LiteralOp("ab", code(0)));
            assertThrows(StructuralException.class, () -> new DocBuilder(index).build(ops));
        }
    }
}
