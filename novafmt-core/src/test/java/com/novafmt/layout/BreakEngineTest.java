package com.novafmt.layout;

import com.novafmt.doc.Break;
import com.novafmt.doc.Doc;
import com.novafmt.doc.Group;
import com.novafmt.doc.Indent;
import com.novafmt.doc.Text;
import com.novafmt.ops.BreakKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BreakEngine 单元测试
 */
class BreakEngineTest {

    private static Text text(String s) {
        return new Text(s, null);
    }

    private static Break line(String flat) {
        return new Break(BreakKind.LINE, flat, false, 0);
    }

    private static Group group(Doc... children) {
        return new Group(Arrays.asList(children), false);
    }

    private static Group fill(Doc... children) {
        return new Group(Arrays.asList(children), true);
    }

    @Nested
    @DisplayName("组")
    class GroupTests {

        @Test
        @DisplayName("放得下时整体平铺")
        void testFits() {
            Break b = line(" ");
            Group g = group(text("foo"), b, text("bar"));
            LayoutPlan plan = new BreakEngine(7).layout(g);
            assertFalse(plan.isBroken(g));
            assertFalse(plan.isNewline(b));
            assertEquals(-1, plan.indentOf(b));
        }

        @Test
        @DisplayName("放不下时所有直接断点换行")
        void testBreaks() {
            Break b1 = line(" ");
            Break b2 = line(" ");
            Group g = group(text("foo"), b1, text("bar"), b2, text("baz"));
            LayoutPlan plan = new BreakEngine(8).layout(g);
            assertTrue(plan.isBroken(g));
            assertTrue(plan.isNewline(b1));
            assertTrue(plan.isNewline(b2));
        }

        @Test
        @DisplayName("换行后的缩进来自所在缩进区域")
        void testIndent() {
            Break b = line("");
            Group g = group(text("call("), new Indent(4, Arrays.<Doc>asList(b, text("argument"))), text(")"));
            LayoutPlan plan = new BreakEngine(10).layout(g);
            assertEquals(4, plan.indentOf(b));
        }

        @Test
        @DisplayName("外层展开后内层组重新判断")
        void testNested() {
            Break outer = line(" ");
            Break inner = line(" ");
            Group innerGroup = group(text("b"), inner, text("c"));
            Group g = group(text("aaaaaaaa"), outer, innerGroup);
            LayoutPlan plan = new BreakEngine(8).layout(g);
            assertTrue(plan.isNewline(outer));
            assertFalse(plan.isBroken(innerGroup));
            assertFalse(plan.isNewline(inner));
            assertEquals(1, plan.brokenGroupCount());
        }

        @Test
        @DisplayName("组之后直到下一个断点的内容计入是否放得下")
        void testTrailingText() {
            Break inner = line(" ");
            Group args = group(text("(aa"), inner, text("bb)"));
            Group g = group(text("x"), args, text(": Type"), line(" "), text("z"));

            LayoutPlan narrow = new BreakEngine(12).layout(g);
            assertTrue(narrow.isBroken(args));
            assertTrue(narrow.isNewline(inner));

            LayoutPlan exact = new BreakEngine(14).layout(g);
            assertFalse(exact.isBroken(args));
        }

        @Test
        @DisplayName("空格断点不截断其后内容的宽度")
        void testTrailingThroughSpace() {
            Group args = group(text("(aa"), line(" "), text("bb)"));
            Break space = new Break(BreakKind.SPACE, " ", false, 0);
            Group g = group(text("x"), args, space, text("long"), line(" "), text("z"));
            assertTrue(new BreakEngine(12).layout(g).isBroken(args));
        }

        @Test
        @DisplayName("同级走完后接上外层组的后续内容")
        void testTrailingFromEnclosingLevel() {
            Group args = group(text("(aa"), line(" "), text("bb)"));
            Group call = group(text("f"), args);
            Group g = group(call, text(" {"), line(" "), text("z"));
            LayoutPlan plan = new BreakEngine(9).layout(g);
            assertTrue(plan.isBroken(args));
        }

        @Test
        @DisplayName("强制换行使组展开")
        void testForced() {
            Break forced = new Break(BreakKind.FORCED_LINE, "", false, 0);
            Break b = line(" ");
            Group g = group(text("a"), forced, text("b"), b, text("c"));
            LayoutPlan plan = new BreakEngine(100).layout(g);
            assertTrue(plan.isNewline(forced));
            assertTrue(plan.isNewline(b));
        }

        @Test
        @DisplayName("空格断点从不换行")
        void testSpace() {
            Break space = new Break(BreakKind.SPACE, " ", false, 0);
            Group g = group(text("aaaa"), space, text("bbbb"));
            LayoutPlan plan = new BreakEngine(3).layout(g);
            assertTrue(plan.isBroken(g));
            assertFalse(plan.isNewline(space));
        }
    }

    @Nested
    @DisplayName("fill 与 flexible")
    class FillTests {

        @Test
        @DisplayName("fill 组只在下一段放不下时换行")
        void testFill() {
            Break b1 = line(" ");
            Break b2 = line(" ");
            Group g = fill(text("aaaa"), b1, text("bbbb"), b2, text("cccc"));
            LayoutPlan plan = new BreakEngine(10).layout(g);
            assertTrue(plan.isBroken(g));
            assertFalse(plan.isNewline(b1));
            assertTrue(plan.isNewline(b2));
        }

        @Test
        @DisplayName("flexible 断点在展开的组中也尽量不换行")
        void testFlexible() {
            Break b1 = line(" ");
            Break flexible = new Break(BreakKind.LINE, " ", true, 0);
            Group g = group(text("aaaa"), b1, text("bb"), flexible, text("cc"));
            LayoutPlan plan = new BreakEngine(8).layout(g);
            assertTrue(plan.isNewline(b1));
            assertFalse(plan.isNewline(flexible));
        }
    }

    @Nested
    @DisplayName("边界")
    class EdgeTests {

        @Test
        @DisplayName("列宽必须为正")
        void testInvalidWidth() {
            assertThrows(IllegalArgumentException.class, () -> new BreakEngine(0));
        }

        @Test
        @DisplayName("超宽的不可分割文本原样保留")
        void testOverlongText() {
            Group g = group(text("abcdefghijklmnopqrstuvwxyz"));
            LayoutPlan plan = new BreakEngine(10).layout(g);
            assertTrue(plan.isBroken(g));
        }
    }
}
