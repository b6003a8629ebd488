package com.novafmt.format;

import com.novafmt.StructuralException;
import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ImportCanonicalizer 单元测试
 */
class ImportCanonicalizerTest {

    private List<ImportCanonicalizer.ImportRecord> records(String text) {
        SyntaxNode importList = Parser.parse(text).findChild(NodeKind.IMPORT_LIST);
        return ImportCanonicalizer.collect(text, importList);
    }

    @Nested
    @DisplayName("排序与去重")
    class SortTests {

        @Test
        @DisplayName("按限定名排序并去掉重复")
        void testSortAndDedup() {
            String text = "import b.X\nimport a.Y\nimport a.Y\n\nfun f() {}\n";
            assertEquals("import a.Y\nimport b.X\n\nfun f() {}\n", ImportCanonicalizer.canonicalize(text));
        }

        @Test
        @DisplayName("import 之间的空行被合并")
        void testBlankLinesRemoved() {
            String text = "package p\n\nimport c.C\n\nimport a.A\nval x = A + C\n";
            assertEquals("package p\n\nimport a.A\nimport c.C\nval x = A + C\n",
                    ImportCanonicalizer.canonicalize(text));
        }

        @Test
        @DisplayName("别名不同的同名 import 都保留")
        void testAliases() {
            String text = "import a.B\nimport a.B as C\n";
            assertEquals("import a.B as C\nimport a.B\n", ImportCanonicalizer.canonicalize(text));
        }

        @Test
        @DisplayName("通配 import 排在同包的具体 import 之前")
        void testWildcard() {
            String text = "import a.B\nimport a.*\n";
            assertEquals("import a.*\nimport a.B\n", ImportCanonicalizer.canonicalize(text));
        }
    }

    @Nested
    @DisplayName("无需改动")
    class UnchangedTests {

        @Test
        @DisplayName("已经有序时返回原实例")
        void testAlreadySorted() {
            String text = "import a.A\nimport b.B\n\nval x = 1\n";
            assertSame(text, ImportCanonicalizer.canonicalize(text));
        }

        @Test
        @DisplayName("没有 import 时返回原实例")
        void testNoImports() {
            String text = "val x = 1\n";
            assertSame(text, ImportCanonicalizer.canonicalize(text));
        }
    }

    @Nested
    @DisplayName("注释")
    class CommentTests {

        @Test
        @DisplayName("import 之间的注释报结构错误")
        void testCommentBetween() {
            StructuralException e = assertThrows(StructuralException.class,
                    () -> ImportCanonicalizer.canonicalize("import a.B\n// x\nimport c.D\n"));
            assertEquals(2, e.getLine());
            assertEquals(1, e.getColumn());
            assertTrue(e.getMessage().contains("Imports not contiguous"));
        }

        @Test
        @DisplayName("import 块之前的注释不受影响")
        void testCommentBefore() {
            String text = "// header\nimport b.B\nimport a.A\n";
            assertEquals("// header\nimport a.A\nimport b.B\n", ImportCanonicalizer.canonicalize(text));
        }
    }

    @Nested
    @DisplayName("记录")
    class RecordTests {

        @Test
        @DisplayName("简单名来自别名或最后一段")
        void testSimpleName() {
            List<ImportCanonicalizer.ImportRecord> records =
                    records("import a.b.C\nimport d.E as `F`\nimport g.*\n");
            assertEquals("C", records.get(0).getSimpleName());
            assertEquals("a.b.C", records.get(0).getQualifiedName());
            assertEquals("F", records.get(1).getAlias());
            assertEquals("F", records.get(1).getSimpleName());
            assertTrue(records.get(2).isWildcard());
            assertNull(records.get(2).getSimpleName());
        }

        @Test
        @DisplayName("规范键")
        void testCanonicalKey() {
            List<ImportCanonicalizer.ImportRecord> records = records("import a.B\nimport a.B as C\nimport a.*\n");
            assertEquals("a.B null ", records.get(0).getCanonicalKey());
            assertEquals("a.B C ", records.get(1).getCanonicalKey());
            assertEquals("a null *", records.get(2).getCanonicalKey());
        }

        @Test
        @DisplayName("原文区间不含换行")
        void testRange() {
            String text = "import a.B\nimport c.D\n";
            ImportCanonicalizer.ImportRecord second = records(text).get(1);
            assertEquals("import c.D", second.getOriginalText());
            assertEquals(11, second.getStart());
            assertEquals(21, second.getEnd());
        }
    }
}
