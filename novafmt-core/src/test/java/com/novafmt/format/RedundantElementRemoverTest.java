package com.novafmt.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedundantElementRemover 单元测试
 */
class RedundantElementRemoverTest {

    private final RedundantElementRemover remover = new RedundantElementRemover(true);

    @Nested
    @DisplayName("分号")
    class SemicolonTests {

        @Test
        @DisplayName("行末分号被删除")
        void testLineEnd() {
            assertEquals("val a = 1\nval b = 2", remover.remove("val a = 1;\nval b = 2;"));
        }

        @Test
        @DisplayName("右花括号前的分号被删除")
        void testBeforeBrace() {
            assertEquals("fun f() { g() }", remover.remove("fun f() { g(); }"));
        }

        @Test
        @DisplayName("分隔同一行语句的分号保留")
        void testSameLine() {
            String text = "fun f() {\n  a(); b()\n}\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("枚举项之后的分号保留")
        void testEnumTerminator() {
            String text = "enum class E {\n  A,\n  B;\n\n  fun f() {}\n}\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("作为空循环体的分号保留")
        void testEmptyLoopBody() {
            String text = "fun f() {\n  while (next());\n}\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("连续的分号一次全部删除")
        void testConsecutive() {
            assertEquals("fun f() {\n  x\n}\n", remover.remove("fun f() {\n  x;;\n}\n"));
            assertEquals("val a = 1\nval b = 2", remover.remove("val a = 1;;\nval b = 2"));
        }

        @Test
        @DisplayName("同一行上后面还有语句时连续分号保留")
        void testConsecutiveSameLine() {
            String text = "fun f() {\n  a();; b()\n}\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("package 与 import 之后的分号")
        void testHeaderSemicolons() {
            assertEquals("package a\nimport b.C\nval x = C\n",
                    remover.remove("package a;\nimport b.C;\nval x = C\n"));
        }

        @Test
        @DisplayName("字符串里的分号不受影响")
        void testSemicolonInString() {
            String text = "val s = \"a;\"\n";
            assertSame(text, remover.remove(text));
        }
    }

    @Nested
    @DisplayName("未使用的 import")
    class UnusedImportTests {

        @Test
        @DisplayName("未引用的 import 连同换行一起删除")
        void testUnused() {
            String text = "import a.Used\nimport a.Unused\n\nval x = Used()\n";
            assertEquals("import a.Used\n\nval x = Used()\n", remover.remove(text));
        }

        @Test
        @DisplayName("通配 import 保留")
        void testWildcard() {
            String text = "import a.*\n\nval x = 1\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("文档注释中的引用算作使用")
        void testDocReference() {
            String text = "import a.Linked\nimport a.Thrown\n\n/**\n * See [Linked].\n * @throws Thrown\n */\nfun f() {}\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("普通注释中的名字不算使用")
        void testPlainComment() {
            String text = "import a.Named\n\n// Named\nfun f() {}\n";
            assertEquals("\n// Named\nfun f() {}\n", remover.remove(text));
        }

        @Test
        @DisplayName("字符串模板中的引用算作使用")
        void testTemplateReference() {
            String text = "import a.name\nimport a.other\n\nval s = \"$name ${other.size}\"\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("运算符函数与 componentN 保留")
        void testOperators() {
            String text = "import a.plus\nimport a.component1\nimport a.getValue\n\nval x = 1\n";
            assertSame(text, remover.remove(text));
        }

        @Test
        @DisplayName("按别名判断是否使用")
        void testAlias() {
            assertSame("import a.B as C\n\nval x = C()\n", remover.remove("import a.B as C\n\nval x = C()\n"));
            assertEquals("\nval x = B()\n", remover.remove("import a.B as C\n\nval x = B()\n"));
        }

        @Test
        @DisplayName("import 中的名字不算使用")
        void testSelfReference() {
            String text = "import a.B\nimport b.B.Inner\n\nval x = Inner\n";
            assertEquals("import b.B.Inner\n\nval x = Inner\n", remover.remove(text));
        }

        @Test
        @DisplayName("删除 import 时其分号一并删除")
        void testImportWithSemicolon() {
            assertEquals("\nval x = 1\n", remover.remove("import a.Unused;\n\nval x = 1\n"));
        }

        @Test
        @DisplayName("关闭删除未使用的 import")
        void testDisabled() {
            String text = "import a.Unused\n\nval x = 1\n";
            assertSame(text, new RedundantElementRemover(false).remove(text));
        }
    }
}
