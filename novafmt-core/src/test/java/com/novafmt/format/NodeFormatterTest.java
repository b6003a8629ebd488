package com.novafmt.format;

import com.novafmt.Formatter;
import com.novafmt.FormattingOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NodeFormatter 规则测试（经由单遍排版）
 */
class NodeFormatterTest {

    private static String layout(String source) {
        return layout(FormattingOptions.DEFAULT_MAX_WIDTH, source);
    }

    private static String layout(int maxWidth, String source) {
        FormattingOptions options = FormattingOptions.builder().maxWidth(maxWidth).build();
        return new LayoutPass(options, "\n").run(source);
    }

    private static final String SAMPLE = ""
            + "package demo\n"
            + "\n"
            + "import kotlin.math.max\n"
            + "\n"
            + "@Target(AnnotationTarget.CLASS)\n"
            + "annotation class Marker\n"
            + "\n"
            + "enum class Color { RED, GREEN, BLUE }\n"
            + "\n"
            + "interface Shape {\n"
            + "  fun area(): Double\n"
            + "}\n"
            + "\n"
            + "data class Circle(val r: Double) : Shape {\n"
            + "  override fun area(): Double = 3.14 * r * r\n"
            + "}\n"
            + "\n"
            + "object Registry {\n"
            + "  private val items = mutableListOf<Shape>()\n"
            + "\n"
            + "  var count: Int = 0\n"
            + "    get() = field\n"
            + "    private set\n"
            + "\n"
            + "  fun register(shape: Shape) {\n"
            + "    items.add(shape)\n"
            + "    count++\n"
            + "  }\n"
            + "}\n"
            + "\n"
            + "fun describe(x: Any?): String = when (x) {\n"
            + "  is Circle -> \"circle ${x.r}\"\n"
            + "  null -> \"nothing\"\n"
            + "  else -> \"other\"\n"
            + "}\n"
            + "\n"
            + "fun loops(n: Int) {\n"
            + "  for (i in 0 until n) {\n"
            + "    if (i % 2 == 0) continue\n"
            + "    println(i)\n"
            + "  }\n"
            + "  var j = 0\n"
            + "  while (j < n) j++\n"
            + "  do {\n"
            + "    j--\n"
            + "  } while (j > 0)\n"
            + "  try {\n"
            + "    risky()\n"
            + "  } catch (e: Exception) {\n"
            + "    throw IllegalStateException(\"failed\", e)\n"
            + "  } finally {\n"
            + "    cleanup()\n"
            + "  }\n"
            + "  val f: (Int) -> Int = { it * 2 }\n"
            + "  val name = user?.name ?: \"anonymous\"\n"
            + "  val m = max(1, 2)\n"
            + "}\n";

    @Nested
    @DisplayName("完整文件")
    class FileTests {

        @Test
        @DisplayName("已格式化的文件是不动点")
        void testFixedPoint() {
            assertSame(SAMPLE, Formatter.format(SAMPLE));
        }

        @Test
        @DisplayName("打开排版跟踪不影响结果")
        void testDebugTrace() {
            FormattingOptions options = FormattingOptions.builder().debugLayoutTrace(true).build();
            assertEquals(SAMPLE, new LayoutPass(options, "\n").run(SAMPLE));
        }

        @Test
        @DisplayName("无需改动时没有替换")
        void testNoReplacements() {
            assertTrue(new LayoutPass(FormattingOptions.defaults(), "\n").replacements(SAMPLE).isEmpty());
        }
    }

    @Nested
    @DisplayName("空格")
    class SpacingTests {

        @Test
        @DisplayName("类头")
        void testClassHeader() {
            assertEquals("class A : B {}\n", layout("class A:B{}"));
        }

        @Test
        @DisplayName("前缀运算符")
        void testPrefix() {
            assertEquals("val x = - -1\n", layout("val x = - -1"));
            assertEquals("val y = !flag\n", layout("val y=!flag"));
        }

        @Test
        @DisplayName("区间运算符两侧不留空格")
        void testRange() {
            assertEquals("val r = 1..10\n", layout("val r = 1 .. 10"));
        }

        @Test
        @DisplayName("具名实参")
        void testNamedArguments() {
            assertEquals("f(a = 1, b = 2)\n", layout("f(a=1,b=2)"));
        }
    }

    @Nested
    @DisplayName("断行")
    class BreakingTests {

        @Test
        @DisplayName("声明参数展开时右括号另起一行")
        void testParameterList() {
            assertEquals("fun f(\n    alpha: Int,\n    beta: Int\n): Int = 0\n",
                    layout(20, "fun f(alpha: Int, beta: Int): Int = 0"));
        }

        @Test
        @DisplayName("单条语句的分支体放不下时换行缩进")
        void testControlBody() {
            assertEquals("fun f() {\n  if (condition)\n    doSomethingLong()\n}\n",
                    layout(20, "fun f() {\n  if (condition) doSomethingLong()\n}"));
        }

        @Test
        @DisplayName("Elvis 在运算符之前断行")
        void testElvis() {
            assertEquals("val name =\n    user\n        ?: fallbackName\n",
                    layout(20, "val name = user ?: fallbackName"));
        }

        @Test
        @DisplayName("多条语句的 lambda 展开")
        void testLambda() {
            assertEquals("run {\n  a()\n  b()\n}\n", layout("run { a()\nb() }"));
        }
    }
}
