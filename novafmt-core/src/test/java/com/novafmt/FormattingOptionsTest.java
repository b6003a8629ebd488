package com.novafmt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FormattingOptions 单元测试
 */
class FormattingOptionsTest {

    @Nested
    @DisplayName("预设")
    class PresetTests {

        @Test
        @DisplayName("默认值")
        void testDefaults() {
            FormattingOptions options = FormattingOptions.defaults();
            assertEquals(100, options.getMaxWidth());
            assertEquals(2, options.getBlockIndent());
            assertEquals(4, options.getContinuationIndent());
            assertTrue(options.isRemoveUnusedImports());
            assertFalse(options.isDebugLayoutTrace());
        }

        @Test
        @DisplayName("按名称选择预设")
        void testPreset() {
            assertEquals(FormattingOptions.dropboxStyle(), FormattingOptions.preset("Dropbox"));
            assertEquals(FormattingOptions.defaults(), FormattingOptions.preset(null));
            assertEquals(4, FormattingOptions.preset("google").getBlockIndent());
            assertThrows(IllegalArgumentException.class, () -> FormattingOptions.preset("tabs"));
        }

        @Test
        @DisplayName("toBuilder 保留全部字段")
        void testToBuilder() {
            FormattingOptions options = FormattingOptions.builder().maxWidth(80).debugLayoutTrace(true).build();
            assertEquals(options, options.toBuilder().build());
            assertEquals(options.hashCode(), options.toBuilder().build().hashCode());
        }

        @Test
        @DisplayName("非法取值")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> FormattingOptions.builder().maxWidth(0).build());
            assertThrows(IllegalArgumentException.class, () -> FormattingOptions.builder().blockIndent(-1).build());
        }
    }

    @Nested
    @DisplayName("JSON 配置")
    class JsonTests {

        @Test
        @DisplayName("缺省字段取预设值")
        void testFromJson() {
            FormattingOptions options = FormattingOptions.fromJson("{\"style\": \"dropbox\", \"maxWidth\": 120}");
            assertEquals(120, options.getMaxWidth());
            assertEquals(4, options.getBlockIndent());
            assertTrue(options.isRemoveUnusedImports());
        }

        @Test
        @DisplayName("未知字段忽略")
        void testUnknownField() {
            FormattingOptions options = FormattingOptions.fromJson("{\"removeUnusedImports\": false, \"color\": 1}");
            assertFalse(options.isRemoveUnusedImports());
            assertEquals(100, options.getMaxWidth());
        }

        @Test
        @DisplayName("空配置等于默认值")
        void testEmpty() {
            assertEquals(FormattingOptions.defaults(), FormattingOptions.fromJson(""));
            assertEquals(FormattingOptions.defaults(), FormattingOptions.fromJson("{}"));
        }

        @Test
        @DisplayName("格式错误的 JSON")
        void testMalformed() {
            assertThrows(IllegalArgumentException.class, () -> FormattingOptions.fromJson("{\"maxWidth\": }"));
            assertThrows(IllegalArgumentException.class, () -> FormattingOptions.fromJson("{\"maxWidth\": \"wide\"}"));
            assertThrows(IllegalArgumentException.class, () -> FormattingOptions.fromJson("{\"maxWidth\": -5}"));
        }
    }
}
