package com.novafmt;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * 格式化选项（不可变）
 *
 * <p>默认值：列宽 100，块缩进 2，续行缩进 4，删除未使用的 import。
 * 可通过 {@link #builder()} 定制，或用 {@link #fromJson(String)} 从 JSON 配置加载。</p>
 */
public final class FormattingOptions {

    public static final int DEFAULT_MAX_WIDTH = 100;

    private final int maxWidth;
    private final int blockIndent;
    private final int continuationIndent;
    private final boolean removeUnusedImports;
    private final boolean debugLayoutTrace;

    private FormattingOptions(Builder builder) {
        this.maxWidth = builder.maxWidth;
        this.blockIndent = builder.blockIndent;
        this.continuationIndent = builder.continuationIndent;
        this.removeUnusedImports = builder.removeUnusedImports;
        this.debugLayoutTrace = builder.debugLayoutTrace;
    }

    public static FormattingOptions defaults() {
        return builder().build();
    }

    /** Dropbox 风格：块缩进与续行缩进均为 4 */
    public static FormattingOptions dropboxStyle() {
        return builder().blockIndent(4).continuationIndent(4).build();
    }

    /** Google 风格：块缩进与续行缩进均为 4 */
    public static FormattingOptions googleStyle() {
        return builder().blockIndent(4).continuationIndent(4).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxWidth(maxWidth)
                .blockIndent(blockIndent)
                .continuationIndent(continuationIndent)
                .removeUnusedImports(removeUnusedImports)
                .debugLayoutTrace(debugLayoutTrace);
    }

    public int getMaxWidth() {
        return maxWidth;
    }

    public int getBlockIndent() {
        return blockIndent;
    }

    public int getContinuationIndent() {
        return continuationIndent;
    }

    public boolean isRemoveUnusedImports() {
        return removeUnusedImports;
    }

    public boolean isDebugLayoutTrace() {
        return debugLayoutTrace;
    }

    // ============ JSON ============

    private static final Gson GSON = new GsonBuilder().create();

    /** JSON 配置文件的结构；缺省字段为 null，取所选预设的值 */
    private static final class JsonConfig {
        String style;
        Integer maxWidth;
        Integer blockIndent;
        Integer continuationIndent;
        Boolean removeUnusedImports;
        Boolean debugLayoutTrace;
    }

    /**
     * 从 JSON 加载：{"style": "dropbox", "maxWidth": 120, ...}。
     * 未知字段忽略，缺省字段取预设值。
     *
     * @throws IllegalArgumentException JSON 无效或取值非法
     */
    public static FormattingOptions fromJson(String json) {
        JsonConfig config;
        try {
            config = GSON.fromJson(json, JsonConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid formatter configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            return defaults();
        }
        Builder builder = preset(config.style).toBuilder();
        if (config.maxWidth != null) builder.maxWidth(config.maxWidth);
        if (config.blockIndent != null) builder.blockIndent(config.blockIndent);
        if (config.continuationIndent != null) builder.continuationIndent(config.continuationIndent);
        if (config.removeUnusedImports != null) builder.removeUnusedImports(config.removeUnusedImports);
        if (config.debugLayoutTrace != null) builder.debugLayoutTrace(config.debugLayoutTrace);
        return builder.build();
    }

    /** 按名称选择预设：default、dropbox、google */
    public static FormattingOptions preset(String style) {
        if (style == null || "default".equalsIgnoreCase(style)) {
            return defaults();
        }
        if ("dropbox".equalsIgnoreCase(style)) {
            return dropboxStyle();
        }
        if ("google".equalsIgnoreCase(style)) {
            return googleStyle();
        }
        throw new IllegalArgumentException("Unknown style: " + style);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormattingOptions)) return false;
        FormattingOptions that = (FormattingOptions) o;
        return maxWidth == that.maxWidth
                && blockIndent == that.blockIndent
                && continuationIndent == that.continuationIndent
                && removeUnusedImports == that.removeUnusedImports
                && debugLayoutTrace == that.debugLayoutTrace;
    }

    @Override
    public int hashCode() {
        int result = maxWidth;
        result = 31 * result + blockIndent;
        result = 31 * result + continuationIndent;
        result = 31 * result + (removeUnusedImports ? 1 : 0);
        result = 31 * result + (debugLayoutTrace ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return "FormattingOptions{maxWidth=" + maxWidth
                + ", blockIndent=" + blockIndent
                + ", continuationIndent=" + continuationIndent
                + ", removeUnusedImports=" + removeUnusedImports
                + ", debugLayoutTrace=" + debugLayoutTrace + "}";
    }

    /**
     * 选项构建器
     */
    public static final class Builder {
        private int maxWidth = DEFAULT_MAX_WIDTH;
        private int blockIndent = 2;
        private int continuationIndent = 4;
        private boolean removeUnusedImports = true;
        private boolean debugLayoutTrace = false;

        private Builder() {
        }

        public Builder maxWidth(int maxWidth) {
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder blockIndent(int blockIndent) {
            this.blockIndent = blockIndent;
            return this;
        }

        public Builder continuationIndent(int continuationIndent) {
            this.continuationIndent = continuationIndent;
            return this;
        }

        public Builder removeUnusedImports(boolean removeUnusedImports) {
            this.removeUnusedImports = removeUnusedImports;
            return this;
        }

        public Builder debugLayoutTrace(boolean debugLayoutTrace) {
            this.debugLayoutTrace = debugLayoutTrace;
            return this;
        }

        public FormattingOptions build() {
            if (maxWidth <= 0) {
                throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
            }
            if (blockIndent < 0 || continuationIndent < 0) {
                throw new IllegalArgumentException("Indents must not be negative");
            }
            return new FormattingOptions(this);
        }
    }
}
