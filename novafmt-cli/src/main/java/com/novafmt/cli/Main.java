package com.novafmt.cli;

import com.novafmt.FormattingOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * novafmt 命令行入口（picocli）
 *
 * <p>格式化给定文件（原地写回），或以 {@code -} 从标准输入读取、向标准输出写出。</p>
 */
@Command(name = "novafmt", version = "novafmt 0.1.0",
         mixinStandardHelpOptions = true,
         description = "格式化 Nova 源码文件")
public class Main implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = "--dropbox-style", description = "块缩进与续行缩进均为 4")
    boolean dropboxStyle;

    @Option(names = "--google-style", description = "块缩进与续行缩进均为 4")
    boolean googleStyle;

    @Option(names = "--max-width", description = "最大行宽（默认 100）")
    Integer maxWidth;

    @Option(names = "--config", description = "JSON 配置文件")
    Path config;

    @Option(names = "--keep-unused-imports", description = "不删除未使用的 import")
    boolean keepUnusedImports;

    @Option(names = "--dry-run", description = "只列出需要格式化的文件，不写回")
    boolean dryRun;

    @Option(names = "--set-exit-if-changed", description = "有文件被改动时退出码为 1")
    boolean setExitIfChanged;

    @Option(names = "--debug-ops", description = "输出排版指令流（JSON）")
    boolean debugOps;

    @Option(names = {"-j", "--threads"}, description = "并行格式化的线程数（默认为 CPU 核数）")
    Integer threads;

    @Parameters(arity = "1..*", description = "源码文件；- 表示标准输入")
    List<String> files = new ArrayList<String>();

    InputStream stdin = System.in;

    @Override
    public Integer call() throws IOException {
        FormattingOptions options = resolveOptions();
        int threadCount = threads != null ? threads : Runtime.getRuntime().availableProcessors();
        FormatRunner runner = new FormatRunner(options, dryRun, setExitIfChanged,
                spec.commandLine().getOut(), spec.commandLine().getErr(), threadCount);

        if (files.size() == 1 && "-".equals(files.get(0))) {
            return runner.formatStdin(stdin);
        }
        if (files.contains("-")) {
            throw new ParameterException(spec.commandLine(), "'-' cannot be combined with file arguments");
        }
        List<Path> paths = new ArrayList<Path>();
        for (String file : files) {
            paths.add(Paths.get(file));
        }
        return runner.formatFiles(paths);
    }

    /**
     * 选项优先级：配置文件 &lt; 风格预设开关 &lt; 单项命令行选项
     */
    FormattingOptions resolveOptions() throws IOException {
        if (dropboxStyle && googleStyle) {
            throw new ParameterException(spec.commandLine(),
                    "--dropbox-style and --google-style are mutually exclusive");
        }
        FormattingOptions base = FormattingOptions.defaults();
        if (config != null) {
            String json = new String(Files.readAllBytes(config), StandardCharsets.UTF_8);
            try {
                base = FormattingOptions.fromJson(json);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), config + ": " + e.getMessage());
            }
        }
        if (dropboxStyle) {
            base = FormattingOptions.dropboxStyle().toBuilder()
                    .maxWidth(base.getMaxWidth())
                    .removeUnusedImports(base.isRemoveUnusedImports())
                    .build();
        } else if (googleStyle) {
            base = FormattingOptions.googleStyle().toBuilder()
                    .maxWidth(base.getMaxWidth())
                    .removeUnusedImports(base.isRemoveUnusedImports())
                    .build();
        }
        FormattingOptions.Builder builder = base.toBuilder();
        if (maxWidth != null) {
            if (maxWidth <= 0) {
                throw new ParameterException(spec.commandLine(), "--max-width must be positive: " + maxWidth);
            }
            builder.maxWidth(maxWidth);
        }
        if (keepUnusedImports) {
            builder.removeUnusedImports(false);
        }
        if (debugOps) {
            builder.debugLayoutTrace(true);
        }
        return builder.build();
    }

    /** 日志统一输出到标准错误 */
    static void configureLogging() {
        Logger root = Logger.getLogger("com.novafmt");
        root.setUseParentHandlers(false);
        for (Handler handler : root.getHandlers()) {
            root.removeHandler(handler);
        }
        Handler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        root.addHandler(handler);
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
