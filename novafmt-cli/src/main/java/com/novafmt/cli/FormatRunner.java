package com.novafmt.cli;

import com.novafmt.Formatter;
import com.novafmt.FormatterException;
import com.novafmt.FormattingOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 批量格式化：每个文件一个任务，在固定线程池上并行执行，结果按参数顺序汇报
 *
 * <p>单个文件失败只影响它自己：错误按 {@code file:line:column: error: message} 打印，其余文件照常处理。</p>
 */
public class FormatRunner {
    private static final Logger LOG = Logger.getLogger(FormatRunner.class.getName());

    private final FormattingOptions options;
    private final boolean dryRun;
    private final boolean setExitIfChanged;
    private final PrintWriter out;
    private final PrintWriter err;
    private final int threads;

    /** 单个文件的处理结果 */
    enum Status {
        UNCHANGED,
        CHANGED,
        FAILED
    }

    static final class Result {
        final String name;
        final Status status;
        final String error;

        Result(String name, Status status, String error) {
            this.name = name;
            this.status = status;
            this.error = error;
        }
    }

    public FormatRunner(FormattingOptions options, boolean dryRun, boolean setExitIfChanged,
                        PrintWriter out, PrintWriter err, int threads) {
        this.options = options;
        this.dryRun = dryRun;
        this.setExitIfChanged = setExitIfChanged;
        this.out = out;
        this.err = err;
        this.threads = Math.max(1, threads);
    }

    /**
     * 格式化文件并原地写回（dry-run 时只列出会改动的文件）
     *
     * @return 退出码：有失败，或开启 --set-exit-if-changed 且有改动时为 1
     */
    public int formatFiles(List<Path> files) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, files.size())));
        List<Future<Result>> futures = new ArrayList<Future<Result>>();
        try {
            for (final Path file : files) {
                futures.add(pool.submit(new Callable<Result>() {
                    @Override
                    public Result call() {
                        return formatFile(file);
                    }
                }));
            }
            List<Result> results = new ArrayList<Result>();
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), files.get(i)));
            }
            return report(results);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 从标准输入读取，格式化结果写到标准输出
     */
    public int formatStdin(InputStream in) throws IOException {
        String source = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        try {
            String formatted = Formatter.format(options, source);
            if (!dryRun) {
                out.print(formatted);
            } else if (!formatted.equals(source)) {
                out.println("<stdin>");
            }
            out.flush();
            return setExitIfChanged && !formatted.equals(source) ? 1 : 0;
        } catch (FormatterException e) {
            String message = describe("<stdin>", e);
            LOG.severe(message);
            err.println(message);
            err.flush();
            return 1;
        }
    }

    Result formatFile(Path file) {
        String name = file.toString();
        try {
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            String formatted = Formatter.format(options, source);
            if (formatted.equals(source)) {
                return new Result(name, Status.UNCHANGED, null);
            }
            if (!dryRun) {
                Files.write(file, formatted.getBytes(StandardCharsets.UTF_8));
            }
            LOG.fine("Formatted " + name);
            return new Result(name, Status.CHANGED, null);
        } catch (FormatterException e) {
            String message = describe(name, e);
            LOG.severe(message);
            return new Result(name, Status.FAILED, message);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Failed to read or write " + name, e);
            return new Result(name, Status.FAILED, name + ": error: " + e.getMessage());
        }
    }

    private static Result await(Future<Result> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Result(file.toString(), Status.FAILED, file + ": error: interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            LOG.log(Level.SEVERE, "Unexpected failure formatting " + file, cause);
            return new Result(file.toString(), Status.FAILED, file + ": error: " + cause);
        }
    }

    private int report(List<Result> results) {
        boolean failed = false;
        boolean changed = false;
        for (Result result : results) {
            switch (result.status) {
                case FAILED:
                    failed = true;
                    err.println(result.error);
                    break;
                case CHANGED:
                    changed = true;
                    if (dryRun) {
                        out.println(result.name);
                    }
                    break;
                default:
                    break;
            }
        }
        out.flush();
        err.flush();
        return failed || (setExitIfChanged && changed) ? 1 : 0;
    }

    static String describe(String name, FormatterException e) {
        return name + ":" + e.getLine() + ":" + e.getColumn() + ": error: " + e.getDescription();
    }
}
