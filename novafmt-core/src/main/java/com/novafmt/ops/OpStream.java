package com.novafmt.ops;

import com.novafmt.StructuralException;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 指令流累加器
 *
 * <p>格式化器按源码顺序对每个代码 Token 调用 {@link #token(Token)}，
 * 注释由本类根据 {@link TokenIndex} 的归属自动插入：</p>
 * <ul>
 *   <li>独占一行的注释之前强制换行（升级已有断点或插入新断点）</li>
 *   <li>行注释、或原文中其后换行的注释之后，下一个断点强制换行</li>
 *   <li>行内块注释与相邻内容之间按原文保留一个空格</li>
 * </ul>
 * <p>空白 Token 从不复制；允许空行的强制断点在原文有两个及以上换行时输出一个空行。</p>
 */
public final class OpStream {
    private final TokenIndex index;
    private final List<Op> ops = new ArrayList<>();
    private final Deque<Integer> openGroups = new ArrayDeque<>();
    private int nextGroupId;
    private int nextCodeIndex;
    private int lastLiteral = -1;
    private Token lastEmitted;
    // 前置注释已由 commentsBefore 提前输出的 Token
    private Token leadingDone;
    private boolean pendingNewline;
    private boolean pendingSpace;
    private boolean finished;

    public OpStream(TokenIndex index) {
        this.index = index;
    }

    // ============ 结构指令 ============

    public void openGroup() {
        open(false);
    }

    /** 填充组：每个断点单独判断是否换行 */
    public void openFill() {
        open(true);
    }

    private void open(boolean fill) {
        int id = nextGroupId++;
        openGroups.push(id);
        append(new OpenGroupOp(id, fill));
    }

    public void closeGroup() {
        if (openGroups.isEmpty()) {
            throw new StructuralException("closeGroup without a matching openGroup");
        }
        append(new CloseGroupOp(openGroups.pop()));
    }

    public void indent(int amount) {
        append(new IndentOp(amount));
    }

    public void dedent() {
        append(new DedentOp());
    }

    // ============ 断点 ============

    /** 不可换行的空格 */
    public void space() {
        append(new BreakOp(BreakKind.SPACE, " ", false, 0, false));
    }

    /** 组展开时换行，平铺时输出 flatText */
    public void lineBreak(String flatText) {
        append(new BreakOp(BreakKind.LINE, flatText, false, 0, false));
    }

    /** 即使所在组展开，也只在后续内容放不下时才换行 */
    public void flexibleBreak(String flatText) {
        append(new BreakOp(BreakKind.LINE, flatText, true, 0, false));
    }

    /** 强制换行；allowBlankLine 为真时保留原文中的空行（最多一个） */
    public void forcedBreak(boolean allowBlankLine) {
        append(new BreakOp(BreakKind.FORCED_LINE, "", false, 0, allowBlankLine));
    }

    /** 强制换行并输出一个空行，不受原文影响 */
    public void blankLine() {
        append(new BreakOp(BreakKind.FORCED_LINE, "", false, 1, false));
    }

    // ============ Token ============

    /**
     * 输出一个代码 Token：先输出其前置注释，再输出 Token 本身，最后输出尾随注释
     */
    public void token(Token token) {
        checkOpen();
        checkNext(token);
        if (leadingDone != token) {
            for (Token comment : index.leadingComments(token)) {
                emitComment(comment, isFirstOnLine(comment));
            }
        }
        emitLiteral(token, token.getText(), false);
        nextCodeIndex++;
        for (Token comment : index.trailingComments(token)) {
            emitComment(comment, false);
        }
    }

    /**
     * 提前输出下一个代码 Token 的前置注释（如右花括号之前的注释，使其留在块的缩进内）
     */
    public void commentsBefore(Token token) {
        checkOpen();
        checkNext(token);
        for (Token comment : index.leadingComments(token)) {
            emitComment(comment, isFirstOnLine(comment));
        }
        leadingDone = token;
    }

    /**
     * 结束指令流：所有代码 Token 都必须已经输出，文件末尾的注释在此输出
     */
    public List<Op> finish() {
        checkOpen();
        Token eof = index.getEof();
        if (nextCodeIndex != index.codeIndexOf(eof)) {
            Token skipped = index.getCodeTokens().get(nextCodeIndex);
            throw new StructuralException("Token was never emitted: " + skipped.getText(),
                    skipped.getText(), skipped.getLine(), skipped.getColumn());
        }
        if (!openGroups.isEmpty()) {
            throw new StructuralException("Unclosed group #" + openGroups.peek());
        }
        for (Token comment : index.leadingComments(eof)) {
            emitComment(comment, isFirstOnLine(comment));
        }
        finished = true;
        return Collections.unmodifiableList(new ArrayList<>(ops));
    }

    // ============ 内部实现 ============

    private void checkOpen() {
        if (finished) {
            throw new StructuralException("Op stream already finished");
        }
    }

    private void checkNext(Token token) {
        if (!index.contains(token) || !token.isCode()) {
            throw new StructuralException("Token is not a code token of this file: " + token,
                    token.getText(), token.getLine(), token.getColumn());
        }
        int position = index.codeIndexOf(token);
        if (position < nextCodeIndex) {
            throw new StructuralException("Token emitted out of order: " + token,
                    token.getText(), token.getLine(), token.getColumn());
        }
        if (position > nextCodeIndex) {
            Token skipped = index.getCodeTokens().get(nextCodeIndex);
            throw new StructuralException("Token was skipped: " + skipped,
                    skipped.getText(), skipped.getLine(), skipped.getColumn());
        }
    }

    private boolean isFirstOnLine(Token comment) {
        return comment.getStart() == 0 || index.newlinesBefore(comment) > 0;
    }

    private void emitComment(Token comment, boolean ownLine) {
        String text = comment.getText();
        if (comment.is(TokenType.LINE_COMMENT)) {
            text = rightTrim(text);
        }
        // 行内注释与前面内容之间的空格按原文保留
        if (!ownLine && index.whitespaceBefore(comment)) {
            pendingSpace = true;
        }
        emitLiteral(comment, text, ownLine);
        if (comment.is(TokenType.LINE_COMMENT) || index.newlinesAfter(comment) > 0) {
            pendingNewline = true;
        } else if (index.whitespaceAfter(comment)) {
            pendingSpace = true;
        }
    }

    private void emitLiteral(Token token, String text, boolean ownLine) {
        boolean hasContent = lastEmitted != null;
        int breakIndex = lastBreakSinceLiteral();

        if (hasContent && (pendingNewline || ownLine)) {
            if (breakIndex >= 0) {
                ops.set(breakIndex, ((BreakOp) ops.get(breakIndex)).withKind(BreakKind.FORCED_LINE));
            } else {
                ops.add(new BreakOp(BreakKind.FORCED_LINE, "", false, 0, true));
                breakIndex = ops.size() - 1;
            }
        } else if (hasContent && pendingSpace) {
            if (breakIndex < 0) {
                ops.add(new BreakOp(BreakKind.SPACE, " ", false, 0, false));
            } else if (((BreakOp) ops.get(breakIndex)).getFlatText().isEmpty()) {
                ops.set(breakIndex, ((BreakOp) ops.get(breakIndex)).withFlatText(" "));
            }
        }
        pendingNewline = false;
        pendingSpace = false;

        if (breakIndex >= 0) {
            BreakOp op = (BreakOp) ops.get(breakIndex);
            if (op.isForced() && op.isBlankLineAllowed()) {
                ops.set(breakIndex, op.withBlankLines(index.newlinesBefore(token) >= 2 ? 1 : 0));
            }
        }

        ops.add(new TokenAnchorOp(token.getStart(), token.getEnd()));
        ops.add(new LiteralOp(text, token));
        lastLiteral = ops.size() - 1;
        lastEmitted = token;
    }

    /**
     * 上一个 Literal 之后最后一个断点的位置；中间只隔着结构指令时才算，没有则返回 -1
     */
    private int lastBreakSinceLiteral() {
        for (int i = ops.size() - 1; i > lastLiteral; i--) {
            if (ops.get(i).is(OpKind.BREAK)) {
                return i;
            }
        }
        return -1;
    }

    private void append(Op op) {
        checkOpen();
        ops.add(op);
    }

    private static String rightTrim(String text) {
        int end = text.length();
        while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
