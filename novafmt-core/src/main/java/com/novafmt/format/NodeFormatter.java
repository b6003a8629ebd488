package com.novafmt.format;

import com.novafmt.FormattingOptions;
import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.lexer.TokenType;
import com.novafmt.ops.Op;
import com.novafmt.ops.OpStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static com.novafmt.lexer.TokenType.*;

/**
 * 语法树格式化器：按节点种类输出指令流
 *
 * <p>每种节点一条规则，按 {@link NodeKind} 穷举分派。代码 Token 严格按源码顺序输出，
 * 注释由 {@link OpStream} 自动插入；本类只决定 Token 之间的断点、分组与缩进。</p>
 */
public final class NodeFormatter {
    private final TokenIndex index;
    private final FormattingOptions options;
    private final OpStream out;

    public NodeFormatter(TokenIndex index, FormattingOptions options) {
        this.index = index;
        this.options = options;
        this.out = new OpStream(index);
    }

    /**
     * 格式化整个文件，返回完整指令流
     */
    public List<Op> formatRoot(SyntaxNode file) {
        formatFile(file);
        return out.finish();
    }

    // ============ 分派 ============

    private void format(SyntaxNode node) {
        switch (node.getKind()) {
            case TOKEN:
                out.token(node.getToken());
                break;
            case FILE:
                formatFile(node);
                break;
            case PACKAGE_HEADER:
                formatPackageHeader(node);
                break;
            case IMPORT_LIST:
                formatImportList(node);
                break;
            case IMPORT_DIRECTIVE:
                formatImportDirective(node);
                break;
            case MODIFIER_LIST:
                formatModifierList(node, false);
                break;
            case CLASS:
                formatClass(node);
                break;
            case OBJECT:
                formatObject(node);
                break;
            case CLASS_BODY:
                formatClassBody(node);
                break;
            case ENUM_ENTRY:
                formatEnumEntry(node);
                break;
            case PRIMARY_CONSTRUCTOR:
                formatPrimaryConstructor(node);
                break;
            case SECONDARY_CONSTRUCTOR:
                formatSecondaryConstructor(node);
                break;
            case INITIALIZER:
                formatInitializer(node);
                break;
            case SUPER_TYPE_LIST:
                formatSuperTypeList(node);
                break;
            case SUPER_TYPE:
                formatSuperType(node);
                break;
            case FUNCTION:
                formatFunction(node);
                break;
            case PROPERTY:
                formatProperty(node);
                break;
            case PROPERTY_ACCESSOR:
                formatPropertyAccessor(node);
                break;
            case TYPE_ALIAS:
                formatTypeAlias(node);
                break;
            case PARAMETER_LIST:
                formatParenthesizedList(node, true);
                break;
            case VALUE_ARGUMENTS:
                formatParenthesizedList(node, false);
                break;
            case PARAMETER:
                formatParameter(node);
                break;
            case TYPE_PARAMETER:
                formatTypeParameter(node);
                break;
            case DESTRUCTURING:
            case LAMBDA_PARAMETERS:
            case TYPE_PARAMETERS:
            case TYPE_ARGUMENTS:
            case INDEX:
                formatCommaSeparated(node);
                break;
            case FUNCTION_TYPE:
                formatFunctionType(node);
                break;
            case TYPE_REFERENCE:
                formatTypeReference(node);
                break;
            case ANNOTATION:
            case NAME_PATH:
            case USER_TYPE:
            case PARENTHESIZED_TYPE:
            case PARENTHESIZED:
            case THIS_EXPRESSION:
            case CALLABLE_REFERENCE:
            case JUMP:
            case POSTFIX:
                formatAdjacent(node);
                break;
            case BLOCK:
                formatBlock(node);
                break;
            case ASSIGNMENT:
                format(node.child(0));
                formatAssignedValue(node.child(1), node.child(2));
                break;
            case RETURN:
                formatReturn(node);
                break;
            case THROW:
                out.token(node.child(0).getToken());
                out.space();
                format(node.child(1));
                break;
            case LABELED:
                formatLabeled(node);
                break;
            case IF:
                formatIf(node);
                break;
            case WHILE:
                formatWhile(node);
                break;
            case DO_WHILE:
                formatDoWhile(node);
                break;
            case FOR:
                formatFor(node);
                break;
            case WHEN:
                formatWhen(node);
                break;
            case WHEN_ENTRY:
                formatWhenEntry(node);
                break;
            case WHEN_CONDITION:
                formatWhenCondition(node);
                break;
            case TRY:
            case CATCH:
            case FINALLY:
                formatSpaced(node);
                break;
            case BINARY:
                formatBinary(node);
                break;
            case IS_EXPRESSION:
            case AS_EXPRESSION:
                formatTypeCheck(node);
                break;
            case PREFIX:
                formatPrefix(node);
                break;
            case CALL:
                formatCall(node);
                break;
            case VALUE_ARGUMENT:
                formatValueArgument(node);
                break;
            case DOT_QUALIFIED:
                formatQualified(node);
                break;
            case LAMBDA:
                formatLambda(node);
                break;
            case OBJECT_LITERAL:
                formatObjectLiteral(node);
                break;
            default:
                throw new IllegalStateException("Unhandled node kind: " + node.getKind());
        }
    }

    // ============ 文件 ============

    private void formatFile(SyntaxNode file) {
        SyntaxNode previous = null;
        for (SyntaxNode child : file.getChildren()) {
            if (previous != null) {
                if (child.isToken(SEMICOLON)) {
                    out.token(child.getToken());
                    previous = child;
                    continue;
                }
                if (previous.is(NodeKind.PACKAGE_HEADER) || previous.is(NodeKind.IMPORT_LIST)
                        || previous.is(NodeKind.MODIFIER_LIST)) {
                    out.blankLine();
                } else {
                    out.forcedBreak(true);
                }
            }
            if (child.is(NodeKind.MODIFIER_LIST)) {
                // 文件注解每个一行
                List<SyntaxNode> annotations = child.getChildren();
                for (int i = 0; i < annotations.size(); i++) {
                    if (i > 0) {
                        out.forcedBreak(false);
                    }
                    format(annotations.get(i));
                }
            } else {
                format(child);
            }
            previous = child;
        }
    }

    private void formatPackageHeader(SyntaxNode node) {
        out.token(node.child(0).getToken());
        out.space();
        for (int i = 1; i < node.childCount(); i++) {
            format(node.child(i));
        }
    }

    private void formatImportList(SyntaxNode node) {
        List<SyntaxNode> imports = node.getChildren();
        for (int i = 0; i < imports.size(); i++) {
            if (i > 0) {
                out.forcedBreak(false);
            }
            format(imports.get(i));
        }
    }

    private void formatImportDirective(SyntaxNode node) {
        out.token(node.child(0).getToken());
        out.space();
        for (int i = 1; i < node.childCount(); i++) {
            SyntaxNode child = node.child(i);
            if (child.isToken(KW_AS)) {
                out.space();
                out.token(child.getToken());
                out.space();
            } else {
                format(child);
            }
        }
    }

    // ============ 修饰符与注解 ============

    /** 若 i 处是修饰符列表则输出它（含其后的分隔），返回下一个位置 */
    private int modifiersAt(List<SyntaxNode> children, int i) {
        if (i < children.size() && children.get(i).is(NodeKind.MODIFIER_LIST)) {
            formatModifierList(children.get(i), true);
            return i + 1;
        }
        return i;
    }

    private void formatModifierList(SyntaxNode modifiers, boolean separatorAfter) {
        List<SyntaxNode> items = modifiers.getChildren();
        for (int i = 0; i < items.size(); i++) {
            SyntaxNode item = items.get(i);
            format(item);
            if (i < items.size() - 1 || separatorAfter) {
                // 注解后原本换行的保留换行
                if (item.is(NodeKind.ANNOTATION) && index.lineBreakAfter(item.lastToken())) {
                    out.forcedBreak(false);
                } else {
                    out.space();
                }
            }
        }
    }

    // ============ 类与对象 ============

    private void formatClass(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(KW_FUN) || child.isToken(KW_CLASS) || child.isToken(KW_INTERFACE)) {
                out.token(child.getToken());
                out.space();
            } else if (child.is(NodeKind.PRIMARY_CONSTRUCTOR)) {
                if (!child.child(0).is(NodeKind.PARAMETER_LIST)) {
                    out.space();
                }
                format(child);
            } else if (child.isToken(COLON)) {
                out.space();
                out.token(child.getToken());
                format(c.get(++i));
            } else if (child.is(NodeKind.CLASS_BODY)) {
                out.space();
                format(child);
            } else {
                format(child);
            }
        }
    }

    private void formatObject(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(COLON)) {
                out.space();
                out.token(child.getToken());
                format(c.get(++i));
            } else if (child.isToken(KW_OBJECT)) {
                out.token(child.getToken());
            } else {
                out.space();
                format(child);
            }
        }
    }

    private void formatObjectLiteral(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.token(c.get(0).getToken());
        for (int i = 1; i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            out.space();
            if (child.isToken(COLON)) {
                out.token(child.getToken());
                format(c.get(++i));
            } else {
                format(child);
            }
        }
    }

    private void formatPrimaryConstructor(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            format(c.get(i));
        }
    }

    /** 父类型列表跟在冒号之后，放不下时整体移到续行 */
    private void formatSuperTypeList(SyntaxNode node) {
        out.openGroup();
        out.indent(options.getContinuationIndent());
        out.lineBreak(" ");
        for (SyntaxNode child : node.getChildren()) {
            format(child);
            if (child.isToken(COMMA)) {
                out.lineBreak(" ");
            }
        }
        out.dedent();
        out.closeGroup();
    }

    private void formatSuperType(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (isSoftKeyword(child, "by")) {
                out.space();
                out.token(child.getToken());
                out.space();
            } else {
                format(child);
            }
        }
    }

    private void formatClassBody(SyntaxNode body) {
        List<SyntaxNode> c = body.getChildren();
        Token lbrace = c.get(0).getToken();
        Token rbrace = c.get(c.size() - 1).getToken();
        if (c.size() == 2 && !index.hasCommentsBetween(lbrace, rbrace)) {
            out.token(lbrace);
            out.token(rbrace);
            return;
        }
        // 只有简单枚举项的枚举体放得下时写在一行
        boolean inline = isSimpleEnumBody(c);
        if (inline) {
            out.openGroup();
        }
        out.token(lbrace);
        out.indent(options.getBlockIndent());
        SyntaxNode previous = null;
        for (int i = 1; i < c.size() - 1; i++) {
            SyntaxNode child = c.get(i);
            if (previous != null && (child.isToken(COMMA) || child.isToken(SEMICOLON))) {
                out.token(child.getToken());
                previous = child;
                continue;
            }
            if (inline) {
                out.lineBreak(" ");
            } else if (previous == null || child.is(NodeKind.ENUM_ENTRY)) {
                out.forcedBreak(false);
            } else {
                out.forcedBreak(true);
            }
            format(child);
            previous = child;
        }
        out.commentsBefore(rbrace);
        out.dedent();
        if (inline) {
            out.lineBreak(" ");
            out.token(rbrace);
            out.closeGroup();
        } else {
            out.forcedBreak(false);
            out.token(rbrace);
        }
    }

    private static boolean isSimpleEnumBody(List<SyntaxNode> children) {
        boolean entries = false;
        for (int i = 1; i < children.size() - 1; i++) {
            SyntaxNode child = children.get(i);
            if (child.isToken(COMMA)) {
                continue;
            }
            if (!child.is(NodeKind.ENUM_ENTRY) || child.findChild(NodeKind.CLASS_BODY) != null) {
                return false;
            }
            entries = true;
        }
        return entries;
    }

    private void formatEnumEntry(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.is(NodeKind.CLASS_BODY)) {
                out.space();
            }
            format(child);
        }
    }

    private void formatSecondaryConstructor(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(COLON)) {
                out.space();
                out.token(child.getToken());
                out.space();
            } else if (child.is(NodeKind.BLOCK)) {
                out.space();
                format(child);
            } else {
                format(child);
            }
        }
    }

    private void formatInitializer(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        int i = modifiersAt(c, 0);
        out.token(c.get(i).getToken());
        out.space();
        format(c.get(i + 1));
    }

    // ============ 函数与属性 ============

    private void formatFunction(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(KW_FUN) || child.is(NodeKind.TYPE_PARAMETERS)) {
                format(child);
                out.space();
            } else if (child.isToken(COLON)) {
                out.token(child.getToken());
                out.space();
                format(c.get(++i));
            } else if (child.isToken(ASSIGN)) {
                formatAssignedValue(child, c.get(++i));
            } else if (child.is(NodeKind.BLOCK)) {
                out.space();
                format(child);
            } else {
                format(child);
            }
        }
    }

    private void formatProperty(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        boolean named = false;
        boolean accessors = false;
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(KW_VAL) || child.isToken(KW_VAR) || child.is(NodeKind.TYPE_PARAMETERS)) {
                format(child);
                out.space();
            } else if (child.isToken(COLON)) {
                out.token(child.getToken());
                out.space();
                format(c.get(++i));
            } else if (child.isToken(ASSIGN) || (named && isSoftKeyword(child, "by"))) {
                formatAssignedValue(child, c.get(++i));
            } else if (child.is(NodeKind.PROPERTY_ACCESSOR)) {
                if (!accessors) {
                    out.indent(options.getBlockIndent());
                    accessors = true;
                }
                out.forcedBreak(false);
                format(child);
            } else {
                if (child.isToken(IDENTIFIER) || child.is(NodeKind.DESTRUCTURING)) {
                    named = true;
                }
                format(child);
            }
        }
        if (accessors) {
            out.dedent();
        }
    }

    private void formatPropertyAccessor(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(COLON)) {
                out.token(child.getToken());
                out.space();
                format(c.get(++i));
            } else if (child.isToken(ASSIGN)) {
                formatAssignedValue(child, c.get(++i));
            } else if (child.is(NodeKind.BLOCK)) {
                out.space();
                format(child);
            } else {
                format(child);
            }
        }
    }

    private void formatTypeAlias(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(KW_TYPEALIAS)) {
                out.token(child.getToken());
                out.space();
            } else if (child.isToken(ASSIGN)) {
                formatAssignedValue(child, c.get(++i));
            } else {
                format(child);
            }
        }
    }

    /**
     * 赋值号（或 by）之后的值：块状值紧跟在同一行，其余值放不下时整体换到续行
     */
    private void formatAssignedValue(SyntaxNode operator, SyntaxNode value) {
        out.space();
        out.token(operator.getToken());
        if (isBlockLike(value)) {
            out.space();
            format(value);
            return;
        }
        out.openGroup();
        out.indent(options.getContinuationIndent());
        out.lineBreak(" ");
        format(value);
        out.dedent();
        out.closeGroup();
    }

    private static boolean isBlockLike(SyntaxNode node) {
        switch (node.getKind()) {
            case LAMBDA:
            case WHEN:
            case IF:
            case TRY:
            case OBJECT_LITERAL:
                return true;
            case CALL:
                return node.child(node.childCount() - 1).is(NodeKind.LAMBDA);
            case DOT_QUALIFIED:
                return isBlockLike(node.child(node.childCount() - 1));
            default:
                return node.firstToken().containsNewline();
        }
    }

    // ============ 参数 ============

    /**
     * 括号列表：左括号后与每个逗号后可断行，参数使用续行缩进。
     * 声明的参数列表展开时右括号另起一行；实参全为字面量时按填充方式换行。
     */
    private void formatParenthesizedList(SyntaxNode list, boolean declaration) {
        List<SyntaxNode> c = list.getChildren();
        Token lparen = c.get(0).getToken();
        Token rparen = c.get(c.size() - 1).getToken();
        if (c.size() == 2 && !index.hasCommentsBetween(lparen, rparen)) {
            out.token(lparen);
            out.token(rparen);
            return;
        }
        if (!declaration && isLiteralArgumentList(c)) {
            out.openFill();
        } else {
            out.openGroup();
        }
        out.token(lparen);
        out.indent(options.getContinuationIndent());
        out.lineBreak("");
        boolean trailingComma = c.size() > 2 && c.get(c.size() - 2).isToken(COMMA);
        for (int i = 1; i < c.size() - 1; i++) {
            SyntaxNode child = c.get(i);
            format(child);
            if (child.isToken(COMMA) && i < c.size() - 2) {
                out.lineBreak(" ");
            }
        }
        out.dedent();
        if (declaration || trailingComma) {
            out.lineBreak("");
        }
        out.token(rparen);
        out.closeGroup();
    }

    private static boolean isLiteralArgumentList(List<SyntaxNode> children) {
        int count = 0;
        for (int i = 1; i < children.size() - 1; i++) {
            SyntaxNode child = children.get(i);
            if (child.isToken(COMMA)) {
                continue;
            }
            if (child.childCount() != 1 || !child.child(0).isToken()
                    || !child.child(0).getToken().getType().isLiteral()) {
                return false;
            }
            count++;
        }
        return count > 1;
    }

    private void formatParameter(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(KW_VAL) || child.isToken(KW_VAR)) {
                out.token(child.getToken());
                out.space();
            } else if (child.isToken(COLON)) {
                out.token(child.getToken());
                out.space();
            } else if (child.isToken(ASSIGN)) {
                formatAssignedValue(child, c.get(++i));
            } else {
                format(child);
            }
        }
    }

    private void formatValueArgument(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.isToken(ASSIGN)) {
                out.space();
                out.token(child.getToken());
                out.space();
            } else {
                format(child);
            }
        }
    }

    // ============ 类型 ============

    private void formatTypeParameter(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(COLON)) {
                out.space();
                out.token(child.getToken());
                out.space();
            } else {
                format(child);
            }
        }
    }

    private void formatTypeReference(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = modifiersAt(c, 0); i < c.size(); i++) {
            format(c.get(i));
        }
    }

    private void formatFunctionType(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.isToken(ARROW)) {
                out.space();
                out.token(child.getToken());
                out.space();
            } else {
                format(child);
                if (child.isToken(COMMA)) {
                    out.space();
                }
            }
        }
    }

    // ============ 语句 ============

    private void formatBlock(SyntaxNode block) {
        List<SyntaxNode> c = block.getChildren();
        Token lbrace = c.get(0).getToken();
        Token rbrace = c.get(c.size() - 1).getToken();
        if (c.size() == 2 && !index.hasCommentsBetween(lbrace, rbrace)) {
            out.token(lbrace);
            out.token(rbrace);
            return;
        }
        out.token(lbrace);
        out.indent(options.getBlockIndent());
        formatStatements(c, 1, c.size() - 1, false);
        out.commentsBefore(rbrace);
        out.dedent();
        out.forcedBreak(false);
        out.token(rbrace);
    }

    /**
     * 语句每行一条，语句间保留至多一个空行；分号紧跟前一条语句。
     * firstBreakOptional 为真时第一条语句前只是可选断点（单行 lambda）。
     */
    private void formatStatements(List<SyntaxNode> c, int from, int to, boolean firstBreakOptional) {
        boolean first = true;
        for (int i = from; i < to; i++) {
            SyntaxNode child = c.get(i);
            if (!first && child.isToken(SEMICOLON)) {
                out.token(child.getToken());
                continue;
            }
            if (first && firstBreakOptional) {
                out.lineBreak(" ");
            } else {
                out.forcedBreak(!first);
            }
            format(child);
            first = false;
        }
    }

    private void formatReturn(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.token(c.get(0).getToken());
        for (int i = 1; i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(AT)) {
                // return@label
                out.token(child.getToken());
                out.token(c.get(++i).getToken());
            } else {
                out.space();
                format(child);
            }
        }
    }

    private void formatLabeled(SyntaxNode node) {
        out.token(node.child(0).getToken());
        out.token(node.child(1).getToken());
        out.space();
        format(node.child(2));
    }

    /** 循环/分支体：块紧跟在同一行，单条语句放不下时换到下一行并缩进 */
    private void formatControlBody(SyntaxNode body) {
        if (body.is(NodeKind.BLOCK)) {
            out.space();
            format(body);
            return;
        }
        out.openGroup();
        out.indent(options.getBlockIndent());
        out.lineBreak(" ");
        format(body);
        out.dedent();
        out.closeGroup();
    }

    private void formatCondition(List<SyntaxNode> c, int lparen) {
        out.space();
        out.token(c.get(lparen).getToken());
        format(c.get(lparen + 1));
        out.token(c.get(lparen + 2).getToken());
    }

    private void formatIf(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.openGroup();
        out.token(c.get(0).getToken());
        formatCondition(c, 1);
        int i = 4;
        SyntaxNode then = null;
        if (i < c.size() && !c.get(i).isToken(KW_ELSE) && !c.get(i).isToken(SEMICOLON)) {
            then = c.get(i++);
            formatControlBody(then);
        }
        boolean semicolon = false;
        if (i < c.size() && c.get(i).isToken(SEMICOLON)) {
            out.token(c.get(i++).getToken());
            semicolon = true;
        }
        if (i < c.size()) {
            if (then != null && then.is(NodeKind.BLOCK) && !semicolon) {
                out.space();
            } else {
                out.lineBreak(" ");
            }
            out.token(c.get(i++).getToken());
            if (i < c.size()) {
                SyntaxNode otherwise = c.get(i);
                if (otherwise.is(NodeKind.IF)) {
                    out.space();
                    format(otherwise);
                } else {
                    formatControlBody(otherwise);
                }
            }
        }
        out.closeGroup();
    }

    private void formatWhile(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.token(c.get(0).getToken());
        formatCondition(c, 1);
        if (c.size() > 4) {
            formatControlBody(c.get(4));
        }
    }

    private void formatDoWhile(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.token(c.get(0).getToken());
        int i = 1;
        if (!c.get(i).isToken(KW_WHILE)) {
            out.space();
            format(c.get(i++));
        }
        out.space();
        out.token(c.get(i).getToken());
        formatCondition(c, i + 1);
    }

    private void formatFor(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.token(c.get(0).getToken());
        out.space();
        out.token(c.get(1).getToken());
        format(c.get(2));
        out.space();
        out.token(c.get(3).getToken());
        out.space();
        format(c.get(4));
        out.token(c.get(5).getToken());
        if (c.size() > 6) {
            formatControlBody(c.get(6));
        }
    }

    private void formatWhen(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        out.token(c.get(0).getToken());
        int i = 1;
        if (c.get(i).isToken(LPAREN)) {
            formatCondition(c, i);
            i += 3;
        }
        out.space();
        Token lbrace = c.get(i).getToken();
        Token rbrace = c.get(c.size() - 1).getToken();
        out.token(lbrace);
        if (i + 1 == c.size() - 1 && !index.hasCommentsBetween(lbrace, rbrace)) {
            out.token(rbrace);
            return;
        }
        out.indent(options.getBlockIndent());
        formatStatements(c, i + 1, c.size() - 1, false);
        out.commentsBefore(rbrace);
        out.dedent();
        out.forcedBreak(false);
        out.token(rbrace);
    }

    private void formatWhenEntry(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = 0; i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (child.isToken(ARROW)) {
                out.space();
                out.token(child.getToken());
                SyntaxNode body = c.get(++i);
                if (body.is(NodeKind.BLOCK) || isBlockLike(body)) {
                    out.space();
                    format(body);
                } else {
                    out.openGroup();
                    out.indent(options.getContinuationIndent());
                    out.lineBreak(" ");
                    format(body);
                    out.dedent();
                    out.closeGroup();
                }
            } else {
                format(child);
                if (child.isToken(COMMA) && i + 1 < c.size() && !c.get(i + 1).isToken(ARROW)) {
                    out.space();
                }
            }
        }
    }

    private void formatWhenCondition(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            format(child);
            if (child.isToken(KW_IS) || child.isToken(KW_IN)) {
                out.space();
            }
        }
    }

    // ============ 表达式 ============

    /** 二元运算符的优先级层级；同层的链展平为一个组 */
    private static int precedenceOf(SyntaxNode binary) {
        TokenType type = binary.child(1).getToken().getType();
        switch (type) {
            case OR:
                return 1;
            case AND:
                return 2;
            case EQ:
            case NE:
            case REF_EQ:
            case REF_NE:
                return 3;
            case LT:
            case GT:
            case LE:
            case GE:
                return 4;
            case NOT:
            case KW_IN:
                return 5;
            case ELVIS:
                return 6;
            case IDENTIFIER:
                return 7;
            case RANGE:
            case RANGE_EXCLUSIVE:
                return 8;
            case PLUS:
            case MINUS:
                return 9;
            default:
                return 10;
        }
    }

    private static final class Operation {
        final List<SyntaxNode> operator = new ArrayList<SyntaxNode>();
        SyntaxNode operand;
    }

    private static SyntaxNode flattenBinary(SyntaxNode node, int level, List<Operation> operations) {
        SyntaxNode left = node.child(0);
        SyntaxNode first = left.is(NodeKind.BINARY) && precedenceOf(left) == level
                ? flattenBinary(left, level, operations)
                : left;
        Operation operation = new Operation();
        for (int i = 1; i < node.childCount() - 1; i++) {
            operation.operator.add(node.child(i));
        }
        operation.operand = node.child(node.childCount() - 1);
        operations.add(operation);
        return first;
    }

    /**
     * 同优先级的二元链：在运算符之后断行（?: 在运算符之前断行），区间运算符两侧不留空格
     */
    private void formatBinary(SyntaxNode node) {
        List<Operation> operations = new ArrayList<Operation>();
        SyntaxNode first = flattenBinary(node, precedenceOf(node), operations);
        out.openGroup();
        format(first);
        out.indent(options.getContinuationIndent());
        for (Operation operation : operations) {
            TokenType type = operation.operator.get(0).getToken().getType();
            if (type == ELVIS) {
                out.lineBreak(" ");
                emitOperator(operation.operator);
                out.space();
            } else if (type == RANGE || type == RANGE_EXCLUSIVE) {
                emitOperator(operation.operator);
            } else {
                out.space();
                emitOperator(operation.operator);
                out.lineBreak(" ");
            }
            format(operation.operand);
        }
        out.dedent();
        out.closeGroup();
    }

    private void emitOperator(List<SyntaxNode> operator) {
        for (SyntaxNode part : operator) {
            out.token(part.getToken());
        }
    }

    private void formatTypeCheck(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        format(c.get(0));
        out.space();
        for (int i = 1; i < c.size() - 1; i++) {
            out.token(c.get(i).getToken());
        }
        out.space();
        format(c.get(c.size() - 1));
    }

    private void formatPrefix(SyntaxNode node) {
        Token operator = node.child(0).getToken();
        SyntaxNode operand = node.child(1);
        out.token(operator);
        // - -x 之类不能合并成另一个运算符
        char last = operator.getText().charAt(operator.getText().length() - 1);
        String next = operand.firstToken().getText();
        if (!next.isEmpty() && next.charAt(0) == last && (last == '-' || last == '+' || last == '!')) {
            out.space();
        }
        format(operand);
    }

    private void formatCall(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.LAMBDA)) {
                out.space();
            }
            format(child);
        }
    }

    /**
     * 限定调用链：开头的简单名称前缀保持在一起，之后可断的段不止一个时在每个 . 之前断行
     */
    private void formatQualified(SyntaxNode node) {
        Deque<SyntaxNode> segments = new ArrayDeque<SyntaxNode>();
        SyntaxNode receiver = node;
        while (receiver.is(NodeKind.DOT_QUALIFIED)) {
            segments.addFirst(receiver);
            receiver = receiver.child(0);
        }
        List<SyntaxNode> chain = new ArrayList<SyntaxNode>(segments);
        int prefix = 0;
        if (isSimpleName(receiver)) {
            while (prefix < chain.size() && isSimpleName(chain.get(prefix).child(2))) {
                prefix++;
            }
        }
        boolean breakable = chain.size() - prefix > 1;

        out.openGroup();
        format(receiver);
        for (int i = 0; i < prefix; i++) {
            out.token(chain.get(i).child(1).getToken());
            format(chain.get(i).child(2));
        }
        out.indent(options.getContinuationIndent());
        for (int i = prefix; i < chain.size(); i++) {
            if (breakable) {
                out.lineBreak("");
            }
            out.token(chain.get(i).child(1).getToken());
            format(chain.get(i).child(2));
        }
        out.dedent();
        out.closeGroup();
    }

    private static boolean isSimpleName(SyntaxNode node) {
        return node.isToken(IDENTIFIER) || node.isToken(KW_THIS) || node.isToken(KW_SUPER);
    }

    /**
     * lambda：放得下时 { params -> body } 写在一行，否则函数体缩进、右花括号另起一行
     */
    private void formatLambda(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        Token lbrace = c.get(0).getToken();
        Token rbrace = c.get(c.size() - 1).getToken();
        if (c.size() == 2 && !index.hasCommentsBetween(lbrace, rbrace)) {
            out.token(lbrace);
            out.token(rbrace);
            return;
        }
        out.openGroup();
        out.token(lbrace);
        int i = 1;
        if (c.get(i).is(NodeKind.LAMBDA_PARAMETERS)) {
            out.space();
            format(c.get(i++));
        }
        if (c.get(i).isToken(ARROW)) {
            out.space();
            out.token(c.get(i++).getToken());
        }
        out.indent(options.getBlockIndent());
        formatStatements(c, i, c.size() - 1, true);
        out.commentsBefore(rbrace);
        out.dedent();
        out.lineBreak(" ");
        out.token(rbrace);
        out.closeGroup();
    }

    // ============ 通用 ============

    /** 子节点依次紧挨着输出 */
    private void formatAdjacent(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            format(child);
        }
    }

    /** 子节点之间用一个空格分隔（try/catch/finally） */
    private void formatSpaced(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = 0; i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            if (i > 0 && !child.isToken(RPAREN) && !c.get(i - 1).isToken(LPAREN)) {
                out.space();
            }
            format(child);
        }
    }

    /** 逗号后加空格的列表：类型参数、类型实参、解构、lambda 参数、下标 */
    private void formatCommaSeparated(SyntaxNode node) {
        List<SyntaxNode> c = node.getChildren();
        for (int i = 0; i < c.size(); i++) {
            SyntaxNode child = c.get(i);
            format(child);
            if (child.isToken(COMMA) && i + 1 < c.size() && !isClosing(c.get(i + 1))) {
                out.space();
            }
        }
    }

    private static boolean isClosing(SyntaxNode node) {
        return node.isToken(RPAREN) || node.isToken(RBRACKET) || node.isToken(GT);
    }

    private static boolean isSoftKeyword(SyntaxNode node, String text) {
        return node.isToken(IDENTIFIER) && text.equals(node.getToken().getText());
    }
}
