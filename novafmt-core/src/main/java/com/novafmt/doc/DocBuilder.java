package com.novafmt.doc;

import com.novafmt.StructuralException;
import com.novafmt.input.TokenIndex;
import com.novafmt.lexer.Token;
import com.novafmt.ops.BreakOp;
import com.novafmt.ops.CloseGroupOp;
import com.novafmt.ops.IndentOp;
import com.novafmt.ops.LiteralOp;
import com.novafmt.ops.Op;
import com.novafmt.ops.OpKind;
import com.novafmt.ops.OpenGroupOp;
import com.novafmt.ops.TokenAnchorOp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 把指令流构建为文档树
 *
 * <p>OpenGroup/CloseGroup 的 id 必须配对，Indent/Dedent 必须正确嵌套；
 * TokenAnchor 之后必须紧跟对应 Token 的 Literal。整个指令流包在一个根组里。</p>
 */
public final class DocBuilder {
    private final TokenIndex index;

    public DocBuilder(TokenIndex index) {
        this.index = index;
    }

    private static final class Frame {
        final OpKind kind;
        final int id;
        final boolean fill;
        final int amount;
        final List<Doc> children = new ArrayList<>();

        Frame(OpKind kind, int id, boolean fill, int amount) {
            this.kind = kind;
            this.id = id;
            this.fill = fill;
            this.amount = amount;
        }
    }

    public Group build(List<Op> ops) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(OpKind.OPEN_GROUP, -1, false, 0));

        for (int i = 0; i < ops.size(); i++) {
            Op op = ops.get(i);
            switch (op.getKind()) {
                case OPEN_GROUP: {
                    OpenGroupOp open = (OpenGroupOp) op;
                    stack.push(new Frame(OpKind.OPEN_GROUP, open.getId(), open.isFill(), 0));
                    break;
                }
                case CLOSE_GROUP: {
                    int id = ((CloseGroupOp) op).getId();
                    Frame top = stack.peek();
                    if (stack.size() == 1 || top.kind != OpKind.OPEN_GROUP || top.id != id) {
                        throw new StructuralException("CloseGroup #" + id + " does not match the innermost open region");
                    }
                    stack.pop();
                    stack.peek().children.add(new Group(top.children, top.fill));
                    break;
                }
                case INDENT:
                    stack.push(new Frame(OpKind.INDENT, -1, false, ((IndentOp) op).getAmount()));
                    break;
                case DEDENT: {
                    Frame top = stack.peek();
                    if (top.kind != OpKind.INDENT) {
                        throw new StructuralException("Dedent without a matching Indent");
                    }
                    stack.pop();
                    stack.peek().children.add(new Indent(top.amount, top.children));
                    break;
                }
                case BREAK: {
                    BreakOp b = (BreakOp) op;
                    stack.peek().children.add(new Break(b.getBreakKind(), b.getFlatText(), b.isFlexible(), b.getBlankLines()));
                    break;
                }
                case TOKEN_ANCHOR: {
                    TokenAnchorOp anchor = (TokenAnchorOp) op;
                    Token token = index.tokenForRange(anchor.getStart(), anchor.getEnd());
                    if (token == null) {
                        throw new StructuralException("Anchor [" + anchor.getStart() + ", " + anchor.getEnd()
                                + ") does not match any token");
                    }
                    if (i + 1 >= ops.size() || !ops.get(i + 1).is(OpKind.LITERAL)
                            || ((LiteralOp) ops.get(i + 1)).getToken() != token) {
                        throw new StructuralException("Anchor [" + anchor.getStart() + ", " + anchor.getEnd()
                                + ") is not followed by the literal of its token", token.getText(),
                                token.getLine(), token.getColumn());
                    }
                    LiteralOp literal = (LiteralOp) ops.get(++i);
                    stack.peek().children.add(new Text(literal.getText(), token));
                    break;
                }
                case LITERAL: {
                    LiteralOp literal = (LiteralOp) op;
                    if (literal.getToken() != null) {
                        throw new StructuralException("Literal of token " + literal.getToken() + " has no anchor");
                    }
                    stack.peek().children.add(new Text(literal.getText(), null));
                    break;
                }
                default:
                    throw new IllegalStateException("Unknown op: " + op);
            }
        }

        if (stack.size() != 1) {
            throw new StructuralException("Unclosed " + (stack.peek().kind == OpKind.INDENT ? "indent" : "group")
                    + " at end of op stream");
        }
        return new Group(stack.pop().children, false);
    }
}
