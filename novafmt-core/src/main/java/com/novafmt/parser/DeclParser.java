package com.novafmt.parser;

import com.novafmt.ast.NodeKind;
import com.novafmt.ast.SyntaxNode;
import com.novafmt.lexer.TokenType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.novafmt.lexer.TokenType.*;

/**
 * 声明解析辅助类
 */
class DeclParser {

    /** 声明所在的上下文 */
    enum Context {
        TOP_LEVEL,
        CLASS_BODY,
        LOCAL
    }

    /** 按 IDENTIFIER 扫描、在声明前充当修饰符的软关键词 */
    static final Set<String> SOFT_MODIFIERS = new HashSet<String>(Arrays.asList(
            "public", "private", "protected", "internal",
            "abstract", "final", "open", "override", "sealed",
            "data", "enum", "inner", "companion", "annotation", "value",
            "const", "lateinit", "inline", "noinline", "crossinline", "reified",
            "suspend", "operator", "infix", "tailrec", "external", "vararg",
            "expect", "actual"
    ));

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 文件头 ============

    SyntaxNode parseFileAnnotations() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        while (parser.check(AT) && parser.peekType(1) == IDENTIFIER
                && "file".equals(parser.peek(1).getText()) && parser.peekType(2) == COLON) {
            parts.add(parseAnnotation());
        }
        return SyntaxNode.node(NodeKind.MODIFIER_LIST, parts);
    }

    SyntaxNode parsePackageHeader() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_PACKAGE, "Expected 'package'"));
        parts.add(parseNamePath(false));
        parser.match(parts, SEMICOLON);
        parser.expectStatementEnd();
        return SyntaxNode.node(NodeKind.PACKAGE_HEADER, parts);
    }

    SyntaxNode parseImportList() {
        List<SyntaxNode> imports = new ArrayList<SyntaxNode>();
        while (parser.check(KW_IMPORT)) {
            imports.add(parseImportDirective());
        }
        return SyntaxNode.node(NodeKind.IMPORT_LIST, imports);
    }

    private SyntaxNode parseImportDirective() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(KW_IMPORT, "Expected 'import'"));
        parts.add(parseNamePath(true));
        if (parser.check(KW_AS)) {
            parts.add(parser.advance());
            parts.add(parser.expect(IDENTIFIER, "Expected import alias"));
        }
        parser.match(parts, SEMICOLON);
        parser.expectStatementEnd();
        return SyntaxNode.node(NodeKind.IMPORT_DIRECTIVE, parts);
    }

    private SyntaxNode parseNamePath(boolean allowWildcard) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(IDENTIFIER, "Expected name"));
        while (parser.check(DOT)) {
            parts.add(parser.advance());
            if (allowWildcard && parser.check(MUL)) {
                parts.add(parser.advance());
                break;
            }
            parts.add(parser.expect(IDENTIFIER, "Expected name after '.'"));
        }
        return SyntaxNode.node(NodeKind.NAME_PATH, parts);
    }

    // ============ 修饰符 ============

    /**
     * 解析注解与软关键词修饰符，没有时返回 null。
     * 软关键词只在其后同一行紧跟标识符、关键词或注解时才视为修饰符。
     */
    SyntaxNode parseModifiers() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        while (true) {
            if (parser.check(AT)) {
                parts.add(parseAnnotation());
            } else if (isSoftModifier()) {
                parts.add(parser.advance());
            } else {
                break;
            }
        }
        return parts.isEmpty() ? null : SyntaxNode.node(NodeKind.MODIFIER_LIST, parts);
    }

    private boolean isSoftModifier() {
        if (!parser.check(IDENTIFIER) || !SOFT_MODIFIERS.contains(parser.current().getText())) {
            return false;
        }
        TokenType next = parser.peekType(1);
        if (next != IDENTIFIER && next != AT && !next.isKeyword()) {
            return false;
        }
        return !parser.index.lineBreakAfter(parser.current());
    }

    /**
     * 注解：@Name、@Name(args)、@target:Name
     */
    SyntaxNode parseAnnotation() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(AT, "Expected '@'"));
        if (parser.check(IDENTIFIER) && parser.peekType(1) == COLON && parser.adjacent(1)) {
            parts.add(parser.advance());
            parts.add(parser.advance());
        }
        parts.add(parser.typeParser.parseUserType(Integer.MAX_VALUE));
        if (parser.check(LPAREN) && parser.adjacentToPrevious()) {
            parts.add(parser.exprParser.parseValueArguments());
        }
        return SyntaxNode.node(NodeKind.ANNOTATION, parts);
    }

    /**
     * 修饰符之后是否为声明关键词
     */
    boolean isDeclarationStart(Context context) {
        switch (parser.current().getType()) {
            case KW_VAL:
            case KW_VAR:
            case KW_CLASS:
            case KW_INTERFACE:
            case KW_TYPEALIAS:
                return true;
            case KW_FUN:
                // fun 之后必须是名称、类型参数、接收者或 interface，排除匿名函数表达式
                return parser.peekType(1) != LPAREN || context != Context.LOCAL;
            case KW_OBJECT:
                return parser.peekType(1) == IDENTIFIER || context == Context.CLASS_BODY;
            case IDENTIFIER:
                if (context != Context.CLASS_BODY) {
                    return false;
                }
                return (parser.checkSoft("constructor") && parser.peekType(1) == LPAREN)
                        || (parser.checkSoft("init") && parser.peekType(1) == LBRACE);
            default:
                return false;
        }
    }

    // ============ 声明 ============

    /**
     * 解析一条声明；顶层与局部上下文中不是声明时按语句解析
     */
    SyntaxNode parseDeclaration(Context context) {
        int mark = parser.mark();
        SyntaxNode modifiers = parseModifiers();
        if (!isDeclarationStart(context)) {
            if (context == Context.CLASS_BODY) {
                throw parser.error("Expected member declaration");
            }
            parser.reset(mark);
            return parser.stmtParser.parseStatement();
        }
        return parseDeclarationAfter(modifiers, context);
    }

    /**
     * 已经解析完修饰符，按声明关键词分派
     */
    SyntaxNode parseDeclarationAfter(SyntaxNode modifiers, Context context) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        if (modifiers != null) {
            parts.add(modifiers);
        }
        switch (parser.current().getType()) {
            case KW_VAL:
            case KW_VAR:
                return parseProperty(parts, context);
            case KW_FUN:
                if (parser.peekType(1) == KW_INTERFACE) {
                    parts.add(parser.advance());
                    return parseClass(parts);
                }
                return parseFunction(parts);
            case KW_CLASS:
            case KW_INTERFACE:
                return parseClass(parts);
            case KW_OBJECT:
                return parseObject(parts);
            case KW_TYPEALIAS:
                return parseTypeAlias(parts);
            default:
                if (parser.checkSoft("constructor")) {
                    return parseSecondaryConstructor(parts);
                }
                if (parser.checkSoft("init")) {
                    parts.add(parser.advance());
                    parts.add(parser.stmtParser.parseBlock());
                    return SyntaxNode.node(NodeKind.INITIALIZER, parts);
                }
                throw parser.error("Expected declaration");
        }
    }

    // ============ 类 ============

    private SyntaxNode parseClass(List<SyntaxNode> parts) {
        boolean isEnum = hasModifier(parts, "enum");
        if (!parser.check(KW_CLASS) && !parser.check(KW_INTERFACE)) {
            throw parser.error("Expected 'class' or 'interface'");
        }
        parts.add(parser.advance());
        parts.add(parser.expect(IDENTIFIER, "Expected class name"));
        if (parser.check(LT)) {
            parts.add(parser.typeParser.parseTypeParameters());
        }

        SyntaxNode constructor = tryParsePrimaryConstructor();
        if (constructor != null) {
            parts.add(constructor);
        }

        if (parser.check(COLON)) {
            parts.add(parser.advance());
            parts.add(parseSuperTypeList());
        }

        if (parser.check(LBRACE)) {
            parts.add(parseClassBody(isEnum));
        }
        return SyntaxNode.node(NodeKind.CLASS, parts);
    }

    private SyntaxNode tryParsePrimaryConstructor() {
        if (parser.check(LPAREN) && !parser.newlineBefore()) {
            List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
            parts.add(parseParameterList());
            return SyntaxNode.node(NodeKind.PRIMARY_CONSTRUCTOR, parts);
        }
        int mark = parser.mark();
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        SyntaxNode modifiers = parseModifiers();
        if (modifiers != null) {
            parts.add(modifiers);
        }
        if (parser.checkSoft("constructor") && parser.peekType(1) == LPAREN) {
            parts.add(parser.advance());
            parts.add(parseParameterList());
            return SyntaxNode.node(NodeKind.PRIMARY_CONSTRUCTOR, parts);
        }
        parser.reset(mark);
        return null;
    }

    private SyntaxNode parseObject(List<SyntaxNode> parts) {
        parts.add(parser.expect(KW_OBJECT, "Expected 'object'"));
        if (parser.check(IDENTIFIER)) {
            parts.add(parser.advance());
        }
        if (parser.check(COLON)) {
            parts.add(parser.advance());
            parts.add(parseSuperTypeList());
        }
        if (parser.check(LBRACE)) {
            parts.add(parseClassBody(false));
        }
        return SyntaxNode.node(NodeKind.OBJECT, parts);
    }

    /**
     * 超类型列表：Base(args), Iface, Other by delegate
     */
    SyntaxNode parseSuperTypeList() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        do {
            parts.add(parseSuperType());
        } while (parser.match(parts, COMMA));
        return SyntaxNode.node(NodeKind.SUPER_TYPE_LIST, parts);
    }

    private SyntaxNode parseSuperType() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.typeParser.parseTypeReference());
        if (parser.check(LPAREN) && !parser.newlineBefore()) {
            parts.add(parser.exprParser.parseValueArguments());
        } else if (parser.checkSoft("by")) {
            parts.add(parser.advance());
            // 委托表达式之后的 '{' 属于类体
            parser.disallowTrailingLambda();
            try {
                parts.add(parser.exprParser.parseExpression());
            } finally {
                parser.allowTrailingLambda();
            }
        }
        return SyntaxNode.node(NodeKind.SUPER_TYPE, parts);
    }

    /**
     * 类体；枚举类的类体以枚举项开头，可选的 ';' 之后是成员
     */
    SyntaxNode parseClassBody(boolean isEnum) {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LBRACE, "Expected '{'"));
        parser.enterBraces();
        if (isEnum) {
            parseEnumEntries(parts);
        }
        while (!parser.check(RBRACE)) {
            if (parser.check(EOF)) {
                throw parser.error("Expected '}'");
            }
            if (parser.check(SEMICOLON)) {
                parts.add(parser.advance());
                continue;
            }
            parts.add(parseDeclaration(Context.CLASS_BODY));
            parser.expectStatementEnd();
        }
        parts.add(parser.advance());
        parser.exitScope();
        return SyntaxNode.node(NodeKind.CLASS_BODY, parts);
    }

    private void parseEnumEntries(List<SyntaxNode> parts) {
        while (isEnumEntryStart()) {
            parts.add(parseEnumEntry());
            if (!parser.match(parts, COMMA)) {
                break;
            }
        }
        parser.match(parts, SEMICOLON);
    }

    private boolean isEnumEntryStart() {
        int mark = parser.mark();
        try {
            // 枚举项前只允许注解
            while (parser.check(AT)) {
                parseAnnotation();
            }
            if (!parser.check(IDENTIFIER) || SOFT_MODIFIERS.contains(parser.current().getText())
                    && isSoftModifier()) {
                return false;
            }
            if (parser.checkSoft("init") && parser.peekType(1) == LBRACE) {
                return false;
            }
            if (parser.checkSoft("constructor") && parser.peekType(1) == LPAREN) {
                return false;
            }
            return true;
        } finally {
            parser.reset(mark);
        }
    }

    private SyntaxNode parseEnumEntry() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        SyntaxNode modifiers = parseModifiers();
        if (modifiers != null) {
            parts.add(modifiers);
        }
        parts.add(parser.expect(IDENTIFIER, "Expected enum entry name"));
        if (parser.check(LPAREN)) {
            parts.add(parser.exprParser.parseValueArguments());
        }
        if (parser.check(LBRACE)) {
            parts.add(parseClassBody(false));
        }
        return SyntaxNode.node(NodeKind.ENUM_ENTRY, parts);
    }

    private SyntaxNode parseSecondaryConstructor(List<SyntaxNode> parts) {
        parts.add(parser.expectSoft("constructor"));
        parts.add(parseParameterList());
        if (parser.check(COLON)) {
            parts.add(parser.advance());
            if (!parser.check(KW_THIS) && !parser.check(KW_SUPER)) {
                throw parser.error("Expected 'this' or 'super'");
            }
            parts.add(parser.advance());
            parts.add(parser.exprParser.parseValueArguments());
        }
        if (parser.check(LBRACE)) {
            parts.add(parser.stmtParser.parseBlock());
        }
        return SyntaxNode.node(NodeKind.SECONDARY_CONSTRUCTOR, parts);
    }

    // ============ 函数 ============

    private SyntaxNode parseFunction(List<SyntaxNode> parts) {
        parts.add(parser.expect(KW_FUN, "Expected 'fun'"));
        if (parser.check(LT)) {
            parts.add(parser.typeParser.parseTypeParameters());
        }
        parseReceiver(parts);
        parts.add(parser.expect(IDENTIFIER, "Expected function name"));
        parts.add(parseParameterList());
        if (parser.check(COLON)) {
            parts.add(parser.advance());
            parts.add(parser.typeParser.parseTypeReference());
        }
        if (parser.check(LBRACE)) {
            parts.add(parser.stmtParser.parseBlock());
        } else if (parser.check(ASSIGN)) {
            parts.add(parser.advance());
            parts.add(parser.exprParser.parseExpression());
        }
        return SyntaxNode.node(NodeKind.FUNCTION, parts);
    }

    /**
     * 扩展函数/属性的接收者类型：最后一段名称属于声明本身，
     * 可空接收者（Foo?.bar）则整段都是接收者
     */
    private void parseReceiver(List<SyntaxNode> parts) {
        if (!parser.check(IDENTIFIER)) {
            return;
        }
        int mark = parser.mark();
        SyntaxNode greedy = parser.typeParser.parseUserType(Integer.MAX_VALUE);
        boolean nullable = parser.check(QUESTION);
        int segments = greedy.childrenOf(NodeKind.TOKEN).size() / 2 + 1;
        parser.reset(mark);

        if (nullable) {
            parts.add(parser.typeParser.parseTypeReference());
            parts.add(parser.expect(DOT, "Expected '.' after receiver type"));
        } else if (segments > 1) {
            List<SyntaxNode> receiver = new ArrayList<SyntaxNode>();
            receiver.add(parser.typeParser.parseUserType(segments - 1));
            parts.add(SyntaxNode.node(NodeKind.TYPE_REFERENCE, receiver));
            parts.add(parser.expect(DOT, "Expected '.' after receiver type"));
        }
    }

    /**
     * 形参列表：(a: Int, vararg b: String = "", )
     */
    SyntaxNode parseParameterList() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        while (!parser.check(RPAREN)) {
            parts.add(parseParameter());
            if (!parser.match(parts, COMMA)) {
                break;
            }
        }
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.PARAMETER_LIST, parts);
    }

    private SyntaxNode parseParameter() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        SyntaxNode modifiers = parseModifiers();
        if (modifiers != null) {
            parts.add(modifiers);
        }
        if (parser.check(KW_VAL) || parser.check(KW_VAR)) {
            parts.add(parser.advance());
        }
        parts.add(parser.expect(IDENTIFIER, "Expected parameter name"));
        if (parser.check(COLON)) {
            parts.add(parser.advance());
            parts.add(parser.typeParser.parseTypeReference());
        }
        if (parser.check(ASSIGN)) {
            parts.add(parser.advance());
            parts.add(parser.exprParser.parseExpression());
        }
        return SyntaxNode.node(NodeKind.PARAMETER, parts);
    }

    // ============ 属性 ============

    SyntaxNode parseProperty(List<SyntaxNode> parts, Context context) {
        if (!parser.check(KW_VAL) && !parser.check(KW_VAR)) {
            throw parser.error("Expected 'val' or 'var'");
        }
        parts.add(parser.advance());
        if (parser.check(LT)) {
            parts.add(parser.typeParser.parseTypeParameters());
        }
        if (parser.check(LPAREN)) {
            parts.add(parseDestructuring());
        } else {
            parseReceiver(parts);
            parts.add(parser.expect(IDENTIFIER, "Expected property name"));
        }
        if (parser.check(COLON)) {
            parts.add(parser.advance());
            parts.add(parser.typeParser.parseTypeReference());
        }
        if (parser.check(ASSIGN)) {
            parts.add(parser.advance());
            parts.add(parser.exprParser.parseExpression());
        } else if (parser.checkSoft("by")) {
            parts.add(parser.advance());
            parts.add(parser.exprParser.parseExpression());
        }
        if (context != Context.LOCAL) {
            for (int i = 0; i < 2; i++) {
                SyntaxNode accessor = tryParseAccessor();
                if (accessor == null) {
                    break;
                }
                parts.add(accessor);
            }
        }
        return SyntaxNode.node(NodeKind.PROPERTY, parts);
    }

    /**
     * 解构声明：(a, b: Int)
     */
    SyntaxNode parseDestructuring() {
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        parts.add(parser.expect(LPAREN, "Expected '('"));
        parser.enterParens();
        do {
            List<SyntaxNode> entry = new ArrayList<SyntaxNode>();
            entry.add(parser.expect(IDENTIFIER, "Expected name"));
            if (parser.check(COLON)) {
                entry.add(parser.advance());
                entry.add(parser.typeParser.parseTypeReference());
            }
            parts.add(SyntaxNode.node(NodeKind.PARAMETER, entry));
        } while (parser.match(parts, COMMA) && !parser.check(RPAREN));
        parts.add(parser.expect(RPAREN, "Expected ')'"));
        parser.exitScope();
        return SyntaxNode.node(NodeKind.DESTRUCTURING, parts);
    }

    private SyntaxNode tryParseAccessor() {
        int mark = parser.mark();
        List<SyntaxNode> parts = new ArrayList<SyntaxNode>();
        SyntaxNode modifiers = parseModifiers();
        if (modifiers != null) {
            parts.add(modifiers);
        }
        if (!(parser.checkSoft("get") || parser.checkSoft("set")) || !isAccessorFollower(parser.peekType(1))) {
            parser.reset(mark);
            return null;
        }
        parts.add(parser.advance());
        if (parser.check(LPAREN)) {
            parts.add(parser.advance());
            parser.enterParens();
            if (!parser.check(RPAREN)) {
                List<SyntaxNode> param = new ArrayList<SyntaxNode>();
                param.add(parser.expect(IDENTIFIER, "Expected setter parameter name"));
                if (parser.check(COLON)) {
                    param.add(parser.advance());
                    param.add(parser.typeParser.parseTypeReference());
                }
                parts.add(SyntaxNode.node(NodeKind.PARAMETER, param));
            }
            parts.add(parser.expect(RPAREN, "Expected ')'"));
            parser.exitScope();
            if (parser.check(COLON)) {
                parts.add(parser.advance());
                parts.add(parser.typeParser.parseTypeReference());
            }
            if (parser.check(LBRACE)) {
                parts.add(parser.stmtParser.parseBlock());
            } else if (parser.check(ASSIGN)) {
                parts.add(parser.advance());
                parts.add(parser.exprParser.parseExpression());
            }
        }
        return SyntaxNode.node(NodeKind.PROPERTY_ACCESSOR, parts);
    }

    private boolean isAccessorFollower(TokenType next) {
        if (next == LPAREN || next == SEMICOLON || next == RBRACE || next == EOF) {
            return true;
        }
        // 无函数体的访问器（如 private set）之后必须换行
        return parser.index.lineBreakAfter(parser.current());
    }

    private SyntaxNode parseTypeAlias(List<SyntaxNode> parts) {
        parts.add(parser.expect(KW_TYPEALIAS, "Expected 'typealias'"));
        parts.add(parser.expect(IDENTIFIER, "Expected type alias name"));
        if (parser.check(LT)) {
            parts.add(parser.typeParser.parseTypeParameters());
        }
        parts.add(parser.expect(ASSIGN, "Expected '='"));
        parts.add(parser.typeParser.parseTypeReference());
        return SyntaxNode.node(NodeKind.TYPE_ALIAS, parts);
    }

    private static boolean hasModifier(List<SyntaxNode> parts, String name) {
        for (SyntaxNode part : parts) {
            if (part.is(NodeKind.MODIFIER_LIST)) {
                for (SyntaxNode modifier : part.getChildren()) {
                    if (modifier.isToken(IDENTIFIER) && name.equals(modifier.getToken().getText())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
