package com.sassed.syntax;

import com.sassed.error.ParseException;
import com.sassed.lexer.Lexer;
import com.sassed.lexer.SourcePosition;
import com.sassed.lexer.StringPart;
import com.sassed.lexer.Token;
import com.sassed.lexer.TokenKind;
import com.sassed.syntax.Expression.*;
import com.sassed.syntax.Statement.*;
import com.sassed.value.ColorNames;
import com.sassed.value.ListSeparator;
import com.sassed.value.SassColor;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser from tokens to a {@link Node.Stylesheet}. Selectors and at-rule
 * preludes stay as {@link Interpolation}s; resolving them is the evaluator's job.
 */
public class Parser {
    private static final Pattern NUMBER = Pattern.compile("([+-]?(?:\\d+(?:\\.\\d+)?|\\.\\d+))(.*)");
    private static final Set<String> RAW_FUNCTIONS = Set.of("calc", "-webkit-calc", "-moz-calc", "var", "env",
            "expression", "element");

    private final List<Token> tokens;
    private final String sourceName;
    private int pos;
    private Set<String> stopWords = Set.of();

    public Parser(List<Token> tokens, String sourceName) {
        this.tokens = tokens;
        this.sourceName = sourceName;
    }

    public static Node.Stylesheet parse(String text, String sourceName) {
        return new Parser(new Lexer(text, sourceName).tokenize(), sourceName).parse();
    }

    /**
     * Parses a parameter signature such as {@code $color, $amount: 10%} into a parameter list.
     */
    public static ParameterList parseParameters(String signature) {
        Parser parser = new Parser(new Lexer("(" + signature + ")", "signature").tokenize(), "signature");
        parser.expect(TokenKind.LPAREN, "\"(\"");
        return parser.parseParameterList();
    }

    public Node.Stylesheet parse() {
        SourcePosition start = peekRaw().position();
        List<Statement> children = parseStatements(true);
        return new Node.Stylesheet(children, sourceName, start);
    }

    // ============================================================
    // Statements
    // ============================================================

    private List<Statement> parseStatements(boolean topLevel) {
        MutableList<Statement> statements = Lists.mutable.empty();
        while (true) {
            Token token = peekRaw();
            if (token.is(TokenKind.COMMENT)) {
                statements.add(new Comment(token.text(), token.position()));
                pos++;
                continue;
            }
            if (token.is(TokenKind.SEMICOLON)) {
                pos++;
                continue;
            }
            if (token.is(TokenKind.EOF)) {
                if (!topLevel) {
                    throw new ParseException(token.position(), "\"}\"", token.toString());
                }
                break;
            }
            if (token.is(TokenKind.RBRACE)) {
                if (topLevel) {
                    throw new ParseException(token.position(), "selector or at-rule", token.toString());
                }
                break;
            }
            statements.add(parseStatement());
        }
        return statements;
    }

    private List<Statement> parseBlock() {
        expect(TokenKind.LBRACE, "\"{\"");
        List<Statement> children = parseStatements(false);
        expect(TokenKind.RBRACE, "\"}\"");
        return children;
    }

    private Statement parseStatement() {
        Token token = peek();
        if (token.is(TokenKind.VARIABLE) && lookahead(1).is(TokenKind.COLON)) {
            return parseVariableDeclaration();
        }
        if (token.is(TokenKind.AT_KEYWORD)) {
            return parseAtRule();
        }
        if (looksLikeDeclaration()) {
            return parseDeclaration();
        }
        Interpolation selector = parseInterpolation(t -> t.is(TokenKind.LBRACE), false);
        if (selector.parts().isEmpty()) {
            throw new ParseException(token.position(), "selector", token.toString());
        }
        return new RuleBlock(selector, parseBlock(), token.position());
    }

    private VariableDeclaration parseVariableDeclaration() {
        Token name = advance();
        expect(TokenKind.COLON, "\":\"");
        Expression value = parseExpressionList();
        boolean isDefault = false;
        boolean global = false;
        while (peek().is(TokenKind.FLAG)) {
            Token flag = advance();
            switch (flag.name().toLowerCase()) {
                case "default" -> isDefault = true;
                case "global" -> global = true;
                default -> throw new ParseException("Invalid flag name \"" + flag.text() + "\"", flag.position());
            }
        }
        expectStatementEnd();
        return new VariableDeclaration(name.name(), value, isDefault, global, name.position());
    }

    /**
     * A name followed by a colon is a declaration unless a brace follows and the colon is glued
     * to the next token, which makes it a pseudo-class selector such as {@code a:hover}.
     */
    private boolean looksLikeDeclaration() {
        int i = skipComments(pos);
        Token first = tokens.get(i);
        if (!first.is(TokenKind.IDENTIFIER) && !first.is(TokenKind.INTERPOLATION_START)) {
            return false;
        }
        boolean firstToken = true;
        while (true) {
            Token token = tokens.get(i);
            if (!firstToken && token.spaceBefore()) {
                break;
            }
            if (token.is(TokenKind.INTERPOLATION_START)) {
                i = skipInterpolation(i);
            } else if (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.OPERATOR, "-")) {
                i++;
            } else {
                break;
            }
            firstToken = false;
        }
        i = skipComments(i);
        if (!tokens.get(i).is(TokenKind.COLON)) {
            return false;
        }
        Token afterColon = tokens.get(skipComments(i + 1));
        int depth = 0;
        for (int j = i + 1; j < tokens.size(); j++) {
            Token token = tokens.get(j);
            switch (token.kind()) {
                case LPAREN, LBRACKET, INTERPOLATION_START -> depth++;
                case RPAREN, RBRACKET, INTERPOLATION_END -> depth--;
                case LBRACE -> {
                    if (depth <= 0) {
                        return afterColon.spaceBefore() || afterColon.is(TokenKind.LBRACE);
                    }
                }
                case SEMICOLON, RBRACE, EOF -> {
                    if (depth <= 0 || token.is(TokenKind.EOF)) {
                        return true;
                    }
                }
                default -> {
                }
            }
        }
        return true;
    }

    private int skipInterpolation(int i) {
        int depth = 0;
        for (int j = i; j < tokens.size(); j++) {
            if (tokens.get(j).is(TokenKind.INTERPOLATION_START)) {
                depth++;
            } else if (tokens.get(j).is(TokenKind.INTERPOLATION_END) && --depth == 0) {
                return j + 1;
            }
        }
        return tokens.size() - 1;
    }

    private int skipComments(int i) {
        while (i < tokens.size() - 1 && tokens.get(i).is(TokenKind.COMMENT)) {
            i++;
        }
        return i;
    }

    private Declaration parseDeclaration() {
        Token start = peek();
        Interpolation name = parseInterpolation(t -> t.is(TokenKind.COLON), false);
        expect(TokenKind.COLON, "\":\"");
        if (name.isPlain() && name.plainText().startsWith("--")) {
            Interpolation raw = parseInterpolation(t -> t.is(TokenKind.SEMICOLON) || t.is(TokenKind.RBRACE), false);
            expectStatementEnd();
            return new Declaration(name, new StringLiteral(raw, false, raw.position()), false, List.of(), start.position());
        }
        if (peek().is(TokenKind.LBRACE)) {
            return new Declaration(name, null, false, parseBlock(), start.position());
        }
        Expression value = parseExpressionList();
        boolean important = false;
        if (peek().is(TokenKind.FLAG) && peek().name().equalsIgnoreCase("important")) {
            advance();
            important = true;
        }
        List<Statement> children = List.of();
        if (peek().is(TokenKind.LBRACE)) {
            children = parseBlock();
        } else {
            expectStatementEnd();
        }
        return new Declaration(name, value, important, children, start.position());
    }

    private Statement parseAtRule() {
        Token keyword = advance();
        SourcePosition position = keyword.position();
        String name = keyword.name().toLowerCase();
        return switch (name) {
            case "mixin" -> {
                String mixinName = expect(TokenKind.IDENTIFIER, "mixin name").text();
                ParameterList parameters = ParameterList.EMPTY;
                if (peek().is(TokenKind.LPAREN)) {
                    advance();
                    parameters = parseParameterList();
                }
                yield new MixinDeclaration(mixinName, parameters, parseBlock(), position);
            }
            case "include" -> parseInclude(position);
            case "content" -> {
                expectStatementEnd();
                yield new Content(position);
            }
            case "function" -> {
                String functionName = expect(TokenKind.IDENTIFIER, "function name").text();
                expect(TokenKind.LPAREN, "\"(\"");
                ParameterList parameters = parseParameterList();
                yield new FunctionDeclaration(functionName, parameters, parseBlock(), position);
            }
            case "return" -> {
                Expression value = parseExpressionList();
                expectStatementEnd();
                yield new Return(value, position);
            }
            case "if" -> parseIf(position);
            case "else" -> throw new ParseException("Invalid CSS: @else must come after @if", position);
            case "each" -> parseEach(position);
            case "for" -> parseFor(position);
            case "while" -> {
                Expression condition = parseExpressionList();
                yield new While(condition, parseBlock(), position);
            }
            case "extend" -> {
                Interpolation selector = parseInterpolation(
                        t -> t.is(TokenKind.SEMICOLON) || t.is(TokenKind.RBRACE) || t.is(TokenKind.FLAG), false);
                boolean optional = false;
                if (peek().is(TokenKind.FLAG)) {
                    Token flag = advance();
                    if (!flag.name().equalsIgnoreCase("optional")) {
                        throw new ParseException(flag.position(), "\"!optional\"", flag.text());
                    }
                    optional = true;
                }
                expectStatementEnd();
                yield new Extend(selector, optional, position);
            }
            case "media" -> {
                Interpolation query = parseInterpolation(t -> t.is(TokenKind.LBRACE), true);
                yield new Media(query, parseBlock(), position);
            }
            case "at-root" -> {
                Interpolation selector = null;
                if (!peek().is(TokenKind.LBRACE)) {
                    selector = parseInterpolation(t -> t.is(TokenKind.LBRACE), false);
                }
                yield new AtRoot(selector, parseBlock(), position);
            }
            case "debug", "warn", "error" -> {
                Expression value = parseExpressionList();
                expectStatementEnd();
                yield new Message(MessageKind.valueOf(name.toUpperCase()), value, position);
            }
            case "import" -> parseImport(position);
            default -> {
                Interpolation prelude = parseInterpolation(
                        t -> t.is(TokenKind.LBRACE) || t.is(TokenKind.SEMICOLON) || t.is(TokenKind.RBRACE), false);
                List<Statement> body = null;
                if (peek().is(TokenKind.LBRACE)) {
                    body = parseBlock();
                } else {
                    expectStatementEnd();
                }
                yield new GenericAtRule(keyword.name(), prelude, body, position);
            }
        };
    }

    private Include parseInclude(SourcePosition position) {
        String mixinName = expect(TokenKind.IDENTIFIER, "mixin name").text();
        ArgumentList arguments = ArgumentList.EMPTY;
        if (peek().is(TokenKind.LPAREN)) {
            advance();
            arguments = parseArgumentList();
        }
        List<Statement> content = null;
        if (peek().is(TokenKind.LBRACE)) {
            content = parseBlock();
        } else {
            expectStatementEnd();
        }
        return new Include(mixinName, arguments, content, position);
    }

    private If parseIf(SourcePosition position) {
        MutableList<IfClause> clauses = Lists.mutable.empty();
        Expression condition = parseExpressionList();
        clauses.add(new IfClause(condition, parseBlock()));
        List<Statement> orElse = null;
        while (lookahead(0).is(TokenKind.AT_KEYWORD) && lookahead(0).name().equalsIgnoreCase("else")) {
            advance();
            if (peek().isIdentifier("if")) {
                advance();
                Expression next = parseExpressionList();
                clauses.add(new IfClause(next, parseBlock()));
            } else {
                orElse = parseBlock();
                break;
            }
        }
        return new If(clauses, orElse, position);
    }

    private Each parseEach(SourcePosition position) {
        MutableList<String> variables = Lists.mutable.empty();
        variables.add(expect(TokenKind.VARIABLE, "variable").name());
        while (peek().is(TokenKind.COMMA)) {
            advance();
            variables.add(expect(TokenKind.VARIABLE, "variable").name());
        }
        Token in = advance();
        if (!in.isIdentifier("in")) {
            throw new ParseException(in.position(), "\"in\"", in.toString());
        }
        Expression list = parseExpressionList();
        return new Each(variables, list, parseBlock(), position);
    }

    private For parseFor(SourcePosition position) {
        String variable = expect(TokenKind.VARIABLE, "variable").name();
        Token from = advance();
        if (!from.isIdentifier("from")) {
            throw new ParseException(from.position(), "\"from\"", from.toString());
        }
        Set<String> saved = stopWords;
        stopWords = Set.of("through", "to");
        Expression start;
        try {
            start = parseExpressionList();
        } finally {
            stopWords = saved;
        }
        Token bound = advance();
        boolean inclusive;
        if (bound.isIdentifier("through")) {
            inclusive = true;
        } else if (bound.isIdentifier("to")) {
            inclusive = false;
        } else {
            throw new ParseException(bound.position(), "\"through\" or \"to\"", bound.toString());
        }
        Expression end = parseExpressionList();
        return new For(variable, start, end, inclusive, parseBlock(), position);
    }

    private Import parseImport(SourcePosition position) {
        MutableList<ImportTarget> targets = Lists.mutable.empty();
        while (true) {
            Token token = peek();
            boolean sassImport = token.is(TokenKind.STRING)
                    && token.parts().stream().allMatch(part -> part instanceof StringPart.Literal)
                    && isImportEnd(lookahead(1));
            String url = sassImport ? unquote(token.text()) : null;
            if (sassImport && !isPlainCssImport(url)) {
                advance();
                targets.add(new ImportTarget.SassImport(url, token.position()));
            } else {
                Interpolation text = parseInterpolation(this::isImportEnd, false);
                targets.add(new ImportTarget.CssImport(text));
            }
            if (!peek().is(TokenKind.COMMA)) {
                break;
            }
            advance();
        }
        expectStatementEnd();
        return new Import(targets, position);
    }

    private boolean isImportEnd(Token token) {
        return token.is(TokenKind.COMMA) || token.is(TokenKind.SEMICOLON) || token.is(TokenKind.RBRACE)
                || token.is(TokenKind.EOF);
    }

    private static boolean isPlainCssImport(String url) {
        return url.endsWith(".css") || url.startsWith("http://") || url.startsWith("https://") || url.startsWith("//");
    }

    private static String unquote(String quoted) {
        return quoted.substring(1, quoted.length() - 1);
    }

    private void expectStatementEnd() {
        Token token = peek();
        if (token.is(TokenKind.SEMICOLON)) {
            advance();
        } else if (!token.is(TokenKind.RBRACE) && !token.is(TokenKind.EOF)) {
            throw new ParseException(token.position(), "\";\"", token.toString());
        }
    }

    // ============================================================
    // Parameters and arguments
    // ============================================================

    private ParameterList parseParameterList() {
        MutableList<Parameter> parameters = Lists.mutable.empty();
        String rest = null;
        while (!peek().is(TokenKind.RPAREN)) {
            Token name = expect(TokenKind.VARIABLE, "variable name");
            if (peek().is(TokenKind.ELLIPSIS)) {
                advance();
                rest = name.name();
                break;
            }
            Expression defaultValue = null;
            if (peek().is(TokenKind.COLON)) {
                advance();
                defaultValue = parseSpaceList();
            }
            parameters.add(new Parameter(name.name(), defaultValue));
            if (!peek().is(TokenKind.COMMA)) {
                break;
            }
            advance();
        }
        expect(TokenKind.RPAREN, "\")\"");
        return new ParameterList(parameters, rest);
    }

    private ArgumentList parseArgumentList() {
        MutableList<Expression> positional = Lists.mutable.empty();
        Map<String, Expression> keywords = new LinkedHashMap<>();
        Expression rest = null;
        Expression keywordRest = null;
        while (!peek().is(TokenKind.RPAREN)) {
            if (peek().is(TokenKind.VARIABLE) && lookahead(1).is(TokenKind.COLON)) {
                Token name = advance();
                advance();
                if (keywords.put(name.name(), parseSpaceList()) != null) {
                    throw new ParseException("Duplicate argument " + name.text(), name.position());
                }
            } else {
                Token start = peek();
                Expression argument = parseSpaceList();
                if (peek().is(TokenKind.ELLIPSIS)) {
                    advance();
                    if (rest == null) {
                        rest = argument;
                    } else if (keywordRest == null) {
                        keywordRest = argument;
                    } else {
                        throw new ParseException(start.position(), "\")\"", "...");
                    }
                } else if (!keywords.isEmpty() || rest != null) {
                    throw new ParseException("Positional arguments must come before keyword arguments", start.position());
                } else {
                    positional.add(argument);
                }
            }
            if (!peek().is(TokenKind.COMMA)) {
                break;
            }
            advance();
        }
        expect(TokenKind.RPAREN, "\")\"");
        return new ArgumentList(positional, keywords, rest, keywordRest);
    }

    // ============================================================
    // Expressions
    // ============================================================

    /**
     * Parses the whole token list as one expression; used for interpolations inside strings.
     */
    private Expression parseStandaloneExpression() {
        Expression expression = parseExpressionList();
        Token token = peek();
        if (!token.is(TokenKind.EOF)) {
            throw new ParseException(token.position(), "\"}\"", token.toString());
        }
        return expression;
    }

    Expression parseExpressionList() {
        Token start = peek();
        Expression first = parseSpaceList();
        if (!peek().is(TokenKind.COMMA)) {
            return first;
        }
        MutableList<Expression> items = Lists.mutable.with(first);
        while (peek().is(TokenKind.COMMA)) {
            advance();
            if (!startsExpression(peek())) {
                break;
            }
            items.add(parseSpaceList());
        }
        return new ListExpression(items, ListSeparator.COMMA, false, start.position());
    }

    private Expression parseSpaceList() {
        Token start = peek();
        Expression first = parseOr();
        if (!startsExpression(peek())) {
            return first;
        }
        MutableList<Expression> items = Lists.mutable.with(first);
        while (startsExpression(peek())) {
            items.add(parseOr());
        }
        return new ListExpression(items, ListSeparator.SPACE, false, start.position());
    }

    private boolean startsExpression(Token token) {
        return switch (token.kind()) {
            case NUMBER, STRING, URL, HASH, VARIABLE, LPAREN, LBRACKET, INTERPOLATION_START -> true;
            case IDENTIFIER -> !stopWords.contains(token.text().toLowerCase());
            case DELIM -> token.text().equals("&");
            case OPERATOR -> (token.text().equals("-") || token.text().equals("+"))
                    && token.spaceBefore() && !lookahead(1).spaceBefore();
            default -> false;
        };
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (peek().isIdentifier("or")) {
            Token op = advance();
            left = new Binary(Operator.OR, left, parseAnd(), op.position());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseEquality();
        while (peek().isIdentifier("and")) {
            Token op = advance();
            left = new Binary(Operator.AND, left, parseEquality(), op.position());
        }
        return left;
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (peek().is(TokenKind.OPERATOR, "==") || peek().is(TokenKind.OPERATOR, "!=")) {
            Token op = advance();
            left = new Binary(Operator.fromSymbol(op.text()), left, parseRelational(), op.position());
        }
        return left;
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (peek().is(TokenKind.OPERATOR) && Set.of("<", ">", "<=", ">=").contains(peek().text())) {
            Token op = advance();
            left = new Binary(Operator.fromSymbol(op.text()), left, parseAdditive(), op.position());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (isBinary("+") || isBinary("-")) {
            Token op = advance();
            left = new Binary(Operator.fromSymbol(op.text()), left, parseMultiplicative(), op.position());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        while (isBinary("*") || isBinary("/") || isBinary("%")) {
            Token op = advance();
            left = new Binary(Operator.fromSymbol(op.text()), left, parseUnary(), op.position());
        }
        return left;
    }

    /**
     * An operator preceded by whitespace but glued to its right operand starts a new list
     * element ({@code 1px -$x}) instead of acting as a binary operator.
     */
    private boolean isBinary(String symbol) {
        Token token = peek();
        if (!token.is(TokenKind.OPERATOR, symbol)) {
            return false;
        }
        if ((symbol.equals("-") || symbol.equals("+")) && token.spaceBefore() && !lookahead(1).spaceBefore()) {
            return false;
        }
        return true;
    }

    private Expression parseUnary() {
        Token token = peek();
        if (token.is(TokenKind.OPERATOR, "-") || token.is(TokenKind.OPERATOR, "+") || token.is(TokenKind.OPERATOR, "/")) {
            advance();
            return new Unary(token.text(), parseUnary(), token.position());
        }
        if (token.isIdentifier("not") && startsOperand(lookahead(1))) {
            advance();
            return new Unary("not", parseUnary(), token.position());
        }
        return parsePrimary();
    }

    private boolean startsOperand(Token token) {
        return token.spaceBefore() && startsExpression(token) || token.is(TokenKind.LPAREN);
    }

    private Expression parsePrimary() {
        Token token = peek();
        SourcePosition position = token.position();
        switch (token.kind()) {
            case NUMBER -> {
                advance();
                Matcher matcher = NUMBER.matcher(token.text());
                if (!matcher.matches()) {
                    throw new ParseException(position, "number", token.text());
                }
                return new NumberLiteral(Double.parseDouble(matcher.group(1)), matcher.group(2), position);
            }
            case STRING -> {
                advance();
                return new StringLiteral(stringInterpolation(token), true, position);
            }
            case URL -> {
                advance();
                return new StringLiteral(stringInterpolation(token), false, position);
            }
            case HASH -> {
                advance();
                SassColor color = SassColor.parseHex(token.text());
                if (color != null && !(glued() && peekRaw().is(TokenKind.INTERPOLATION_START))) {
                    return new ColorLiteral(color, position);
                }
                return new StringLiteral(Interpolation.plain(token.text(), position), false, position);
            }
            case VARIABLE -> {
                advance();
                return new VariableReference(token.name(), position);
            }
            case LPAREN -> {
                return parseParenthesized();
            }
            case LBRACKET -> {
                advance();
                if (peek().is(TokenKind.RBRACKET)) {
                    advance();
                    return new ListExpression(List.of(), ListSeparator.UNDECIDED, true, position);
                }
                Expression inner = parseExpressionList();
                expect(TokenKind.RBRACKET, "\"]\"");
                if (inner instanceof ListExpression list && !list.bracketed()) {
                    return new ListExpression(list.items(), list.separator(), true, position);
                }
                return new ListExpression(List.of(inner), ListSeparator.UNDECIDED, true, position);
            }
            case IDENTIFIER, INTERPOLATION_START -> {
                return parseIdentifierLike();
            }
            case DELIM -> {
                if (token.text().equals("&")) {
                    advance();
                    return new ParentReference(position);
                }
            }
            default -> {
            }
        }
        throw new ParseException(position, "expression", token.toString());
    }

    private Expression parseParenthesized() {
        Token open = advance();
        if (peek().is(TokenKind.RPAREN)) {
            advance();
            return new ListExpression(List.of(), ListSeparator.UNDECIDED, false, open.position());
        }
        Set<String> saved = stopWords;
        stopWords = Set.of();
        try {
            Expression first = parseSpaceList();
            if (peek().is(TokenKind.COLON)) {
                return parseMap(first, open.position());
            }
            Expression inner = first;
            if (peek().is(TokenKind.COMMA)) {
                MutableList<Expression> items = Lists.mutable.with(first);
                while (peek().is(TokenKind.COMMA)) {
                    advance();
                    if (!startsExpression(peek())) {
                        break;
                    }
                    items.add(parseSpaceList());
                }
                inner = new ListExpression(items, ListSeparator.COMMA, false, open.position());
            }
            expect(TokenKind.RPAREN, "\")\"");
            return new Parenthesized(inner, open.position());
        } finally {
            stopWords = saved;
        }
    }

    private MapExpression parseMap(Expression firstKey, SourcePosition position) {
        MutableList<Expression> keys = Lists.mutable.with(firstKey);
        MutableList<Expression> values = Lists.mutable.empty();
        expect(TokenKind.COLON, "\":\"");
        values.add(parseSpaceList());
        while (peek().is(TokenKind.COMMA)) {
            advance();
            if (peek().is(TokenKind.RPAREN)) {
                break;
            }
            keys.add(parseSpaceList());
            expect(TokenKind.COLON, "\":\"");
            values.add(parseSpaceList());
        }
        expect(TokenKind.RPAREN, "\")\"");
        return new MapExpression(keys, values, position);
    }

    private Expression parseIdentifierLike() {
        Token first = peek();
        SourcePosition position = first.position();
        if (first.is(TokenKind.IDENTIFIER) && lookahead(1).is(TokenKind.LPAREN) && !lookahead(1).spaceBefore()) {
            advance();
            advance();
            if (RAW_FUNCTIONS.contains(first.text().toLowerCase())) {
                Interpolation raw = parseRawArguments(first.text(), position);
                return new StringLiteral(raw, false, position);
            }
            return new FunctionCall(first.text(), parseArgumentList(), position);
        }

        MutableList<Interpolation.Part> parts = Lists.mutable.empty();
        boolean plain = true;
        do {
            Token token = peek();
            if (token.is(TokenKind.INTERPOLATION_START)) {
                parts.add(new Interpolation.Part.Expr(parseInterpolationExpression()));
                plain = false;
            } else {
                advance();
                parts.add(new Interpolation.Part.Text(token.text()));
            }
        } while (glued() && (peek().is(TokenKind.IDENTIFIER) || peek().is(TokenKind.INTERPOLATION_START)
                || (!plain && (peek().is(TokenKind.NUMBER) || peek().is(TokenKind.OPERATOR, "-")))));

        Interpolation text = new Interpolation(mergeText(parts), position);
        if (text.isPlain()) {
            String word = text.plainText();
            switch (word) {
                case "true" -> {
                    return new BooleanLiteral(true, position);
                }
                case "false" -> {
                    return new BooleanLiteral(false, position);
                }
                case "null" -> {
                    return new NullLiteral(position);
                }
                default -> {
                    SassColor named = ColorNames.lookup(word);
                    if (named != null) {
                        return new ColorLiteral(named, position);
                    }
                }
            }
        }
        return new StringLiteral(text, false, position);
    }

    /**
     * Reads {@code calc(...)}-style arguments verbatim, keeping only interpolations live.
     */
    private Interpolation parseRawArguments(String name, SourcePosition position) {
        MutableList<Interpolation.Part> parts = Lists.mutable.empty();
        parts.add(new Interpolation.Part.Text(name + "("));
        int depth = 0;
        boolean first = true;
        while (true) {
            Token token = peekRaw();
            if (token.is(TokenKind.EOF)) {
                throw new ParseException(token.position(), "\")\"", token.toString());
            }
            if (token.is(TokenKind.RPAREN) && depth == 0) {
                advance();
                break;
            }
            if (token.spaceBefore() && !first) {
                parts.add(new Interpolation.Part.Text(" "));
            }
            first = false;
            if (token.is(TokenKind.INTERPOLATION_START)) {
                parts.add(new Interpolation.Part.Expr(parseInterpolationExpression()));
                continue;
            }
            if (token.is(TokenKind.LPAREN)) {
                depth++;
            } else if (token.is(TokenKind.RPAREN)) {
                depth--;
            }
            pos++;
            parts.add(new Interpolation.Part.Text(token.text()));
        }
        parts.add(new Interpolation.Part.Text(")"));
        return new Interpolation(mergeText(parts), position);
    }

    private Expression parseInterpolationExpression() {
        expect(TokenKind.INTERPOLATION_START, "\"#{\"");
        Set<String> saved = stopWords;
        stopWords = Set.of();
        try {
            Expression expression = parseExpressionList();
            expect(TokenKind.INTERPOLATION_END, "\"}\"");
            return expression;
        } finally {
            stopWords = saved;
        }
    }

    // ============================================================
    // Interpolated text
    // ============================================================

    /**
     * Rebuilds raw text up to (not including) the first token matching {@code stop}, collapsing
     * whitespace to single spaces and turning {@code #{}} into expressions. When
     * {@code variables} is set, bare {@code $variables} are live too (media queries).
     */
    private Interpolation parseInterpolation(Predicate<Token> stop, boolean variables) {
        SourcePosition position = peek().position();
        MutableList<Interpolation.Part> parts = Lists.mutable.empty();
        boolean first = true;
        int depth = 0;
        while (true) {
            Token token = peekRaw();
            if (token.is(TokenKind.EOF)) {
                break;
            }
            if (depth == 0 && stop.test(token)) {
                break;
            }
            if (token.is(TokenKind.RBRACE) || (token.is(TokenKind.SEMICOLON) && depth == 0) || token.is(TokenKind.LBRACE)) {
                throw new ParseException(token.position(), "\"{\"", token.toString());
            }
            if (token.is(TokenKind.COMMENT)) {
                pos++;
                continue;
            }
            if (token.spaceBefore() && !first) {
                parts.add(new Interpolation.Part.Text(" "));
            }
            first = false;
            if (token.is(TokenKind.INTERPOLATION_START)) {
                parts.add(new Interpolation.Part.Expr(parseInterpolationExpression()));
                continue;
            }
            if (variables && token.is(TokenKind.VARIABLE)) {
                pos++;
                parts.add(new Interpolation.Part.Expr(new VariableReference(token.name(), token.position())));
                continue;
            }
            if (token.is(TokenKind.LPAREN) || token.is(TokenKind.LBRACKET)) {
                depth++;
            } else if (token.is(TokenKind.RPAREN) || token.is(TokenKind.RBRACKET)) {
                depth--;
            }
            pos++;
            if ((token.is(TokenKind.STRING) || token.is(TokenKind.URL)) && token.parts().size() > 0
                    && !token.parts().stream().allMatch(part -> part instanceof StringPart.Literal)) {
                boolean quoted = token.is(TokenKind.STRING);
                if (quoted) {
                    parts.add(new Interpolation.Part.Text(token.text().substring(0, 1)));
                }
                parts.addAll(stringInterpolation(token).parts());
                if (quoted) {
                    parts.add(new Interpolation.Part.Text(token.text().substring(0, 1)));
                }
            } else {
                parts.add(new Interpolation.Part.Text(token.text()));
            }
        }
        return new Interpolation(mergeText(parts), position);
    }

    private Interpolation stringInterpolation(Token token) {
        MutableList<Interpolation.Part> parts = Lists.mutable.empty();
        for (StringPart part : token.parts()) {
            if (part instanceof StringPart.Literal literal) {
                parts.add(new Interpolation.Part.Text(literal.text()));
            } else if (part instanceof StringPart.Interpolation interpolation) {
                Expression expression = new Parser(interpolation.tokens(), sourceName).parseStandaloneExpression();
                parts.add(new Interpolation.Part.Expr(expression));
            }
        }
        return new Interpolation(mergeText(parts), token.position());
    }

    private static List<Interpolation.Part> mergeText(List<Interpolation.Part> parts) {
        MutableList<Interpolation.Part> merged = Lists.mutable.empty();
        StringBuilder text = new StringBuilder();
        for (Interpolation.Part part : parts) {
            if (part instanceof Interpolation.Part.Text t) {
                text.append(t.text());
            } else {
                if (text.length() > 0) {
                    merged.add(new Interpolation.Part.Text(text.toString()));
                    text.setLength(0);
                }
                merged.add(part);
            }
        }
        if (text.length() > 0) {
            merged.add(new Interpolation.Part.Text(text.toString()));
        }
        return merged;
    }

    // ============================================================
    // Token access
    // ============================================================

    private Token peekRaw() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    private Token peek() {
        pos = skipComments(pos);
        return peekRaw();
    }

    private Token lookahead(int ahead) {
        int i = skipComments(pos);
        for (int n = 0; n < ahead; n++) {
            i = skipComments(Math.min(i + 1, tokens.size() - 1));
        }
        return tokens.get(Math.min(i, tokens.size() - 1));
    }

    /**
     * True when the next token directly follows the previous one with no whitespace.
     */
    private boolean glued() {
        return !peekRaw().spaceBefore() && !peekRaw().is(TokenKind.EOF);
    }

    private Token advance() {
        Token token = peek();
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return token;
    }

    private Token expect(TokenKind kind, String description) {
        Token token = peek();
        if (!token.is(kind)) {
            throw new ParseException(token.position(), description, token.toString());
        }
        return advance();
    }
}
