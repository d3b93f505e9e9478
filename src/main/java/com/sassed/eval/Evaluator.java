package com.sassed.eval;

import com.sassed.config.SassOptions;
import com.sassed.css.CssAtRule;
import com.sassed.css.CssComment;
import com.sassed.css.CssDeclaration;
import com.sassed.css.CssNode;
import com.sassed.css.CssRule;
import com.sassed.error.EvalException;
import com.sassed.error.SassException;
import com.sassed.extend.ExtendGraph;
import com.sassed.extend.Extension;
import com.sassed.function.Arguments;
import com.sassed.function.BuiltinFunction;
import com.sassed.function.FunctionContext;
import com.sassed.function.FunctionRegistry;
import com.sassed.lexer.SourcePosition;
import com.sassed.selector.ComplexSelector;
import com.sassed.selector.SelectorList;
import com.sassed.selector.SelectorParser;
import com.sassed.syntax.ArgumentList;
import com.sassed.syntax.Expression;
import com.sassed.syntax.Expression.*;
import com.sassed.syntax.Interpolation;
import com.sassed.syntax.Node;
import com.sassed.syntax.Operator;
import com.sassed.syntax.Parameter;
import com.sassed.syntax.ParameterList;
import com.sassed.syntax.Statement;
import com.sassed.syntax.Statement.*;
import com.sassed.value.ListSeparator;
import com.sassed.value.SassBoolean;
import com.sassed.value.SassColor;
import com.sassed.value.SassList;
import com.sassed.value.SassMap;
import com.sassed.value.SassNull;
import com.sassed.value.SassNumber;
import com.sassed.value.SassString;
import com.sassed.value.Value;
import com.sassed.value.ValueFormatter;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;

/**
 * Expands a parsed stylesheet into flat CSS: variables, control directives, mixins and
 * functions are evaluated, nested rules are joined to their parents and {@code @media} is
 * bubbled to the top. {@code @extend}s are only recorded here; the extend resolver applies them.
 * One instance serves one compilation.
 */
public class Evaluator implements FunctionContext {
    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);
    private static final int MAX_CALL_DEPTH = 1024;
    private static final Set<String> DECLARATION_DIRECTIVES = Set.of("font-face", "page", "viewport");

    private final SassOptions options;
    private final DiagnosticSink diagnostics;
    private final FunctionRegistry functions;
    private final ImportResolver importResolver;
    private final ValueFormatter formatter;
    private final Environment environment = new Environment();
    private final ExtendGraph extendGraph = new ExtendGraph();
    private final MutableList<CssNode> root = Lists.mutable.empty();
    private final Map<SassList, SassMap> argumentKeywords = new IdentityHashMap<>();
    private final Deque<Path> imports = new ArrayDeque<>();
    private int ruleOrder;
    private int callDepth;
    private Frame current;

    public Evaluator(SassOptions options, DiagnosticSink diagnostics) {
        this(options, diagnostics, FunctionRegistry.standard());
    }

    public Evaluator(SassOptions options, DiagnosticSink diagnostics, FunctionRegistry functions) {
        this.options = options;
        this.diagnostics = diagnostics;
        this.functions = functions;
        this.importResolver = new ImportResolver(options);
        this.formatter = new ValueFormatter(options.precision(), options.compressed());
    }

    /**
     * Where evaluation currently is: the variable scope, the selector and rule that receive
     * declarations, and the output list new rules are appended to.
     */
    private static final class Frame {
        private int scope;
        private SelectorList selector;
        private CssRule rule;
        private CssAtRule directive;
        private MutableList<CssNode> container;
        private MutableList<CssNode> baseContainer;
        private String media;
        private ContentBlock content;
        private boolean inKeyframes;
        private String propertyPrefix = "";
        private boolean inFunction;
        private Path baseDir;

        private Frame copy() {
            Frame frame = new Frame();
            frame.scope = scope;
            frame.selector = selector;
            frame.rule = rule;
            frame.directive = directive;
            frame.container = container;
            frame.baseContainer = baseContainer;
            frame.media = media;
            frame.content = content;
            frame.inKeyframes = inKeyframes;
            frame.propertyPrefix = propertyPrefix;
            frame.inFunction = inFunction;
            frame.baseDir = baseDir;
            return frame;
        }

        private Frame withScope(int newScope) {
            Frame frame = copy();
            frame.scope = newScope;
            return frame;
        }
    }

    public ExpansionResult expand(Node.Stylesheet stylesheet, Path baseDir) {
        Frame frame = new Frame();
        frame.scope = Environment.GLOBAL;
        frame.container = root;
        frame.baseContainer = root;
        frame.baseDir = baseDir;
        evaluateStatements(stylesheet.children(), frame);
        return new ExpansionResult(root, extendGraph);
    }

    // ============================================================
    // Statements
    // ============================================================

    private void evaluateStatements(List<Statement> statements, Frame frame) {
        for (Statement statement : statements) {
            Frame saved = current;
            current = frame;
            try {
                evaluateStatement(statement, frame);
            } catch (EvalException e) {
                throw e.at(statement.position());
            } finally {
                current = saved;
            }
        }
    }

    private void evaluateStatement(Statement statement, Frame frame) {
        if (frame.inFunction && statement instanceof Comment) {
            return;
        }
        if (frame.inFunction && !allowedInFunction(statement)) {
            throw new EvalException("Functions can only contain variable declarations and control directives.",
                    statement.position());
        }
        if (statement instanceof RuleBlock rule) {
            evaluateRule(rule, frame);
        } else if (statement instanceof Declaration declaration) {
            evaluateDeclaration(declaration, frame);
        } else if (statement instanceof VariableDeclaration variable) {
            Value value = evaluate(variable.value(), frame);
            environment.assign(frame.scope, variable.name(), value, variable.isDefault(), variable.global());
        } else if (statement instanceof Comment comment) {
            evaluateComment(comment, frame);
        } else if (statement instanceof MixinDeclaration mixin) {
            environment.defineMixin(frame.scope, new UserCallable(mixin.name(), mixin.parameters(), mixin.body(), frame.scope));
        } else if (statement instanceof FunctionDeclaration function) {
            environment.defineFunction(frame.scope,
                    new UserCallable(function.name(), function.parameters(), function.body(), frame.scope));
        } else if (statement instanceof Include include) {
            evaluateInclude(include, frame);
        } else if (statement instanceof Content) {
            if (frame.content != null) {
                Frame inner = frame.withScope(environment.push(frame.content.scope()));
                inner.content = frame.content.outer();
                evaluateStatements(frame.content.body(), inner);
            }
        } else if (statement instanceof Return ret) {
            if (!frame.inFunction) {
                throw new EvalException("@return may only be used within a function.", ret.position());
            }
            throw new ReturnSignal(evaluate(ret.value(), frame));
        } else if (statement instanceof If ifStatement) {
            evaluateIf(ifStatement, frame);
        } else if (statement instanceof Each each) {
            evaluateEach(each, frame);
        } else if (statement instanceof For forStatement) {
            evaluateFor(forStatement, frame);
        } else if (statement instanceof While whileStatement) {
            while (evaluate(whileStatement.condition(), frame).isTruthy()) {
                evaluateStatements(whileStatement.body(), frame.withScope(environment.pushTransparent(frame.scope)));
            }
        } else if (statement instanceof Extend extend) {
            evaluateExtend(extend, frame);
        } else if (statement instanceof Media media) {
            evaluateMedia(media, frame);
        } else if (statement instanceof AtRoot atRoot) {
            evaluateAtRoot(atRoot, frame);
        } else if (statement instanceof Message message) {
            evaluateMessage(message, frame);
        } else if (statement instanceof Import importStatement) {
            evaluateImport(importStatement, frame);
        } else if (statement instanceof GenericAtRule atRule) {
            evaluateAtRule(atRule, frame);
        }
    }

    private static boolean allowedInFunction(Statement statement) {
        return statement instanceof VariableDeclaration || statement instanceof Return || statement instanceof If
                || statement instanceof Each || statement instanceof For || statement instanceof While
                || statement instanceof Message || statement instanceof Comment
                || statement instanceof FunctionDeclaration;
    }

    private void evaluateRule(RuleBlock block, Frame frame) {
        String text = interpolate(block.selector(), frame).strip();
        Frame inner = frame.withScope(environment.push(frame.scope));
        inner.propertyPrefix = "";
        if (frame.inKeyframes) {
            CssRule rule = new CssRule(text, null, ruleOrder++, block.position());
            frame.container.add(rule);
            inner.rule = rule;
            inner.directive = null;
            evaluateStatements(block.children(), inner);
            return;
        }
        SelectorList selector = SelectorParser.parse(text, block.position()).resolveParent(frame.selector);
        CssRule rule = new CssRule(selector, frame.rule, ruleOrder++, block.position());
        frame.container.add(rule);
        inner.selector = selector;
        inner.rule = rule;
        inner.directive = null;
        evaluateStatements(block.children(), inner);
    }

    private void evaluateDeclaration(Declaration declaration, Frame frame) {
        String name = interpolate(declaration.name(), frame);
        String fullName = frame.propertyPrefix.isEmpty() ? name : frame.propertyPrefix + "-" + name;
        if (declaration.value() != null) {
            Value value = evaluateDeclarationValue(declaration.value(), frame);
            if (!isEmptyValue(value)) {
                formatter.toCss(value);
                declarationTarget(frame, declaration.position())
                        .add(new CssDeclaration(fullName, value, declaration.important(), declaration.position()));
            }
        }
        if (!declaration.children().isEmpty()) {
            Frame inner = frame.copy();
            inner.propertyPrefix = fullName;
            evaluateStatements(declaration.children(), inner);
        }
    }

    private MutableList<CssNode> declarationTarget(Frame frame, SourcePosition position) {
        if (frame.rule != null) {
            return frame.rule.children();
        }
        if (frame.directive != null) {
            return frame.directive.children();
        }
        throw new EvalException("Properties are only allowed within rules, directives, mixin includes, or other properties.",
                position);
    }

    private static boolean isEmptyValue(Value value) {
        if (value instanceof SassNull) {
            return true;
        }
        if (value instanceof SassList list) {
            return !list.bracketed() && list.items().stream().allMatch(item -> item instanceof SassNull);
        }
        return value instanceof SassString string && !string.quoted() && string.text().isEmpty();
    }

    private void evaluateComment(Comment comment, Frame frame) {
        CssComment css = new CssComment(comment.text(), comment.position());
        if (frame.rule != null) {
            frame.rule.children().add(css);
        } else if (frame.directive != null) {
            frame.directive.children().add(css);
        } else {
            frame.container.add(css);
        }
    }

    private void evaluateInclude(Include include, Frame frame) {
        UserCallable mixin = environment.findMixin(frame.scope, include.name());
        if (mixin == null) {
            throw new EvalException("Undefined mixin '" + include.name() + "'.", include.position());
        }
        EvaluatedArguments arguments = evaluateArguments(include.arguments(), frame);
        enterCall(include.position());
        try {
            int scope = environment.push(mixin.closureScope());
            bindArguments("mixin " + mixin.name(), mixin.parameters(), arguments, scope, frame);
            Frame inner = frame.withScope(scope);
            inner.content = include.content() == null ? null : new ContentBlock(include.content(), frame.scope, frame.content);
            evaluateStatements(mixin.body(), inner);
        } finally {
            callDepth--;
        }
    }

    private void enterCall(SourcePosition position) {
        if (++callDepth > MAX_CALL_DEPTH) {
            callDepth--;
            throw new EvalException("Stack depth exceeded max of " + MAX_CALL_DEPTH, position);
        }
    }

    private void evaluateIf(If ifStatement, Frame frame) {
        for (IfClause clause : ifStatement.clauses()) {
            if (evaluate(clause.condition(), frame).isTruthy()) {
                evaluateStatements(clause.body(), frame.withScope(environment.pushTransparent(frame.scope)));
                return;
            }
        }
        if (ifStatement.orElse() != null) {
            evaluateStatements(ifStatement.orElse(), frame.withScope(environment.pushTransparent(frame.scope)));
        }
    }

    private void evaluateEach(Each each, Frame frame) {
        Value list = evaluate(each.list(), frame);
        for (Value item : list.asList()) {
            int scope = environment.pushTransparent(frame.scope);
            if (each.variables().size() == 1) {
                environment.define(scope, each.variables().get(0), item);
            } else {
                List<Value> parts = item.asList();
                for (int i = 0; i < each.variables().size(); i++) {
                    environment.define(scope, each.variables().get(i), i < parts.size() ? parts.get(i) : SassNull.INSTANCE);
                }
            }
            evaluateStatements(each.body(), frame.withScope(scope));
        }
    }

    private void evaluateFor(For forStatement, Frame frame) {
        SassNumber from = requireInteger(evaluate(forStatement.from(), frame), forStatement.from().position());
        SassNumber to = requireInteger(evaluate(forStatement.to(), frame), forStatement.to().position());
        int start = from.intValue();
        int end = (int) Math.rint(to.valueIn(from));
        int step = start <= end ? 1 : -1;
        int last = forStatement.inclusive() ? end : end - step;
        for (int i = start; step > 0 ? i <= last : i >= last; i += step) {
            int scope = environment.pushTransparent(frame.scope);
            environment.define(scope, forStatement.variable(), from.withValue(i));
            evaluateStatements(forStatement.body(), frame.withScope(scope));
        }
    }

    private SassNumber requireInteger(Value value, SourcePosition position) {
        if (value instanceof SassNumber number && number.isInteger()) {
            return number;
        }
        throw new EvalException(formatter.inspect(value) + " is not an integer.", position);
    }

    private void evaluateExtend(Extend extend, Frame frame) {
        if (frame.selector == null) {
            throw new EvalException("Extend directives may only be used within rules.", extend.position());
        }
        String text = interpolate(extend.selector(), frame).strip();
        SelectorList targets = SelectorParser.parse(text, extend.position());
        for (ComplexSelector target : targets.selectors()) {
            if (target.components().size() != 1 || target.hasLeadingCombinator()) {
                throw new EvalException("Can't extend " + target + ": can't extend nested selectors", extend.position());
            }
            for (ComplexSelector extender : frame.selector.selectors()) {
                extendGraph.add(new Extension(target.last(), extender, extend.optional(), frame.media,
                        frame.rule.order(), extend.position()));
            }
        }
    }

    private void evaluateMedia(Media media, Frame frame) {
        String query = interpolate(media.query(), frame).strip();
        String merged = frame.media == null ? query : frame.media + " and " + query;
        CssAtRule atRule = CssAtRule.withBody("media", merged, media.position());
        frame.baseContainer.add(atRule);

        Frame inner = frame.withScope(environment.push(frame.scope));
        inner.media = merged;
        inner.container = atRule.children();
        inner.directive = null;
        if (frame.selector != null && !frame.inKeyframes) {
            CssRule rule = new CssRule(frame.selector, null, ruleOrder++, media.position());
            atRule.children().add(rule);
            inner.rule = rule;
        } else {
            inner.rule = null;
        }
        evaluateStatements(media.body(), inner);
    }

    private void evaluateAtRoot(AtRoot atRoot, Frame frame) {
        Frame inner = frame.copy();
        inner.selector = null;
        inner.rule = null;
        inner.directive = null;
        inner.container = frame.media != null ? frame.container : root;
        if (atRoot.selector() == null) {
            inner.scope = environment.push(frame.scope);
            evaluateStatements(atRoot.body(), inner);
        } else {
            evaluateRule(new RuleBlock(atRoot.selector(), atRoot.body(), atRoot.position()), inner);
        }
    }

    private void evaluateMessage(Message message, Frame frame) {
        Value value = evaluate(message.value(), frame);
        switch (message.kind()) {
            case DEBUG -> diagnostics.debug(formatter.inspect(value).replaceAll("^\"|\"$", ""), message.position());
            case WARN -> diagnostics.warn(formatter.interpolate(value), message.position());
            case ERROR -> throw new EvalException(formatter.interpolate(value), message.position());
        }
    }

    private void evaluateImport(Import importStatement, Frame frame) {
        for (ImportTarget target : importStatement.targets()) {
            if (target instanceof ImportTarget.CssImport css) {
                String text = interpolate(css.text(), frame);
                CssAtRule rule = CssAtRule.statement("import", text, importStatement.position());
                (frame.rule == null ? frame.container : root).add(rule);
            } else if (target instanceof ImportTarget.SassImport sass) {
                Path path = importResolver.resolve(sass.url(), frame.baseDir, sass.position()).toAbsolutePath().normalize();
                if (imports.contains(path)) {
                    throw new EvalException("An @import loop has been found: " + path, sass.position());
                }
                Node.Stylesheet imported = importResolver.load(path, sass.position());
                imports.push(path);
                try {
                    Frame inner = frame.copy();
                    inner.baseDir = path.getParent();
                    evaluateStatements(imported.children(), inner);
                } finally {
                    imports.pop();
                }
            }
        }
    }

    private void evaluateAtRule(GenericAtRule atRule, Frame frame) {
        String name = atRule.name().toLowerCase();
        String prelude = interpolate(atRule.prelude(), frame).strip();
        if (name.equals("charset")) {
            return;
        }
        if (atRule.body() == null) {
            CssAtRule statement = CssAtRule.statement(atRule.name(), prelude, atRule.position());
            (frame.rule != null ? frame.rule.children() : frame.container).add(statement);
            return;
        }
        CssAtRule css = CssAtRule.withBody(atRule.name(), prelude, atRule.position());
        Frame inner = frame.withScope(environment.push(frame.scope));
        inner.container = css.children();
        inner.directive = null;
        inner.rule = null;
        if (css.isKeyframes()) {
            frame.baseContainer.add(css);
            inner.selector = null;
            inner.inKeyframes = true;
            inner.directive = css;
        } else if (DECLARATION_DIRECTIVES.contains(name) || frame.selector == null) {
            (frame.rule != null ? frame.baseContainer : frame.container).add(css);
            inner.directive = css;
            if (frame.selector == null) {
                inner.baseContainer = css.children();
            }
            inner.selector = DECLARATION_DIRECTIVES.contains(name) ? null : frame.selector;
        } else {
            frame.baseContainer.add(css);
            CssRule rule = new CssRule(frame.selector, null, ruleOrder++, atRule.position());
            css.children().add(rule);
            inner.rule = rule;
            inner.baseContainer = css.children();
        }
        evaluateStatements(atRule.body(), inner);
    }

    // ============================================================
    // Expressions
    // ============================================================

    /**
     * A declaration value, where {@code /} between two literal numbers is a separator
     * ({@code font: 12px/30px}) rather than a division.
     */
    private Value evaluateDeclarationValue(Expression expression, Frame frame) {
        if (isSlashSeparated(expression)) {
            Binary binary = (Binary) expression;
            return SassString.unquoted(slashText(binary.left(), frame) + "/" + slashText(binary.right(), frame));
        }
        if (expression instanceof ListExpression list && !list.bracketed()) {
            MutableList<Value> items = Lists.mutable.empty();
            for (Expression item : list.items()) {
                items.add(evaluateDeclarationValue(item, frame));
            }
            return new SassList(items, list.separator(), false);
        }
        return evaluate(expression, frame);
    }

    private static boolean isSlashSeparated(Expression expression) {
        return expression instanceof Binary binary && binary.operator() == Operator.DIVIDE
                && (binary.left() instanceof NumberLiteral || isSlashSeparated(binary.left()))
                && binary.right() instanceof NumberLiteral;
    }

    private String slashText(Expression expression, Frame frame) {
        if (expression instanceof Binary binary) {
            return slashText(binary.left(), frame) + "/" + slashText(binary.right(), frame);
        }
        return formatter.toCss(evaluate(expression, frame));
    }

    private Value evaluate(Expression expression, Frame frame) {
        try {
            return evaluateExpression(expression, frame);
        } catch (EvalException e) {
            throw e.at(expression.position());
        }
    }

    private Value evaluateExpression(Expression expression, Frame frame) {
        if (expression instanceof NumberLiteral number) {
            return SassNumber.of(number.value(), number.unit());
        }
        if (expression instanceof ColorLiteral color) {
            return color.color();
        }
        if (expression instanceof StringLiteral string) {
            return new SassString(interpolate(string.text(), frame), string.quoted());
        }
        if (expression instanceof BooleanLiteral bool) {
            return SassBoolean.of(bool.value());
        }
        if (expression instanceof NullLiteral) {
            return SassNull.INSTANCE;
        }
        if (expression instanceof VariableReference variable) {
            Value value = environment.lookup(frame.scope, variable.name());
            if (value == null) {
                throw new EvalException("Undefined variable: \"$" + variable.name() + "\".", variable.position());
            }
            return value;
        }
        if (expression instanceof Binary binary) {
            return evaluateBinary(binary, frame);
        }
        if (expression instanceof Unary unary) {
            return evaluateUnary(unary, frame);
        }
        if (expression instanceof ListExpression list) {
            MutableList<Value> items = Lists.mutable.empty();
            for (Expression item : list.items()) {
                items.add(evaluate(item, frame));
            }
            return new SassList(items, list.separator(), list.bracketed());
        }
        if (expression instanceof MapExpression map) {
            Map<Value, Value> entries = new LinkedHashMap<>();
            for (int i = 0; i < map.keys().size(); i++) {
                Value key = evaluate(map.keys().get(i), frame);
                if (entries.put(key, evaluate(map.values().get(i), frame)) != null) {
                    throw new EvalException("Duplicate key " + formatter.inspect(key) + " in map "
                            + "(" + formatter.inspect(key) + ": ...).", map.keys().get(i).position());
                }
            }
            return new SassMap(entries);
        }
        if (expression instanceof FunctionCall call) {
            return evaluateCall(call, frame);
        }
        if (expression instanceof Parenthesized parenthesized) {
            return evaluate(parenthesized.inner(), frame);
        }
        if (expression instanceof ParentReference) {
            if (frame.selector == null) {
                return SassNull.INSTANCE;
            }
            MutableList<Value> selectors = Lists.mutable.empty();
            for (ComplexSelector selector : frame.selector.selectors()) {
                selectors.add(SassString.unquoted(selector.toCss(false)));
            }
            return new SassList(selectors, ListSeparator.COMMA);
        }
        throw new EvalException("Unsupported expression " + expression, expression.position());
    }

    private Value evaluateBinary(Binary binary, Frame frame) {
        Operator operator = binary.operator();
        Value left = evaluate(binary.left(), frame);
        if (operator == Operator.AND) {
            return left.isTruthy() ? evaluate(binary.right(), frame) : left;
        }
        if (operator == Operator.OR) {
            return left.isTruthy() ? left : evaluate(binary.right(), frame);
        }
        Value right = evaluate(binary.right(), frame);
        return switch (operator) {
            case EQUALS -> SassBoolean.of(left.equals(right));
            case NOT_EQUALS -> SassBoolean.of(!left.equals(right));
            case LESS_THAN, LESS_THAN_OR_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUALS -> compare(operator, left, right);
            case PLUS -> plus(left, right);
            case MINUS -> minus(left, right);
            case TIMES -> times(left, right);
            case DIVIDE -> divide(left, right);
            case MODULO -> modulo(left, right);
            default -> throw new EvalException("Unknown operator " + operator.symbol());
        };
    }

    private Value compare(Operator operator, Value left, Value right) {
        if (!(left instanceof SassNumber a) || !(right instanceof SassNumber b)) {
            throw undefinedOperation(left, operator, right);
        }
        int result = a.compareTo(b);
        return SassBoolean.of(switch (operator) {
            case LESS_THAN -> result < 0;
            case LESS_THAN_OR_EQUALS -> result <= 0;
            case GREATER_THAN -> result > 0;
            default -> result >= 0;
        });
    }

    private Value plus(Value left, Value right) {
        if (left instanceof SassNumber a && right instanceof SassNumber b) {
            return a.plus(b);
        }
        if (left instanceof SassColor a && right instanceof SassColor b) {
            return colorChannels(a, b, Double::sum, Operator.PLUS);
        }
        if (left instanceof SassColor a && right instanceof SassNumber b && b.isUnitless()) {
            return a.mapChannels(Double::sum, b.value(), b.value(), b.value());
        }
        if (left instanceof SassNumber && right instanceof SassColor) {
            throw undefinedOperation(left, Operator.PLUS, right);
        }
        if (left instanceof SassString a) {
            return new SassString(a.text() + formatter.interpolate(right), a.quoted());
        }
        if (right instanceof SassString b) {
            return new SassString(formatter.interpolate(left) + b.text(), b.quoted());
        }
        return SassString.unquoted(formatter.interpolate(left) + formatter.interpolate(right));
    }

    private Value minus(Value left, Value right) {
        if (left instanceof SassNumber a && right instanceof SassNumber b) {
            return a.minus(b);
        }
        if (left instanceof SassColor a && right instanceof SassColor b) {
            return colorChannels(a, b, (x, y) -> x - y, Operator.MINUS);
        }
        if (left instanceof SassColor a && right instanceof SassNumber b && b.isUnitless()) {
            return a.mapChannels((x, y) -> x - y, b.value(), b.value(), b.value());
        }
        if (left instanceof SassNumber && right instanceof SassColor) {
            throw undefinedOperation(left, Operator.MINUS, right);
        }
        return SassString.unquoted(formatter.interpolate(left) + "-" + formatter.interpolate(right));
    }

    private Value times(Value left, Value right) {
        if (left instanceof SassNumber a && right instanceof SassNumber b) {
            return a.times(b);
        }
        if (left instanceof SassColor a && right instanceof SassColor b) {
            return colorChannels(a, b, (x, y) -> x * y, Operator.TIMES);
        }
        if (left instanceof SassColor a && right instanceof SassNumber b && b.isUnitless()) {
            return a.mapChannels((x, y) -> x * y, b.value(), b.value(), b.value());
        }
        if (left instanceof SassNumber a && a.isUnitless() && right instanceof SassColor b) {
            return b.mapChannels((x, y) -> x * y, a.value(), a.value(), a.value());
        }
        throw undefinedOperation(left, Operator.TIMES, right);
    }

    private Value divide(Value left, Value right) {
        if (left instanceof SassNumber a && right instanceof SassNumber b) {
            return a.dividedBy(b);
        }
        if (left instanceof SassColor a && right instanceof SassColor b) {
            return colorChannels(a, b, (x, y) -> x / y, Operator.DIVIDE);
        }
        if (left instanceof SassColor a && right instanceof SassNumber b && b.isUnitless()) {
            return a.mapChannels((x, y) -> x / y, b.value(), b.value(), b.value());
        }
        if (left instanceof SassNumber && right instanceof SassColor) {
            throw undefinedOperation(left, Operator.DIVIDE, right);
        }
        return SassString.unquoted(formatter.interpolate(left) + "/" + formatter.interpolate(right));
    }

    private Value modulo(Value left, Value right) {
        if (left instanceof SassNumber a && right instanceof SassNumber b) {
            return a.modulo(b);
        }
        if (left instanceof SassColor a && right instanceof SassColor b) {
            return colorChannels(a, b, (x, y) -> x % y, Operator.MODULO);
        }
        throw undefinedOperation(left, Operator.MODULO, right);
    }

    private Value colorChannels(SassColor a, SassColor b, DoubleBinaryOperator op, Operator operator) {
        if (Math.abs(a.alpha() - b.alpha()) > 1e-9) {
            throw new EvalException("Alpha channels must be equal: " + formatter.inspect(a) + " "
                    + operator.symbol() + " " + formatter.inspect(b));
        }
        return a.mapChannels(op, b.red(), b.green(), b.blue());
    }

    private EvalException undefinedOperation(Value left, Operator operator, Value right) {
        return new EvalException("Undefined operation: \"" + formatter.inspect(left) + " " + operator.symbol() + " "
                + formatter.inspect(right) + "\".");
    }

    private Value evaluateUnary(Unary unary, Frame frame) {
        Value operand = evaluate(unary.operand(), frame);
        switch (unary.operator()) {
            case "not":
                return SassBoolean.of(!operand.isTruthy());
            case "-":
                if (operand instanceof SassNumber number) {
                    return number.withValue(-number.value());
                }
                return SassString.unquoted("-" + formatter.interpolate(operand));
            case "+":
                if (operand instanceof SassNumber) {
                    return operand;
                }
                return SassString.unquoted("+" + formatter.interpolate(operand));
            default:
                return SassString.unquoted(unary.operator() + formatter.interpolate(operand));
        }
    }

    private String interpolate(Interpolation interpolation, Frame frame) {
        StringBuilder sb = new StringBuilder();
        for (Interpolation.Part part : interpolation.parts()) {
            if (part instanceof Interpolation.Part.Text text) {
                sb.append(text.text());
            } else if (part instanceof Interpolation.Part.Expr expr) {
                sb.append(formatter.interpolate(evaluate(expr.expression(), frame)));
            }
        }
        return sb.toString();
    }

    // ============================================================
    // Calls
    // ============================================================

    private record EvaluatedArguments(List<Value> positional, Map<String, Value> keywords) {
    }

    private Value evaluateCall(FunctionCall call, Frame frame) {
        String name = call.name();
        UserCallable function = environment.findFunction(frame.scope, name);
        if (function == null && Environment.normalize(name).equals("if")) {
            return evaluateIfFunction(call, frame);
        }
        EvaluatedArguments arguments = evaluateArguments(call.arguments(), frame);
        if (function != null) {
            return callUserFunction(function, arguments, frame, call.position());
        }
        BuiltinFunction builtin = functions.get(name);
        if (builtin != null) {
            return callBuiltin(builtin, arguments, frame, call.position());
        }
        if (!arguments.keywords().isEmpty()) {
            throw new EvalException("Plain CSS function " + name + " doesn't support keyword arguments", call.position());
        }
        MutableList<String> parts = Lists.mutable.empty();
        for (Value value : arguments.positional()) {
            parts.add(formatter.toCss(value));
        }
        return SassString.unquoted(name + "(" + parts.makeString(options.compressed() ? "," : ", ") + ")");
    }

    /**
     * {@code if()} only evaluates the branch it returns.
     */
    private Value evaluateIfFunction(FunctionCall call, Frame frame) {
        ArgumentList arguments = call.arguments();
        Expression[] slots = new Expression[3];
        String[] names = {"condition", "if-true", "if-false"};
        for (int i = 0; i < arguments.positional().size() && i < 3; i++) {
            slots[i] = arguments.positional().get(i);
        }
        arguments.keywords().forEach((key, value) -> {
            for (int i = 0; i < names.length; i++) {
                if (names[i].equals(Environment.normalize(key))) {
                    slots[i] = value;
                }
            }
        });
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                throw new EvalException("Missing argument $" + names[i] + ".", call.position());
            }
        }
        return evaluate(evaluate(slots[0], frame).isTruthy() ? slots[1] : slots[2], frame);
    }

    private EvaluatedArguments evaluateArguments(ArgumentList arguments, Frame frame) {
        MutableList<Value> positional = Lists.mutable.empty();
        Map<String, Value> keywords = new LinkedHashMap<>();
        for (Expression expression : arguments.positional()) {
            positional.add(evaluate(expression, frame));
        }
        arguments.keywords().forEach((name, expression) ->
                keywords.put(Environment.normalize(name), evaluate(expression, frame)));
        if (arguments.rest() != null) {
            Value rest = evaluate(arguments.rest(), frame);
            if (rest instanceof SassMap map) {
                addKeywords(map, keywords);
            } else if (rest instanceof SassList list) {
                positional.addAll(list.items());
                addKeywords(keywordsOf(list), keywords);
            } else {
                positional.add(rest);
            }
        }
        if (arguments.keywordRest() != null) {
            Value rest = evaluate(arguments.keywordRest(), frame);
            if (!(rest instanceof SassMap map)) {
                throw new EvalException("Variable keyword arguments must be a map (was " + formatter.inspect(rest) + ").");
            }
            addKeywords(map, keywords);
        }
        return new EvaluatedArguments(positional, keywords);
    }

    private void addKeywords(SassMap map, Map<String, Value> keywords) {
        map.entries().forEach((key, value) -> {
            if (!(key instanceof SassString string)) {
                throw new EvalException("Variable keyword argument map must have string keys.\n"
                        + formatter.inspect(key) + " is not a string in " + formatter.inspect(map) + ".");
            }
            keywords.put(Environment.normalize(string.text()), value);
        });
    }

    /**
     * Binds call arguments into {@code scope}: positional first, then by name, then defaults
     * (evaluated in {@code scope}, so they can refer to earlier parameters).
     */
    private void bindArguments(String callable, ParameterList parameters, EvaluatedArguments arguments, int scope,
                               Frame frame) {
        List<Parameter> declared = parameters.parameters();
        List<Value> positional = arguments.positional();
        Map<String, Value> keywords = new LinkedHashMap<>(arguments.keywords());
        if (parameters.restParameter() == null && positional.size() > declared.size()) {
            throw new EvalException("Only " + declared.size() + " argument" + (declared.size() == 1 ? "" : "s")
                    + " allowed, but " + positional.size() + " " + (positional.size() == 1 ? "was" : "were")
                    + " passed to " + callable + ".");
        }
        Frame defaults = frame.withScope(scope);
        for (int i = 0; i < declared.size(); i++) {
            Parameter parameter = declared.get(i);
            String name = Environment.normalize(parameter.name());
            if (i < positional.size()) {
                if (keywords.containsKey(name)) {
                    throw new EvalException("Argument $" + parameter.name() + " was passed both by position and by name.");
                }
                environment.define(scope, name, positional.get(i));
            } else if (keywords.containsKey(name)) {
                environment.define(scope, name, keywords.remove(name));
            } else if (parameter.defaultValue() != null) {
                environment.define(scope, name, evaluate(parameter.defaultValue(), defaults));
            } else {
                throw new EvalException("Missing argument $" + parameter.name() + " for " + callable + ".");
            }
        }
        if (parameters.restParameter() != null) {
            List<Value> surplus = positional.size() > declared.size()
                    ? positional.subList(declared.size(), positional.size()) : List.of();
            SassList rest = new SassList(surplus, ListSeparator.COMMA);
            Map<Value, Value> restKeywords = new LinkedHashMap<>();
            keywords.forEach((key, value) -> restKeywords.put(SassString.unquoted(key), value));
            argumentKeywords.put(rest, new SassMap(restKeywords));
            environment.define(scope, parameters.restParameter(), rest);
            keywords.clear();
        }
        if (!keywords.isEmpty()) {
            throw new EvalException("No argument named $" + keywords.keySet().iterator().next() + " for " + callable + ".");
        }
    }

    private Value callUserFunction(UserCallable function, EvaluatedArguments arguments, Frame frame,
                                   SourcePosition position) {
        enterCall(position);
        try {
            int scope = environment.push(function.closureScope());
            bindArguments("function " + function.name(), function.parameters(), arguments, scope, frame);
            Frame inner = frame.withScope(scope);
            inner.inFunction = true;
            inner.content = null;
            try {
                evaluateStatements(function.body(), inner);
            } catch (ReturnSignal signal) {
                return signal.value();
            }
            throw new EvalException("Function " + function.name() + " finished without @return", position);
        } finally {
            callDepth--;
        }
    }

    private Value callBuiltin(BuiltinFunction builtin, EvaluatedArguments arguments, Frame frame,
                              SourcePosition position) {
        int scope = environment.push(Environment.GLOBAL);
        bindArguments("`" + builtin.name() + "'", builtin.parameters(), arguments, scope, frame);
        Map<String, Value> values = new LinkedHashMap<>();
        for (Parameter parameter : builtin.parameters().parameters()) {
            values.put(parameter.name(), environment.lookup(scope, parameter.name()));
        }
        if (builtin.parameters().restParameter() != null) {
            String rest = builtin.parameters().restParameter();
            values.put(rest, environment.lookup(scope, rest));
        }
        try {
            return builtin.body().apply(new Arguments(builtin, values, this));
        } catch (EvalException e) {
            throw e.at(position);
        } catch (SassException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.debug("Built-in {} failed", builtin.name(), e);
            throw new EvalException("Error in " + builtin.signature() + ": " + e.getMessage(), position);
        }
    }

    // ============================================================
    // FunctionContext
    // ============================================================

    @Override
    public ValueFormatter formatter() {
        return formatter;
    }

    @Override
    public String imagePath() {
        return options.imagePath();
    }

    private int currentScope() {
        return current != null ? current.scope : Environment.GLOBAL;
    }

    @Override
    public boolean variableExists(String name) {
        return environment.lookup(currentScope(), name) != null;
    }

    @Override
    public boolean globalVariableExists(String name) {
        return environment.isGlobal(name);
    }

    @Override
    public boolean functionExists(String name) {
        return environment.findFunction(currentScope(), name) != null || functions.contains(name);
    }

    @Override
    public boolean mixinExists(String name) {
        return environment.findMixin(currentScope(), name) != null;
    }

    @Override
    public Value call(String name, List<Value> positional, Map<String, Value> keywords) {
        Frame frame = current;
        UserCallable function = environment.findFunction(frame.scope, name);
        EvaluatedArguments arguments = new EvaluatedArguments(positional, keywords);
        if (function != null) {
            return callUserFunction(function, arguments, frame, SourcePosition.UNKNOWN);
        }
        BuiltinFunction builtin = functions.get(name);
        if (builtin != null) {
            return callBuiltin(builtin, arguments, frame, SourcePosition.UNKNOWN);
        }
        MutableList<String> parts = Lists.mutable.empty();
        for (Value value : positional) {
            parts.add(formatter.toCss(value));
        }
        return SassString.unquoted(name + "(" + parts.makeString(", ") + ")");
    }

    @Override
    public SassMap keywordsOf(SassList argumentList) {
        SassMap keywords = argumentKeywords.get(argumentList);
        return keywords != null ? keywords : SassMap.EMPTY;
    }
}
