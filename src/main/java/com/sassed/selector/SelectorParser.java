package com.sassed.selector;

import com.sassed.error.ParseException;
import com.sassed.lexer.SourcePosition;
import com.sassed.selector.ComplexSelector.Component;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Parses evaluated selector text (interpolations already substituted) into a {@link SelectorList}.
 */
public class SelectorParser {
    private final String text;
    private final SourcePosition position;
    private int pos;

    public SelectorParser(String text, SourcePosition position) {
        this.text = text;
        this.position = position;
    }

    public static SelectorList parse(String text, SourcePosition position) {
        return new SelectorParser(text, position).parseList();
    }

    public static SelectorList parse(String text) {
        return parse(text, SourcePosition.UNKNOWN);
    }

    public SelectorList parseList() {
        MutableList<ComplexSelector> selectors = Lists.mutable.empty();
        while (true) {
            skipWhitespace();
            selectors.add(parseComplex());
            skipWhitespace();
            if (pos >= text.length()) {
                break;
            }
            if (text.charAt(pos) != ',') {
                throw error("selector", String.valueOf(text.charAt(pos)));
            }
            pos++;
            skipWhitespace();
            // trailing comma
            if (pos >= text.length()) {
                break;
            }
        }
        return new SelectorList(selectors);
    }

    private ComplexSelector parseComplex() {
        MutableList<Component> components = Lists.mutable.empty();
        String combinator = "";
        while (true) {
            boolean space = skipWhitespace();
            if (pos >= text.length() || text.charAt(pos) == ',') {
                break;
            }
            char c = text.charAt(pos);
            if (c == '>' || c == '+' || c == '~') {
                pos++;
                combinator = String.valueOf(c);
                continue;
            }
            if (space && combinator.isEmpty() && !components.isEmpty()) {
                combinator = " ";
            }
            components.add(new Component(combinator, parseCompound()));
            combinator = "";
        }
        if (components.isEmpty()) {
            throw error("selector", pos < text.length() ? String.valueOf(text.charAt(pos)) : "end of selector");
        }
        return new ComplexSelector(components);
    }

    private CompoundSelector parseCompound() {
        MutableList<SimpleSelector> simples = Lists.mutable.empty();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '&') {
                if (!simples.isEmpty()) {
                    throw error("\"&\" at the start of a compound selector", "&");
                }
                pos++;
                simples.add(new SimpleSelector.Parent(readName(true)));
            } else if (c == '.') {
                pos++;
                simples.add(new SimpleSelector.ClassName(requireName()));
            } else if (c == '#') {
                pos++;
                simples.add(new SimpleSelector.Id(requireName()));
            } else if (c == '%') {
                pos++;
                simples.add(new SimpleSelector.Placeholder(requireName()));
            } else if (c == '[') {
                simples.add(new SimpleSelector.Attribute(readBalanced('[', ']')));
            } else if (c == ':') {
                pos++;
                boolean element = pos < text.length() && text.charAt(pos) == ':';
                if (element) {
                    pos++;
                }
                String name = requireName();
                String argument = null;
                if (pos < text.length() && text.charAt(pos) == '(') {
                    argument = readBalanced('(', ')').strip();
                }
                simples.add(new SimpleSelector.Pseudo(name, argument, element));
            } else if (c == '*') {
                pos++;
                simples.add(new SimpleSelector.Type("*"));
            } else if (isNameChar(c) || c == '\\') {
                if (!simples.isEmpty()) {
                    throw error("selector", String.valueOf(c));
                }
                simples.add(new SimpleSelector.Type(readName(false)));
            } else {
                break;
            }
        }
        if (simples.isEmpty()) {
            throw error("selector", pos < text.length() ? String.valueOf(text.charAt(pos)) : "end of selector");
        }
        return new CompoundSelector(simples);
    }

    /**
     * Reads the text between an opening and its matching closing delimiter, exclusive.
     */
    private String readBalanced(char open, char close) {
        int start = ++pos;
        int depth = 1;
        char quote = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (quote != 0) {
                if (c == '\\') {
                    pos++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == open) {
                depth++;
            } else if (c == close && --depth == 0) {
                pos++;
                return text.substring(start, pos - 1);
            }
            pos++;
        }
        throw error("\"" + close + "\"", "end of selector");
    }

    private String requireName() {
        String name = readName(false);
        if (name.isEmpty()) {
            throw error("identifier", pos < text.length() ? String.valueOf(text.charAt(pos)) : "end of selector");
        }
        return name;
    }

    private String readName(boolean allowEmpty) {
        int start = pos;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                pos += 2;
            } else if (isNameChar(c) || (c == '|' && pos > start)) {
                pos++;
            } else {
                break;
            }
        }
        return text.substring(start, pos);
    }

    private boolean skipWhitespace() {
        int start = pos;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos > start;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c > 0x7F;
    }

    private ParseException error(String expected, String found) {
        return new ParseException(position, expected, found);
    }
}
