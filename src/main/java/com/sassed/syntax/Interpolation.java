package com.sassed.syntax;

import com.sassed.lexer.SourcePosition;

import java.util.List;

/**
 * Literal text mixed with {@code #{}} expressions, as found in selectors, property names and
 * at-rule preludes.
 */
public record Interpolation(List<Part> parts, SourcePosition position) {

    public sealed interface Part {
        record Text(String text) implements Part {}

        record Expr(Expression expression) implements Part {}
    }

    public Interpolation {
        parts = List.copyOf(parts);
    }

    public static Interpolation plain(String text, SourcePosition position) {
        return new Interpolation(List.of(new Part.Text(text)), position);
    }

    public boolean isPlain() {
        return parts.stream().allMatch(part -> part instanceof Part.Text);
    }

    /**
     * The literal text, with any expressions left out.
     */
    public String plainText() {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Part.Text text) {
                sb.append(text.text());
            }
        }
        return sb.toString();
    }
}
