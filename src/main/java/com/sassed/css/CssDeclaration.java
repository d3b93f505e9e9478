package com.sassed.css;

import com.sassed.lexer.SourcePosition;
import com.sassed.value.Value;

public record CssDeclaration(String name, Value value, boolean important, SourcePosition position) implements CssNode {
}
