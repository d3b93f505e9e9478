package com.sassed.eval;

import com.sassed.syntax.Statement;

import java.util.List;

/**
 * The block passed to {@code @include}, evaluated in the includer's scope when the mixin
 * reaches {@code @content}. {@code outer} is the content block active at the include site.
 */
record ContentBlock(List<Statement> body, int scope, ContentBlock outer) {
}
