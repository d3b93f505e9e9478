package com.sassed;

import java.util.Optional;

/**
 * Compiled CSS, and the source map JSON when source maps are enabled.
 */
public record CompileResult(String css, Optional<String> sourceMap) {
}
