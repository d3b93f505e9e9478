package com.sassed.output;

import java.util.Optional;

/**
 * Rendered stylesheet text and, when source maps are on, the map JSON.
 */
public record RenderedCss(String css, Optional<String> sourceMap) {
}
