package com.sassed.config;

import com.sassed.error.SassRuntimeException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SassOptionsTest {

    @Test
    public void testDefaults() {
        SassOptions options = SassOptions.defaults();
        assertEquals(OutputStyle.NESTED, options.style());
        assertEquals(5, options.precision());
        assertFalse(options.sourceMap().enabled());
        assertFalse(options.singleFile().enabled());
        assertEquals(ExtensionOptions.DEFAULT, options.extensions());
    }

    @Test
    public void testToBuilderCopiesEverything() {
        SassOptions options = SassOptions.builder()
                .style(OutputStyle.COMPRESSED)
                .precision(3)
                .includePaths(List.of(Path.of("lib")))
                .sourceComments(true)
                .build();
        SassOptions copy = options.toBuilder().precision(7).build();
        assertEquals(OutputStyle.COMPRESSED, copy.style());
        assertEquals(7, copy.precision());
        assertEquals(List.of(Path.of("lib")), copy.includePaths());
        assertTrue(copy.sourceComments());
        assertEquals(3, options.precision());
    }

    @Test
    public void testUnsupportedStylesAreRejected() {
        assertThrows(SassRuntimeException.class, () -> SassOptions.builder().style(OutputStyle.EXPANDED));
        assertThrows(SassRuntimeException.class, () -> SassOptions.builder().style(OutputStyle.COMPACT));
    }

    @Test
    public void testNegativePrecision() {
        assertThrows(SassRuntimeException.class, () -> SassOptions.builder().precision(-1));
    }

    @Test
    public void testParseStyle() {
        assertEquals(OutputStyle.COMPRESSED, OutputStyle.parse("Compressed"));
        SassRuntimeException e = assertThrows(SassRuntimeException.class, () -> OutputStyle.parse("fancy"));
        assertEquals("Unknown output style: fancy", e.getMessage());
    }

    // ============================================================
    // Single file and source maps
    // ============================================================

    @Test
    public void testSingleFileDefaults() {
        SingleFileOptions options = SingleFileOptions.enabled(null);
        assertEquals("style", options.name());
        assertFalse(options.comments().enabled());
    }

    @Test
    public void testCommentTemplate() {
        SingleFileOptions.Comments comments = new SingleFileOptions.Comments(true, "{f}", "from {f}");
        assertEquals("/* from a.scss */", comments.render("a.scss"));
        assertEquals("/* Source: b.sass */", SingleFileOptions.Comments.ENABLED.render("b.sass"));
    }

    @Test
    public void testTemplateWithoutPlaceholderIsRejected() {
        assertThrows(SassRuntimeException.class, () -> new SingleFileOptions.Comments(true, "%{filename}", "Source"));
        assertThrows(SassRuntimeException.class, () -> new SingleFileOptions.Comments(true, "", "Source"));
    }

    @Test
    public void testSourceMapOptions() {
        SourceMapOptions options = SourceMapOptions.on().withEmbed(true).withExtension(null);
        assertTrue(options.enabled());
        assertTrue(options.embed());
        assertEquals(".map", options.extension());
        assertFalse(SourceMapOptions.DISABLED.enabled());
    }

    @Test
    public void testExtensions() {
        ExtensionOptions extensions = ExtensionOptions.DEFAULT;
        assertTrue(extensions.matches("a.scss"));
        assertTrue(extensions.isSass("a.sass"));
        assertFalse(extensions.matches("a.css"));
    }

    @Test
    public void testSass2ScssOptions() {
        Sass2ScssOptions defaults = SassOptions.defaults().sass2scss();
        assertEquals(Sass2ScssOptions.CommentMode.KEEP, defaults.comments());
        assertEquals(Sass2ScssOptions.PrettifyLevel.FIRST, defaults.prettify());

        Sass2ScssOptions options = defaults.withPrettify(Sass2ScssOptions.PrettifyLevel.THIRD)
                .withComments(Sass2ScssOptions.CommentMode.STRIP);
        assertEquals(Sass2ScssOptions.PrettifyLevel.THIRD, options.prettify());
        assertEquals(Sass2ScssOptions.CommentMode.STRIP, options.comments());
        assertEquals(Sass2ScssOptions.PrettifyLevel.FIRST, new Sass2ScssOptions(null, null).prettify());
    }
}
