package com.sassed;

import com.sassed.config.OutputStyle;
import com.sassed.config.Sass2ScssOptions;
import com.sassed.config.SassOptions;
import com.sassed.config.SingleFileOptions;
import com.sassed.config.SourceMapOptions;
import com.sassed.error.EvalException;
import com.sassed.error.ParseException;
import com.sassed.error.SassException;
import com.sassed.error.SassRuntimeException;
import com.sassed.eval.DiagnosticSink;
import com.sassed.lexer.SourcePosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SassCompilerTest {

    private final List<String> warnings = new ArrayList<>();
    private final List<String> debugs = new ArrayList<>();
    private final SassCompiler compiler = new SassCompiler(new DiagnosticSink() {
        @Override
        public void debug(String message, SourcePosition position) {
            debugs.add(message);
        }

        @Override
        public void warn(String message, SourcePosition position) {
            warnings.add(message);
        }
    });

    private String compile(String scss) {
        return compiler.compile(scss, SassOptions.defaults()).css();
    }

    private String compileCompressed(String scss) {
        return compiler.compile(scss, SassOptions.builder().style(OutputStyle.COMPRESSED).build()).css();
    }

    private static Path write(Path dir, String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    // ============================================================
    // Nesting and output style
    // ============================================================

    @Test
    public void testNestedRules() {
        String css = compile(".a { color: red; .b { color: blue; } }");
        assertEquals(".a {\n  color: red; }\n  .a .b {\n    color: blue; }\n", css);
    }

    @Test
    public void testTopLevelRulesAreSeparatedByBlankLine() {
        assertEquals("a {\n  x: 1; }\n\nb {\n  y: 2; }\n", compile("a { x: 1 }\nb { y: 2 }"));
    }

    @Test
    public void testEmptyStylesheet() {
        assertEquals("", compile(""));
        assertEquals("", compile("$a: 1;"));
        assertEquals("", compile(".empty { }"));
    }

    @Test
    public void testParentSelector() {
        assertEquals(".btn:hover {\n  color: red; }\n", compile(".btn { &:hover { color: red; } }"));
    }

    @Test
    public void testParentSelectorPositions() {
        String css = compileCompressed(".a { &:hover { x: 1; } &-suffix { y: 2; } .p & { z: 3; } }");
        assertEquals(".a:hover{x:1}.a-suffix{y:2}.p .a{z:3}\n", css);
    }

    @Test
    public void testNestedProperties() {
        String css = compile(".a { font: { family: serif; size: 12px; } }");
        assertEquals(".a {\n  font-family: serif;\n  font-size: 12px; }\n", css);
    }

    @Test
    public void testCompressedOutput() {
        String css = compileCompressed("@each $i in 1, 2, 3 { .item-#{$i} { width: 10px * $i; } }");
        assertEquals(".item-1{width:10px}.item-2{width:20px}.item-3{width:30px}\n", css);
    }

    @Test
    public void testCompressedDropsLeadingZeroAndComments() {
        assertEquals(".a{opacity:.5}\n", compileCompressed("/* gone */\n.a { opacity: 0.5; }"));
    }

    @Test
    public void testCommentsAreKeptInNestedStyle() {
        assertEquals("/* hello */\n.a {\n  b: c; }\n", compile("/* hello */\n.a { b: c; }"));
    }

    @Test
    public void testSourceComments() {
        SassOptions options = SassOptions.builder().sourceComments(true).build();
        String css = compiler.compile(".a { b: c; }", options).css();
        assertEquals("/* line 1, stdin */\n.a {\n  b: c; }\n", css);
    }

    @Test
    public void testIndentedSyntaxString() {
        SassOptions options = SassOptions.builder().indentedSyntax(true).build();
        assertEquals("a {\n  b: c; }\n", compiler.compile("a\n  b: c", options).css());
    }

    // ============================================================
    // Media and at-rules
    // ============================================================

    @Test
    public void testMediaBubblesOutOfRule() {
        assertEquals("@media screen {\n  .a {\n    color: red; } }\n", compile(".a { @media screen { color: red; } }"));
    }

    @Test
    public void testNestedMediaQueriesAreMerged() {
        String css = compile("@media screen { @media (min-width: 10px) { .a { b: c; } } }");
        assertEquals("@media screen and (min-width: 10px) {\n  .a {\n    b: c; } }\n", css);
    }

    @Test
    public void testAtRoot() {
        assertEquals(".b {\n  c: d; }\n", compile(".a { @at-root .b { c: d; } }"));
    }

    @Test
    public void testCharsetIsDropped() {
        assertEquals(".a {\n  b: c; }\n", compile("@charset \"UTF-8\";\n.a { b: c; }"));
    }

    // ============================================================
    // Variables, mixins and functions
    // ============================================================

    @Test
    public void testVariableArithmetic() {
        assertEquals(".a {\n  width: 25px; }\n", compile("$w: 10px;\n.a { width: $w * 2 + 5; }"));
    }

    @Test
    public void testDefaultReplacesNull() {
        assertEquals(".x {\n  y: 1; }\n", compile("$a: null;\n$a: 1 !default;\n.x { y: $a; }"));
        assertEquals(".x {\n  y: 2; }\n", compile("$a: 2;\n$a: 1 !default;\n.x { y: $a; }"));
    }

    @Test
    public void testNullDeclarationIsOmitted() {
        assertEquals(".x {\n  a: b; }\n", compile(".x { a: b; c: null; }"));
    }

    @Test
    public void testMixinWithDefaultReferringToEarlierParameter() {
        String css = compile("@mixin size($w, $h: $w) { width: $w; height: $h; }\n.x { @include size(5px); }");
        assertEquals(".x {\n  width: 5px;\n  height: 5px; }\n", css);
    }

    @Test
    public void testMixinContent() {
        String css = compile("@mixin m { .inner { @content; } }\n.x { @include m { color: red; } }");
        assertEquals(".x .inner {\n  color: red; }\n", css);
    }

    @Test
    public void testUserFunction() {
        String css = compile("@function double($n) { @return $n * 2; }\n.x { width: double(4px); }");
        assertEquals(".x {\n  width: 8px; }\n", css);
    }

    @Test
    public void testIfElse() {
        String css = compile("$t: dark;\n.x { @if $t == light { color: white; } @else { color: black; } }");
        assertEquals(".x {\n  color: black; }\n", css);
    }

    @Test
    public void testWhileUpdatesGlobal() {
        String css = compile("$i: 2;\n@while $i > 0 { .w-#{$i} { x: $i; } $i: $i - 1; }");
        assertEquals(".w-2 {\n  x: 2; }\n\n.w-1 {\n  x: 1; }\n", css);
    }

    @Test
    public void testForLoopInsideRule() {
        String css = compile(".x { @for $i from 1 to 3 { .y-#{$i} { z: $i; } } }");
        assertEquals(".x .y-1 {\n  z: 1; }\n\n.x .y-2 {\n  z: 2; }\n", css);
    }

    @Test
    public void testUnknownFunctionPassesThrough() {
        assertEquals(".a {\n  x: foo(1, 2px); }\n", compile(".a { x: foo(1, 2px); }"));
    }

    // ============================================================
    // Values
    // ============================================================

    @Test
    public void testColorArithmeticClamps() {
        assertEquals(".x {\n  color: #ffff00; }\n", compile(".x { color: #f00 + #0f0; }"));
    }

    @Test
    public void testColorArithmeticClampsOverflowPerChannel() {
        assertEquals(".x {\n  color: #ff0406; }\n", compile(".x { color: #ff0102 + #020304; }"));
        assertEquals(".x {\n  color: #000000; }\n", compile(".x { color: #010203 - #0a0a0a; }"));
    }

    @Test
    public void testLiteralColorKeepsItsText() {
        assertEquals(".x {\n  color: #FFF;\n  background: red; }\n", compile(".x { color: #FFF; background: red; }"));
    }

    @Test
    public void testSlashBetweenLiteralNumbers() {
        assertEquals(".x {\n  font: 12px/30px;\n  width: 5px; }\n", compile(".x { font: 12px/30px; width: (10px/2); }"));
    }

    @Test
    public void testPrecision() {
        String scss = ".x { width: (10px / 3); }";
        assertEquals(".x {\n  width: 3.33333px; }\n", compile(scss));
        SassOptions options = SassOptions.builder().precision(2).build();
        assertEquals(".x {\n  width: 3.33px; }\n", compiler.compile(scss, options).css());
    }

    @Test
    public void testCalcIsNotEvaluated() {
        assertEquals(".x {\n  width: calc(100% - 10px); }\n", compile(".x { width: calc(100% - 10px); }"));
    }

    // ============================================================
    // Extend
    // ============================================================

    @Test
    public void testExtend() {
        assertEquals(".a, .b {\n  color: red; }\n", compile(".a { @extend .b; }\n.b { color: red; }"));
    }

    @Test
    public void testExtendPlaceholder() {
        assertEquals(".warn {\n  color: red; }\n", compile("%msg { color: red; }\n.warn { @extend %msg; }"));
    }

    @Test
    public void testExtendOutsideRuleIsAnError() {
        assertThrows(EvalException.class, () -> compile("@extend .a;"));
    }

    // ============================================================
    // Messages and errors
    // ============================================================

    @Test
    public void testWarnAndDebugGoToTheSink() {
        compile("@warn \"careful\";\n@debug 1 + 1;");
        assertEquals(List.of("careful"), warnings);
        assertEquals(List.of("2"), debugs);
    }

    @Test
    public void testErrorDirective() {
        EvalException e = assertThrows(EvalException.class, () -> compile("@error \"boom\";"));
        assertEquals("boom", e.reason());
    }

    @Test
    public void testUndefinedVariable() {
        EvalException e = assertThrows(EvalException.class, () -> compile(".x {\n  y: $nope;\n}"));
        assertEquals("Undefined variable: \"$nope\".", e.reason());
        assertEquals("Undefined variable: \"$nope\".\n  on line 2 of stdin", e.getMessage());
    }

    @Test
    public void testUndefinedMixin() {
        EvalException e = assertThrows(EvalException.class, () -> compile(".x { @include nope; }"));
        assertEquals("Undefined mixin 'nope'.", e.reason());
    }

    @Test
    public void testTooManyArguments() {
        EvalException e = assertThrows(EvalException.class,
                () -> compile("@mixin m($a) { x: $a; }\n.x { @include m(1, 2); }"));
        assertEquals("Only 1 argument allowed, but 2 were passed to mixin m.", e.reason());
    }

    @Test
    public void testKeywordArgumentsToPlainCssFunction() {
        assertThrows(EvalException.class, () -> compile(".a { x: foo($a: 1); }"));
    }

    @Test
    public void testParentSelectorAtTopLevel() {
        assertThrows(EvalException.class, () -> compile("&:hover { x: y; }"));
    }

    @Test
    public void testSyntaxError() {
        SassException e = assertThrows(ParseException.class, () -> compile(".a { color: red;"));
        assertTrue(e.getMessage().startsWith("expected \"}\", was \"end of file\""), e.getMessage());
    }

    @Test
    public void testDeclarationAtTopLevel() {
        assertThrows(EvalException.class, () -> compile("color: red;"));
    }

    // ============================================================
    // Files and folders
    // ============================================================

    @Test
    public void testImportPartial(@TempDir Path dir) throws IOException {
        write(dir, "_vars.scss", "$c: red;");
        Path main = write(dir, "main.scss", "@import 'vars';\n.a { color: $c; }");
        assertEquals(".a {\n  color: red; }\n", compiler.compileFile(main, SassOptions.defaults()).css());
    }

    @Test
    public void testImportFromLoadPath(@TempDir Path dir) throws IOException {
        write(dir, "_colors.scss", "$brand: blue;");
        SassOptions options = SassOptions.builder().includePaths(List.of(dir)).build();
        String css = compiler.compile("@import 'colors';\n.a { color: $brand; }", options).css();
        assertEquals(".a {\n  color: blue; }\n", css);
    }

    @Test
    public void testMissingImport() {
        EvalException e = assertThrows(EvalException.class, () -> compile("@import 'nowhere';"));
        assertEquals("File to import not found or unreadable: nowhere.", e.reason());
    }

    @Test
    public void testPlainCssImportIsKept(@TempDir Path dir) throws IOException {
        Path main = write(dir, "main.scss", "@import \"theme.css\";");
        assertEquals("@import \"theme.css\";\n", compiler.compileFile(main, SassOptions.defaults()).css());
    }

    @Test
    public void testImportLoop(@TempDir Path dir) throws IOException {
        write(dir, "_a.scss", "@import 'b';");
        write(dir, "_b.scss", "@import 'a';");
        Path main = write(dir, "main.scss", "@import 'a';");
        EvalException e = assertThrows(EvalException.class, () -> compiler.compileFile(main, SassOptions.defaults()));
        assertTrue(e.reason().startsWith("An @import loop has been found"), e.reason());
    }

    @Test
    public void testCompileMissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.scss");
        SassRuntimeException e = assertThrows(SassRuntimeException.class,
                () -> compiler.compileFile(missing, SassOptions.defaults()));
        assertEquals("File `" + missing + "` does not exist", e.getMessage());
    }

    @Test
    public void testCompileSassFileByExtension(@TempDir Path dir) throws IOException {
        Path file = write(dir, "style.sass", "a\n  b: c\n");
        assertEquals("a {\n  b: c; }\n", compiler.compileFile(file, SassOptions.defaults()).css());
    }

    @Test
    public void testCompileFileWithSourceMap(@TempDir Path dir) throws IOException {
        Path input = write(dir, "main.scss", ".a { b: c; }");
        Path output = dir.resolve("main.css");
        SassOptions options = SassOptions.builder().sourceMap(SourceMapOptions.on()).build();
        compiler.compileFile(input, output, options);
        assertEquals(".a {\n  b: c; }\n/*# sourceMappingURL=main.css.map */\n", read(output));
        String map = read(dir.resolve("main.css.map"));
        assertTrue(map.contains("\"file\" : \"main.css\""), map);
        assertTrue(map.contains("\"main.scss\""), map);
    }

    @Test
    public void testStringSourceMap() {
        SassOptions options = SassOptions.builder().sourceMap(SourceMapOptions.on()).build();
        CompileResult result = compiler.compile(".a { b: c; }", options);
        assertEquals(".a {\n  b: c; }\n/*# sourceMappingURL=stdin.css.map */\n", result.css());
        assertTrue(result.sourceMap().isPresent());
        assertTrue(result.sourceMap().get().contains("\"mappings\" : \"AAAA;EAAK\""), result.sourceMap().get());
    }

    @Test
    public void testEmbeddedAndOmittedSourceMap() {
        SassOptions embedded = SassOptions.builder().sourceMap(SourceMapOptions.on().withEmbed(true)).build();
        assertTrue(compiler.compile(".a { b: c; }", embedded).css()
                .contains("/*# sourceMappingURL=data:application/json;base64,"));
        SassOptions omitted = SassOptions.builder().sourceMap(SourceMapOptions.on().withOmitUrl(true)).build();
        CompileResult result = compiler.compile(".a { b: c; }", omitted);
        assertEquals(".a {\n  b: c; }\n", result.css());
        assertTrue(result.sourceMap().isPresent());
    }

    @Test
    public void testCompileFolder(@TempDir Path dir) throws IOException {
        Path in = Files.createDirectory(dir.resolve("in"));
        Path out = dir.resolve("out");
        write(in, "a.scss", "@import 'p';\n.a { x: $p; }");
        write(in, "b.sass", "b\n  c: d");
        write(in, "_p.scss", "$p: 1;");
        write(in, "notes.txt", "not sass");
        compiler.compileFolder(in, out, SassOptions.defaults());
        assertEquals(".a {\n  x: 1; }\n", read(out.resolve("a.css")));
        assertEquals("b {\n  c: d; }\n", read(out.resolve("b.css")));
        assertFalse(Files.exists(out.resolve("_p.css")));
        assertFalse(Files.exists(out.resolve("notes.css")));
    }

    @Test
    public void testCompileFolderIntoSingleFile(@TempDir Path dir) throws IOException {
        Path in = Files.createDirectory(dir.resolve("in"));
        write(in, "b.scss", ".b { y: 2; }");
        write(in, "a.scss", ".a { x: 1; }");
        SassOptions options = SassOptions.builder()
                .singleFile(SingleFileOptions.enabled("bundle").withComments(SingleFileOptions.Comments.ENABLED))
                .build();
        compiler.compileFolder(in, dir, options);
        assertEquals("/* Source: a.scss */\n.a {\n  x: 1; }\n\n/* Source: b.scss */\n.b {\n  y: 2; }\n",
                read(dir.resolve("bundle.css")));
        assertFalse(Files.exists(dir.resolve("a.css")));
    }

    @Test
    public void testSingleFileWithoutComments(@TempDir Path dir) throws IOException {
        Path in = Files.createDirectory(dir.resolve("in"));
        write(in, "a.scss", ".a { x: 1; }");
        write(in, "b.scss", ".b { y: 2; }");
        SassOptions options = SassOptions.builder().singleFile(SingleFileOptions.enabled("all")).build();
        compiler.compileFolder(in, dir, options);
        assertEquals(".a {\n  x: 1; }\n\n.b {\n  y: 2; }\n", read(dir.resolve("all.css")));
    }

    @Test
    public void testCompileMissingFolder(@TempDir Path dir) {
        Path missing = dir.resolve("missing");
        Path out = dir.resolve("out");
        SassRuntimeException e = assertThrows(SassRuntimeException.class,
                () -> compiler.compileFolder(missing, out, SassOptions.defaults()));
        assertEquals("Directory `" + missing + "` does not exist", e.getMessage());
        assertFalse(Files.exists(out));
    }

    @Test
    public void testFolderErrorNamesTheFile(@TempDir Path dir) throws IOException {
        Path in = Files.createDirectory(dir.resolve("in"));
        write(in, "bad.scss", ".a { b: $missing; }");
        EvalException e = assertThrows(EvalException.class,
                () -> compiler.compileFolder(in, dir.resolve("out"), SassOptions.defaults()));
        assertTrue(e.getMessage().contains("bad.scss"), e.getMessage());
    }

    // ============================================================
    // sass2scss
    // ============================================================

    @Test
    public void testConvertSass2Scss() {
        assertEquals("a {\n  b: c; }", compiler.convertSass2Scss("a\n  b: c", SassOptions.defaults()));
    }

    @Test
    public void testConvertSass2ScssHonorsPrettifyLevel() {
        SassOptions options = SassOptions.builder()
                .sass2scss(Sass2ScssOptions.DEFAULT.withPrettify(Sass2ScssOptions.PrettifyLevel.SECOND))
                .build();
        assertEquals("a {\n  b: c;\n}", compiler.convertSass2Scss("a\n  b: c", options));
    }

    @Test
    public void testCompileIgnoresPrettifyLevelForLinePositions() {
        SassOptions options = SassOptions.builder()
                .indentedSyntax(true)
                .sass2scss(Sass2ScssOptions.DEFAULT.withPrettify(Sass2ScssOptions.PrettifyLevel.ZERO))
                .build();
        EvalException e = assertThrows(EvalException.class, () -> compiler.compile("a\n  b: c\n  d: $nope", options));
        assertEquals("Undefined variable: \"$nope\".\n  on line 3 of stdin", e.getMessage());
    }
}
