package com.sassed.syntax;

import com.sassed.error.ParseException;
import com.sassed.syntax.Expression.*;
import com.sassed.syntax.Statement.*;
import com.sassed.value.ListSeparator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private List<Statement> parse(String scss) {
        return Parser.parse(scss, "test.scss").children();
    }

    private Statement first(String scss) {
        return parse(scss).get(0);
    }

    // ============================================================
    // Rules and declarations
    // ============================================================

    @Test
    public void testRuleWithDeclaration() {
        RuleBlock rule = (RuleBlock) first("a { color: red; }");
        assertEquals("a", rule.selector().plainText());
        Declaration declaration = (Declaration) rule.children().get(0);
        assertEquals("color", declaration.name().plainText());
        assertTrue(declaration.value() instanceof ColorLiteral);
        assertFalse(declaration.important());
    }

    @Test
    public void testPseudoClassSelectorIsNotADeclaration() {
        RuleBlock rule = (RuleBlock) first("a:hover { color: red }");
        assertEquals("a:hover", rule.selector().plainText());
    }

    @Test
    public void testSelectorWhitespaceIsNormalized() {
        RuleBlock rule = (RuleBlock) first(".a   >\n  .b { x: y }");
        assertEquals(".a > .b", rule.selector().plainText());
    }

    @Test
    public void testInterpolatedSelector() {
        RuleBlock rule = (RuleBlock) first(".item-#{$i} { x: y }");
        assertFalse(rule.selector().isPlain());
        assertEquals(2, rule.selector().parts().size());
    }

    @Test
    public void testNestedPropertyBlock() {
        RuleBlock rule = (RuleBlock) first("a { font: { family: serif; size: 12px; } }");
        Declaration font = (Declaration) rule.children().get(0);
        assertNull(font.value());
        assertEquals(2, font.children().size());
    }

    @Test
    public void testImportantFlag() {
        RuleBlock rule = (RuleBlock) first("a { color: red !important; }");
        assertTrue(((Declaration) rule.children().get(0)).important());
    }

    @Test
    public void testCustomPropertyIsRaw() {
        RuleBlock rule = (RuleBlock) first("a { --gap: 1px  2px; }");
        Declaration declaration = (Declaration) rule.children().get(0);
        StringLiteral value = (StringLiteral) declaration.value();
        assertEquals("1px 2px", value.text().plainText());
    }

    // ============================================================
    // Variables and expressions
    // ============================================================

    @Test
    public void testVariableFlags() {
        VariableDeclaration variable = (VariableDeclaration) first("$size: 10px !default !global;");
        assertEquals("size", variable.name());
        assertTrue(variable.isDefault());
        assertTrue(variable.global());
    }

    @Test
    public void testOperatorPrecedence() {
        VariableDeclaration variable = (VariableDeclaration) first("$a: 1 + 2 * 3;");
        Binary plus = (Binary) variable.value();
        assertEquals(Operator.PLUS, plus.operator());
        assertEquals(Operator.TIMES, ((Binary) plus.right()).operator());
    }

    @Test
    public void testSpaceAndCommaLists() {
        VariableDeclaration variable = (VariableDeclaration) first("$a: 1px 2px, 3px;");
        ListExpression list = (ListExpression) variable.value();
        assertEquals(ListSeparator.COMMA, list.separator());
        assertEquals(2, list.items().size());
        assertEquals(ListSeparator.SPACE, ((ListExpression) list.items().get(0)).separator());
    }

    @Test
    public void testMapLiteral() {
        VariableDeclaration variable = (VariableDeclaration) first("$m: (a: 1, b: 2);");
        MapExpression map = (MapExpression) variable.value();
        assertEquals(2, map.keys().size());
    }

    @Test
    public void testCalcIsKeptRaw() {
        VariableDeclaration variable = (VariableDeclaration) first("$w: calc(100% - 10px);");
        StringLiteral calc = (StringLiteral) variable.value();
        assertEquals("calc(100% - 10px)", calc.text().plainText());
    }

    // ============================================================
    // Directives
    // ============================================================

    @Test
    public void testIfElseChain() {
        If statement = (If) first("@if $a { x: 1 } @else if $b { x: 2 } @else { x: 3 }");
        assertEquals(2, statement.clauses().size());
        assertNotNull(statement.orElse());
    }

    @Test
    public void testForThroughAndTo() {
        For through = (For) first("@for $i from 1 through 3 { }");
        assertTrue(through.inclusive());
        For to = (For) first("@for $i from 1 to $n { }");
        assertFalse(to.inclusive());
        assertEquals("i", to.variable());
    }

    @Test
    public void testEachWithSeveralVariables() {
        Each each = (Each) first("@each $key, $value in $map { }");
        assertEquals(List.of("key", "value"), each.variables());
    }

    @Test
    public void testMixinAndInclude() {
        List<Statement> statements = parse("@mixin m($a, $b: 2) { x: $a; } a { @include m(1, $b: 3) { y: z; } }");
        MixinDeclaration mixin = (MixinDeclaration) statements.get(0);
        assertEquals(2, mixin.parameters().parameters().size());
        Include include = (Include) ((RuleBlock) statements.get(1)).children().get(0);
        assertEquals("m", include.name());
        assertEquals(1, include.arguments().positional().size());
        assertTrue(include.arguments().keywords().containsKey("b"));
        assertEquals(1, include.content().size());
    }

    @Test
    public void testRestArguments() {
        Include include = (Include) first("@include m($list..., $map...);");
        assertNotNull(include.arguments().rest());
        assertNotNull(include.arguments().keywordRest());
    }

    @Test
    public void testExtendOptional() {
        RuleBlock rule = (RuleBlock) first("a { @extend .b !optional; }");
        Extend extend = (Extend) rule.children().get(0);
        assertEquals(".b", extend.selector().plainText());
        assertTrue(extend.optional());
    }

    @Test
    public void testImportTargets() {
        Import statement = (Import) first("@import \"a\", \"b.css\", url(c.css);");
        assertEquals(3, statement.targets().size());
        assertEquals("a", ((ImportTarget.SassImport) statement.targets().get(0)).url());
        assertTrue(statement.targets().get(1) instanceof ImportTarget.CssImport);
        assertTrue(statement.targets().get(2) instanceof ImportTarget.CssImport);
    }

    @Test
    public void testGenericAtRuleWithoutBody() {
        GenericAtRule rule = (GenericAtRule) first("@charset \"UTF-8\";");
        assertEquals("charset", rule.name());
        assertNull(rule.body());
    }

    @Test
    public void testParseParameters() {
        ParameterList parameters = Parser.parseParameters("$color, $amount: 10%, $rest...");
        assertEquals(2, parameters.parameters().size());
        assertNotNull(parameters.parameters().get(1).defaultValue());
        assertEquals("rest", parameters.restParameter());
    }

    // ============================================================
    // Errors
    // ============================================================

    @Test
    public void testMissingClosingBrace() {
        ParseException e = assertThrows(ParseException.class, () -> parse("a { color: red;"));
        assertEquals("\"}\"", e.expected());
        assertEquals("end of file", e.found());
    }

    @Test
    public void testUnexpectedClosingBrace() {
        assertThrows(ParseException.class, () -> parse("a { } }"));
    }

    @Test
    public void testElseWithoutIf() {
        assertThrows(ParseException.class, () -> parse("@else { }"));
    }
}
