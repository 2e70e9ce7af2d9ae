package com.field.resolution.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.lexicalEngine();
    }

    @ParameterizedTest
    @DisplayName("Should lowercase, strip accents and keep only letters")
    @CsvSource({
            "Veintitrés,veintitres",
            "DIECISÉIS,dieciseis",
            "'  Treinta   y   CINCO ',treinta y cinco",
            "'cuatrocientos, veintiuno.',cuatrocientos veintiuno",
            "veinti-uno,veintiuno",
            "Año 2024,ano"
    })
    void testNormalize(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Null and blank input normalize to empty string")
    void testEmptyInput() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
        assertEquals("", engine.normalize("545"));
    }

    @Test
    @DisplayName("Non-breaking spaces should separate words")
    void testUnicodeSpaces() {
        assertEquals("treinta y dos", engine.normalize("treinta y dos"));
        assertEquals("ciento diez", engine.normalize("ciento\tdiez\n"));
    }

    @Test
    @DisplayName("Precomposed and decomposed accents normalize identically")
    void testDecomposedInput() {
        assertTrue(engine.areEquivalent("dieciséis", "dieciséis"));
    }

    @Test
    @DisplayName("Rules should be applied in priority order")
    void testRuleOrder() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()
        ));

        assertEquals(List.of("first", "second"),
                custom.getRules().stream().map(NormalizationRule::getName).toList());
        assertEquals("cc", custom.normalize("ab"));
    }

    @Test
    @DisplayName("Rule builder should require name, pattern and replacement")
    void testRuleBuilderValidation() {
        assertThrows(NullPointerException.class, () ->
                NormalizationRule.builder().pattern("a").replacement("").build());
        assertThrows(NullPointerException.class, () ->
                NormalizationRule.builder().name("x").replacement("").build());
        assertThrows(NullPointerException.class, () ->
                NormalizationRule.builder().name("x").pattern("a").build());
    }

    @Test
    @DisplayName("Rule builder should reject invalid and empty-matching patterns")
    void testRulePatternValidation() {
        IllegalArgumentException invalid = assertThrows(IllegalArgumentException.class, () ->
                NormalizationRule.builder().name("broken").pattern("[a-").replacement("").build());
        assertTrue(invalid.getMessage().contains("broken"));

        assertThrows(IllegalArgumentException.class, () ->
                NormalizationRule.builder().name("empty").pattern("x*").replacement("").build());
    }

    @Test
    @DisplayName("Replacement text is inserted literally")
    void testLiteralReplacement() {
        NormalizationRule rule = NormalizationRule.builder()
                .name("dollar").pattern("s").replacement("$1").build();

        assertEquals("do$1", rule.apply("dos"));
        assertNull(rule.apply(null));
    }
}
