package com.contact.resolution.rules;

import com.contact.resolution.core.model.HandleKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NormalizationEngine Tests")
class NormalizationEngineTest {

    @Test
    @DisplayName("Rules only run for their handle kinds")
    void rulesScopedByKind() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();

        assertEquals("15551234", engine.normalize("+1 555-1234", HandleKind.PHONE));
        assertEquals("+1 555-1234", engine.normalize("+1 555-1234", HandleKind.EMAIL));
    }

    @Test
    @DisplayName("Rules run in priority order")
    void priorityOrder() {
        NormalizationEngine engine = new NormalizationEngine(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()));

        assertEquals("c", engine.normalize("a", HandleKind.EMAIL));
        assertEquals("first", engine.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Rules without kinds apply to every kind")
    void unscopedRule() {
        NormalizationRule rule = NormalizationRule.builder().name("strip-x").pattern("x").build();

        assertTrue(rule.appliesTo(HandleKind.PHONE));
        assertTrue(rule.appliesTo(HandleKind.EMAIL));
    }

    @Test
    @DisplayName("Should add and remove rules by name")
    void addAndRemove() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRule(NormalizationRule.builder().name("dots").pattern("\\.").build());

        assertEquals("ab", engine.normalize("a.b", HandleKind.EMAIL));
        assertTrue(engine.removeRule("dots"));
        assertFalse(engine.removeRule("dots"));
        assertEquals("a.b", engine.normalize("a.b", HandleKind.EMAIL));
    }

    @Test
    @DisplayName("Builder requires name and pattern")
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().pattern("x").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().name("x").build());
    }
}
