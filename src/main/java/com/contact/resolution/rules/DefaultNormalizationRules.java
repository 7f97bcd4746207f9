package com.contact.resolution.rules;

import com.contact.resolution.core.model.HandleKind;

import java.util.List;

/**
 * Built-in rules for phone and email handles.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getPhoneRules());
        engine.addRules(getEmailRules());
        return engine;
    }

    /**
     * Phones keep digits only. Extension markers ("ext.", "x") disappear with the
     * rest of the punctuation and the extension digits stay appended.
     */
    public static List<NormalizationRule> getPhoneRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("phone-non-digits")
                        .pattern("[^0-9]+")
                        .replacement("")
                        .applicableKinds(HandleKind.PHONE)
                        .priority(10)
                        .build()
        );
    }

    public static List<NormalizationRule> getEmailRules() {
        return List.of(
                // String.trim() leaves no-break spaces alone, so edge whitespace,
                // no-break spaces and control characters are stripped together here
                NormalizationRule.builder()
                        .name("email-edge-spaces")
                        .pattern("^[\\s\\u00A0\\p{Cntrl}]+|[\\s\\u00A0\\p{Cntrl}]+$")
                        .replacement("")
                        .applicableKinds(HandleKind.EMAIL)
                        .priority(10)
                        .build()
        );
    }
}
