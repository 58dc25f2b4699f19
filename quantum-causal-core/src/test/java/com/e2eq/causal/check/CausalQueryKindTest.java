package com.e2eq.causal.check;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CausalQueryKindTest {

    @Test
    void parsesSpellingVariants() {
        assertEquals(Optional.of(CausalQueryKind.REGULATE_AMOUNT), CausalQueryKind.parse("RegulateAmount"));
        assertEquals(Optional.of(CausalQueryKind.REGULATE_AMOUNT), CausalQueryKind.parse("regulate-amount"));
        assertEquals(Optional.of(CausalQueryKind.REGULATE_AMOUNT), CausalQueryKind.parse("REGULATE_AMOUNT"));
        assertEquals(Optional.of(CausalQueryKind.INFLUENCE), CausalQueryKind.parse(" influence "));
    }

    @Test
    void foldsConcreteTypesIntoFamilies() {
        assertEquals(Optional.of(CausalQueryKind.REGULATE_AMOUNT), CausalQueryKind.parse("DecreaseAmount"));
        assertEquals(Optional.of(CausalQueryKind.REGULATE_ACTIVITY), CausalQueryKind.parse("Inhibition"));
        assertEquals(Optional.of(CausalQueryKind.MODIFICATION), CausalQueryKind.parse("Phosphorylation"));
    }

    @Test
    void unknownKindsAreEmpty() {
        assertTrue(CausalQueryKind.parse("Translocation").isEmpty());
        assertTrue(CausalQueryKind.parse("").isEmpty());
        assertTrue(CausalQueryKind.parse(null).isEmpty());
    }
}
