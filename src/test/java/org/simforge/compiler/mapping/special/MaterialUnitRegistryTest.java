package org.simforge.compiler.mapping.special;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class MaterialUnitRegistryTest {

    @Test
    void assignsLabelsInFirstSeenOrderAndReusesThem() {
        MaterialUnitRegistry registry = new MaterialUnitRegistry();

        assertThat(registry.labelFor("Widget")).isEqualTo("PartA");
        assertThat(registry.labelFor("Gadget")).isEqualTo("PartB");
        assertThat(registry.labelFor("Widget")).isEqualTo("PartA");
        assertThat(registry.labels().keySet()).containsExactly("Widget", "Gadget");
    }

    @Test
    void lettersContinueAfterZ() {
        assertThat(MaterialUnitRegistry.letters(0)).isEqualTo("A");
        assertThat(MaterialUnitRegistry.letters(25)).isEqualTo("Z");
        assertThat(MaterialUnitRegistry.letters(26)).isEqualTo("AA");
        assertThat(MaterialUnitRegistry.letters(27)).isEqualTo("AB");
        assertThat(MaterialUnitRegistry.letters(26 + 26 * 26)).isEqualTo("AAA");
    }

    @Test
    void twentySeventhProductTypeGetsDoubleLetterLabel() {
        MaterialUnitRegistry registry = new MaterialUnitRegistry();
        for (int i = 0; i < 26; i++) {
            registry.labelFor("P" + i);
        }

        assertThat(registry.labelFor("P26")).isEqualTo("PartAA");
    }
}
