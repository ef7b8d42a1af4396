package org.simforge.compiler.mapping;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.simforge.compiler.mapping.rules.NamingRules;
import org.simforge.compiler.mapping.rules.RuleTable;
import org.simforge.compiler.mapping.rules.UnitCategory;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class UnitConverterTest {

    private UnitConverter converter;

    @BeforeEach
    void setUp() {
        RuleTable rules = new RuleTable(List.of(),
                List.of(new UnitCategory("time", "second", Map.of("min", 60.0, "h", 3600.0, "ms", 0.001))),
                Map.of(), NamingRules.DEFAULTS);
        converter = new UnitConverter(rules);
    }

    @Test
    void convertsIntoBaseUnit() {
        UnitConverter.Result result = converter.toBase(1.5, "h", "time");

        assertThat(result.value()).isEqualTo(5400.0);
        assertThat(result.warning()).isEmpty();
    }

    @Test
    void baseUnitNeedsNoFactor() {
        assertThat(converter.toBase(7.0, "second", "time").value()).isEqualTo(7.0);
    }

    @Test
    void roundTripRestoresValue() {
        double base = converter.toBase(250.0, "ms", "time").value();

        assertThat(converter.fromBase(base, "ms", "time").value()).isCloseTo(250.0, within(1e-9));
    }

    @Test
    void unknownUnitLeavesValueUnchanged() {
        UnitConverter.Result result = converter.toBase(3.0, "fortnight", "time");

        assertThat(result.value()).isEqualTo(3.0);
        assertThat(result.warning()).contains("Unknown unit 'fortnight' for conversion category 'time'");
    }

    @Test
    void unknownCategoryLeavesValueUnchanged() {
        UnitConverter.Result result = converter.fromBase(3.0, "kg", "mass");

        assertThat(result.value()).isEqualTo(3.0);
        assertThat(result.warning()).contains("Unknown unit conversion category 'mass'");
    }
}
