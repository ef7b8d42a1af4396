package org.simforge.compiler.backend.creation;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ErrorPolicyTest {

    @Test
    void unconfiguredCategoriesWarnAndContinue() {
        ErrorPolicy policy = ErrorPolicy.fromConfig(ConfigFactory.parseString("on-property-error = ignore"));

        assertThat(policy.mode(ErrorCategory.PROPERTY)).isEqualTo(ErrorMode.IGNORE);
        assertThat(policy.mode(ErrorCategory.CREATION)).isEqualTo(ErrorMode.WARN_AND_CONTINUE);
        assertThat(ErrorPolicy.defaults().mode(ErrorCategory.CONNECTION)).isEqualTo(ErrorPolicy.DEFAULT_MODE);
    }

    @Test
    void modeNamesAcceptDashesAndCase() {
        ErrorPolicy policy = ErrorPolicy.fromConfig(ConfigFactory.parseString("on-creation-error = Error-And-Stop"));

        assertThat(policy.mode(ErrorCategory.CREATION)).isEqualTo(ErrorMode.ERROR_AND_STOP);
    }

    @Test
    void invalidModeNamesTheKey() {
        assertThatThrownBy(() -> ErrorPolicy.fromConfig(ConfigFactory.parseString("on-connection-error = retry")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid value for error-handling.on-connection-error: retry");
    }

    @Test
    void withReturnsModifiedCopy() {
        ErrorPolicy base = ErrorPolicy.defaults();

        ErrorPolicy strict = base.with(ErrorCategory.CREATION, ErrorMode.ERROR_AND_STOP);

        assertThat(strict.mode(ErrorCategory.CREATION)).isEqualTo(ErrorMode.ERROR_AND_STOP);
        assertThat(base.mode(ErrorCategory.CREATION)).isEqualTo(ErrorMode.WARN_AND_CONTINUE);
        assertThat(strict).hasToString(
                "ErrorPolicy{on-creation-error=ERROR_AND_STOP, on-property-error=WARN_AND_CONTINUE, on-connection-error=WARN_AND_CONTINUE}");
    }
}
