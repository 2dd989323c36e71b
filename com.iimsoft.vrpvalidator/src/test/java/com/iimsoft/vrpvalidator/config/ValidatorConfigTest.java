package com.iimsoft.vrpvalidator.config;

import com.iimsoft.vrpvalidator.validation.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ValidatorConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ValidatorConfig.CONFIG_JSON_PROPERTY);
    }

    @Test
    void blankJsonGivesDefaults() {
        ValidatorConfig config = ValidatorConfig.fromJson("  ");

        assertThat(config.isParallel()).isFalse();
        assertThat(config.getDisabledRules()).isEmpty();
        assertThat(config.isEnabled(ErrorCode.E1000)).isTrue();
    }

    @Test
    void readsParallelFlagAndDisabledRules() {
        ValidatorConfig config = ValidatorConfig.fromJson("{\"parallel\":true,\"disabledRules\":[\"E1001\",\"E1005\"]}");

        assertThat(config.isParallel()).isTrue();
        assertThat(config.getDisabledRules()).containsExactlyInAnyOrder(ErrorCode.E1001, ErrorCode.E1005);
        assertThat(config.isEnabled(ErrorCode.E1001)).isFalse();
        assertThat(config.isEnabled(ErrorCode.E1002)).isTrue();
    }

    @Test
    void invalidJsonFallsBackToDefaults() {
        assertThat(ValidatorConfig.fromJson("{parallel:").isParallel()).isFalse();
        assertThat(ValidatorConfig.fromJson("{\"disabledRules\":[\"E9999\"]}").getDisabledRules()).isEmpty();
    }

    @Test
    void loadsFromSystemProperty() {
        System.setProperty(ValidatorConfig.CONFIG_JSON_PROPERTY, "{\"parallel\":true}");

        assertThat(ValidatorConfig.load().isParallel()).isTrue();
    }

    @Test
    void missingSystemPropertyGivesDefaults() {
        assertThat(ValidatorConfig.load().isParallel()).isFalse();
    }
}
