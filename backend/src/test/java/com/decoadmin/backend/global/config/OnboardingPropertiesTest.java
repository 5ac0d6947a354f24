package com.decoadmin.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OnboardingPropertiesTest {

    @Test
    void slugRetriesAreBounded() {
        assertThat(new OnboardingProperties.Slug(0).maxRetries()).isZero();
        assertThat(new OnboardingProperties.Slug(1000).maxRetries()).isEqualTo(1000);
        assertThatThrownBy(() -> new OnboardingProperties.Slug(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OnboardingProperties.Slug(1001))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-retries");
    }

    @Test
    void avatarLimitMustBePositive() {
        assertThatThrownBy(() -> new OnboardingProperties.Avatar(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
