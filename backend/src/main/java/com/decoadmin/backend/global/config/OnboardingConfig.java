package com.decoadmin.backend.global.config;

import java.util.random.RandomGenerator;

import com.decoadmin.backend.modules.organization.domain.OrganizationNameSupplier;
import com.decoadmin.backend.modules.organization.domain.RandomOrganizationNameSupplier;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OnboardingConfig {

    @Bean
    public OrganizationNameSupplier organizationNameSupplier(RandomGenerator randomGenerator) {
        return new RandomOrganizationNameSupplier(randomGenerator);
    }
}
