package com.decoadmin.backend.modules.organization.domain;

import java.util.function.Supplier;

/**
 * Source of display names for organizations created without a requested name.
 */
@FunctionalInterface
public interface OrganizationNameSupplier extends Supplier<String> {
}
