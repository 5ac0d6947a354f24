package com.decoadmin.backend.modules.organization.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * @param name optional; a generated name is used when blank
 */
public record CreateOrganizationRequest(@Size(max = 120) String name) {
}
