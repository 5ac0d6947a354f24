package com.decoadmin.backend.modules.organization.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.decoadmin.backend.modules.organization.domain.Organization;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

    Optional<Organization> findByCreatedByAndCreationKey(UUID createdBy, String creationKey);

    boolean existsBySlugAndIdNot(String slug, UUID id);
}
