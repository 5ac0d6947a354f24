package com.decoadmin.backend.modules.organization.domain;

import java.util.UUID;

import com.decoadmin.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * An "admin": the organizational home a user is onboarded into.
 * The slug is globally unique (uq_organization_slug) and only ever derived from the name.
 */
@Entity
@Table(name = "organization")
public class Organization extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "slug", nullable = false, unique = true, length = 140)
    private String slug;

    @Column(name = "avatar_url", length = 1024)
    private String avatarUrl;

    @Column(name = "created_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @Column(name = "creation_key", updatable = false, length = 128)
    private String creationKey;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(UUID createdBy) {
        this.createdBy = createdBy;
    }

    public String getCreationKey() {
        return creationKey;
    }

    public void setCreationKey(String creationKey) {
        this.creationKey = creationKey;
    }

    public OrganizationSummary toSummary() {
        return new OrganizationSummary(id, name, slug, avatarUrl);
    }
}
