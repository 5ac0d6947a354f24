package com.decoadmin.backend.modules.organization.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.decoadmin.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

/**
 * Email domains allowed to join an organization without an invitation.
 * Domains are kept in the normalized {@code @example.com} form and in insertion order.
 */
@Entity
@Table(name = "organization_domain_policy")
public class OrganizationDomainPolicy extends AbstractTimestampedEntity {

    @Id
    @Column(name = "organization_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "open", nullable = false)
    private boolean open;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "organization_domain_policy_domain", joinColumns = @JoinColumn(name = "organization_id"))
    @OrderColumn(name = "position")
    @Column(name = "domain", nullable = false, length = 255)
    private List<String> domains = new ArrayList<>();

    protected OrganizationDomainPolicy() {
    }

    public OrganizationDomainPolicy(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public boolean isOpen() {
        return open;
    }

    public void setOpen(boolean open) {
        this.open = open;
    }

    public List<String> getDomains() {
        return domains;
    }

    public void replaceDomains(List<String> rawDomains) {
        List<String> normalized = new ArrayList<>();
        for (String raw : rawDomains) {
            String domain = EmailDomains.normalizePolicyDomain(raw);
            if (!normalized.contains(domain)) {
                normalized.add(domain);
            }
        }
        domains.clear();
        domains.addAll(normalized);
    }

    public DomainPolicy toPolicy() {
        return new DomainPolicy(organizationId, List.copyOf(domains), open);
    }
}
