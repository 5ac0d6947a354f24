package com.decoadmin.backend.modules.organization.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.decoadmin.backend.modules.organization.domain.OrganizationDomainPolicy;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrganizationDomainPolicyRepository extends JpaRepository<OrganizationDomainPolicy, UUID> {

    /**
     * Pre-filters on the stored {@code @domain} entry; callers still run the result
     * through {@code DomainMatcher} so the open flag and normalization rules apply.
     */
    @Query("""
            select distinct p
              from OrganizationDomainPolicy p
              join p.domains d
             where d = :policyDomain
             order by p.createdAt, p.organizationId
            """)
    List<OrganizationDomainPolicy> findByDomainEntry(@Param("policyDomain") String policyDomain);
}
