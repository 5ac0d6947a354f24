package com.decoadmin.backend.modules.organization.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.decoadmin.backend.modules.organization.domain.Membership;
import com.decoadmin.backend.modules.organization.domain.MembershipRole;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MembershipRepository extends JpaRepository<Membership, UUID> {

    @Query("""
            select m
              from Membership m
             where m.userId = :userId
               and m.organization.id = :organizationId
            """)
    Optional<Membership> findByUserAndOrganization(
            @Param("userId") UUID userId,
            @Param("organizationId") UUID organizationId
    );

    @Query("""
            select case when count(m) > 0 then true else false end
              from Membership m
             where m.userId = :userId
               and m.organization.id = :organizationId
            """)
    boolean existsByUserAndOrganization(
            @Param("userId") UUID userId,
            @Param("organizationId") UUID organizationId
    );

    @Query("""
            select case when count(m) > 0 then true else false end
              from Membership m
             where m.userId = :userId
               and m.organization.id = :organizationId
               and m.role = :role
            """)
    boolean existsWithRole(
            @Param("userId") UUID userId,
            @Param("organizationId") UUID organizationId,
            @Param("role") MembershipRole role
    );

    @Query("""
            select m.organization.id, count(m)
              from Membership m
             where m.organization.id in :organizationIds
             group by m.organization.id
            """)
    List<Object[]> countByOrganizationIds(@Param("organizationIds") Collection<UUID> organizationIds);

    @Query("""
            select m.userId
              from Membership m
             where m.organization.id = :organizationId
             order by m.joinedAt asc, m.userId asc
            """)
    List<UUID> findMemberIds(@Param("organizationId") UUID organizationId, Pageable pageable);
}
