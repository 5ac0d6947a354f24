package com.decoadmin.backend.modules.onboarding.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.decoadmin.backend.modules.onboarding.domain.OnboardingProfile;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OnboardingProfileRepository extends JpaRepository<OnboardingProfile, UUID> {

    /**
     * Single-statement upsert so concurrent first submissions never race on the primary key.
     * Completion columns are left untouched on conflict.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            insert into onboarding_profile (user_id, role, company_size, use_case, created_at, updated_at)
            values (:userId, :role, :companySize, :useCase, :now, :now)
            on conflict (user_id) do update
               set role = excluded.role,
                   company_size = excluded.company_size,
                   use_case = excluded.use_case,
                   updated_at = excluded.updated_at
            """, nativeQuery = true)
    int upsertAnswers(@Param("userId") UUID userId,
                      @Param("role") String role,
                      @Param("companySize") String companySize,
                      @Param("useCase") String useCase,
                      @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OnboardingProfile p
               set p.completedAt = :completedAt,
                   p.destinationOrganizationId = :destinationOrganizationId,
                   p.updatedAt = :completedAt
             where p.userId = :userId
               and p.completedAt is null
            """)
    int markCompleted(@Param("userId") UUID userId,
                      @Param("destinationOrganizationId") UUID destinationOrganizationId,
                      @Param("completedAt") OffsetDateTime completedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OnboardingProfile p
               set p.destinationOrganizationId = :destinationOrganizationId,
                   p.updatedAt = :now
             where p.userId = :userId
               and p.completedAt is not null
               and p.destinationOrganizationId is null
            """)
    int fillMissingDestination(@Param("userId") UUID userId,
                               @Param("destinationOrganizationId") UUID destinationOrganizationId,
                               @Param("now") OffsetDateTime now);
}
