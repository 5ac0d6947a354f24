package com.decoadmin.backend.modules.onboarding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.decoadmin.backend.modules.audit.domain.AuditLog;
import com.decoadmin.backend.modules.audit.infrastructure.AuditLogRepository;
import com.decoadmin.backend.modules.onboarding.application.MembershipStore;
import com.decoadmin.backend.modules.organization.domain.OrganizationDomainPolicy;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.MembershipRepository;
import com.decoadmin.backend.modules.organization.infrastructure.persistence.OrganizationDomainPolicyRepository;
import com.decoadmin.backend.support.AbstractPostgresIntegrationTest;
import com.decoadmin.backend.support.TestTokens;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class OnboardingIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PROFILE_JSON = """
            {"role": "engineering", "companySize": "26-100", "useCase": "internal-apps"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MembershipStore membershipStore;

    @Autowired
    private OrganizationDomainPolicyRepository domainPolicyRepository;

    @Autowired
    private MembershipRepository membershipRepository;

    @Autowired
    private AuditLogRepository auditLogRepository;

    private OrganizationSummary seedAcme() {
        OrganizationSummary acme = membershipStore.insertOrganization("Acme", "acme", UUID.randomUUID(), null);
        OrganizationDomainPolicy policy = new OrganizationDomainPolicy(acme.id());
        policy.setOpen(true);
        policy.replaceDomains(List.of("acme.com"));
        domainPolicyRepository.save(policy);
        return acme;
    }

    private JsonNode readBody(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void matchingDomainUserJoinsExistingOrganization() throws Exception {
        OrganizationSummary acme = seedAcme();
        UUID userId = UUID.randomUUID();
        String bearer = TestTokens.bearer(userId, "a@acme.com");

        mockMvc.perform(put("/onboarding/profile")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("AWAITING_ORG_CHOICE"))
                .andExpect(jsonPath("$.profile.role").value("engineering"))
                .andExpect(jsonPath("$.joinableOrganizations[0].id").value(acme.id().toString()))
                .andExpect(jsonPath("$.joinableOrganizations[0].memberCount").value(1));

        mockMvc.perform(post("/organizations/{organizationId}/join", acme.id())
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("acme"))
                .andExpect(jsonPath("$.alreadyMember").value(false));

        mockMvc.perform(post("/organizations/{organizationId}/join", acme.id())
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyMember").value(true));

        mockMvc.perform(get("/onboarding/state").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("COMPLETED"))
                .andExpect(jsonPath("$.destination.id").value(acme.id().toString()));

        assertThat(membershipRepository.existsByUserAndOrganization(userId, acme.id())).isTrue();
        List<AuditLog> events = auditLogRepository.findByActorUserIdOrderByCreatedAtAsc(userId);
        assertThat(events).extracting(AuditLog::getActionType)
                .containsExactlyInAnyOrder("ORGANIZATION_JOINED", "ONBOARDING_COMPLETED");
    }

    @Test
    void userWithoutMatchingDomainCompletesOnProfileAndCreatesOrganization() throws Exception {
        seedAcme();
        UUID userId = UUID.randomUUID();
        String bearer = TestTokens.bearer(userId, "b@nomatch.com");

        mockMvc.perform(put("/onboarding/profile")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("COMPLETED"))
                .andExpect(jsonPath("$.joinableOrganizations").isEmpty());

        MvcResult created = mockMvc.perform(post("/organizations")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.alreadyMember").value(false))
                .andReturn();

        JsonNode body = readBody(created);
        assertThat(body.path("name").asText()).isNotBlank();
        assertThat(body.path("slug").asText()).matches("[a-z0-9]+(-[a-z0-9]+)*");
        assertThat(membershipRepository.existsByUserAndOrganization(
                userId, UUID.fromString(body.path("organizationId").asText()))).isTrue();
    }

    @Test
    void sameNameCreatesGetSuffixedSlugs() throws Exception {
        String first = TestTokens.bearer(UUID.randomUUID(), "one@nomatch.com");
        String second = TestTokens.bearer(UUID.randomUUID(), "two@nomatch.com");
        for (String bearer : List.of(first, second)) {
            mockMvc.perform(put("/onboarding/profile")
                            .header("Authorization", bearer)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(PROFILE_JSON))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/organizations")
                        .header("Authorization", first)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Acme Inc\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slug").value("acme-inc"));

        mockMvc.perform(post("/organizations")
                        .header("Authorization", second)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Acme Inc\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slug").value("acme-inc-2"));
    }

    @Test
    void idempotencyKeyReplayReturnsTheSameOrganization() throws Exception {
        String bearer = TestTokens.bearer(UUID.randomUUID(), "c@nomatch.com");
        mockMvc.perform(put("/onboarding/profile")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PROFILE_JSON))
                .andExpect(status().isOk());

        MvcResult first = mockMvc.perform(post("/organizations")
                        .header("Authorization", bearer)
                        .header("Idempotency-Key", "signup-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Replay Co\"}"))
                .andExpect(status().isCreated())
                .andReturn();

        MvcResult replay = mockMvc.perform(post("/organizations")
                        .header("Authorization", bearer)
                        .header("Idempotency-Key", "signup-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Replay Co\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alreadyMember").value(true))
                .andReturn();

        assertThat(readBody(replay).path("organizationId").asText())
                .isEqualTo(readBody(first).path("organizationId").asText());
        Integer organizations = jdbcTemplate.queryForObject("SELECT count(*) FROM organization", Integer.class);
        assertThat(organizations).isEqualTo(1);
    }

    @Test
    void invalidProfileValueIsRejectedWithValidationCode() throws Exception {
        String bearer = TestTokens.bearer(UUID.randomUUID(), "d@acme.com");

        mockMvc.perform(put("/onboarding/profile")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"astronaut\", \"companySize\": \"26-100\", \"useCase\": \"internal-apps\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("onboarding.validation_error"));

        Integer profiles = jdbcTemplate.queryForObject("SELECT count(*) FROM onboarding_profile", Integer.class);
        assertThat(profiles).isZero();
    }

    @Test
    void createBeforeProfileIsRejected() throws Exception {
        mockMvc.perform(post("/organizations")
                        .header("Authorization", TestTokens.bearer(UUID.randomUUID(), "e@nomatch.com"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Too Early\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("onboarding.profile_required"));
    }

    @Test
    void requestsWithoutTokenAreUnauthorized() throws Exception {
        mockMvc.perform(get("/onboarding/state"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }
}
