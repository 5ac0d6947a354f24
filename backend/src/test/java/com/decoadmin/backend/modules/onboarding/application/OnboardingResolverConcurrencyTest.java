package com.decoadmin.backend.modules.onboarding.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.decoadmin.backend.global.config.OnboardingProperties;
import com.decoadmin.backend.global.security.AuthenticatedUser;
import com.decoadmin.backend.modules.analytics.application.AnalyticsEvent;
import com.decoadmin.backend.modules.organization.domain.OrganizationSummary;
import com.decoadmin.backend.support.InMemoryMembershipStore;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OnboardingResolverConcurrencyTest {

    private static final int THREADS = 8;

    private InMemoryMembershipStore store;
    private List<AnalyticsEvent> events;
    private OnboardingResolver resolver;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryMembershipStore();
        events = new CopyOnWriteArrayList<>();
        Clock clock = Clock.fixed(OffsetDateTime.parse("2025-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        resolver = new OnboardingResolver(store, () -> "Magic Unicorn", events::add, OnboardingProperties.defaults(), clock);
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private <T> List<T> runConcurrently(int count, Callable<T> task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        return results;
    }

    private long completedEvents() {
        return events.stream().filter(e -> e.name().equals(AnalyticsEvent.ONBOARDING_COMPLETED)).count();
    }

    @Test
    @DisplayName("parallel joins of one user create a single membership and complete once")
    void concurrentJoin() throws Exception {
        OrganizationSummary acme = store.addOrganization("Acme", "acme", UUID.randomUUID());
        store.putDomainPolicy(acme.id(), true, "@acme.com");
        AuthenticatedUser alice = new AuthenticatedUser(UUID.randomUUID(), "alice@acme.com");
        resolver.submitProfile(alice, "engineering", "26-100", "internal-apps");

        List<OrganizationDestination> results = runConcurrently(THREADS, () -> resolver.joinOrganization(alice, acme.id()));

        assertThat(results).allSatisfy(r -> assertThat(r.organizationId()).isEqualTo(acme.id()));
        assertThat(results).filteredOn(r -> !r.alreadyMember()).hasSize(1);
        assertThat(store.membershipsOf(alice.userId())).hasSize(1);
        assertThat(completedEvents()).isEqualTo(1);
    }

    @Test
    @DisplayName("parallel creates with one idempotency key produce one organization")
    void concurrentCreateWithSameKey() throws Exception {
        AuthenticatedUser bob = new AuthenticatedUser(UUID.randomUUID(), "bob@nomatch.com");
        resolver.submitProfile(bob, "founder", "1", "ai-saas");

        List<OrganizationDestination> results =
                runConcurrently(THREADS, () -> resolver.createOrganization(bob, "Bob Co", "create-1"));

        assertThat(results).extracting(OrganizationDestination::organizationId).containsOnly(results.get(0).organizationId());
        assertThat(store.organizationCount()).isEqualTo(1);
        assertThat(store.membershipsOf(bob.userId())).hasSize(1);
    }

    @Test
    @DisplayName("parallel creates of the same name by different users get distinct slugs")
    void concurrentCreateSameName() throws Exception {
        int users = 6;
        List<AuthenticatedUser> creators = new ArrayList<>();
        for (int i = 0; i < users; i++) {
            AuthenticatedUser user = new AuthenticatedUser(UUID.randomUUID(), "user" + i + "@nomatch.com");
            resolver.submitProfile(user, "other", "2-25", "internal-apps");
            creators.add(user);
        }
        CopyOnWriteArrayList<AuthenticatedUser> queue = new CopyOnWriteArrayList<>(creators);

        List<OrganizationDestination> results = runConcurrently(users,
                () -> resolver.createOrganization(queue.remove(0), "Acme Inc", null));

        assertThat(results).extracting(OrganizationDestination::slug)
                .containsExactlyInAnyOrder("acme-inc", "acme-inc-2", "acme-inc-3", "acme-inc-4", "acme-inc-5", "acme-inc-6");
    }

    @Test
    @DisplayName("parallel first submissions store one profile and complete once")
    void concurrentSubmit() throws Exception {
        AuthenticatedUser carol = new AuthenticatedUser(UUID.randomUUID(), "carol@nomatch.com");

        runConcurrently(THREADS, () -> resolver.submitProfile(carol, "sales", "101-500", "manage-mcps"));

        assertThat(store.profileCount()).isEqualTo(1);
        assertThat(completedEvents()).isEqualTo(1);
    }
}
