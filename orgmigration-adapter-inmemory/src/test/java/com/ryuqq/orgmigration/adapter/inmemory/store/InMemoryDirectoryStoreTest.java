package com.ryuqq.orgmigration.adapter.inmemory.store;

import com.ryuqq.orgmigration.core.model.MembershipRole;
import com.ryuqq.orgmigration.core.model.RedirectType;
import com.ryuqq.orgmigration.core.spi.MembershipPatch;
import com.ryuqq.orgmigration.core.spi.UniqueConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.membership;
import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.organization;
import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.standaloneUser;
import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryDirectoryStore 시딩/헬퍼 및 동시성 테스트.
 */
class InMemoryDirectoryStoreTest {

    private InMemoryDirectoryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDirectoryStore();
    }

    @Test
    void putUser_같은_범위의_중복_username은_거부된다() {
        // given
        store.putUser(standaloneUser(1L, "alice", "a@gmail.com"));

        // when / then
        assertThatThrownBy(() -> store.putUser(standaloneUser(2L, "alice", "a2@gmail.com")))
            .isInstanceOf(UniqueConstraintViolationException.class);
    }

    @Test
    void putUser_같은_ID로_다시_넣으면_교체된다() {
        // given
        store.putUser(standaloneUser(1L, "alice", "a@gmail.com"));

        // when
        store.putUser(standaloneUser(1L, "alice", "alice@acme.com"));

        // then
        assertThat(store.findUserById(1L).orElseThrow().email()).isEqualTo("alice@acme.com");
    }

    @Test
    void putTeam_같은_부모_아래_중복_slug는_거부된다() {
        // given
        store.putTeam(team(10L, "sales"));

        // when / then
        assertThatThrownBy(() -> store.putTeam(team(11L, "sales")))
            .isInstanceOf(UniqueConstraintViolationException.class);
    }

    @Test
    void 스냅샷_헬퍼와_clear() {
        // given
        store.putTeam(organization(3L, "acme", null, null));
        store.putMembership(membership(7L, 3L, MembershipRole.MEMBER));
        store.upsertRedirect(RedirectType.USER, "alice", 0L, "https://acme.example.com/alice");

        // then
        assertThat(store.allMemberships()).hasSize(1);
        assertThat(store.allRedirects()).hasSize(1);

        // when
        store.clear();

        // then
        assertThat(store.allMemberships()).isEmpty();
        assertThat(store.allRedirects()).isEmpty();
        assertThat(store.findTeamById(3L)).isEmpty();
    }

    @Test
    void 동시_upsertMembership은_중복_행을_만들지_않는다() throws Exception {
        // given
        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threadCount; i++) {
            MembershipRole role = i % 2 == 0 ? MembershipRole.MEMBER : MembershipRole.ADMIN;
            futures.add(executor.submit(() -> {
                startLatch.await();
                store.upsertMembership(7L, 3L, new MembershipPatch(role, true));
                return null;
            }));
        }
        startLatch.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        assertThat(store.findMembershipsByUser(7L)).hasSize(1);
    }
}
