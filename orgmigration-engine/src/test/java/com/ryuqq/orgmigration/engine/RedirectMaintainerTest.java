package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.model.RedirectType;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * RedirectMaintainer 유닛 테스트.
 */
@ExtendWith(MockitoExtension.class)
class RedirectMaintainerTest {

    @Mock
    private DirectoryStore store;

    private RedirectMaintainer maintainer;

    @BeforeEach
    void setUp() {
        maintainer = new RedirectMaintainer(store, new MigrationEngineConfig());
    }

    @Test
    void originOf_slug가_있으면_slug를_사용() {
        Organization org = Organization.from(DirectoryFixtures.organization(3L, "acme", "other", null));

        assertThat(maintainer.originOf(org)).contains("https://acme.example.com");
    }

    @Test
    void originOf_slug가_없으면_requestedSlug를_사용() {
        Organization org = Organization.from(DirectoryFixtures.organization(3L, null, "acme", null));

        assertThat(maintainer.originOf(org)).contains("https://acme.example.com");
    }

    @Test
    void originOf_둘_다_없으면_empty() {
        Organization org = Organization.from(DirectoryFixtures.organization(3L, null, null, null));

        assertThat(maintainer.originOf(org)).isEmpty();
    }

    @Test
    void addUserRedirect_standalone_네임스페이스에서_upsert() {
        // when
        maintainer.addUserRedirect("alice7", "https://acme.example.com", "alice");

        // then
        verify(store).upsertRedirect(RedirectType.USER, "alice7", 0L, "https://acme.example.com/alice");
    }

    @Test
    void addTeamRedirects_slug_없는_팀은_건너뛰고_알린다() {
        // given
        List<String> skipped = new ArrayList<>();

        // when
        maintainer.addTeamRedirects(
            List.of(DirectoryFixtures.team(12L, "sales"), DirectoryFixtures.team(13L, null)),
            "https://acme.example.com", skipped::add);

        // then
        verify(store).upsertRedirect(RedirectType.TEAM, "sales", 0L, "https://acme.example.com/team/sales");
        verifyNoMoreInteractions(store);
        assertThat(skipped).containsExactly("No slug for team 13. Not adding the redirect");
    }

    @Test
    void removeTeamRedirects_삭제는_행이_없어도_오류가_아니다() {
        // given
        when(store.deleteRedirects(RedirectType.TEAM, "sales", 0L)).thenReturn(0);
        List<String> skipped = new ArrayList<>();

        // when
        maintainer.removeTeamRedirects(
            List.of(DirectoryFixtures.team(12L, "sales"), DirectoryFixtures.team(13L, null)), skipped::add);

        // then
        verify(store).deleteRedirects(RedirectType.TEAM, "sales", 0L);
        assertThat(skipped).containsExactly("No slug for team 13. Not removing the redirect");
    }

    @Test
    void removeUserRedirect_삭제_건수를_반환() {
        when(store.deleteRedirects(RedirectType.USER, "alice7", 0L)).thenReturn(1);

        assertThat(maintainer.removeUserRedirect("alice7")).isEqualTo(1);
    }
}
