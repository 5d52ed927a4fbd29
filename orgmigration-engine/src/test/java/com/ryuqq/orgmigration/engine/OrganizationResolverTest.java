package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.core.error.ErrorKind;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * OrganizationResolver 유닛 테스트.
 */
@ExtendWith(MockitoExtension.class)
class OrganizationResolverTest {

    @Mock
    private DirectoryStore store;

    private OrganizationResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new OrganizationResolver(store);
    }

    @Test
    void Organization_태그가_있으면_스냅샷을_반환() {
        // given
        when(store.findTeamById(3L)).thenReturn(Optional.of(DirectoryFixtures.organization(3L, null, "acme", "acme.com")));

        // when
        Organization organization = resolver.resolve(3L);

        // then
        assertThat(organization.id()).isEqualTo(3L);
        assertThat(organization.hasSlug()).isFalse();
        assertThat(organization.effectiveSlug()).isEqualTo("acme");
        verify(store).findTeamById(3L);
        verifyNoMoreInteractions(store);
    }

    @Test
    void 팀이_없으면_NOT_FOUND() {
        when(store.findTeamById(3L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(3L))
            .isInstanceOf(MigrationException.class)
            .hasMessage("Org with id: 3 not found")
            .extracting("kind").isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void 일반_팀이면_NOT_AN_ORGANIZATION() {
        when(store.findTeamById(12L)).thenReturn(Optional.of(DirectoryFixtures.team(12L, "sales")));

        assertThatThrownBy(() -> resolver.resolve(12L))
            .isInstanceOf(MigrationException.class)
            .hasMessage("12 is not an Org")
            .extracting("kind").isEqualTo(ErrorKind.NOT_AN_ORGANIZATION);
    }

    @Test
    void store가_null이면_거부() {
        assertThatThrownBy(() -> new OrganizationResolver(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
