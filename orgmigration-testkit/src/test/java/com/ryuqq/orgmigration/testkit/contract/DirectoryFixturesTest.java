package com.ryuqq.orgmigration.testkit.contract;

import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.model.User;
import com.ryuqq.orgmigration.core.statemachine.MigrationState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DirectoryFixtures 테스트.
 */
class DirectoryFixturesTest {

    @Test
    void 각_사용자_픽스처는_의도한_마이그레이션_상태를_가진다() {
        User standalone = DirectoryFixtures.standaloneUser(1L, "alice", "alice@acme.com");
        User orgNative = DirectoryFixtures.orgNativeUser(2L, "bob", "bob@acme.com", 3L);
        User migrated = DirectoryFixtures.migratedUser(4L, "carol", "carol@acme.com", 3L, "carol-old", Instant.EPOCH);

        assertThat(MigrationState.of(standalone)).isEqualTo(MigrationState.STANDALONE);
        assertThat(MigrationState.of(orgNative)).isEqualTo(MigrationState.ORGANIZATION_NATIVE);
        assertThat(MigrationState.of(migrated)).isEqualTo(MigrationState.MIGRATED);
        assertThat(migrated.provenance().username()).isEqualTo("carol-old");
    }

    @Test
    void organization_픽스처는_최상위_Organization이다() {
        Team org = DirectoryFixtures.organization(3L, null, "acme", "acme.com");

        assertThat(org.isOrganization()).isTrue();
        assertThat(org.parentId()).isNull();
        assertThat(org.metadata().requestedSlug()).isEqualTo("acme");
        assertThat(org.metadata().orgAutoAcceptEmail()).isEqualTo("acme.com");
    }

    @Test
    void teamIn_픽스처는_상위_Organization을_가리킨다() {
        Team team = DirectoryFixtures.teamIn(12L, "sales", 3L);

        assertThat(team.isOrganization()).isFalse();
        assertThat(team.isChildOf(3L)).isTrue();
        assertThat(DirectoryFixtures.team(13L, null).hasSlug()).isFalse();
    }
}
