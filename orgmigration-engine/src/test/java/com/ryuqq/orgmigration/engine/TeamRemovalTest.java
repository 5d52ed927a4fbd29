package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.application.migration.MigrationReport;
import com.ryuqq.orgmigration.core.contract.RemoveTeamCommand;
import com.ryuqq.orgmigration.core.error.ErrorKind;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.RedirectType;
import com.ryuqq.orgmigration.core.spi.UniqueConstraintViolationException;
import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.organization;
import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.team;
import static com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures.teamIn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * removeTeamFromOrg 시나리오 테스트.
 */
class TeamRemovalTest extends EngineScenarioSupport {

    @BeforeEach
    void seed() {
        store.putTeam(organization(3L, "acme", null, null));
        store.putTeam(teamIn(12L, "sales", 3L));
        store.upsertRedirect(RedirectType.TEAM, "sales", 0L, ACME_ORIGIN + "/team/sales");
    }

    private MigrationException removeExpectingFailure(long teamId, long orgId) {
        MigrationException thrown = catchThrowableOfType(
            () -> engine.removeTeamFromOrg(new RemoveTeamCommand(teamId, orgId)), MigrationException.class);
        assertThat(thrown).as("expected MigrationException").isNotNull();
        return thrown;
    }

    @Test
    void 팀을_분리하고_리다이렉트를_삭제한다() {
        // when
        MigrationReport report = engine.removeTeamFromOrg(new RemoveTeamCommand(12L, 3L));

        // then
        assertThat(storedTeam(12L).parentId()).isNull();
        assertThat(store.findRedirect(RedirectType.TEAM, "sales", 0L)).isEmpty();
        assertThat(report.completedSteps()).containsExactly(
            MigrationStep.RESOLVE_ORGANIZATION,
            MigrationStep.LOCATE_TEAM,
            MigrationStep.DETACH_TEAM,
            MigrationStep.REMOVE_TEAM_REDIRECT);
        assertThat(report.hasWarnings()).isFalse();
    }

    @Test
    void Organization_밖의_팀이_같은_slug를_쓰고_있으면_CONFLICT() {
        // given
        store.putTeam(team(20L, "sales"));

        // when
        MigrationException thrown = removeExpectingFailure(12L, 3L);

        // then
        assertThat(thrown.kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(thrown.getMessage()).isEqualTo(TeamRemoval.SLUG_TAKEN_MESSAGE);
        assertThat(thrown.getCause()).isInstanceOf(UniqueConstraintViolationException.class);
        assertThat(thrown.completedSteps())
            .containsExactly(MigrationStep.RESOLVE_ORGANIZATION, MigrationStep.LOCATE_TEAM);
        assertThat(storedTeam(12L).parentId()).isEqualTo(3L);
        assertThat(store.findRedirect(RedirectType.TEAM, "sales", 0L)).isPresent();
    }

    @Test
    void 이미_분리된_팀도_리다이렉트는_삭제한다() {
        // given
        store.putTeam(team(12L, "sales"));

        // when
        MigrationReport report = engine.removeTeamFromOrg(new RemoveTeamCommand(12L, 3L));

        // then
        assertThat(report.warnings()).containsExactly("Team 12 is not part of org 3. Not updating");
        assertThat(store.findRedirect(RedirectType.TEAM, "sales", 0L)).isEmpty();
    }

    @Test
    void 두_번_실행해도_오류가_없다() {
        engine.removeTeamFromOrg(new RemoveTeamCommand(12L, 3L));
        MigrationReport second = engine.removeTeamFromOrg(new RemoveTeamCommand(12L, 3L));

        assertThat(second.completed(MigrationStep.REMOVE_TEAM_REDIRECT)).isTrue();
        assertThat(storedTeam(12L).parentId()).isNull();
    }

    @Test
    void 팀이_없으면_NOT_FOUND() {
        assertThat(removeExpectingFailure(404L, 3L).kind()).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void 대상이_Organization이_아니면_NOT_AN_ORGANIZATION() {
        assertThat(removeExpectingFailure(12L, 12L).kind()).isEqualTo(ErrorKind.NOT_AN_ORGANIZATION);
        assertThat(storedTeam(12L).parentId()).isEqualTo(3L);
    }

    @Test
    void Organization_자신을_팀으로_지정하면_다른_팀의_리다이렉트를_건드리지_않는다() {
        // given: Organization과 같은 slug를 쓰는 하위 팀
        store.putTeam(teamIn(13L, "acme", 3L));
        store.upsertRedirect(RedirectType.TEAM, "acme", 0L, ACME_ORIGIN + "/team/acme");

        // when
        MigrationException thrown = removeExpectingFailure(3L, 3L);

        // then
        assertThat(thrown.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(thrown.getMessage()).isEqualTo("Team with id: 3 is an Org and can't be removed from an Org");
        assertThat(thrown.completedSteps()).containsExactly(MigrationStep.RESOLVE_ORGANIZATION);
        assertThat(store.findRedirect(RedirectType.TEAM, "acme", 0L)).isPresent();
        assertThat(storedTeam(13L).parentId()).isEqualTo(3L);
    }

    @Test
    void slug_없는_팀은_분리된_뒤_INVALID_ARGUMENT() {
        // given
        store.putTeam(teamIn(13L, null, 3L));

        // when
        MigrationException thrown = removeExpectingFailure(13L, 3L);

        // then
        assertThat(thrown.kind()).isEqualTo(ErrorKind.INVALID_ARGUMENT);
        assertThat(thrown.getMessage()).isEqualTo("No slug for team 13. Not removing the redirect");
        assertThat(thrown.completedSteps()).endsWith(MigrationStep.DETACH_TEAM);
        assertThat(storedTeam(13L).parentId()).isNull();
    }
}
