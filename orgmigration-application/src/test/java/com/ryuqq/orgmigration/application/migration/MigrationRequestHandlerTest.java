package com.ryuqq.orgmigration.application.migration;

import com.ryuqq.orgmigration.core.contract.MigrateUserCommand;
import com.ryuqq.orgmigration.core.contract.MoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveTeamCommand;
import com.ryuqq.orgmigration.core.contract.RemoveUserCommand;
import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.MembershipRole;
import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * MigrationRequestHandler 유닛 테스트.
 *
 * <ul>
 *   <li>성공 시 200 + 명령별 메시지</li>
 *   <li>MigrationException → 예외 상태 코드 + 메시지</li>
 *   <li>예상치 못한 예외 → 500</li>
 * </ul>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MigrationRequestHandlerTest {

    @Mock
    private OrgMigrationService service;

    private MigrationRequestHandler handler;

    @BeforeEach
    void setUp() {
        handler = new MigrationRequestHandler(service);
    }

    @Test
    void moveTeamToOrg_성공시_멤버포함_메시지() {
        // given
        MoveTeamCommand command = new MoveTeamCommand(12L, 3L, true);
        MigrationReport report = new MigrationReport("moveTeamToOrg",
            List.of(MigrationStep.REPARENT_TEAM, MigrationStep.MIGRATE_MEMBERS), List.of());
        when(service.moveTeamToOrg(command)).thenReturn(report);

        // when
        MigrationResponse response = handler.moveTeamToOrg(command);

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getMessage()).isEqualTo("Added team 12 to Org: 3 along with the members");
        assertThat(response.getReportOrNull()).isSameAs(report);
    }

    @Test
    void moveTeamToOrg_멤버제외_메시지() {
        // given
        MoveTeamCommand command = new MoveTeamCommand(12L, 3L, false);
        when(service.moveTeamToOrg(command)).thenReturn(new MigrationReport("moveTeamToOrg", null, null));

        // when
        MigrationResponse response = handler.moveTeamToOrg(command);

        // then
        assertThat(response.getMessage()).isEqualTo("Added team 12 to Org: 3 without the members");
    }

    @Test
    void removeUserFromOrg_성공시_Reverted() {
        // given
        RemoveUserCommand command = new RemoveUserCommand(7L, 3L);
        when(service.removeUserFromOrg(command)).thenReturn(new MigrationReport("removeUserFromOrg", null, null));

        // when
        MigrationResponse response = handler.removeUserFromOrg(command);

        // then
        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getMessage()).isEqualTo("Reverted");
    }

    @Test
    void migrateUserToOrg_Conflict는_409로_변환() {
        // given
        MigrateUserCommand command = MigrateUserCommand.byUserName("alice", 3L, MembershipRole.MEMBER);
        when(service.migrateUserToOrg(command))
            .thenThrow(MigrationException.conflict("User is already a part of an organization"));

        // when
        MigrationResponse response = handler.migrateUserToOrg(command);

        // then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getStatusCode()).isEqualTo(409);
        assertThat(response.getMessage()).isEqualTo("User is already a part of an organization");
        assertThat(response.getReportOrNull()).isNull();
    }

    @Test
    void removeTeamFromOrg_NotAnOrganization은_400으로_변환() {
        // given
        RemoveTeamCommand command = new RemoveTeamCommand(12L, 4L);
        when(service.removeTeamFromOrg(command))
            .thenThrow(MigrationException.notAnOrganization("4 is not an Org"));

        // when
        MigrationResponse response = handler.removeTeamFromOrg(command);

        // then
        assertThat(response.getStatusCode()).isEqualTo(400);
        assertThat(response.getMessage()).isEqualTo("4 is not an Org");
    }

    @Test
    void 예상치못한_예외는_500으로_변환() {
        // given
        when(service.migrateUserToOrg(any())).thenThrow(new IllegalStateException("connection reset"));

        // when
        MigrationResponse response = handler.migrateUserToOrg(
            MigrateUserCommand.byUserId(7L, 3L, MembershipRole.MEMBER));

        // then
        assertThat(response.getStatusCode()).isEqualTo(500);
        assertThat(response.getMessage()).isEqualTo("connection reset");
        verify(service, times(1)).migrateUserToOrg(any());
    }

    @Test
    void null_명령은_서비스_호출_전에_거부() {
        assertThatThrownBy(() -> handler.migrateUserToOrg(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("command cannot be null");
        assertThatThrownBy(() -> handler.moveTeamToOrg(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handler.removeTeamFromOrg(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> handler.removeUserFromOrg(null))
            .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(service);
    }

    @Test
    void 생성자_null_service_거부() {
        assertThatThrownBy(() -> new MigrationRequestHandler(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("service cannot be null");
    }

    @Test
    void failed_응답은_400이상만_허용() {
        assertThatThrownBy(() -> MigrationResponse.failed(200, "ok?"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
