package com.ryuqq.orgmigration.core.error;

import com.ryuqq.orgmigration.core.statemachine.MigrationStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MigrationExceptionTest {

    @Test
    void factories_map_to_expected_status_codes() {
        assertThat(MigrationException.invalidArgument("bad").statusCode()).isEqualTo(400);
        assertThat(MigrationException.notFound("missing").statusCode()).isEqualTo(404);
        assertThat(MigrationException.conflict("clash").statusCode()).isEqualTo(409);
        assertThat(MigrationException.notAnOrganization("plain team").statusCode()).isEqualTo(400);
        assertThat(MigrationException.internal("boom", new IllegalStateException()).statusCode()).isEqualTo(500);
    }

    @Test
    void withCompletedSteps_keeps_kind_message_and_cause() {
        IllegalStateException cause = new IllegalStateException("store down");
        MigrationException original = MigrationException.internal("Unexpected failure", cause);

        MigrationException enriched = original.withCompletedSteps(
            List.of(MigrationStep.RESOLVE_ORGANIZATION, MigrationStep.UPDATE_USER));

        assertThat(enriched.kind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(enriched.getMessage()).isEqualTo("Unexpected failure");
        assertThat(enriched.getCause()).isSameAs(cause);
        assertThat(enriched.completedSteps())
            .containsExactly(MigrationStep.RESOLVE_ORGANIZATION, MigrationStep.UPDATE_USER);
    }

    @Test
    void isPartiallyApplied_only_when_a_mutation_step_completed() {
        MigrationException readOnly = MigrationException.conflict("clash")
            .withCompletedSteps(List.of(MigrationStep.RESOLVE_ORGANIZATION, MigrationStep.LOCATE_USER));
        MigrationException partial = MigrationException.invalidArgument("no slug")
            .withCompletedSteps(List.of(MigrationStep.UPDATE_USER, MigrationStep.ADD_REDIRECTS));

        assertThat(readOnly.isPartiallyApplied()).isFalse();
        assertThat(partial.isPartiallyApplied()).isTrue();
    }

    @Test
    void blank_message_is_rejected() {
        assertThatThrownBy(() -> MigrationException.conflict(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
