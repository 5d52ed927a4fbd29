package com.ryuqq.orgmigration.core.statemachine;

import com.ryuqq.orgmigration.core.error.ErrorKind;
import com.ryuqq.orgmigration.core.error.MigrationException;
import org.junit.jupiter.api.Test;

import static com.ryuqq.orgmigration.core.statemachine.MigrationState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * MigrationTransition 테스트.
 *
 * <ul>
 *   <li>모든 상태에서 MIGRATED로의 (재)마이그레이션 허용</li>
 *   <li>MIGRATED → REVERTED만 revert 허용</li>
 *   <li>REVERTED → REVERTED 시 CONFLICT</li>
 *   <li>STANDALONE/ORGANIZATION_NATIVE → REVERTED 시 INVALID_ARGUMENT</li>
 * </ul>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
class MigrationTransitionTest {

    // ========== 허용되는 전이 ==========

    @Test
    void validate_StandaloneToMigrated_Succeeds() {
        assertDoesNotThrow(() -> MigrationTransition.validate(7L, STANDALONE, MIGRATED));
    }

    @Test
    void validate_MigratedToMigrated_RefreshSucceeds() {
        assertDoesNotThrow(() -> MigrationTransition.validate(7L, MIGRATED, MIGRATED));
    }

    @Test
    void validate_RevertedToMigrated_Succeeds() {
        assertDoesNotThrow(() -> MigrationTransition.validate(7L, REVERTED, MIGRATED));
    }

    @Test
    void validate_OrganizationNativeToMigrated_Succeeds() {
        assertDoesNotThrow(() -> MigrationTransition.validate(7L, ORGANIZATION_NATIVE, MIGRATED));
    }

    // ========== 거부되는 전이 ==========

    @Test
    void validate_RevertedToReverted_ThrowsConflict() {
        MigrationException exception = assertThrows(
            MigrationException.class,
            () -> MigrationTransition.validate(7L, REVERTED, REVERTED)
        );

        assertEquals(ErrorKind.CONFLICT, exception.kind());
        assertTrue(exception.getMessage().contains("already reverted"));
    }

    @Test
    void validate_StandaloneToReverted_ThrowsInvalidArgument() {
        MigrationException exception = assertThrows(
            MigrationException.class,
            () -> MigrationTransition.validate(7L, STANDALONE, REVERTED)
        );

        assertEquals(ErrorKind.INVALID_ARGUMENT, exception.kind());
        assertTrue(exception.getMessage().contains("wasn't migrated"));
    }

    @Test
    void validate_OrganizationNativeToReverted_ThrowsInvalidArgument() {
        MigrationException exception = assertThrows(
            MigrationException.class,
            () -> MigrationTransition.validate(7L, ORGANIZATION_NATIVE, REVERTED)
        );

        assertEquals(ErrorKind.INVALID_ARGUMENT, exception.kind());
    }

    @Test
    void validate_NonTargetState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> MigrationTransition.validate(7L, MIGRATED, STANDALONE));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> MigrationTransition.validate(7L, null, MIGRATED));
    }
}
