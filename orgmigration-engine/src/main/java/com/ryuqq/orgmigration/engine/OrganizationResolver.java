package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;

/**
 * 대상 ID를 Organization으로 해석합니다.
 *
 * <p>모든 진입점이 mutation 전에 호출하므로, 일반 팀이 Organization처럼 변경되는 일은 없습니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class OrganizationResolver {

    private final DirectoryStore store;

    OrganizationResolver(DirectoryStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * Organization 조회.
     *
     * @param orgId Organization ID
     * @return Organization 스냅샷
     * @throws MigrationException NOT_FOUND (팀 없음), NOT_AN_ORGANIZATION (Organization 태그 없음)
     */
    Organization resolve(long orgId) {
        Team team = store.findTeamById(orgId)
            .orElseThrow(() -> MigrationException.notFound("Org with id: " + orgId + " not found"));

        if (!team.isOrganization()) {
            throw MigrationException.notAnOrganization(orgId + " is not an Org");
        }
        return Organization.from(team);
    }
}
