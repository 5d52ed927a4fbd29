package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.core.error.MigrationException;
import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import com.ryuqq.orgmigration.core.spi.TeamPatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Organization slug가 비어 있으면 requestedSlug를 채택합니다.
 *
 * <p>항상 마이그레이션의 마지막 변경 단계로 실행되므로, 실패는 "나머지는 모두 완료됨"을
 * 의미합니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class OrgSlugBackfill {

    private static final Logger log = LoggerFactory.getLogger(OrgSlugBackfill.class);

    private final DirectoryStore store;

    OrgSlugBackfill(DirectoryStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * slug가 없으면 requestedSlug로 설정.
     *
     * @param organization 마이그레이션 시작 시점의 Organization 스냅샷
     * @return slug를 새로 설정했으면 true, 이미 있었으면 false
     * @throws MigrationException INVALID_ARGUMENT (slug와 requestedSlug 모두 없음)
     */
    boolean setOrgSlugIfNotSet(Organization organization) {
        if (organization.hasSlug()) {
            return false;
        }
        if (!organization.metadata().hasRequestedSlug()) {
            throw MigrationException.invalidArgument("Org with id: " + organization.id()
                + " doesn't have a slug. Tried using requestedSlug but that's also not present."
                + " So, all migration done but failed to set the Organization slug. Please set it manually");
        }
        String requestedSlug = organization.metadata().requestedSlug();
        store.updateTeam(organization.id(), TeamPatch.empty().withSlug(requestedSlug));
        log.debug("Org {} slug set to requested slug {}", organization.id(), requestedSlug);
        return true;
    }
}
