package com.ryuqq.orgmigration.engine;

import com.ryuqq.orgmigration.core.model.Organization;
import com.ryuqq.orgmigration.core.model.RedirectMapping;
import com.ryuqq.orgmigration.core.model.RedirectType;
import com.ryuqq.orgmigration.core.model.Team;
import com.ryuqq.orgmigration.core.spi.DirectoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Standalone 식별자 → Organization URL 리다이렉트 관리.
 *
 * <p>모든 리다이렉트는 standalone 네임스페이스({@link RedirectMapping#STANDALONE_ORG_ID})에서
 * 출발합니다. 추가는 upsert, 삭제는 delete-if-exists이므로 두 번 호출해도 안전합니다.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
final class RedirectMaintainer {

    private static final Logger log = LoggerFactory.getLogger(RedirectMaintainer.class);

    private final DirectoryStore store;
    private final MigrationEngineConfig config;

    RedirectMaintainer(DirectoryStore store, MigrationEngineConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * Organization origin 계산.
     *
     * @param organization Organization
     * @return origin, slug와 requestedSlug가 모두 없으면 empty
     */
    Optional<String> originOf(Organization organization) {
        String orgSlug = organization.effectiveSlug();
        if (orgSlug == null) {
            return Optional.empty();
        }
        String origin = OrgOrigins.fullOrigin(orgSlug, config);
        log.debug("Resolved org URL prefix {} for org {}", origin, organization.id());
        return Optional.of(origin);
    }

    /**
     * 사용자 리다이렉트 추가 (upsert).
     *
     * @param nonOrgUsername 이전 standalone username
     * @param origin Organization origin
     * @param orgUsername Organization username
     */
    void addUserRedirect(String nonOrgUsername, String origin, String orgUsername) {
        addRedirect(RedirectType.USER, nonOrgUsername, OrgOrigins.userUrl(origin, orgUsername));
    }

    /**
     * 팀 리다이렉트 추가 (upsert).
     *
     * @param teamSlug 팀 slug
     * @param origin Organization origin
     */
    void addTeamRedirect(String teamSlug, String origin) {
        addRedirect(RedirectType.TEAM, teamSlug, OrgOrigins.teamUrl(origin, teamSlug));
    }

    /**
     * 팀 목록의 리다이렉트 추가. slug 없는 팀은 건너뜁니다.
     *
     * @param teams 팀 목록
     * @param origin Organization origin
     * @param onSkip 건너뛴 팀에 대한 경고 수신자
     */
    void addTeamRedirects(List<Team> teams, String origin, Consumer<String> onSkip) {
        for (Team team : teams) {
            if (!team.hasSlug()) {
                onSkip.accept("No slug for team " + team.id() + ". Not adding the redirect");
                continue;
            }
            addTeamRedirect(team.slug(), origin);
        }
    }

    /**
     * 사용자 리다이렉트 삭제.
     *
     * @param nonOrgUsername 이전 standalone username
     * @return 삭제된 행 수
     */
    int removeUserRedirect(String nonOrgUsername) {
        return removeRedirect(RedirectType.USER, nonOrgUsername);
    }

    /**
     * 팀 리다이렉트 삭제.
     *
     * @param teamSlug 팀 slug
     * @return 삭제된 행 수
     */
    int removeTeamRedirect(String teamSlug) {
        return removeRedirect(RedirectType.TEAM, teamSlug);
    }

    /**
     * 팀 목록의 리다이렉트 삭제. slug 없는 팀은 건너뜁니다.
     *
     * @param teams 팀 목록
     * @param onSkip 건너뛴 팀에 대한 경고 수신자
     */
    void removeTeamRedirects(List<Team> teams, Consumer<String> onSkip) {
        for (Team team : teams) {
            if (!team.hasSlug()) {
                onSkip.accept("No slug for team " + team.id() + ". Not removing the redirect");
                continue;
            }
            removeTeamRedirect(team.slug());
        }
    }

    private void addRedirect(RedirectType type, String from, String toUrl) {
        store.upsertRedirect(type, from, RedirectMapping.STANDALONE_ORG_ID, toUrl);
        log.debug("Redirect {} {} -> {}", type, from, toUrl);
    }

    private int removeRedirect(RedirectType type, String from) {
        int deleted = store.deleteRedirects(type, from, RedirectMapping.STANDALONE_ORG_ID);
        log.debug("Removed {} redirect(s) for {} {}", deleted, type, from);
        return deleted;
    }
}
