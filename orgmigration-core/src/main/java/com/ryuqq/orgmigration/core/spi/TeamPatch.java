package com.ryuqq.orgmigration.core.spi;

import com.ryuqq.orgmigration.core.model.Team;

/**
 * Partial update for a {@link Team}.
 *
 * <p>Only fields explicitly set are written; setting a field to {@code null} clears it.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
public final class TeamPatch {

    private static final TeamPatch EMPTY = new TeamPatch(false, null, false, null);

    private final boolean parentIdSet;
    private final Long parentId;
    private final boolean slugSet;
    private final String slug;

    private TeamPatch(boolean parentIdSet, Long parentId, boolean slugSet, String slug) {
        this.parentIdSet = parentIdSet;
        this.parentId = parentId;
        this.slugSet = slugSet;
        this.slug = slug;
    }

    public static TeamPatch empty() {
        return EMPTY;
    }

    /**
     * Shortcut for a reparent (or detach when {@code parentId} is null).
     *
     * @param parentId new parent organization id, or null
     * @return TeamPatch instance
     */
    public static TeamPatch parent(Long parentId) {
        return EMPTY.withParentId(parentId);
    }

    public TeamPatch withParentId(Long parentId) {
        return new TeamPatch(true, parentId, slugSet, slug);
    }

    public TeamPatch withSlug(String slug) {
        return new TeamPatch(parentIdSet, parentId, true, slug);
    }

    /**
     * Returns a copy of the team with this patch applied.
     *
     * @param team the current record
     * @return the patched record
     */
    public Team applyTo(Team team) {
        return new Team(
            team.id(),
            team.name(),
            slugSet ? slug : team.slug(),
            parentIdSet ? parentId : team.parentId(),
            team.metadata()
        );
    }

    public boolean isParentIdSet() {
        return parentIdSet;
    }

    public Long parentId() {
        return parentId;
    }

    public boolean isSlugSet() {
        return slugSet;
    }

    public String slug() {
        return slug;
    }

    @Override
    public String toString() {
        return "TeamPatch{"
            + (parentIdSet ? "parentId=" + parentId + (slugSet ? ", " : "") : "")
            + (slugSet ? "slug=" + slug : "")
            + '}';
    }
}
