package alertmigrator.model;

/**
 * Key of the datasource and dashboard lookup maps: an entity id scoped to
 * its organization.
 *
 * @param orgId the organization id
 * @param id the entity id within the organization
 */
public record OrgScopedId(long orgId, long id) {

    public static OrgScopedId of(long orgId, long id) {
        return new OrgScopedId(orgId, id);
    }
}
