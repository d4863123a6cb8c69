package ua.beengoo.rolink.api.model;

/**
 * Role mapping of one guild. A value of {@code 0} means "not configured".
 */
public record TenantRoleConfig(long verifiedRoleId, long groupMemberRoleId, long externalGroupId) {
    public static final TenantRoleConfig EMPTY = new TenantRoleConfig(0L, 0L, 0L);

    /** Fills unset fields from {@code defaults}. */
    public TenantRoleConfig withDefaults(TenantRoleConfig defaults) {
        if (defaults == null) return this;
        return new TenantRoleConfig(
                verifiedRoleId != 0 ? verifiedRoleId : defaults.verifiedRoleId,
                groupMemberRoleId != 0 ? groupMemberRoleId : defaults.groupMemberRoleId,
                externalGroupId != 0 ? externalGroupId : defaults.externalGroupId
        );
    }
}
