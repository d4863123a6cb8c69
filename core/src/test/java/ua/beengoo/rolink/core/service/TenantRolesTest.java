package ua.beengoo.rolink.core.service;

import org.junit.jupiter.api.Test;
import ua.beengoo.rolink.api.model.TenantRoleConfig;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TenantRolesTest {

    @Test
    void defaultsEntryIsNotATenantButFillsGaps() {
        var roles = new TenantRoles(Map.of(
                0L, new TenantRoleConfig(0L, 0L, 16185131L),
                9L, new TenantRoleConfig(901L, 902L, 0L),
                7L, new TenantRoleConfig(701L, 0L, 55L)
        ));

        assertEquals(List.of(7L, 9L), roles.tenantIds());
        assertEquals(new TenantRoleConfig(901L, 902L, 16185131L), roles.resolve(9L));
        assertEquals(new TenantRoleConfig(701L, 0L, 55L), roles.resolve(7L));
        assertEquals(new TenantRoleConfig(0L, 0L, 16185131L), roles.resolve(12345L));
    }

    @Test
    void worksWithoutDefaultsEntry() {
        var roles = new TenantRoles(Map.of(7L, new TenantRoleConfig(1L, 2L, 3L)));
        assertEquals(TenantRoleConfig.EMPTY, roles.defaults());
        assertEquals(new TenantRoleConfig(1L, 2L, 3L), roles.resolve(7L));
    }
}
