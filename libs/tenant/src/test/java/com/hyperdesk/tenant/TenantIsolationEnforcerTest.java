package com.hyperdesk.tenant;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Test
    @DisplayName("matching tenants belong together")
    void matchingTenants() {
        assertThat(TenantIsolationEnforcer.belongsTo("tenant-a", "tenant-a")).isTrue();
    }

    @Test
    @DisplayName("different or missing tenants never match")
    void differentTenants() {
        assertThat(TenantIsolationEnforcer.belongsTo("tenant-a", "tenant-b")).isFalse();
        assertThat(TenantIsolationEnforcer.belongsTo(null, "tenant-b")).isFalse();
        assertThat(TenantIsolationEnforcer.belongsTo("tenant-a", null)).isFalse();
    }
}
