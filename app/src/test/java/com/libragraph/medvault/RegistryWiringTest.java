package com.libragraph.medvault;

import com.libragraph.medvault.core.health.RegistryHealthCheck;
import com.libragraph.medvault.core.registry.InvalidAuthTokenException;
import com.libragraph.medvault.core.registry.VaultRegistry;
import com.libragraph.medvault.types.Principal;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class RegistryWiringTest {

    private static final Principal CLINIC = Principal.of("clinic-north");
    private static final Principal LAB = Principal.of("lab-central");

    @Inject
    VaultRegistry registry;

    @Inject
    @Readiness
    RegistryHealthCheck healthCheck;

    @Test
    void registryUsesInMemoryStoreUnderTestProfile() {
        assertThat(registry.storeType()).isEqualTo("memory");
    }

    @Test
    void registryIsSharedAcrossInjections() {
        long before = registry.getTotalVaultCount();

        long id = registry.createVaultEntry(CLINIC, "9f2c", 2048, "wiring", List.of("ct"));

        assertThat(id).isEqualTo(before + 1);
        assertThat(registry.getTotalVaultCount()).isEqualTo(before + 1);
        assertThat(registry.checkAccessPermissions(id, CLINIC)).isTrue();
    }

    @Test
    void authorityGateAppliesThroughCdiProxy() {
        long id = registry.createVaultEntry(CLINIC, "77aa", 10, "gate", List.of("mri"));

        assertThatThrownBy(() -> registry.transferMedicalAuthority(LAB, id, LAB))
                .isInstanceOf(InvalidAuthTokenException.class);
        assertThat(registry.transferMedicalAuthority(CLINIC, id, LAB)).isTrue();
        assertThat(registry.getMedicalAuthority(id)).isEqualTo(LAB);
    }

    @Test
    void readinessReportsCounters() {
        registry.createVaultEntry(CLINIC, "beef", 1, "health", List.of("xr"));

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getName()).isEqualTo("vault-registry");
        assertThat(response.getData()).isPresent();
        assertThat(response.getData().get())
                .containsEntry("store", "memory")
                .containsKey("totalVaultEntries")
                .containsKey("ledgerHeight");
        assertThat((Long) response.getData().get().get("totalVaultEntries")).isPositive();
    }
}
