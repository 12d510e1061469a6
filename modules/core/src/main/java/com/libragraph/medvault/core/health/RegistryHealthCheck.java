package com.libragraph.medvault.core.health;

import com.libragraph.medvault.core.registry.VaultRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class RegistryHealthCheck implements HealthCheck {

    private final VaultRegistry registry;

    @Inject
    public RegistryHealthCheck(VaultRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        try {
            return HealthCheckResponse.named("vault-registry")
                    .up()
                    .withData("store", registry.storeType())
                    .withData("totalVaultEntries", registry.getTotalVaultCount())
                    .withData("ledgerHeight", registry.getLedgerHeight())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("vault-registry")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
