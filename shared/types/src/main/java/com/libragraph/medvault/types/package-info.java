/**
 * Pure Java value types shared across all MedVault modules.
 *
 * <p>Identities, tag lists and the registry error taxonomy live here so that callers
 * embedding the registry do not need the core module's framework dependencies.
 */
package com.libragraph.medvault.types;
