package com.nayem.tenancy.workflow;

import java.util.UUID;

/**
 * Ids of an onboarded tenant and its administrator, locally and in the provider.
 */
public record OnboardingResult(UUID tenantId, UUID userId, String externalOrgId, String externalUserId) {
}
