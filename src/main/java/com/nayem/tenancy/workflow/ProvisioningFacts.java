package com.nayem.tenancy.workflow;

import com.nayem.tenancy.identity.ExternalOrganization;
import com.nayem.tenancy.identity.ExternalUser;
import com.nayem.tenancy.saga.ContextKey;

/**
 * Facts the provisioning sagas record as their steps succeed. Compensations
 * branch only on these.
 */
public final class ProvisioningFacts {

    public static final ContextKey<ExternalUser> EXTERNAL_USER =
            ContextKey.of("externalUser", ExternalUser.class);
    public static final ContextKey<String> EXTERNAL_USER_ID =
            ContextKey.of("externalUserId", String.class);
    /** True only if this saga created the provider user rather than reusing one. */
    public static final ContextKey<Boolean> USER_WAS_CREATED =
            ContextKey.of("userWasCreated", Boolean.class);
    public static final ContextKey<ExternalOrganization> EXTERNAL_ORG =
            ContextKey.of("externalOrg", ExternalOrganization.class);
    public static final ContextKey<String> EXTERNAL_ORG_ID =
            ContextKey.of("externalOrgId", String.class);
    /** True only if this saga created the user's organization membership. */
    public static final ContextKey<Boolean> LINK_CREATED =
            ContextKey.of("linkCreated", Boolean.class);
    public static final ContextKey<Boolean> LOCAL_TRANSACTION_OPEN =
            ContextKey.of("localTransactionOpen", Boolean.class);
    public static final ContextKey<ExternalUser> USER_SNAPSHOT =
            ContextKey.of("userSnapshot", ExternalUser.class);
    public static final ContextKey<Boolean> PROVIDER_USER_DELETED =
            ContextKey.of("providerUserDeleted", Boolean.class);
    public static final ContextKey<Boolean> REMOVED_FROM_ORG =
            ContextKey.of("removedFromOrg", Boolean.class);
    public static final ContextKey<String> RESTORED_EXTERNAL_USER_ID =
            ContextKey.of("restoredExternalUserId", String.class);

    private ProvisioningFacts() {
    }
}
