package com.nayem.tenancy.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs provider deletions so that "already absent" counts as success.
 * <p>
 * Every compensation and reconciliation rollback that deletes or unlinks
 * something in the provider goes through here: the target may never have
 * been fully created, or an earlier partial run may have removed it.
 * </p>
 */
public final class IdempotentDeletes {

    private static final Logger log = LoggerFactory.getLogger(IdempotentDeletes.class);

    private IdempotentDeletes() {
    }

    /**
     * @return {@code true} if the delete took effect, {@code false} if the target was already gone
     */
    public static boolean tolerateNotFound(String description, Runnable delete) {
        try {
            delete.run();
            return true;
        } catch (IdentityProviderException e) {
            if (e.getStatus() != 404) {
                throw e;
            }
            log.info("{}: already absent in identity provider, treating as success", description);
            return false;
        }
    }
}
