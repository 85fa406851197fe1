package io.deskrelay.spi;

import java.util.UUID;

/**
 * Permission check consulted before every ticket and comment operation.
 * Role and permission storage live outside this library.
 */
@FunctionalInterface
public interface Authorizer {

    /**
     * Returns {@code true} if the actor holds the named permission, e.g. {@code tickets:assign}.
     */
    boolean can(UUID actorId, String permission);

    /** Grants every permission. Intended for tests and single-user tools. */
    Authorizer ALLOW_ALL = (actorId, permission) -> true;
}
