package io.deskrelay;

import java.util.UUID;

public class AccessDeniedException extends RuntimeException {
    private final UUID actorId;
    private final String permission;

    public AccessDeniedException(UUID actorId, String permission) {
        super("Actor " + actorId + " lacks permission " + permission);
        this.actorId = actorId;
        this.permission = permission;
    }

    public UUID actorId() {
        return actorId;
    }

    /**
     * The permission that was checked, e.g. {@code tickets:assign}.
     */
    public String permission() {
        return permission;
    }
}
