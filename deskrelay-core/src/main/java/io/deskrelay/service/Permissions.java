package io.deskrelay.service;

/**
 * Permission names passed to {@link io.deskrelay.spi.Authorizer#can}.
 */
public final class Permissions {
    public static final String TICKETS_CREATE = "tickets:create";
    public static final String TICKETS_READ = "tickets:read";
    /** Read tickets the actor neither filed nor is assigned to. */
    public static final String TICKETS_READ_ALL = "tickets:read:all";
    public static final String TICKETS_UPDATE_STATUS = "tickets:update:status";
    public static final String TICKETS_ASSIGN = "tickets:assign";
    public static final String COMMENTS_CREATE = "comments:create";
    public static final String COMMENTS_READ = "comments:read";

    private Permissions() {
    }
}
