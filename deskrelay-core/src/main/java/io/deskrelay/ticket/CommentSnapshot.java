package io.deskrelay.ticket;

/** Immutable view of a comment embedded in {@code COMMENT_ADDED} payloads. */
public record CommentSnapshot(String id, long ticketId, String authorId, String body, String createdAt) {

    public static CommentSnapshot of(Comment comment) {
        return new CommentSnapshot(
                Long.toString(comment.id()),
                comment.ticketId(),
                comment.authorId().toString(),
                comment.body(),
                comment.createdAt().toString());
    }
}
