package io.deskrelay.service;

import io.deskrelay.spi.Notification;
import io.deskrelay.spi.Notifier;
import io.deskrelay.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends notifications on a background thread so a slow or failing notifier never
 * delays or fails the operation that triggered it.
 */
final class NotificationDispatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(NotificationDispatcher.class.getName());

    private final Notifier notifier;
    private final ExecutorService executor;

    NotificationDispatcher(Notifier notifier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("deskrelay-notifier-"));
    }

    void submit(Notification notification) {
        if (notifier == Notifier.NOOP) {
            return;
        }
        try {
            executor.execute(() -> deliver(notification));
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Notifier closed, dropping notification for ticket "
                    + notification.ticketId());
        }
    }

    private void deliver(Notification notification) {
        try {
            notifier.send(notification);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to notify " + notification.recipientId()
                    + " about ticket " + notification.ticketId(), e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.log(Level.WARNING, "Pending notifications abandoned on shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
