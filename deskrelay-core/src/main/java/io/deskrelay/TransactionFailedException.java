package io.deskrelay;

/**
 * A transaction could not be started or committed, or its work failed with a
 * checked exception. Everything written in the transaction was rolled back.
 *
 * <p>Callers may retry the whole operation; deskrelay never retries on its own.
 */
public class TransactionFailedException extends RuntimeException {

    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
