package com.mikov.emailverifier.smtp.verification;

import com.mikov.emailverifier.smtp.core.SmtpConnection;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Lets another thread stop a running {@link SmtpVerifier#verify} call. Cancelling closes the
 * connection currently in use, which unblocks a pending connect or read at once.
 */
@Slf4j
public class CancellationHandle {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicReference<SmtpConnection> current = new AtomicReference<>();

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            final var connection = current.getAndSet(null);
            if (connection != null) {
                log.debug("Closing SMTP connection after cancellation");
                connection.close();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void throwIfCancelled(final String recipient) {
        if (isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("SMTP verification cancelled for " + recipient);
        }
    }

    /**
     * Registers the connection about to be opened. A connection attached after {@link #cancel()}
     * is closed immediately.
     */
    void attach(final SmtpConnection connection) {
        current.set(connection);
        if (isCancelled()) {
            current.compareAndSet(connection, null);
            connection.close();
        }
    }

    void detach(final SmtpConnection connection) {
        current.compareAndSet(connection, null);
    }
}
