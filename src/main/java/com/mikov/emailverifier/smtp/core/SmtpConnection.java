package com.mikov.emailverifier.smtp.core;

import java.io.IOException;

/**
 * A session with one mail exchanger. Created unconnected so that another thread can
 * {@link #close()} it while {@link #open()} is still waiting for the server.
 */
public interface SmtpConnection extends AutoCloseable {

    /**
     * Connects and reads the greeting.
     *
     * @throws IOException if the server cannot be reached or does not greet with 220
     */
    void open() throws IOException;

    /**
     * Sends a command and reads the full (possibly multi-line) reply.
     *
     * @throws IOException on any transport failure, including the server closing the connection
     */
    SmtpResponse sendCommand(SmtpCommand command) throws IOException;

    /**
     * Releases the underlying transport and unblocks a pending read. Safe to call more than once
     * and from any thread.
     */
    @Override
    void close();
}
