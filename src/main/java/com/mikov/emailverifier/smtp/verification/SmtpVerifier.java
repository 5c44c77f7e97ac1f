package com.mikov.emailverifier.smtp.verification;

import com.mikov.emailverifier.dtos.SmtpData;
import com.mikov.emailverifier.exception.ConnectionException;
import com.mikov.emailverifier.smtp.core.SmtpConnection;
import com.mikov.emailverifier.smtp.core.SmtpConnectionFactory;
import com.mikov.emailverifier.smtp.core.SmtpResponse;
import com.mikov.emailverifier.smtp.core.commands.HeloCommand;
import com.mikov.emailverifier.smtp.core.commands.MailFromCommand;
import com.mikov.emailverifier.smtp.core.commands.QuitCommand;
import com.mikov.emailverifier.smtp.core.commands.RcptToCommand;
import com.mikov.emailverifier.smtp.dns.MxRecord;
import com.mikov.emailverifier.smtp.model.SmtpConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Probes mail exchangers to learn whether a mailbox is accepted, without sending a message.
 * Hosts are tried in the given order; each host gets {@code maxRetries} attempts before moving on.
 */
@Slf4j
@RequiredArgsConstructor
public class SmtpVerifier {
    public static final int SMTP_PORT = 25;

    private final SmtpConnectionFactory connectionFactory;
    private final SmtpConfig config;
    private final CatchAllDetector catchAllDetector;

    public SmtpVerifier(SmtpConnectionFactory connectionFactory, SmtpConfig config) {
        this(connectionFactory, config, new CatchAllDetector());
    }

    public SmtpData verify(String username, String hostname, List<MxRecord> records) {
        return verify(username, hostname, records, new CancellationHandle());
    }

    /**
     * @param username local part without the plus tag
     * @param hostname ASCII hostname
     * @param records mail exchangers in preference order
     * @param cancellation closes the live connection when cancelled from another thread
     * @throws ConnectionException if every host and attempt failed at the transport level
     * @throws CancellationException if the verification was cancelled or the thread interrupted
     */
    public SmtpData verify(String username, String hostname, List<MxRecord> records,
                           CancellationHandle cancellation) {
        if (records.isEmpty()) {
            return SmtpData.noRecords();
        }

        String recipient = username + "@" + hostname;
        String catchAllRecipient = catchAllDetector.randomLocalPart() + "@" + hostname;
        log.debug("Starting SMTP verification for {}", recipient);

        IOException lastError = null;
        for (MxRecord record : records) {
            for (int attempt = 1; attempt <= config.getMaxRetries(); attempt++) {
                cancellation.throwIfCancelled(recipient);
                try {
                    SmtpData result = probe(record.exchange(), recipient, catchAllRecipient, cancellation);
                    log.debug("SMTP verification completed for {} via {}: deliverable={}, catchAll={}",
                        recipient, record.exchange(), result.isDeliverable(), result.getCatchAll());
                    return result;
                } catch (IOException e) {
                    cancellation.throwIfCancelled(recipient);
                    lastError = e;
                    log.debug("SMTP verification attempt {}/{} against {} failed for {}: {}",
                        attempt, config.getMaxRetries(), record.exchange(), recipient, e.getMessage());
                }
            }
        }

        log.error("All SMTP verification attempts failed for {}", recipient);
        throw new ConnectionException("Failed to connect to any SMTP server for " + hostname, lastError);
    }

    private SmtpData probe(String mxHost, String recipient, String catchAllRecipient,
                           CancellationHandle cancellation) throws IOException {
        try (SmtpConnection connection = connectionFactory.create(mxHost, SMTP_PORT)) {
            cancellation.attach(connection);
            try {
                connection.open();
                return converse(connection, mxHost, recipient, catchAllRecipient);
            } finally {
                cancellation.detach(connection);
            }
        }
    }

    private SmtpData converse(SmtpConnection connection, String mxHost, String recipient,
                              String catchAllRecipient) throws IOException {
        connection.sendCommand(new HeloCommand(config.getHeloDomain()));
        connection.sendCommand(new MailFromCommand(config.getFromEmail()));
        SmtpResponse rcptToResponse = connection.sendCommand(new RcptToCommand(recipient));

        Boolean catchAll = null;
        if (config.isCatchAllCheck()) {
            catchAll = catchAllDetector.classify(connection.sendCommand(new RcptToCommand(catchAllRecipient)));
        }

        try {
            connection.sendCommand(new QuitCommand());
        } catch (IOException e) {
            log.debug("Error sending QUIT to {}: {}", mxHost, e.getMessage());
        }

        return SmtpData.builder()
            .deliverable(rcptToResponse.isSuccess())
            .catchAll(catchAll)
            .smtpCode(rcptToResponse.getCode())
            .smtpMessage(rcptToResponse.getMessage())
            .mxHost(mxHost)
            .build();
    }
}
