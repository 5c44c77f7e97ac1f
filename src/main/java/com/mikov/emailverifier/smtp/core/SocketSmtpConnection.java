package com.mikov.emailverifier.smtp.core;

import com.mikov.emailverifier.smtp.model.SmtpConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;

@Slf4j
public class SocketSmtpConnection implements SmtpConnection {
    private static final int GREETING_CODE = 220;

    @Getter
    private final String host;
    private final int port;
    private final int timeout;
    private final Socket socket;
    private final SocketAddress target;
    private BufferedReader in;
    private Writer out;

    /**
     * Prepares a connection to {@code host:port}, direct or through the configured SOCKS proxy.
     */
    public SocketSmtpConnection(String host, int port, SmtpConfig config) {
        this.host = host;
        this.port = port;
        this.timeout = (int) config.getTimeout().toMillis();
        if (config.getProxy() != null) {
            log.debug("Using proxy {}:{} for SMTP server {}:{}",
                config.getProxy().getHost(), config.getProxy().getPort(), host, port);
            this.socket = new Socket(config.getProxy().toProxy());
            this.target = InetSocketAddress.createUnresolved(host, port);
        } else {
            this.socket = new Socket();
            this.target = new InetSocketAddress(host, port);
        }
    }

    /**
     * @throws IOException if the connection cannot be established or the greeting is not 220;
     *                     the socket is closed in that case
     */
    @Override
    public void open() throws IOException {
        log.debug("Connecting to SMTP server {}:{}", host, port);
        try {
            socket.connect(target, timeout);
            socket.setSoTimeout(timeout);
            in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8);
            SmtpResponse greeting = readResponse();
            if (greeting.getCode() != GREETING_CODE) {
                throw new IOException("Unexpected greeting from " + host + ": " + greeting.getMessage());
            }
        } catch (IOException e) {
            close();
            throw e;
        }
    }

    @Override
    public SmtpResponse sendCommand(SmtpCommand command) throws IOException {
        if (out == null) {
            throw new IOException("Connection to " + host + " is not open");
        }
        log.debug("Sending command to {}: {}", host, command.getCommand());
        out.write(command.getCommand());
        out.write("\r\n");
        out.flush();
        SmtpResponse response = readResponse();
        log.debug("Response from {}: {}", host, response.getMessage());
        return response;
    }

    private SmtpResponse readResponse() throws IOException {
        StringBuilder response = new StringBuilder();
        String line;
        while ((line = in.readLine()) != null) {
            if (response.length() > 0) {
                response.append("\n");
            }
            response.append(line);
            if (line.length() < 4 || line.charAt(3) != '-') {
                return new SmtpResponse(response.toString());
            }
        }
        throw new IOException("Connection closed by " + host);
    }

    @Override
    public void close() {
        if (!socket.isClosed()) {
            try {
                socket.close();
            } catch (IOException e) {
                log.debug("Error closing connection to {}: {}", host, e.getMessage());
            }
        }
    }
}
