package com.mikov.emailverifier.smtp.core.commands;

import com.mikov.emailverifier.smtp.core.SmtpCommand;

public class RcptToCommand implements SmtpCommand {
    private final String toEmail;

    public RcptToCommand(String toEmail) {
        this.toEmail = toEmail;
    }

    @Override
    public String getCommand() {
        return "RCPT TO:<" + toEmail + ">";
    }
}
