package com.mikov.emailverifier.smtp.core.commands;

import com.mikov.emailverifier.smtp.core.SmtpCommand;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class MailFromCommand implements SmtpCommand {
    private final String email;

    @Override
    public String getCommand() {
        return "MAIL FROM:<" + email + ">";
    }
}
