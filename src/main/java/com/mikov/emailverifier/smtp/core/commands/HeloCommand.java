package com.mikov.emailverifier.smtp.core.commands;

import com.mikov.emailverifier.smtp.core.SmtpCommand;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class HeloCommand implements SmtpCommand {
    private final String domain;

    @Override
    public String getCommand() {
        return "HELO " + domain;
    }
}
