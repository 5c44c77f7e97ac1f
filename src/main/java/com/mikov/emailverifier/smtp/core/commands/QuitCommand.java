package com.mikov.emailverifier.smtp.core.commands;

import com.mikov.emailverifier.smtp.core.SmtpCommand;

public class QuitCommand implements SmtpCommand {

    @Override
    public String getCommand() {
        return "QUIT";
    }
}
