package com.mikov.emailverifier.smtp.core;

public interface SmtpCommand {
    String getCommand();
}
