package com.mikov.emailverifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mikov.emailverifier.utils.ValidationResultConverter;
import com.mikov.emailverifier.validation.EmailValidationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Verifies each program argument and prints one JSON document per line.
 * {@code --refresh} reloads every dataset before the addresses are verified.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationCommandLineRunner implements CommandLineRunner {
    public static final String REFRESH_OPTION = "--refresh";

    private final EmailValidationPipeline pipeline;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws JsonProcessingException {
        run(System.out, args);
    }

    void run(PrintStream out, String... args) throws JsonProcessingException {
        for (String arg : args) {
            if (REFRESH_OPTION.equals(arg)) {
                log.info("Refreshing datasets");
                pipeline.refreshAll();
            }
        }
        for (String arg : args) {
            if (arg.startsWith("--")) {
                continue;
            }
            final var result = pipeline.verify(arg);
            out.println(objectMapper.writeValueAsString(ValidationResultConverter.toMap(result)));
        }
    }
}
