package com.mikov.emailverifier.smtp.verification;

import com.mikov.emailverifier.smtp.core.SmtpResponse;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds throwaway recipients and interprets the server's answer to them.
 * A server that accepts a mailbox nobody could own is most likely accepting everything.
 */
public class CatchAllDetector {

    public String randomLocalPart() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return random.nextInt(10000, 100000) + "catchalltest" + random.nextInt(10000, 100000);
    }

    /**
     * @return true for 2xx, false for 5xx, null when the answer is inconclusive
     */
    public Boolean classify(SmtpResponse response) {
        if (response.isSuccess()) {
            return Boolean.TRUE;
        }
        if (response.isPermanentFailure()) {
            return Boolean.FALSE;
        }
        return null;
    }
}
