package uk.gegc.pixelperfect.features.billing.application;

import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.domain.model.ProviderKind;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Generates job ids of the form {@code <prefix>_<unixMillis>_<7 base36 chars>}, e.g. {@code rep_1718000000000_k3x9a0b}.
 * The id doubles as the ledger idempotency key for the job's debit and refund.
 */
@Component
public class JobIdGenerator {

    private static final char[] BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int RANDOM_LENGTH = 7;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public JobIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(ProviderKind providerKind) {
        StringBuilder id = new StringBuilder(providerKind.getJobIdPrefix())
                .append('_')
                .append(clock.millis())
                .append('_');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(BASE36[random.nextInt(BASE36.length)]);
        }
        return id.toString();
    }
}
