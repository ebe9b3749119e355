package org.notevault.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notevault.ledger")
public class LedgerProperties {

    private String algorithm = "SHA-256";

    /**
     * Attempts to claim the next chain position of an entry when concurrent downloads collide.
     */
    private int maxAppendAttempts = 5;

    private String verificationCron = "0 0 3 * * ?";

    private boolean verificationEnabled = true;
}
