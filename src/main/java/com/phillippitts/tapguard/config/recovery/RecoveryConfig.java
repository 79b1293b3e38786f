package com.phillippitts.tapguard.config.recovery;

import com.phillippitts.tapguard.service.terminal.PaymentIntentGateway;
import com.phillippitts.tapguard.service.terminal.ReaderGateway;
import com.phillippitts.tapguard.service.terminal.UnboundTerminalGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the recovery engine's collaborators.
 *
 * <p>The host integration provides real {@link ReaderGateway} and {@link PaymentIntentGateway}
 * beans; without them every command fails fast through {@link UnboundTerminalGateway}.
 */
@Configuration
public class RecoveryConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean({ReaderGateway.class, PaymentIntentGateway.class})
    public UnboundTerminalGateway unboundTerminalGateway() {
        return new UnboundTerminalGateway();
    }
}
