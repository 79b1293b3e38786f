package com.phillippitts.tapguard;

import com.phillippitts.tapguard.config.recovery.RecoveryProperties;
import com.phillippitts.tapguard.config.recovery.TerminalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecoveryProperties.class,
        TerminalProperties.class
})
@EnableScheduling
public class TapGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TapGuardApplication.class, args);
    }

}
