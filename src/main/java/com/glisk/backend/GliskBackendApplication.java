package com.glisk.backend;

import com.glisk.backend.recovery.cli.TokenRecoveryRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class GliskBackendApplication {

    public static void main(String[] args) {
        if (!TokenRecoveryRunner.isRecoveryCommand(args)) {
            SpringApplication.run(GliskBackendApplication.class, args);
            return;
        }

        // one-shot operator command: no web server, no pipeline loops
        SpringApplication app = new SpringApplication(GliskBackendApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.setAdditionalProfiles("cli");
        ConfigurableApplicationContext ctx = app.run(args);
        System.exit(SpringApplication.exit(ctx));
    }

    /**
     * Test profile runs without the reaper schedule; tests call it directly.
     */
    @Configuration
    @Profile("!test & !cli")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
