package com.example.renderflow.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator encoderHealth(RenderflowProperties properties) {
        String binary = properties.getEncoder().getBinary();
        return () -> {
            try {
                var p = new ProcessBuilder(binary, "-version").redirectErrorStream(true)
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
                if (!p.waitFor(5, TimeUnit.SECONDS)) {
                    p.destroyForcibly();
                    return Health.down().withDetail("encoder", binary).withDetail("reason", "timeout").build();
                }
                if (p.exitValue() == 0) {
                    return Health.up().withDetail("encoder", binary).build();
                }
                return Health.down().withDetail("encoder", binary).withDetail("exitCode", p.exitValue()).build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Health.down(e).withDetail("encoder", binary).build();
            } catch (Exception e) {
                return Health.down(e).withDetail("encoder", binary).withDetail("reason", "missing").build();
            }
        };
    }
}
