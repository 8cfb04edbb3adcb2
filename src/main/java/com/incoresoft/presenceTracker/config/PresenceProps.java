package com.incoresoft.presenceTracker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Session engine settings. Read from the `presence` block of application.yml / config.yaml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "presence")
public class PresenceProps {
    /** How long an identity must be matched continuously before its session is confirmed. */
    @NotNull
    private Duration activationWindow = Duration.ofSeconds(3);
    /** Similarity at or above this value makes a face a known candidate. */
    @DecimalMin("0") @DecimalMax("100")
    private double knownThreshold = 70;
    /** Similarity strictly below this value is logged as an unknown incident. */
    @DecimalMin("0") @DecimalMax("100")
    private double unknownThreshold = 60;
    /** Maximum number of detection events retained in memory. */
    @Min(1)
    private int historyCapacity = 1000;
    /** Window of the "recent detections" counter in stats. */
    @NotNull
    private Duration recentWindow = Duration.ofHours(24);
    @Min(1)
    private int defaultHistoryLimit = 50;

    @Valid
    private Storage storage = new Storage();
    @Valid
    private Export export = new Export();

    @Data
    public static class Storage {
        /** One folder per identity: reference image and verified report. */
        @NotBlank
        private String usersDir = "users";
        /** Archive for unknown face crops and the unknown incident log. */
        @NotBlank
        private String unknownDir = "unknown";
        /** Rebuild the history ledger from report files at startup. */
        private boolean restoreHistory = true;
    }

    @Data
    public static class Export {
        private boolean enabled = false;
        /** Absolute or relative output folder for XLSX */
        private String outputDir = "exports";
        /** Cron for the daily export (local time of {@link #timezone}) */
        private String scheduleCron = "0 0 23 * * *";
        private String timezone = "UTC";
    }

    public void validateThresholds() {
        if (unknownThreshold > knownThreshold) {
            throw new IllegalStateException("presence.unknown-threshold (" + unknownThreshold
                    + ") must not exceed presence.known-threshold (" + knownThreshold + ")");
        }
        if (activationWindow.isNegative()) {
            throw new IllegalStateException("presence.activation-window must not be negative");
        }
    }
}
