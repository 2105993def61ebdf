package com.example.realty.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private ConversationConfig conversation = new ConversationConfig();
    private SessionConfig session = new SessionConfig();
    private DispatchConfig dispatch = new DispatchConfig();
    private FollowupConfig followup = new FollowupConfig();
    private ScoringConfig scoring = new ScoringConfig();
    private ExtractionConfig extraction = new ExtractionConfig();

    @Data
    public static class ConversationConfig {
        /** failed phone parses before the raw text is accepted */
        private int contactRetryBudget = 2;
        private int scarcityMinUnits = 2;
        private int scarcityMaxUnits = 5;
        private int maxPreviewItems = 3;
    }

    @Data
    public static class SessionConfig {
        private Duration cacheTtl = Duration.ofMinutes(10);
        /** how long tenant settings provisioned outside this process may stay stale */
        private Duration tenantCacheTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class DispatchConfig {
        private int threadPoolSize = 4;
        private int queueCapacity = 500;
        private Duration drainTimeout = Duration.ofSeconds(10);
        private Duration supervisorInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class FollowupConfig {
        /** delay before stage N is due, indexed by stage 0..4 */
        private List<Duration> stageDelays = new ArrayList<>(List.of(
                Duration.ofHours(1),
                Duration.ofDays(1),
                Duration.ofDays(3),
                Duration.ofDays(7),
                Duration.ofDays(14)));
        private Duration scanInterval = Duration.ofMinutes(30);
        private Duration ghostScanInterval = Duration.ofMinutes(10);
        private Duration recoveryInterval = Duration.ofMinutes(15);
        private Duration initialDelay = Duration.ofMinutes(1);
        private Duration ghostDelay = Duration.ofHours(2);
        private Duration claimTimeout = Duration.ofHours(1);
        private int batchSize = 100;
    }

    @Data
    public static class ScoringConfig {
        private int burningThreshold = 70;
        private int hotThreshold = 50;
        private int warmThreshold = 25;
    }

    @Data
    public static class ExtractionConfig {
        private List<String> knownLocations = new ArrayList<>(List.of(
                "Dubai Marina", "Downtown", "Palm Jumeirah", "Business Bay", "JVC",
                "Jumeirah Village Circle", "Dubai Hills", "JLT", "Arabian Ranches",
                "Dubai Creek Harbour", "Emaar Beachfront", "Al Barsha", "Deira", "Abu Dhabi"));
    }
}
