package com.macrointel.ingest.config;

import com.macrointel.ingest.model.DataSource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "macro-ingest")
@Data
public class MacroIngestProperties {

    private Catalog catalog = new Catalog();
    private Ingestion ingestion = new Ingestion();
    private Scheduling scheduling = new Scheduling();
    private Sources sources = new Sources();
    private Output output = new Output();
    private Alerts alerts = new Alerts();

    @Data
    public static class Catalog {
        /** File path, or {@code classpath:} resource. */
        private String path = "classpath:config/series_catalog.yaml";
    }

    @Data
    public static class Ingestion {
        private boolean parallelSources = false;
        private int maxParallelSources = 4;

        /** Source to re-route to once a provider reports its daily quota is exhausted. */
        private Map<DataSource, DataSource> fallbackSources = defaultFallbacks();

        private static Map<DataSource, DataSource> defaultFallbacks() {
            Map<DataSource, DataSource> fallbacks = new EnumMap<>(DataSource.class);
            fallbacks.put(DataSource.BLS, DataSource.FRED);
            return fallbacks;
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 30 6 * * ?";
        private String digestCron = "0 0 8 * * ?";
        private boolean runOnStartup = false;
        private String startupMode = "incremental";
    }

    @Data
    public static class Sources {
        private Provider fred = new Provider("https://api.stlouisfed.org/fred", 500);
        private Provider bls = new Provider("https://api.bls.gov/publicAPI/v2/timeseries/data/", 500);
        private Provider treasury = new Provider(
                "https://api.fiscaldata.treasury.gov/services/api/fiscal_service/", 300);

        @Data
        public static class Provider {
            private String baseUrl;
            private String apiKey;
            private long minIntervalMs;

            public Provider() {
            }

            public Provider(String baseUrl, long minIntervalMs) {
                this.baseUrl = baseUrl;
                this.minIntervalMs = minIntervalMs;
            }
        }
    }

    @Data
    public static class Output {
        private String healthJsonPath = "artifacts/run-health.json";
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean enabled = false;
            private String outputDir = "artifacts/dq";
            private boolean includeHeader = true;
        }
    }

    @Data
    public static class Alerts {
        private DispatchMode dispatchMode = DispatchMode.DIGEST;
        private List<Rule> rules = new ArrayList<>();
        private Email email = new Email();

        public enum DispatchMode {
            IMMEDIATE, DIGEST
        }

        @Data
        public static class Rule {
            private String name;
            private boolean enabled = true;
            private String severity = "info";
            private String description = "";
            private double cooldownHours = 24;
            private Condition condition = new Condition();
        }

        /**
         * Flat binding target for every condition type; only the fields relevant to
         * {@link #type} are read when the rule is built.
         */
        @Data
        public static class Condition {
            private String type;
            private List<String> statuses = new ArrayList<>();
            private String severity = "critical";
            private String operator = ">=";
            private Double threshold;
            private int maxAgeDays = 60;
            private int days = 30;
        }

        @Data
        public static class Email {
            private boolean enabled = false;
            private String fromAddress = "macro-alerts@example.com";
            private List<String> toAddresses = new ArrayList<>();
            private String subjectPrefix = "[Macro Alert]";
        }
    }
}
