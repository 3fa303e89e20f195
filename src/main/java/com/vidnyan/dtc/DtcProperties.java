package com.vidnyan.dtc;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the code database.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "dtc")
public class DtcProperties {

    private Corpus corpus = new Corpus();
    private Search search = new Search();
    private Cli cli = new Cli();
    private Explainer explainer = new Explainer();

    @PostConstruct
    public void init() {
        // Default system catalog if not configured
        if (corpus.getKnownSystems().isEmpty()) {
            corpus.getKnownSystems().addAll(List.of(
                    "ABS", "Airbag", "Body", "Brakes", "Charging", "Climate Control",
                    "Cooling", "Electrical", "Emissions", "Engine", "Exhaust",
                    "Fuel System", "Ignition", "Lighting", "Network", "Steering",
                    "Suspension", "Transmission"));
        }
    }

    @Data
    public static class Corpus {

        /**
         * Spring resource location of the corpus.
         * Default: bundled reference corpus
         */
        private String location = "classpath:corpus/error-codes.txt";

        /**
         * AUTO picks CSV for *.csv and the block format otherwise.
         */
        private String format = "AUTO";

        /**
         * Canonical system labels.
         */
        private List<String> knownSystems = new ArrayList<>();

        /**
         * Reject records whose system is not in knownSystems.
         */
        private boolean strictSystems = true;
    }

    @Data
    public static class Search {
        private double descriptionWeight = 3.0;
        private double causeWeight = 2.0;
        private double actionWeight = 1.0;

        /**
         * Maximum number of search hits returned. 0 means unlimited.
         */
        private int maxResults = 0;
    }

    @Data
    public static class Cli {

        /**
         * Run the command line runner on startup.
         */
        private boolean enabled = true;
    }

    @Data
    public static class Explainer {

        /**
         * OpenAI-compatible chat completions URL. Empty: offline template explanations.
         */
        private String endpoint = "";
        private String apiKey = "";
        private String model = "llama-3.3-70b-versatile";
        private int timeoutSeconds = 30;
    }
}
