package com.vidnyan.dtc.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.dtc.DtcProperties;
import com.vidnyan.dtc.adapter.out.ai.HttpExplainer;
import com.vidnyan.dtc.adapter.out.ai.TemplateExplainer;
import com.vidnyan.dtc.application.port.out.Explainer;
import com.vidnyan.dtc.domain.model.SystemCatalog;
import com.vidnyan.dtc.domain.query.FieldWeights;
import com.vidnyan.dtc.domain.query.SearchScorer;
import com.vidnyan.dtc.domain.query.TokenSumScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the code database components.
 */
@Slf4j
@Configuration
public class DtcConfiguration {

    /**
     * ObjectMapper for JSON output and the remote explainer.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public SystemCatalog systemCatalog(DtcProperties properties) {
        DtcProperties.Corpus corpus = properties.getCorpus();
        SystemCatalog catalog = SystemCatalog.of(corpus.getKnownSystems(), corpus.isStrictSystems());
        log.debug("System catalog: {} known systems, strict={}", catalog.knownSystems().size(), catalog.isStrict());
        return catalog;
    }

    /**
     * Token-sum ranking. Invalid weights fail startup.
     */
    @Bean
    public SearchScorer searchScorer(DtcProperties properties) {
        DtcProperties.Search search = properties.getSearch();
        FieldWeights weights = new FieldWeights(
                search.getDescriptionWeight(),
                search.getCauseWeight(),
                search.getActionWeight());
        log.debug("Search weights: {}", weights);
        return new TokenSumScorer(weights);
    }

    /**
     * Remote explainer when an endpoint is configured, offline templates otherwise.
     */
    @Bean
    public Explainer explainer(DtcProperties properties, ObjectMapper objectMapper) {
        TemplateExplainer template = new TemplateExplainer();
        DtcProperties.Explainer config = properties.getExplainer();
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()) {
            log.debug("No explainer endpoint configured. Using template explanations.");
            return template;
        }
        log.info("Using remote explainer at {} (model {})", config.getEndpoint(), config.getModel());
        return new HttpExplainer(config, objectMapper, template);
    }
}
