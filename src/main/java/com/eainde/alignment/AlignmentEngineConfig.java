package com.eainde.alignment;

import com.eainde.alignment.narrative.LlmNarrativeScorer;
import com.eainde.alignment.narrative.NarrativeAnalysisAgent;
import com.eainde.alignment.narrative.NarrativeCallListener;
import com.eainde.alignment.narrative.NarrativePromptFormatter;
import com.eainde.alignment.narrative.NarrativeScorer;
import com.eainde.alignment.ranking.UniverseRanker;
import com.eainde.alignment.ranking.UniverseRankingAgent;
import com.eainde.alignment.store.CompanySourceRepository;
import com.eainde.alignment.store.InMemoryCompanySourceRepository;
import com.eainde.alignment.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wiring for properties, executors, the document store and the narrative model.
 * The narrative beans are only created when narrative analysis is enabled and an API key is set;
 * without them companies are scored from structured data alone.
 */
@Slf4j
@Configuration
public class AlignmentEngineConfig {

    /** Narrative analysis needs both the switch and an API key. */
    private static final String NARRATIVE_ACTIVE =
            "${alignment.narrative.enabled:true} and !'${alignment.narrative.api-key:}'.isBlank()";

    @Bean
    public RankingProperties rankingProperties(
            @Value("${alignment.ranking.list-size:5}") int listSize,
            @Value("${alignment.ranking.cache-ttl:PT12H}") Duration cacheTtl,
            @Value("${alignment.ranking.fetch-parallelism:16}") int fetchParallelism,
            @Value("${alignment.ranking.scoring-parallelism:8}") int scoringParallelism) {
        return new RankingProperties(listSize, cacheTtl, fetchParallelism, scoringParallelism);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("sourceFetchExecutor")
    public MdcAwareExecutor sourceFetchExecutor(RankingProperties properties) {
        return new MdcAwareExecutor("source-fetch-", properties.fetchParallelism());
    }

    @Bean("scoringExecutor")
    public MdcAwareExecutor scoringExecutor(RankingProperties properties) {
        return new MdcAwareExecutor("scoring-", properties.scoringParallelism());
    }

    @Bean
    public CompanySourceRepository companySourceRepository(
            @Value("${alignment.store.company-sources:classpath:data/company-sources.json}") Resource seed,
            ObjectMapper objectMapper) {
        return InMemoryCompanySourceRepository.fromResource(seed, objectMapper);
    }

    @Bean
    @ConditionalOnExpression(NARRATIVE_ACTIVE)
    public NarrativeProperties narrativeProperties(
            @Value("${alignment.narrative.api-key:}") String apiKey,
            @Value("${alignment.narrative.model-name:gemini-2.5-flash}") String modelName,
            @Value("${alignment.narrative.temperature:0.3}") double temperature,
            @Value("${alignment.narrative.timeout:PT60S}") Duration timeout) {
        return new NarrativeProperties(apiKey, modelName, temperature, timeout);
    }

    @Bean
    @ConditionalOnExpression(NARRATIVE_ACTIVE)
    public ChatModel narrativeChatModel(NarrativeProperties properties) {
        log.info("Narrative analysis enabled with model {}", properties.modelName());
        return GoogleAiGeminiChatModel.builder()
                .apiKey(properties.apiKey())
                .modelName(properties.modelName())
                .temperature(properties.temperature())
                .timeout(properties.timeout())
                .listeners(List.of(new NarrativeCallListener()))
                .build();
    }

    @Bean
    @ConditionalOnExpression(NARRATIVE_ACTIVE)
    public NarrativeScorer narrativeScorer(ChatModel narrativeChatModel,
                                           NarrativePromptFormatter formatter,
                                           ObjectMapper objectMapper) {
        NarrativeAnalysisAgent agent = AiServices.builder(NarrativeAnalysisAgent.class)
                .chatModel(narrativeChatModel)
                .build();
        return new LlmNarrativeScorer(agent, formatter, objectMapper);
    }

    @Bean
    @ConditionalOnExpression(NARRATIVE_ACTIVE)
    public UniverseRanker universeRanker(ChatModel narrativeChatModel, ObjectMapper objectMapper) {
        UniverseRankingAgent agent = AiServices.builder(UniverseRankingAgent.class)
                .chatModel(narrativeChatModel)
                .build();
        return new UniverseRanker(agent, objectMapper);
    }
}
