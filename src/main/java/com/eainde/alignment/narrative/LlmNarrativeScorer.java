package com.eainde.alignment.narrative;

import com.eainde.alignment.scoring.Scores;
import com.eainde.alignment.source.CompanyProfile;
import com.eainde.alignment.source.CompanySources;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link NarrativeScorer} backed by a chat model through {@link NarrativeAnalysisAgent}.
 * <p>
 * The reply is expected to be a JSON object with {@code score} and {@code rationale}.
 * Markdown fences are tolerated; a missing or non-numeric score is a failure, while a
 * score outside [0,100] is clamped.
 * </p>
 */
@Slf4j
public class LlmNarrativeScorer implements NarrativeScorer {

    static final String DEFAULT_RATIONALE = "Narrative analysis completed";

    private final NarrativeAnalysisAgent agent;
    private final NarrativePromptFormatter formatter;
    private final ObjectMapper objectMapper;

    public LlmNarrativeScorer(NarrativeAnalysisAgent agent,
                              NarrativePromptFormatter formatter,
                              ObjectMapper objectMapper) {
        this.agent = agent;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
    }

    @Override
    public NarrativeVerdict analyze(NarrativeRequest request) throws NarrativeAnalysisException {
        CompanyProfile company = request.company();
        String reply;
        try {
            reply = request.generalKnowledge()
                    ? agent.analyzeFromGeneralKnowledge(company.name(), company.symbol(), company.sector(),
                            request.persona().description())
                    : analyzeWithData(company, request);
        } catch (RuntimeException e) {
            throw new NarrativeAnalysisException("Narrative model call failed for " + company.symbol(), e);
        }
        return parse(company.symbol(), reply);
    }

    private String analyzeWithData(CompanyProfile company, NarrativeRequest request) {
        CompanySources sources = request.sources();
        return agent.analyzeWithData(
                company.name(), company.symbol(), company.sector(),
                request.persona().description(),
                formatter.donationSummary(sources.donation()),
                formatter.sustainabilitySummary(sources.sustainability()),
                formatter.leadershipSummary(sources.leadership()),
                formatter.newsSummary(sources.news()));
    }

    NarrativeVerdict parse(String symbol, String reply) throws NarrativeAnalysisException {
        if (reply == null || reply.isBlank()) {
            throw new NarrativeAnalysisException("Empty narrative reply for " + symbol);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJson(reply));
        } catch (JsonProcessingException e) {
            throw new NarrativeAnalysisException("Unparseable narrative reply for " + symbol, e);
        }

        JsonNode score = root.get("score");
        if (score == null || !score.isNumber()) {
            throw new NarrativeAnalysisException("Narrative reply for " + symbol + " has no numeric score");
        }
        JsonNode rationale = root.get("rationale");
        String text = rationale != null && !rationale.asText().isBlank()
                ? rationale.asText().trim() : DEFAULT_RATIONALE;

        log.debug("Narrative verdict for {}: {} ({})", symbol, score.asDouble(), text);
        return new NarrativeVerdict(Scores.clamp(score.asDouble()), text);
    }

    private static String cleanJson(String json) {
        return json.replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
