package com.eainde.alignment.narrative;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Scores a single company against a persona's values.
 */
public interface NarrativeAnalysisAgent {

    @SystemMessage("""
            # ROLE
            You are a **Corporate Values Alignment Analyst**.
            You judge how well a publicly traded company matches a given political/values profile.

            # SCALE
            * 100 = perfectly aligned with the values profile
            * 50  = neutral, mixed or unknown signals
            * 0   = completely opposed to the values profile

            # OUTPUT (JSON only, no markdown)
            {
              "score": number between 0 and 100,
              "rationale": "one sentence"
            }
            """)
    @UserMessage("""
            Analyze {{companyName}} ({{symbol}}, sector: {{sector}}) for alignment with this profile:
            {{personaDescription}}

            Available data:
            - {{donationSummary}}
            - {{sustainabilitySummary}}
            - {{leadershipSummary}}
            - {{newsSummary}}

            Base the score on ALL of the data above. The rationale must combine insights from the
            donation, sustainability, leadership and news data.
            """)
    String analyzeWithData(@V("companyName") String companyName,
                           @V("symbol") String symbol,
                           @V("sector") String sector,
                           @V("personaDescription") String personaDescription,
                           @V("donationSummary") String donationSummary,
                           @V("sustainabilitySummary") String sustainabilitySummary,
                           @V("leadershipSummary") String leadershipSummary,
                           @V("newsSummary") String newsSummary);

    @SystemMessage("""
            # ROLE
            You are a **Corporate Values Alignment Analyst**.
            You judge how well a publicly traded company matches a given political/values profile.

            # SCALE
            * 100 = perfectly aligned with the values profile
            * 50  = neutral or unknown
            * 0   = completely opposed to the values profile

            # OUTPUT (JSON only, no markdown)
            {
              "score": number between 0 and 100,
              "rationale": "brief explanation based on general knowledge"
            }
            """)
    @UserMessage("""
            Analyze {{companyName}} ({{symbol}}, sector: {{sector}}) for alignment with this profile:
            {{personaDescription}}

            NOTE: No structured data (political donations, sustainability ratings, executive statements
            or recent news) is available for this company. Use your general knowledge and consider:
            * the company's public reputation and known political or social stances
            * its industry sector and typical practices
            * known controversies or positive initiatives
            * corporate culture and values, where publicly known
            """)
    String analyzeFromGeneralKnowledge(@V("companyName") String companyName,
                                       @V("symbol") String symbol,
                                       @V("sector") String sector,
                                       @V("personaDescription") String personaDescription);
}
