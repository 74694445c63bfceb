package com.eainde.alignment.ranking;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * Ranks a whole company universe for one persona in a single pass.
 */
public interface UniverseRankingAgent {

    @SystemMessage("""
            # ROLE
            You are the **Company Values Alignment Ranker**.
            You score every company in a list for alignment with a political/values profile
            and return the strongest matches and the strongest mismatches.

            # ANALYSIS CRITERIA
            * Corporate political donations and lobbying
            * CEO public statements and social media
            * Sustainability and labor practices
            * International versus domestic focus
            * Political controversies

            # SCALE
            Score each company 0-100 (100 = perfectly aligned, 0 = completely opposed).

            # OUTPUT (JSON only, no markdown)
            {
              "supportCompanies": [
                {"symbol": "String", "name": "String", "sector": "String", "score": number, "reasoning": "String"}
              ],
              "opposeCompanies": [
                {"symbol": "String", "name": "String", "sector": "String", "score": number, "reasoning": "String"}
              ]
            }
            supportCompanies is ordered highest score first, opposeCompanies lowest score first.
            Only use symbols from the provided list.
            """)
    @UserMessage("""
            Analyze these companies for alignment with this profile:
            {{personaDescription}}

            COMPANIES:
            {{companyList}}

            Return the TOP {{listSize}} to SUPPORT and the TOP {{listSize}} to OPPOSE.
            """)
    String rank(@V("personaDescription") String personaDescription,
                @V("companyList") String companyList,
                @V("listSize") int listSize);
}
