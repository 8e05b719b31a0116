package com.flamingo.ai.assessrec.agent;

import com.flamingo.ai.assessrec.agent.dto.RerankingScores;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that scores how well each candidate assessment fits a hiring query.
 *
 * <p>The agent is advisory: it only produces scores, and the caller decides whether the resulting
 * ordering is usable.
 */
public interface AssessmentRerankerAgent {

  @SystemMessage(
      """
        You are an expert in pre-employment testing. Score how well each candidate assessment
        fits the hiring need described in the query, on a scale of 0.0 to 1.0.

        Scoring Guidelines:
        - 1.0 = Directly measures the skills or traits the role requires
        - 0.7-0.9 = Strong fit, covers most of what the role requires
        - 0.4-0.6 = Partial fit, covers related skills or traits
        - 0.1-0.3 = Weak fit, only tangentially related
        - 0.0 = Not relevant at all

        Return a JSON object with a "scores" array containing one float per assessment, in the
        order the assessments are listed. Do not add, drop or reorder entries.
        Example: {"scores": [0.8, 0.3, 0.9, 0.5]}
        """)
  @UserMessage("""
        Query: {{query}}

        Assessments:
        {{assessments}}
        """)
  RerankingScores scoreAssessments(
      @V("query") String query, @V("assessments") String assessments);
}
