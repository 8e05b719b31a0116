package com.flamingo.ai.assessrec.agent.dto;

import java.util.List;

/**
 * Structured JSON output from AssessmentRerankerAgent: one fit score (0.0-1.0) per candidate, in
 * candidate order.
 */
public record RerankingScores(List<Double> scores) {}
