package com.flamingo.ai.assessrec.domain.enums;

/**
 * Scoring strategy that produced a ranking. Vector scores are cosine similarities in [-1, 1];
 * lexical scores are shared-term counts and are never comparable with vector scores.
 */
public enum ScoreSource {
  VECTOR,
  LEXICAL
}
