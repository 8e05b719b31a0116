package com.flamingo.ai.assessrec.domain.enums;

import java.util.Locale;

/**
 * Closed set of assessment categories. Each category has a one-letter catalog code and the display
 * label used on the wire.
 */
public enum AssessmentCategory {
  KNOWLEDGE_SKILLS("K", "Knowledge & Skills"),
  PERSONALITY_BEHAVIOR("P", "Personality & Behavior"),
  ABILITY_APTITUDE("C", "Ability & Aptitude"),
  SIMULATION("S", "Simulations"),
  OTHER("O", "Other");

  private final String code;
  private final String displayName;

  AssessmentCategory(String code, String displayName) {
    this.code = code;
    this.displayName = displayName;
  }

  public String getCode() {
    return code;
  }

  public String getDisplayName() {
    return displayName;
  }

  /**
   * Resolves a category from a catalog code ("K"), an enum name or a display label. Labels are
   * matched loosely so that variants such as "Cognitive Ability" or "Situational Judgment" still
   * land in the right bucket.
   *
   * @param value raw value from the catalog source
   * @return the matching category, or {@link #OTHER} when nothing matches
   */
  public static AssessmentCategory fromLabel(String value) {
    if (value == null || value.isBlank()) {
      return OTHER;
    }
    String trimmed = value.trim();
    for (AssessmentCategory category : values()) {
      if (category.code.equalsIgnoreCase(trimmed)
          || category.name().equalsIgnoreCase(trimmed)
          || category.displayName.equalsIgnoreCase(trimmed)) {
        return category;
      }
    }

    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.contains("knowledge") || lower.contains("skill")) {
      return KNOWLEDGE_SKILLS;
    }
    if (lower.contains("personality") || lower.contains("behavio")) {
      return PERSONALITY_BEHAVIOR;
    }
    if (lower.contains("ability") || lower.contains("aptitude") || lower.contains("cognitive")) {
      return ABILITY_APTITUDE;
    }
    if (lower.contains("simulation") || lower.contains("situational")) {
      return SIMULATION;
    }
    return OTHER;
  }
}
