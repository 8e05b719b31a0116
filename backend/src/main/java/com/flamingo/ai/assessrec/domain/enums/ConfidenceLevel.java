package com.flamingo.ai.assessrec.domain.enums;

/** Coarse confidence attached to a recommendation result. */
public enum ConfidenceLevel {
  HIGH,
  MEDIUM,
  LOW
}
