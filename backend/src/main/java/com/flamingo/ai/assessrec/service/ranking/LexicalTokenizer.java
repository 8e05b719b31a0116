package com.flamingo.ai.assessrec.service.ranking;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Case-insensitive tokenizer splitting on non-alphanumeric boundaries. No stop-word removal. */
public final class LexicalTokenizer {

  private static final Pattern SEPARATOR = Pattern.compile("[^a-z0-9]+");

  private LexicalTokenizer() {}

  /**
   * Returns the distinct terms of {@code text} in first-seen order.
   *
   * @param text any text, may be null
   * @return lower-case terms
   */
  public static Set<String> terms(String text) {
    Set<String> terms = new LinkedHashSet<>();
    if (text == null) {
      return terms;
    }
    for (String token : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        terms.add(token);
      }
    }
    return terms;
  }
}
