package com.flamingo.ai.assessrec.service.evaluation;

import java.util.List;

/**
 * A query with the catalog ids (or urls) judged relevant to it.
 *
 * @param query query text
 * @param relevant relevant record ids or urls
 */
public record LabeledQuery(String query, List<String> relevant) {

  public LabeledQuery {
    relevant = relevant == null ? List.of() : List.copyOf(relevant);
  }
}
