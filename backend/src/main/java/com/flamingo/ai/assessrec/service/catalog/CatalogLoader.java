package com.flamingo.ai.assessrec.service.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.exception.CatalogLoadException;
import com.flamingo.ai.assessrec.exception.InternalInconsistencyException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads the catalog snapshot (a JSON array of assessment objects) into immutable records.
 *
 * <p>Entries without a name or url are skipped. Duplicate ids abort the load.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogLoader {

  private static final Pattern FIRST_INTEGER = Pattern.compile("(\\d+)");

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;
  private final RecommenderConfig recommenderConfig;

  public List<CatalogRecord> load() {
    return load(recommenderConfig.getCatalog().getLocation());
  }

  /**
   * Loads catalog records from a Spring resource location.
   *
   * @param location e.g. {@code classpath:catalog/assessments.json} or {@code file:/data/x.json}
   * @return records in file order
   */
  public List<CatalogRecord> load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new CatalogLoadException("Catalog resource not found: " + location, null);
    }

    JsonNode root;
    try (InputStream in = resource.getInputStream()) {
      root = objectMapper.readTree(in);
    } catch (IOException e) {
      throw new CatalogLoadException("Failed to read catalog from " + location, e);
    }

    if (root == null || !root.isArray()) {
      throw new CatalogLoadException("Catalog must be a JSON array: " + location, null);
    }

    List<CatalogRecord> records = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();
    int skipped = 0;

    for (JsonNode node : root) {
      CatalogRecord record = toRecord(node);
      if (record == null) {
        skipped++;
        continue;
      }
      if (!seenIds.add(record.id())) {
        throw new InternalInconsistencyException("Duplicate catalog id: " + record.id());
      }
      records.add(record);
    }

    log.info("Loaded {} catalog records from {} ({} skipped)", records.size(), location, skipped);
    return List.copyOf(records);
  }

  private CatalogRecord toRecord(JsonNode node) {
    String name = text(node, "assessment_name");
    if (name == null) {
      name = text(node, "name");
    }
    String url = text(node, "url");
    if (name == null || url == null) {
      log.warn("Skipping catalog entry without name or url: {}", node);
      return null;
    }

    String id = text(node, "id");
    return CatalogRecord.builder()
        .id(id != null ? id : url)
        .name(name)
        .url(url)
        .description(text(node, "description"))
        .categories(categories(node))
        .durationMinutes(duration(node.get("duration")))
        .adaptiveSupport(flag(node.get("adaptive_support")))
        .remoteSupport(flag(node.get("remote_support")))
        .build();
  }

  private List<AssessmentCategory> categories(JsonNode node) {
    Set<AssessmentCategory> categories = new LinkedHashSet<>();
    String code = text(node, "test_type");
    if (code != null) {
      categories.add(AssessmentCategory.fromLabel(code));
    }
    JsonNode types = node.get("test_types");
    if (types != null && types.isArray()) {
      types.forEach(t -> categories.add(AssessmentCategory.fromLabel(t.asText())));
    }
    if (categories.isEmpty()) {
      String label = text(node, "test_type_full");
      if (label == null) {
        label = text(node, "category");
      }
      if (label != null) {
        categories.add(AssessmentCategory.fromLabel(label));
      }
    }
    return new ArrayList<>(categories);
  }

  /** Minutes from a number or the first integer in text such as "30-45 minutes"; else null. */
  private static Integer duration(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      if (node.canConvertToInt()) {
        return node.asInt();
      }
      log.warn("Ignoring out-of-range duration: {}", node);
      return null;
    }
    Matcher matcher = FIRST_INTEGER.matcher(node.asText());
    if (!matcher.find()) {
      return null;
    }
    try {
      return Integer.valueOf(matcher.group(1));
    } catch (NumberFormatException e) {
      log.warn("Ignoring out-of-range duration: {}", node.asText());
      return null;
    }
  }

  private static boolean flag(JsonNode node) {
    if (node == null || node.isNull()) {
      return false;
    }
    if (node.isBoolean()) {
      return node.asBoolean();
    }
    String value = node.asText().trim().toLowerCase(Locale.ROOT);
    return value.equals("yes") || value.equals("true") || value.equals("y");
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    String text = value.asText().trim();
    return text.isEmpty() ? null : text;
  }
}
