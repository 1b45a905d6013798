package org.waabox.budman.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.budman.ConfigurationException;

/**
 * Static utility class that converts {@link ConfigurationRecord} instances
 * to and from JSON.
 *
 * <p>Uses Jackson's tree model so the stored layout is spelled out here and
 * does not depend on Java names. Property names are snake case. Reading
 * accepts comments and trailing commas, so hand edited {@code .jsonc}
 * files load as well, and ignores properties it does not know.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigurationRecordCodec {

  /** Shared mapper for tree model operations. */
  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
      .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
      .enable(SerializationFeature.INDENT_OUTPUT)
      .build();

  /** Private constructor to prevent instantiation. */
  private ConfigurationRecordCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a configuration record into pretty printed JSON.
   *
   * @param record the record to serialize, never null.
   * @return the JSON bytes, UTF-8 encoded, never null.
   */
  public static byte[] serialize(final ConfigurationRecord record) {
    Objects.requireNonNull(record, "record must not be null");

    final ObjectNode root = MAPPER.createObjectNode();
    putIfSet(root, "id", record.id());
    putIfSet(root, "root_folder", record.rootFolder());

    final ArrayNode institutions = root.putArray("institutions");
    for (final FinancialInstitutionRecord fi : record.institutions()) {
      final ObjectNode node = institutions.addObject();
      putIfSet(node, "key", fi.key());
      putIfSet(node, "name", fi.name());
      putIfSet(node, "type", fi.type());
      putIfSet(node, "folder", fi.folder());
      final ArrayNode workbooks = node.putArray("workbooks");
      for (final WorkbookRecord wb : fi.workbooks()) {
        final ObjectNode wbNode = workbooks.addObject();
        putIfSet(wbNode, "name", wb.name());
        putIfSet(wbNode, "url", wb.url());
        putIfSet(wbNode, "workflow", wb.workflow());
        putIfSet(wbNode, "purpose", wb.purpose());
        putIfSet(wbNode, "folder_role", wb.folderRole());
        putIfSet(wbNode, "folder", wb.folder());
        putIfSet(wbNode, "type", wb.type());
      }
    }

    final ArrayNode workflows = root.putArray("workflows");
    for (final WorkflowRecord wf : record.workflows()) {
      final ObjectNode node = workflows.addObject();
      putIfSet(node, "key", wf.key());
      putIfSet(node, "name", wf.name());
      putMap(node.putObject("folders"), wf.folders());
      putMap(node.putObject("purposes"), wf.purposes());
      putMap(node.putObject("prefixes"), wf.prefixes());
    }

    putMap(root.putObject("options"), record.options());

    final WorkingStateRecord state = record.workingState();
    final ObjectNode stateNode = root.putObject("working_state");
    putIfSet(stateNode, "fi_key", state.fiKey());
    putIfSet(stateNode, "wf_key", state.wfKey());
    putIfSet(stateNode, "purpose", state.purpose());
    putIfSet(stateNode, "workbook_id", state.workbookId());
    stateNode.put("all_workbooks", state.allWorkbooks());

    putIfSet(root, "created_date", record.createdDate());
    putIfSet(root, "last_modified_date", record.lastModifiedDate());
    putIfSet(root, "last_modified_by", record.lastModifiedBy());

    try {
      return MAPPER.writeValueAsBytes(root);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to serialize configuration record " + record.id(), e);
    }
  }

  /**
   * Deserializes JSON into a configuration record.
   *
   * @param json the JSON bytes, UTF-8 encoded, never null.
   * @return the record, never null.
   * @throws ConfigurationException if the JSON is malformed or is not an
   *     object.
   */
  public static ConfigurationRecord deserialize(final byte[] json) {
    Objects.requireNonNull(json, "json must not be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final IOException e) {
      throw new ConfigurationException(
          "Malformed configuration record: " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigurationException(
          "Configuration record must be a JSON object");
    }

    final List<FinancialInstitutionRecord> institutions = new ArrayList<>();
    for (final JsonNode node : root.path("institutions")) {
      final List<WorkbookRecord> workbooks = new ArrayList<>();
      for (final JsonNode wb : node.path("workbooks")) {
        workbooks.add(new WorkbookRecord(
            text(wb, "name"),
            text(wb, "url"),
            text(wb, "workflow"),
            text(wb, "purpose"),
            text(wb, "folder_role"),
            text(wb, "folder"),
            text(wb, "type")));
      }
      institutions.add(new FinancialInstitutionRecord(
          text(node, "key"),
          text(node, "name"),
          text(node, "type"),
          text(node, "folder"),
          workbooks));
    }

    final List<WorkflowRecord> workflows = new ArrayList<>();
    for (final JsonNode node : root.path("workflows")) {
      workflows.add(new WorkflowRecord(
          text(node, "key"),
          text(node, "name"),
          map(node.path("folders")),
          map(node.path("purposes")),
          map(node.path("prefixes"))));
    }

    final JsonNode state = root.path("working_state");
    final WorkingStateRecord workingState = new WorkingStateRecord(
        text(state, "fi_key"),
        text(state, "wf_key"),
        text(state, "purpose"),
        text(state, "workbook_id"),
        state.path("all_workbooks").asBoolean(false));

    return new ConfigurationRecord(
        text(root, "id"),
        text(root, "root_folder"),
        institutions,
        workflows,
        map(root.path("options")),
        workingState,
        text(root, "created_date"),
        text(root, "last_modified_date"),
        text(root, "last_modified_by"));
  }

  /** Puts a text field unless the value is null.
   *
   * @param node the target node.
   * @param field the field name.
   * @param value the value, may be null.
   */
  private static void putIfSet(final ObjectNode node, final String field,
      final String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  /** Copies a string map into an object node.
   *
   * @param node the target node.
   * @param values the values.
   */
  private static void putMap(final ObjectNode node,
      final Map<String, String> values) {
    for (final Map.Entry<String, String> entry : values.entrySet()) {
      putIfSet(node, entry.getKey(), entry.getValue());
    }
  }

  /** Returns a text field, or null when it is missing or null.
   *
   * @param node the parent node.
   * @param field the field name.
   * @return the text, may be null.
   */
  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  /** Reads an object node of scalar values into an ordered map.
   *
   * @param node the object node, may be missing.
   * @return the map, never null.
   */
  private static Map<String, String> map(final JsonNode node) {
    final Map<String, String> values = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().isNull()) {
        values.put(field.getKey(), field.getValue().asText());
      }
    }
    return values;
  }
}
