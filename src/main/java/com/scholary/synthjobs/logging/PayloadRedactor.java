package com.scholary.synthjobs.logging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks sensitive fields in JSON payloads before they are logged.
 *
 * <p>Matching is on field names, at any depth. The input is never modified.
 */
public final class PayloadRedactor {

  public static final String REDACTED = "***REDACTED***";

  private static final List<Pattern> SENSITIVE_PATTERNS =
      List.of(
          Pattern.compile("password", Pattern.CASE_INSENSITIVE),
          Pattern.compile("token", Pattern.CASE_INSENSITIVE),
          Pattern.compile("secret", Pattern.CASE_INSENSITIVE),
          Pattern.compile("authorization", Pattern.CASE_INSENSITIVE),
          Pattern.compile("cookie", Pattern.CASE_INSENSITIVE),
          Pattern.compile("email", Pattern.CASE_INSENSITIVE),
          Pattern.compile("credit.*card", Pattern.CASE_INSENSITIVE),
          Pattern.compile("cvv", Pattern.CASE_INSENSITIVE),
          Pattern.compile("api[-_]?key", Pattern.CASE_INSENSITIVE),
          Pattern.compile("(first|last|full)[-_]?name", Pattern.CASE_INSENSITIVE),
          Pattern.compile("phone", Pattern.CASE_INSENSITIVE),
          Pattern.compile("ssn", Pattern.CASE_INSENSITIVE));

  private PayloadRedactor() {}

  public static JsonNode redact(JsonNode node) {
    if (node == null) {
      return null;
    }
    JsonNode copy = node.deepCopy();
    redactInPlace(copy);
    return copy;
  }

  public static boolean isSensitive(String fieldName) {
    return SENSITIVE_PATTERNS.stream().anyMatch(p -> p.matcher(fieldName).find());
  }

  private static void redactInPlace(JsonNode node) {
    if (node.isObject()) {
      ObjectNode object = (ObjectNode) node;
      List<String> names = new ArrayList<>();
      Iterator<String> it = object.fieldNames();
      it.forEachRemaining(names::add);
      for (String name : names) {
        if (isSensitive(name)) {
          object.set(name, TextNode.valueOf(REDACTED));
        } else {
          redactInPlace(object.get(name));
        }
      }
    } else if (node.isArray()) {
      ((ArrayNode) node).forEach(PayloadRedactor::redactInPlace);
    }
  }
}
