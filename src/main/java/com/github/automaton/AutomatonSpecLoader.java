package com.github.automaton;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.automaton.AutomatonException.Code;

/**
 * Reads an {@link AutomatonSpec} from a JSON document of the shape:
 *
 * <pre>
 * {
 *   "alphabet": ["a", "b"],
 *   "states": ["s1", "s2", "s3"],
 *   "initialState": "s1",
 *   "finalStates": ["s3"],
 *   "transitions": [["s1", "s2", "a"], ["s2", "s3", "b"]]
 * }
 * </pre>
 *
 * No validation happens here. JSON values keep their natural Java type (numbers, booleans, lists,
 * maps) so the validator can report them, and absent keys leave the field unset.
 */
public final class AutomatonSpecLoader {
  private static final Logger logger =
      LogManager.getLogger(AutomatonSpecLoader.class.getSimpleName());

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static AutomatonSpec load(final String json) throws AutomatonException {
    try {
      return fromTree(OBJECT_MAPPER.readTree(json));
    } catch (IOException exception) {
      throw new AutomatonException(Code.SPEC_LOAD_FAILURE,
          "Failed to parse automaton spec: " + exception.getMessage(), exception);
    }
  }

  public static AutomatonSpec load(final Reader reader) throws AutomatonException {
    try {
      return fromTree(OBJECT_MAPPER.readTree(reader));
    } catch (IOException exception) {
      throw new AutomatonException(Code.SPEC_LOAD_FAILURE,
          "Failed to parse automaton spec: " + exception.getMessage(), exception);
    }
  }

  public static AutomatonSpec load(final InputStream stream) throws AutomatonException {
    try {
      return fromTree(OBJECT_MAPPER.readTree(stream));
    } catch (IOException exception) {
      throw new AutomatonException(Code.SPEC_LOAD_FAILURE,
          "Failed to parse automaton spec: " + exception.getMessage(), exception);
    }
  }

  public static AutomatonSpec load(final Path path) throws AutomatonException {
    logger.info("Loading automaton spec from " + path);
    try (InputStream stream = Files.newInputStream(path)) {
      return load(stream);
    } catch (IOException exception) {
      throw new AutomatonException(Code.SPEC_LOAD_FAILURE,
          "Failed to read automaton spec from " + path, exception);
    }
  }

  private static AutomatonSpec fromTree(final JsonNode root) throws AutomatonException {
    if (root == null || root.isMissingNode() || root.isNull()) {
      throw new AutomatonException(Code.MISSING_FIELD, "automaton spec is not defined");
    }
    if (!root.isObject()) {
      throw new AutomatonException(Code.SPEC_LOAD_FAILURE,
          "automaton spec must be a JSON object, but got " + root.getNodeType());
    }
    return AutomatonSpec.AutomatonSpecBuilder.newBuilder()
        .alphabet(list(root, "alphabet"))
        .states(list(root, "states"))
        .initialState(toJava(root.get("initialState")))
        .finalStates(list(root, "finalStates"))
        .transitions(list(root, "transitions"))
        .build();
  }

  private static List<?> list(final JsonNode root, final String field) throws AutomatonException {
    final JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isArray()) {
      throw new AutomatonException(Code.SPEC_LOAD_FAILURE,
          "automaton spec property " + field + " must be an array, but got "
              + node.getNodeType());
    }
    return (List<?>) toJava(node);
  }

  private static Object toJava(final JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isTextual()) {
      return node.asText();
    }
    if (node.isNumber()) {
      return node.numberValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isArray()) {
      final List<Object> values = new ArrayList<>(node.size());
      for (final JsonNode element : node) {
        values.add(toJava(element));
      }
      return values;
    }
    final Map<String, Object> values = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> entry = fields.next();
      values.put(entry.getKey(), toJava(entry.getValue()));
    }
    return values;
  }

  private AutomatonSpecLoader() {}
}
