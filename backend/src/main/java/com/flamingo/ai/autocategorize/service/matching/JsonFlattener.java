package com.flamingo.ai.autocategorize.service.matching;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.autocategorize.domain.model.FlattenedEntry;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Flattens a JSON tree into path/value entries.
 *
 * <p>Object keys are joined with dots and array elements are addressed as {@code path[i]}, so
 * {@code {"a":{"b":[1,{"c":2}]}}} yields {@code a.b[0] = 1} and {@code a.b[1].c = 2}. Only scalar
 * leaves (including null) become entries; empty objects and arrays contribute nothing.
 */
@Component
public class JsonFlattener {

  public List<FlattenedEntry> flatten(JsonNode root) {
    List<FlattenedEntry> entries = new ArrayList<>();
    if (root != null) {
      flatten(root, "", entries);
    }
    return entries;
  }

  private void flatten(JsonNode node, String path, List<FlattenedEntry> entries) {
    if (node.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        String childPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
        flatten(field.getValue(), childPath, entries);
      }
    } else if (node.isArray()) {
      for (int i = 0; i < node.size(); i++) {
        flatten(node.get(i), path + "[" + i + "]", entries);
      }
    } else if (!path.isEmpty()) {
      entries.add(new FlattenedEntry(path, node));
    }
  }
}
