package com.nayem.strata.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.nayem.strata.model.Identified;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key-set diffs. Two values under the same key are modified iff they are not
 * structurally equal.
 */
public final class StructuralDiff {

    private StructuralDiff() {
    }

    /**
     * Diffs two entity lists keyed by id.
     */
    public static ChangeSet diffById(List<? extends Identified> before, List<? extends Identified> after) {
        return diff(index(before), index(after));
    }

    /**
     * Diffs the top-level fields of two JSON objects. A {@code null} side is
     * treated as an empty object.
     */
    public static ChangeSet diffKeys(JsonNode before, JsonNode after) {
        return diff(fields(before), fields(after));
    }

    private static <V> ChangeSet diff(Map<String, V> before, Map<String, V> after) {
        List<String> added = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, V> entry : after.entrySet()) {
            V previous = before.get(entry.getKey());
            if (previous == null) {
                added.add(entry.getKey());
            } else if (!previous.equals(entry.getValue())) {
                modified.add(entry.getKey());
            }
        }
        for (String key : before.keySet()) {
            if (!after.containsKey(key)) {
                removed.add(key);
            }
        }
        return ChangeSet.of(added, modified, removed);
    }

    private static Map<String, Identified> index(List<? extends Identified> entities) {
        Map<String, Identified> byId = new LinkedHashMap<>();
        for (Identified entity : entities) {
            byId.put(entity.id(), entity);
        }
        return byId;
    }

    private static Map<String, JsonNode> fields(JsonNode node) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> field = it.next();
                fields.put(field.getKey(), field.getValue());
            }
        }
        return fields;
    }
}
