package com.flowrunner.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Item extraction and cursor-based deduplication of polled trigger outputs.
 * 
 * Polled items are ordered newest first. An idKey of the form {@code arrayPath[].itemIdPath}
 * selects the array at arrayPath (an empty arrayPath means the outputs are the array) and
 * reads each item's id at itemIdPath. A plain idKey treats the outputs as a single item,
 * or each element as an item when the outputs are an array.
 */
public final class TriggerItems {

    private static final String ARRAY_MARKER = "[]";

    private TriggerItems() {
    }

    /**
     * A polled item and its identity.
     */
    public record Item(String id, JsonNode data) {
        public Item withData(JsonNode data) {
            return new Item(id, data);
        }
    }

    /**
     * Extract identified items from an operation's outputs. Items without an id are skipped.
     */
    public static List<Item> extract(JsonNode outputs, String idKey) {
        if (outputs == null || outputs.isMissingNode() || outputs.isNull()) {
            return List.of();
        }

        int marker = idKey.indexOf(ARRAY_MARKER);
        JsonNode candidates;
        String itemIdPath;
        if (marker >= 0) {
            candidates = at(outputs, idKey.substring(0, marker));
            itemIdPath = stripLeadingDot(idKey.substring(marker + ARRAY_MARKER.length()));
        } else {
            candidates = outputs;
            itemIdPath = idKey;
        }

        List<Item> items = new ArrayList<>();
        if (candidates.isArray()) {
            for (JsonNode candidate : candidates) {
                addIfIdentified(items, candidate, itemIdPath);
            }
        } else if (marker < 0) {
            addIfIdentified(items, candidates, itemIdPath);
        }
        return items;
    }

    /**
     * Select the items not yet processed.
     * 
     * Without a cursor only the newest item is new. With a cursor found at position k,
     * the first k items are new. A cursor that is no longer in the list makes every item new.
     * 
     * @param items Polled items, newest first
     * @param lastId Id of the newest item processed so far, may be null
     * @return New items, newest first
     */
    public static List<Item> selectNew(List<Item> items, String lastId) {
        if (items.isEmpty()) {
            return List.of();
        }
        if (lastId == null || lastId.isEmpty()) {
            return List.of(items.get(0));
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id().equals(lastId)) {
                return List.copyOf(items.subList(0, i));
            }
        }
        return List.copyOf(items);
    }

    /**
     * Order new items oldest first, so they execute chronologically.
     */
    public static List<Item> chronological(List<Item> newestFirst) {
        List<Item> ordered = new ArrayList<>(newestFirst);
        Collections.reverse(ordered);
        return ordered;
    }

    private static void addIfIdentified(List<Item> items, JsonNode candidate, String itemIdPath) {
        JsonNode id = at(candidate, itemIdPath);
        if (id.isMissingNode() || id.isNull()) {
            return;
        }
        items.add(new Item(id.isValueNode() ? id.asText() : id.toString(), candidate));
    }

    private static JsonNode at(JsonNode node, String dottedPath) {
        JsonNode current = node;
        if (dottedPath == null || dottedPath.isEmpty()) {
            return current;
        }
        for (String segment : dottedPath.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            current = current.isArray() && segment.chars().allMatch(Character::isDigit)
                ? current.path(Integer.parseInt(segment))
                : current.path(segment);
        }
        return current;
    }

    private static String stripLeadingDot(String path) {
        return path.startsWith(".") ? path.substring(1) : path;
    }
}
