package io.spekcheck.core.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.spekcheck.core.error.SetupParseException;
import io.spekcheck.core.model.FilterPosition;
import io.spekcheck.core.model.Mode;
import io.spekcheck.core.model.SetupDescription;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a {@link SetupDescription}, used to save and share setups:
 *
 * <pre>
 * {"detector":null,"dye":"alexa-488","excitation":"xcite-120",
 *  "exPath":[{"filter":"ff01-482","mode":"t"}],"emPath":[{"filter":"ff01-525","mode":"t"}]}
 * </pre>
 *
 * <p>
 * Thread-safe.
 */
public final class SetupDescriptionCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SetupDescriptionCodec() {}

    public static String encode(SetupDescription description) {
        try {
            return MAPPER.writeValueAsString(toTree(description));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize setup description", e);
        }
    }

    public static ObjectNode toTree(SetupDescription description) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("detector", description.detector());
        node.put("dye", description.dye());
        node.put("excitation", description.excitation());
        node.set("exPath", pathToTree(description.exPath()));
        node.set("emPath", pathToTree(description.emPath()));
        return node;
    }

    /**
     * @param json   encoded description
     * @param source name reported in errors, e.g. the setup uid or file name
     * @throws SetupParseException if the JSON is malformed or the description is invalid
     */
    public static SetupDescription decode(String json, String source) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SetupParseException("Invalid setup JSON: " + e.getOriginalMessage(), e, null, source);
        }
        return fromTree(root, source);
    }

    public static SetupDescription fromTree(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new SetupParseException("Setup description must be a JSON object", null, source);
        }
        SetupDescription description = new SetupDescription(
                text(root, "detector"),
                text(root, "dye"),
                text(root, "excitation"),
                pathFromTree(root.get("exPath"), "exPath", source),
                pathFromTree(root.get("emPath"), "emPath", source));
        String error = description.validate();
        if (error != null) {
            throw new SetupParseException("Invalid setup description: " + error, null, source);
        }
        return description;
    }

    private static ArrayNode pathToTree(List<FilterPosition> path) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (FilterPosition position : path) {
            ObjectNode element = array.addObject();
            element.put("filter", position.filter());
            element.put("mode", position.mode().code());
        }
        return array;
    }

    private static List<FilterPosition> pathFromTree(JsonNode node, String name, String source) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new SetupParseException("'" + name + "' must be an array", null, source);
        }
        List<FilterPosition> path = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            String filter = text(element, "filter");
            String code = text(element, "mode");
            Mode mode;
            try {
                mode = Mode.fromCode(code);
            } catch (IllegalArgumentException e) {
                throw new SetupParseException(
                        "mode of '" + filter + "' in " + name + " must be r or t", e, null, source);
            }
            path.add(new FilterPosition(filter, mode));
        }
        return path;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
