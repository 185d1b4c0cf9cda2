package com.signallint.plugins.react.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Converts the parser bridge's ESTree JSON into a typed {@link JsNode} tree.
 * Only the slots a {@link NodeKind} declares are read; any other property is ignored.
 * A {@code type} outside the closed node-kind set is rejected.
 */
public class EstreeReader {
    private static final int MAX_NESTING_DEPTH = 50_000;

    private final ObjectMapper mapper;

    public EstreeReader() {
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .build())
                .build();
        this.mapper = new ObjectMapper(factory);
    }

    /**
     * Parses the bridge envelope without converting the tree.
     */
    public JsonNode readEnvelope(String json) throws EstreeReadException {
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EstreeReadException("Malformed parser output: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds the typed tree for a {@code Program} JSON object.
     */
    public JsNode toTree(JsonNode program, LineIndex lineIndex) throws EstreeReadException {
        JsNode root = _convert(program, lineIndex);
        if (root == null || root.kind() != NodeKind.PROGRAM) {
            throw new EstreeReadException("Parser output does not start with a Program node");
        }
        return root;
    }

    private JsNode _convert(JsonNode json, LineIndex lineIndex) throws EstreeReadException {
        if (json == null || json.isNull() || json.isMissingNode()) {
            return null;
        }
        if (!json.isObject()) {
            throw new EstreeReadException("Expected a node object but found: " + json.getNodeType());
        }

        String typeName = json.path("type").asText("");
        NodeKind kind = NodeKind.fromTypeName(typeName);
        int start = json.path("start").asInt(0);
        int end = Math.max(start, json.path("end").asInt(start));
        if (kind == null) {
            throw new EstreeReadException("Unsupported node type '" + typeName + "' at line "
                    + lineIndex.lineOf(start) + ", column " + (lineIndex.columnOf(start) + 1));
        }

        JsonNode loc = json.path("loc");
        SourceRange range = loc.isObject()
                ? new SourceRange(start, end, loc.path("line").asInt(lineIndex.lineOf(start)),
                        loc.path("column").asInt(lineIndex.columnOf(start)))
                : lineIndex.range(start, end);

        Set<Flag> flags = EnumSet.noneOf(Flag.class);
        for (Flag flag : Flag.values()) {
            JsonNode value = json.path(flag.getJsonKey());
            boolean set = flag == Flag.TYPE_ONLY
                    ? "type".equals(value.asText()) || "typeof".equals(value.asText())
                    : value.asBoolean(false);
            if (set) {
                flags.add(flag);
            }
        }

        JsNode node = new JsNode(kind, range, flags,
                _nameOf(kind, json),
                _textOrNull(json.get("operator")),
                _rawOf(kind, json),
                _stringValueOf(kind, json),
                _textOrNull(json.get("kind")));

        for (Slot slot : kind.getSlots()) {
            JsonNode value = json.get(slot.getField().getJsonKey());
            if (slot.isMany()) {
                List<JsNode> children = new ArrayList<>();
                if (value != null && value.isArray()) {
                    for (JsonNode element : value) {
                        children.add(_convert(element, lineIndex));
                    }
                }
                node.setList(slot.getField(), children);
            } else if (value != null && value.isObject()) {
                node.setSingle(slot.getField(), _convert(value, lineIndex));
            }
        }
        node.seal();
        return node;
    }

    private static String _nameOf(NodeKind kind, JsonNode json) {
        if (kind == NodeKind.IDENTIFIER || kind == NodeKind.PRIVATE_IDENTIFIER || kind == NodeKind.JSX_IDENTIFIER) {
            return json.path("name").asText("");
        }
        return null;
    }

    private static String _rawOf(NodeKind kind, JsonNode json) {
        if (kind == NodeKind.LITERAL) {
            return _textOrNull(json.get("raw"));
        }
        if (kind == NodeKind.TEMPLATE_ELEMENT) {
            return _textOrNull(json.path("value").get("raw"));
        }
        return null;
    }

    private static String _stringValueOf(NodeKind kind, JsonNode json) {
        switch (kind) {
            case LITERAL: {
                JsonNode value = json.get("value");
                return value != null && value.isTextual() ? value.asText() : null;
            }
            case JSX_TEXT:
                return _textOrNull(json.get("value"));
            case TEMPLATE_ELEMENT:
                return _textOrNull(json.path("value").get("cooked"));
            default:
                return null;
        }
    }

    private static String _textOrNull(JsonNode value) {
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
