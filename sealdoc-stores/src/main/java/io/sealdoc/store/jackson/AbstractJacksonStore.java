/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.store.jackson;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.sealdoc.DocumentParseException;
import io.sealdoc.MetadataNotFoundException;
import io.sealdoc.SealdocException;
import io.sealdoc.UnsupportedValueException;
import io.sealdoc.metadata.Metadata;
import io.sealdoc.metadata.MetadataMapper;
import io.sealdoc.store.Store;
import io.sealdoc.tree.Comment;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.TreeBranch;
import io.sealdoc.tree.TreeItem;
import io.sealdoc.tree.TreeList;
import io.sealdoc.tree.TreeValue;
import io.sealdoc.tree.TreeValueVisitor;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * <p>A {@link Store} for any format Jackson reads into a tree of {@link JsonNode}s.</p>
 *
 * <p>Mappings keep the order of their keys. Values Jackson cannot hand over exactly, such as
 * binary data or integers wider than 64 bits, are refused rather than converted.</p>
 */
@ThreadSafe
public abstract class AbstractJacksonStore implements Store {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractJacksonStore.class);
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final MetadataMapper metadataMapper;

    protected AbstractJacksonStore(@NonNull ObjectMapper mapper, @NonNull MetadataMapper metadataMapper) {
        this.mapper = Objects.requireNonNull(mapper);
        this.metadataMapper = Objects.requireNonNull(metadataMapper);
    }

    /**
     * @return the name of the format, used in messages
     */
    protected abstract String formatName();

    @Override
    public TreeBranch unmarshal(byte[] document) {
        ObjectNode root = readRoot(document);
        var items = new ArrayList<TreeItem>(root.size());
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (Metadata.RESERVED_KEY.equals(field.getKey())) {
                continue;
            }
            items.add(TreeItem.of(field.getKey(), toValue(field.getValue(), field.getKey())));
        }
        return TreeBranch.of(items);
    }

    @Override
    public Metadata unmarshalMetadata(byte[] document) {
        JsonNode node = readRoot(document).get(Metadata.RESERVED_KEY);
        if (node == null || node.isNull()) {
            throw new MetadataNotFoundException("the " + formatName() + " document has no '" + Metadata.RESERVED_KEY + "' metadata and is not encrypted");
        }
        if (!node.isObject()) {
            throw new DocumentParseException("'" + Metadata.RESERVED_KEY + "' metadata must be a mapping");
        }
        Map<String, Object> map;
        try {
            map = mapper.convertValue(node, METADATA_TYPE);
        }
        catch (IllegalArgumentException e) {
            throw new DocumentParseException("'" + Metadata.RESERVED_KEY + "' metadata could not be read", e);
        }
        return metadataMapper.fromMap(map);
    }

    @Override
    public byte[] marshal(TreeBranch tree) {
        return write(toNode(tree));
    }

    @Override
    public byte[] marshalWithMetadata(TreeBranch tree, Metadata metadata) {
        ObjectNode root = (ObjectNode) toNode(tree);
        root.set(Metadata.RESERVED_KEY, mapper.valueToTree(metadataMapper.toMap(metadata)));
        return write(root);
    }

    @Override
    public byte[] marshalValue(TreeValue value) {
        if (value instanceof Scalar.StringValue s) {
            return s.value().getBytes(StandardCharsets.UTF_8);
        }
        return write(toNode(value));
    }

    private ObjectNode readRoot(byte[] document) {
        JsonNode root;
        try {
            root = mapper.readTree(document);
        }
        catch (IOException e) {
            throw new DocumentParseException("the " + formatName() + " document could not be parsed: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            LOGGER.debug("{} document is empty", formatName());
            return JsonNodeFactory.instance.objectNode();
        }
        if (!(root instanceof ObjectNode object)) {
            throw new DocumentParseException("the " + formatName() + " document must be a mapping at its top level, not " + root.getNodeType());
        }
        return object;
    }

    private static TreeValue toValue(JsonNode node, String key) {
        if (node.isObject()) {
            var items = new ArrayList<TreeItem>(node.size());
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                items.add(TreeItem.of(field.getKey(), toValue(field.getValue(), field.getKey())));
            }
            return TreeBranch.of(items);
        }
        if (node.isArray()) {
            var values = new ArrayList<TreeValue>(node.size());
            for (JsonNode element : node) {
                values.add(toValue(element, key));
            }
            return new TreeList(values);
        }
        if (node.isTextual()) {
            return Scalar.of(node.textValue());
        }
        if (node.isBoolean()) {
            return Scalar.of(node.booleanValue());
        }
        if (node.isNull()) {
            return Scalar.nullValue();
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new UnsupportedValueException("integer under '" + key + "' does not fit in 64 bits");
            }
            return Scalar.of(node.longValue());
        }
        if (node.isNumber()) {
            return Scalar.of(node.doubleValue());
        }
        throw new UnsupportedValueException("value under '" + key + "' has unsupported type " + node.getNodeType());
    }

    private static JsonNode toNode(TreeValue value) {
        return value.accept(NodeBuilder.INSTANCE);
    }

    private byte[] write(JsonNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        }
        catch (JsonProcessingException e) {
            throw new SealdocException("failed to write " + formatName() + " document", e);
        }
    }

    private static final class NodeBuilder implements TreeValueVisitor<JsonNode> {

        static final NodeBuilder INSTANCE = new NodeBuilder();

        private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

        @Override
        public JsonNode visitScalar(Scalar scalar) {
            if (scalar instanceof Scalar.StringValue s) {
                return NODES.textNode(s.value());
            }
            if (scalar instanceof Scalar.IntValue i) {
                return NODES.numberNode(i.value());
            }
            if (scalar instanceof Scalar.FloatValue f) {
                return NODES.numberNode(f.value());
            }
            if (scalar instanceof Scalar.BoolValue b) {
                return NODES.booleanNode(b.value());
            }
            return NODES.nullNode();
        }

        @Override
        public JsonNode visitBranch(TreeBranch branch) {
            ObjectNode object = NODES.objectNode();
            for (TreeItem item : branch.items()) {
                item.name().ifPresent(name -> object.set(name, item.value().accept(this)));
            }
            return object;
        }

        @Override
        public JsonNode visitList(TreeList list) {
            ArrayNode array = NODES.arrayNode(list.values().size());
            for (TreeValue value : list.values()) {
                if (!(value instanceof Comment)) {
                    array.add(value.accept(this));
                }
            }
            return array;
        }

        @Override
        public JsonNode visitComment(Comment comment) {
            return NODES.missingNode();
        }
    }
}
