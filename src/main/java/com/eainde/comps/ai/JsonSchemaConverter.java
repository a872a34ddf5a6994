package com.eainde.comps.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns plain JSON-Schema documents into LangChain4j {@link JsonSchema} response formats.
 *
 * <p>Supports the subset the two prompts need: object, array, string (with enum),
 * integer, number and boolean, plus {@code description} and {@code required}.</p>
 */
public final class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    /**
     * Loads a schema from the classpath, e.g. {@code schemas/extraction.json}.
     */
    public static JsonSchema fromClasspath(String name, String resource) {
        ClassLoader loader = JsonSchemaConverter.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + resource);
            }
            return toLangChainSchema(name, new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read schema resource " + resource, e);
        }
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        JsonNode rootNode;
        try {
            rootNode = objectMapper.readTree(jsonSchemaString);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema string", e);
        }
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(rootNode))
                .build();
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            return JsonStringSchema.builder().build();
        }

        return switch (node.get("type").asText()) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> parseString(node);
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder()
                .description(description(node));

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> required.add(n.asText()));
            builder.required(required);
        }
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder()
                .description(description(node));
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> values = new ArrayList<>();
            node.get("enum").forEach(n -> values.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(values)
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
