package com.eainde.comps.ai;

import com.google.genai.types.Schema;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LangChain4j schema elements → Gen AI {@link Schema} for {@code responseSchema}.
 *
 * <pre>
 *   JsonObjectSchema  → OBJECT  (properties, required)
 *   JsonArraySchema   → ARRAY   (items)
 *   JsonEnumSchema    → STRING  (format "enum", enum values)
 *   JsonStringSchema  → STRING
 *   JsonIntegerSchema → INTEGER
 *   JsonNumberSchema  → NUMBER
 *   JsonBooleanSchema → BOOLEAN
 * </pre>
 */
final class GeminiSchemaMapper {

    private GeminiSchemaMapper() {
    }

    static Schema toGeminiSchema(JsonSchemaElement element) {
        if (element == null) {
            return null;
        }

        if (element instanceof JsonObjectSchema object) {
            Map<String, Schema> properties = new LinkedHashMap<>();
            if (object.properties() != null) {
                object.properties().forEach((key, value) -> properties.put(key, toGeminiSchema(value)));
            }
            Schema.Builder builder = typed("OBJECT", object.description()).properties(properties);
            if (object.required() != null && !object.required().isEmpty()) {
                builder.required(object.required());
            }
            return builder.build();
        }
        if (element instanceof JsonArraySchema array) {
            Schema.Builder builder = typed("ARRAY", array.description());
            if (array.items() != null) {
                builder.items(toGeminiSchema(array.items()));
            }
            return builder.build();
        }
        if (element instanceof JsonEnumSchema enumeration) {
            return typed("STRING", enumeration.description())
                    .format("enum")
                    .enum_(enumeration.enumValues())
                    .build();
        }
        if (element instanceof JsonStringSchema string) {
            return typed("STRING", string.description()).build();
        }
        if (element instanceof JsonIntegerSchema integer) {
            return typed("INTEGER", integer.description()).build();
        }
        if (element instanceof JsonNumberSchema number) {
            return typed("NUMBER", number.description()).build();
        }
        if (element instanceof JsonBooleanSchema bool) {
            return typed("BOOLEAN", bool.description()).build();
        }
        throw new IllegalArgumentException("Unsupported schema element: " + element.getClass().getSimpleName());
    }

    private static Schema.Builder typed(String type, String description) {
        Schema.Builder builder = Schema.builder().type(type);
        if (description != null) {
            builder.description(description);
        }
        return builder;
    }
}
