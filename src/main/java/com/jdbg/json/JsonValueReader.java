package com.jdbg.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;

/**
 * Reads a JSON document into plain values: {@code MutableMap}, {@code MutableList},
 * {@code String}, {@code Long} (or {@code BigInteger} past its range), {@code Double},
 * {@code Boolean} and {@code null}.
 * Object keys keep their document order.
 */
public class JsonValueReader {
    // The caller owns the stream
    private final JsonFactory factory = JsonFactory.builder()
        .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
        .build();

    public Object read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Empty JSON document");
            }
            return readValue(parser, token);
        }
    }

    private Object readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                ? parser.getBigIntegerValue()
                : (Object) parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private MutableMap<String, Object> readObject(JsonParser parser) throws IOException {
        MutableMap<String, Object> fields = MapAdapter.adapt(new LinkedHashMap<>());

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, readValue(parser, parser.nextToken()));
        }

        return fields;
    }

    private MutableList<Object> readArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }

        return elements;
    }
}
