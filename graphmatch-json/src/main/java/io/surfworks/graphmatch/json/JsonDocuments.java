package io.surfworks.graphmatch.json;

import java.io.EOFException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.stream.MalformedJsonException;

/**
 * Parses the top-level object of a definition document.
 */
final class JsonDocuments {

    private static final Gson GSON = new Gson();

    private JsonDocuments() {}

    static JsonObject parse(Reader reader) {
        JsonObject root;
        try {
            root = GSON.fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw translate(e);
        }
        if (root == null) {
            throw new GraphDefinitionException("Empty document", "$");
        }
        return root;
    }

    static JsonObject parse(String json) {
        JsonObject root;
        try {
            root = GSON.fromJson(json, JsonObject.class);
        } catch (JsonParseException e) {
            throw translate(e);
        }
        if (root == null) {
            throw new GraphDefinitionException("Empty document", "$");
        }
        return root;
    }

    /*
     * Gson reports both syntax errors and failures of the underlying reader as
     * JsonParseException. Only the latter carry an IOException that is not a
     * parse error of its own.
     */
    private static RuntimeException translate(JsonParseException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException io
                && !(cause instanceof EOFException)
                && !(cause instanceof MalformedJsonException)) {
            return new UncheckedIOException("Failed to read JSON document", io);
        }
        return new GraphDefinitionException("Malformed JSON: " + e.getMessage(), e);
    }

    static JsonObject parse(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }
}
