package com.twbconvert.pbip.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.Objects;

/** One staged document: TMDL text or a JSON tree, addressed by its path relative to the project root. */
public final class Artifact {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public enum Kind {
        TMDL,
        JSON
    }

    private final String path;
    private final Kind kind;
    private final String text;
    private final JsonNode json;

    private Artifact(String path, Kind kind, String text, JsonNode json) {
        this.path = Objects.requireNonNull(path, "path");
        this.kind = kind;
        this.text = text;
        this.json = json;
    }

    public static Artifact tmdl(String path, String text) {
        return new Artifact(path, Kind.TMDL, Objects.requireNonNull(text, "text"), null);
    }

    public static Artifact json(String path, JsonNode json) {
        return new Artifact(path, Kind.JSON, null, Objects.requireNonNull(json, "json").deepCopy());
    }

    public String getPath() {
        return path;
    }

    public Kind getKind() {
        return kind;
    }

    /** A copy of the JSON tree; {@code null} for TMDL documents. */
    public JsonNode getJson() {
        return json == null ? null : json.deepCopy();
    }

    /** Serialized document. JSON is pretty-printed with LF line endings so equal trees give equal bytes. */
    public String getContent() {
        if (kind == Kind.TMDL) {
            return text;
        }
        try {
            return JSON_WRITER.writeValueAsString(json).replace("\r\n", "\n") + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + path, e);
        }
    }
}
