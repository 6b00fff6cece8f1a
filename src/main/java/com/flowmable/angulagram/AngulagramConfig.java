package com.flowmable.angulagram;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Complete run configuration: scan geometry plus separation-zone extraction.
 * <p>
 * Stored as JSON. A document may name any subset of fields; the rest keep their
 * {@link #DEFAULT} values, e.g.
 * <pre>{@code
 * { "scan": { "angleStep": 0.5, "mapping": "FORWARD" },
 *   "zone": { "inletX": 812, "inletY": 1460, "mirror": true } }
 * }</pre>
 */
public record AngulagramConfig(ScanSettings scan, ZoneSettings zone) {

    public static final AngulagramConfig DEFAULT = new AngulagramConfig(ScanSettings.DEFAULT, ZoneSettings.DEFAULT);

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeSpecialFloatingPointValues()
            .create();

    public static AngulagramConfig load(Path file) throws IOException {
        return fromJson(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws IOException if the document is not a JSON object or a field has the wrong type
     */
    public static AngulagramConfig fromJson(String json) throws IOException {
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new IOException("Configuration must be a JSON object");
            }
            JsonObject merged = GSON.toJsonTree(DEFAULT).getAsJsonObject();
            merge(merged, parsed.getAsJsonObject());
            AngulagramConfig config = GSON.fromJson(merged, AngulagramConfig.class);
            if (config.scan().originPlacement() == null || config.scan().angleReference() == null
                    || config.scan().mapping() == null || config.scan().forwardIndexing() == null
                    || config.scan().polarity() == null) {
                throw new IOException("Unknown enum value in configuration");
            }
            return config;
        } catch (JsonParseException | NumberFormatException e) {
            throw new IOException("Malformed configuration: " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void save(Path file) throws IOException {
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
    }

    public AngulagramConfig withScan(ScanSettings scan) {
        return new AngulagramConfig(scan, zone);
    }

    public AngulagramConfig withZone(ZoneSettings zone) {
        return new AngulagramConfig(scan, zone);
    }

    private static void merge(JsonObject target, JsonObject overrides) {
        for (Map.Entry<String, JsonElement> e : overrides.entrySet()) {
            JsonElement current = target.get(e.getKey());
            if (current != null && current.isJsonObject() && e.getValue().isJsonObject()) {
                merge(current.getAsJsonObject(), e.getValue().getAsJsonObject());
            } else {
                target.add(e.getKey(), e.getValue());
            }
        }
    }
}
