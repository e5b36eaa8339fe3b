package com.platform.updater.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.platform.updater.error.PayloadException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns JSON or YAML documents into {@link Manifest}s.
 * Only validates what the engine relies on: apiVersion, kind and metadata.name.
 */
public class ManifestParser {
    
    private final ObjectMapper jsonMapper;
    private final YAMLMapper yamlMapper;
    
    public ManifestParser() {
        this(new ObjectMapper());
    }
    
    public ManifestParser(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = new YAMLMapper();
    }
    
    /**
     * Parse a single JSON document.
     */
    public Manifest parseJson(String json) {
        try {
            return fromTree(jsonMapper.readTree(json), "<inline>");
        } catch (JsonProcessingException e) {
            throw PayloadException.invalidManifest("<inline>", e.getOriginalMessage());
        }
    }
    
    /**
     * Parse every document of a (possibly multi-document) YAML or JSON stream, in order.
     * Empty documents are skipped.
     */
    public List<Manifest> parseDocuments(InputStream input, String source) {
        List<Manifest> manifests = new ArrayList<>();
        try (MappingIterator<JsonNode> documents = yamlMapper.readerFor(JsonNode.class).readValues(input)) {
            while (documents.hasNextValue()) {
                JsonNode document = documents.nextValue();
                if (isBlankDocument(document)) {
                    continue;
                }
                manifests.add(fromTree(document, source));
            }
        } catch (JsonProcessingException e) {
            throw PayloadException.invalidManifest(source, e.getOriginalMessage());
        } catch (IOException e) {
            throw PayloadException.unreadable(source, e);
        }
        return manifests;
    }
    
    /**
     * Build a manifest from an already-parsed object tree.
     */
    public Manifest fromTree(JsonNode tree, String source) {
        if (!(tree instanceof ObjectNode)) {
            throw PayloadException.invalidManifest(source, "document is not an object");
        }
        ObjectNode body = (ObjectNode) tree;
        
        String apiVersion = requireText(body, "apiVersion", source);
        String kind = requireText(body, "kind", source);
        JsonNode metadata = body.path("metadata");
        String name = metadata.path("name").asText("");
        if (name.isBlank()) {
            throw PayloadException.invalidManifest(source, "metadata.name is required for " + kind);
        }
        
        ResourceKind resourceKind;
        try {
            resourceKind = ResourceKind.of(apiVersion, kind);
        } catch (IllegalArgumentException e) {
            throw PayloadException.invalidManifest(source, e.getMessage());
        }
        
        return new Manifest(
            resourceKind,
            metadata.path("namespace").asText(""),
            name,
            body,
            readAnnotations(metadata.path("annotations"))
        );
    }
    
    /**
     * Empty YAML documents ({@code ---} with nothing after it) and empty objects carry no manifest.
     * Any other non-object document is left to {@link #fromTree} to reject.
     */
    private static boolean isBlankDocument(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return true;
        }
        return document.isObject() && document.isEmpty();
    }
    
    private static String requireText(ObjectNode body, String field, String source) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw PayloadException.invalidManifest(source, field + " is required");
        }
        return value.asText();
    }
    
    private static Map<String, String> readAnnotations(JsonNode annotations) {
        Map<String, String> result = new LinkedHashMap<>();
        if (!annotations.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = annotations.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), field.getValue().asText());
        }
        return result;
    }
}
