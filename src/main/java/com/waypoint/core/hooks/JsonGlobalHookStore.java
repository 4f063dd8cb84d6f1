package com.waypoint.core.hooks;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waypoint.core.model.HookDefinition;
import com.waypoint.core.persistence.JsonDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global hooks read from a JSON file shaped {@code {"hooks": {"<event>": [ {...}, ... ]}}}.
 * Entries do not repeat their event; it is taken from the enclosing key. The file is re-read
 * on every call, so edits made outside Waypoint are picked up immediately.
 */
public class JsonGlobalHookStore implements GlobalHookStore {

    private static final Logger log = LoggerFactory.getLogger(JsonGlobalHookStore.class);

    private final Path configFile;
    private final ObjectMapper mapper;

    public JsonGlobalHookStore(Path configFile, ObjectMapper mapper) {
        this.configFile = configFile;
        this.mapper = mapper;
    }

    public Path getConfigFile() {
        return configFile;
    }

    @Override
    public Map<String, List<HookDefinition>> all() {
        var result = new LinkedHashMap<String, List<HookDefinition>>();
        ObjectNode hooks = (ObjectNode) readDocument().path("hooks");
        Iterator<Map.Entry<String, JsonNode>> events = hooks.fields();
        while (events.hasNext()) {
            var entry = events.next();
            String event = HookEvents.requireValid(entry.getKey());
            if (!entry.getValue().isArray()) {
                throw new HookConfigurationException("Hooks for event '" + event + "' in " + configFile
                        + " must be an array");
            }
            var definitions = new ArrayList<HookDefinition>();
            for (JsonNode node : entry.getValue()) {
                definitions.add(toDefinition(node, event));
            }
            result.put(event, List.copyOf(definitions));
        }
        return result;
    }

    @Override
    public void add(HookDefinition hook) {
        String event = HookEvents.requireValid(hook.event());
        ObjectNode document = readDocument();
        ObjectNode hooks = (ObjectNode) document.get("hooks");
        ArrayNode list = hooks.has(event) ? (ArrayNode) hooks.get(event) : hooks.putArray(event);
        for (JsonNode existing : list) {
            if (hook.name().equals(existing.path("name").asText())) {
                throw new HookConfigurationException("Global hook '%s' already exists for %s"
                        .formatted(hook.name(), event));
            }
        }
        ObjectNode node = mapper.valueToTree(hook);
        node.remove("event");
        list.add(node);
        write(document);
        log.info("Added global hook '{}' for {}", hook.name(), event);
    }

    @Override
    public boolean remove(String event, String name) {
        ObjectNode document = readDocument();
        JsonNode list = document.path("hooks").path(event);
        if (!list.isArray()) {
            return false;
        }
        Iterator<JsonNode> it = list.elements();
        boolean removed = false;
        while (it.hasNext()) {
            if (name.equals(it.next().path("name").asText())) {
                it.remove();
                removed = true;
            }
        }
        if (removed) {
            if (list.isEmpty()) {
                ((ObjectNode) document.get("hooks")).remove(event);
            }
            write(document);
            log.info("Removed global hook '{}' from {}", name, event);
        }
        return removed;
    }

    private HookDefinition toDefinition(JsonNode node, String event) {
        try {
            HookDefinition hook = mapper.treeToValue(node, HookDefinition.class).withEvent(event);
            if (hook.name() == null || hook.command() == null) {
                throw new HookConfigurationException("Hook under '" + event + "' in " + configFile
                        + " needs both a name and a command");
            }
            return hook;
        } catch (IOException e) {
            throw new HookConfigurationException("Malformed hook under '" + event + "' in " + configFile, e);
        }
    }

    private ObjectNode readDocument() {
        ObjectNode document = mapper.createObjectNode();
        if (Files.exists(configFile)) {
            try {
                JsonNode root = mapper.readTree(configFile.toFile());
                if (root instanceof ObjectNode object) {
                    document = object;
                } else if (root != null && !root.isMissingNode()) {
                    throw new HookConfigurationException(configFile + " must contain a JSON object");
                }
            } catch (IOException e) {
                throw new HookConfigurationException("Cannot parse hook configuration " + configFile, e);
            }
        }
        if (!document.has("hooks")) {
            document.putObject("hooks");
        } else if (!document.get("hooks").isObject()) {
            throw new HookConfigurationException("\"hooks\" in " + configFile + " must be an object keyed by event");
        }
        return document;
    }

    private void write(ObjectNode document) {
        try {
            JsonDocuments.writeAtomically(configFile, mapper.writeValueAsBytes(document));
        } catch (IOException e) {
            throw new HookConfigurationException("Cannot write hook configuration " + configFile, e);
        }
    }
}
