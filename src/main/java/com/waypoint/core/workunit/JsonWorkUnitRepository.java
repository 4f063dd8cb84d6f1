package com.waypoint.core.workunit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.waypoint.core.model.WorkUnit;
import com.waypoint.core.persistence.JsonDocuments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work unit repository backed by a single JSON document of the form
 * {@code {"workUnits": {"<id>": {...}}}}.
 * <p>
 * Saving is a read-modify-write of the whole document. Fields this class does not model,
 * both at the top level and inside a unit, are carried over untouched so other tools
 * sharing the document keep their data.
 */
public class JsonWorkUnitRepository implements WorkUnitRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonWorkUnitRepository.class);

    static final String WORK_UNITS_FIELD = "workUnits";

    // Fields owned by WorkUnit; anything else in a unit's object is preserved on save
    private static final List<String> MODELED_FIELDS = List.of(
            "id", "title", "type", "status", "stateHistory", "virtualHooks", "tags",
            "epic", "estimate", "blockedReason", "createdAt", "updatedAt");

    private final Path documentPath;
    private final ObjectMapper mapper;

    public JsonWorkUnitRepository(Path documentPath, ObjectMapper mapper) {
        this.documentPath = documentPath;
        this.mapper = mapper;
    }

    public JsonWorkUnitRepository(Path documentPath) {
        this(documentPath, JsonDocuments.newMapper());
    }

    @Override
    public Optional<WorkUnit> findById(String id) {
        JsonNode node = readDocument().path(WORK_UNITS_FIELD).get(id);
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        return Optional.of(toWorkUnit(id, node));
    }

    @Override
    public List<WorkUnit> findAll() {
        var result = new ArrayList<WorkUnit>();
        JsonNode units = readDocument().path(WORK_UNITS_FIELD);
        Iterator<Map.Entry<String, JsonNode>> fields = units.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (entry.getValue().isObject()) {
                result.add(toWorkUnit(entry.getKey(), entry.getValue()));
            }
        }
        return result;
    }

    @Override
    public void save(WorkUnit workUnit) {
        ObjectNode document = readDocument();
        ObjectNode units = document.has(WORK_UNITS_FIELD) && document.get(WORK_UNITS_FIELD).isObject()
                ? (ObjectNode) document.get(WORK_UNITS_FIELD)
                : document.putObject(WORK_UNITS_FIELD);

        ObjectNode merged = units.get(workUnit.id()) instanceof ObjectNode existing
                ? existing.deepCopy()
                : mapper.createObjectNode();
        // Modeled fields that are now null must disappear rather than keep stale values
        merged.remove(MODELED_FIELDS);
        merged.setAll((ObjectNode) mapper.valueToTree(workUnit));
        units.set(workUnit.id(), merged);

        try {
            JsonDocuments.writeAtomically(documentPath, mapper.writeValueAsBytes(document));
            log.debug("Saved work unit {} ({}) to {}", workUnit.id(), workUnit.status(), documentPath);
        } catch (IOException e) {
            throw new WorkUnitStoreException("Failed to write work units to " + documentPath, e);
        }
    }

    private WorkUnit toWorkUnit(String id, JsonNode node) {
        try {
            WorkUnit unit = mapper.treeToValue(node, WorkUnit.class);
            if (unit.id() == null) {
                ObjectNode withId = ((ObjectNode) node).deepCopy();
                withId.put("id", id);
                unit = mapper.treeToValue(withId, WorkUnit.class);
            }
            return unit;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WorkUnitStoreException("Work unit '" + id + "' in " + documentPath + " is malformed", e);
        }
    }

    private ObjectNode readDocument() {
        if (!Files.exists(documentPath)) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode root = mapper.readTree(documentPath.toFile());
            if (root == null || !root.isObject()) {
                return mapper.createObjectNode();
            }
            return (ObjectNode) root;
        } catch (IOException e) {
            throw new WorkUnitStoreException("Failed to read work units from " + documentPath, e);
        }
    }
}
