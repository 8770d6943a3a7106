package com.charter.core.edit;

import com.charter.core.logging.MdcContext;
import com.charter.core.model.AcceptanceCriterion;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.Alternative;
import com.charter.core.model.AlternativeStatus;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.ChecklistStatus;
import com.charter.core.model.Clause;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.SemanticVersion;
import com.charter.core.model.WorkItem;
import com.charter.core.store.ArtifactStore;
import com.charter.core.store.GovernanceJson;
import com.charter.core.validation.AmendmentPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Field-level edits of stored artifacts: replace a scalar, append to or remove from
 * a list, tick checklist entries.
 * <p>
 * Lifecycle fields ({@code status}, {@code phase}, {@code superseded_by}) are not
 * editable here; they change through the lifecycle operations only. Every rejected
 * request throws {@link EditRejectedException} and leaves the store untouched.
 */
@Service
public class ArtifactEditor {

    private static final Logger log = LoggerFactory.getLogger(ArtifactEditor.class);

    enum FieldType { TEXT, VERSION, TEXT_LIST, REF_LIST, CRITERIA, ALTERNATIVES }

    private static final Map<ArtifactKind, Map<String, FieldType>> FIELDS = Map.of(
            ArtifactKind.RFC, Map.of(
                    "title", FieldType.TEXT,
                    "version", FieldType.VERSION,
                    "owners", FieldType.TEXT_LIST),
            ArtifactKind.CLAUSE, Map.of(
                    "title", FieldType.TEXT,
                    "text", FieldType.TEXT,
                    "kind", FieldType.TEXT,
                    "since", FieldType.VERSION),
            ArtifactKind.ADR, Map.ofEntries(
                    Map.entry("title", FieldType.TEXT),
                    Map.entry("date", FieldType.TEXT),
                    Map.entry("context", FieldType.TEXT),
                    Map.entry("decision", FieldType.TEXT),
                    Map.entry("consequences", FieldType.TEXT),
                    Map.entry("refs", FieldType.REF_LIST),
                    Map.entry("alternatives", FieldType.ALTERNATIVES),
                    Map.entry("alternatives[].text", FieldType.TEXT),
                    Map.entry("alternatives[].pros", FieldType.TEXT_LIST),
                    Map.entry("alternatives[].cons", FieldType.TEXT_LIST),
                    Map.entry("alternatives[].rejection_reason", FieldType.TEXT)),
            ArtifactKind.WORK_ITEM, Map.of(
                    "title", FieldType.TEXT,
                    "description", FieldType.TEXT,
                    "notes", FieldType.TEXT_LIST,
                    "acceptance_criteria", FieldType.CRITERIA,
                    "refs", FieldType.REF_LIST)
    );

    private final ArtifactStore store;
    private final Clock clock;
    private final ObjectMapper mapper = GovernanceJson.mapper();

    public ArtifactEditor(ArtifactStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /** Replaces a scalar field. */
    public void setField(String artifactId, String field, String value) {
        MdcContext.setArtifact(artifactId, "edit");
        try {
            GovernanceIndex index = store.loadIndex();
            FieldPath path = FieldPath.parse(artifactId, field);
            Target target = open(index, artifactId, path);
            FieldType type = fieldType(target, path);
            if (type != FieldType.TEXT && type != FieldType.VERSION) {
                throw new EditRejectedException(artifactId, path + " is a list; add or remove entries instead");
            }
            if (value == null || value.isBlank()) {
                throw new EditRejectedException(artifactId, path + " cannot be blank");
            }
            if (type == FieldType.VERSION && !SemanticVersion.isValid(value)) {
                throw new EditRejectedException(artifactId, "'" + value + "' is not a semantic version");
            }
            container(target, path).put(key(path), value);
            commit(index, target);
            log.info("Set {} on {}", path, artifactId);
        } finally {
            MdcContext.clear();
        }
    }

    /** Appends an entry to a list field. Criteria take their category from a text prefix. */
    public void addToField(String artifactId, String field, String value) {
        MdcContext.setArtifact(artifactId, "edit");
        try {
            GovernanceIndex index = store.loadIndex();
            FieldPath path = FieldPath.parse(artifactId, field);
            Target target = open(index, artifactId, path);
            FieldType type = fieldType(target, path);
            if (value == null || value.isBlank()) {
                throw new EditRejectedException(artifactId, "cannot add a blank entry to " + path);
            }
            ArrayNode list = list(target, path, type);
            switch (type) {
                case TEXT_LIST -> list.add(value);
                case REF_LIST -> {
                    if (!index.contains(value)) {
                        throw new EditRejectedException(artifactId, "unknown artifact " + value);
                    }
                    if (entries(list, type).contains(List.of(value))) {
                        throw new EditRejectedException(artifactId, value + " is already referenced");
                    }
                    list.add(value);
                }
                case CRITERIA -> list.add(mapper.<JsonNode>valueToTree(AcceptanceCriterion.pending(value)));
                case ALTERNATIVES -> list.add(mapper.<JsonNode>valueToTree(Alternative.considered(value)));
                default -> throw new IllegalStateException("not a list: " + type);
            }
            commit(index, target);
            log.info("Added to {} on {}", path, artifactId);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Removes the entries selected by {@code pattern} from a list field.
     *
     * @return number of entries removed
     */
    public int removeFromField(String artifactId, String field, String pattern, MatchOptions options) {
        MdcContext.setArtifact(artifactId, "edit");
        try {
            GovernanceIndex index = store.loadIndex();
            FieldPath path = FieldPath.parse(artifactId, field);
            Target target = open(index, artifactId, path);
            FieldType type = fieldType(target, path);
            ArrayNode list = list(target, path, type);
            List<Integer> selected = options.selectAny(artifactId, entries(list, type), pattern);
            for (int i = selected.size() - 1; i >= 0; i--) {
                list.remove(selected.get(i).intValue());
            }
            commit(index, target);
            log.info("Removed {} entries from {} on {}", selected.size(), path, artifactId);
            return selected.size();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Sets the status of checklist entries: acceptance criteria of a work item, or
     * alternatives of an ADR (done accepts, pending reconsiders, cancelled rejects).
     *
     * @return number of entries ticked
     */
    public int tick(String artifactId, String field, String pattern, MatchOptions options, ChecklistStatus status) {
        MdcContext.setArtifact(artifactId, "tick");
        try {
            GovernanceIndex index = store.loadIndex();
            FieldPath path = FieldPath.parse(artifactId, field);
            Target target = open(index, artifactId, path);
            FieldType type = fieldType(target, path);
            if (type != FieldType.CRITERIA && type != FieldType.ALTERNATIVES) {
                throw new EditRejectedException(artifactId, path + " has no checklist entries");
            }
            ArrayNode list = list(target, path, type);
            List<Integer> selected = options.selectAny(artifactId, entries(list, type), pattern);
            String statusId = type == FieldType.CRITERIA ? status.id() : alternativeStatus(status).id();
            for (int i : selected) {
                ((ObjectNode) list.get(i)).put("status", statusId);
            }
            commit(index, target);
            log.info("Ticked {} entries of {} on {} as {}", selected.size(), path, artifactId, statusId);
            return selected.size();
        } finally {
            MdcContext.clear();
        }
    }

    static AlternativeStatus alternativeStatus(ChecklistStatus status) {
        return switch (status) {
            case DONE -> AlternativeStatus.ACCEPTED;
            case PENDING -> AlternativeStatus.CONSIDERED;
            case CANCELLED -> AlternativeStatus.REJECTED;
        };
    }

    // ── Target resolution ────────────────────────────────────────

    /** The artifact being edited, as a mutable JSON tree. */
    private record Target(ArtifactKind kind, String id, ObjectNode tree, RfcDocument document) {}

    private Target open(GovernanceIndex index, String artifactId, FieldPath path) {
        ArtifactKind kind = ArtifactKind.ofId(artifactId);
        if (kind == null) {
            throw new EditRejectedException(artifactId, "not an artifact id");
        }
        Optional<String> lock;
        ObjectNode tree;
        RfcDocument document = null;
        switch (kind) {
            case RFC -> {
                document = index.rfc(artifactId).orElseThrow(() -> notFound(artifactId));
                lock = AmendmentPolicy.rfcLock(document.rfc());
                tree = mapper.valueToTree(document.rfc());
            }
            case CLAUSE -> {
                int separator = artifactId.indexOf(ArtifactKind.CLAUSE_SEPARATOR);
                document = index.rfc(artifactId.substring(0, separator)).orElseThrow(() -> notFound(artifactId));
                Clause clause = document.clause(artifactId.substring(separator + 1))
                        .orElseThrow(() -> notFound(artifactId));
                lock = AmendmentPolicy.clauseLock(document.rfc(), clause);
                tree = mapper.valueToTree(clause);
            }
            case ADR -> {
                Adr adr = index.adr(artifactId).orElseThrow(() -> notFound(artifactId));
                lock = adr.status() == AdrStatus.SUPERSEDED || adr.status() == AdrStatus.REJECTED
                        ? Optional.of("ADR is " + adr.status() + " and can no longer be edited")
                        : Optional.empty();
                tree = mapper.valueToTree(adr);
            }
            case WORK_ITEM -> {
                WorkItem item = index.workItem(artifactId).orElseThrow(() -> notFound(artifactId));
                lock = item.status().isTerminal() && !"notes".equals(path.name())
                        ? Optional.of("work item is " + item.status() + "; only notes can change")
                        : Optional.empty();
                tree = mapper.valueToTree(item);
            }
            default -> throw new IllegalStateException("Unhandled kind " + kind);
        }
        lock.ifPresent(reason -> {
            throw new EditRejectedException(artifactId, reason);
        });
        return new Target(kind, artifactId, tree, document);
    }

    private static FieldType fieldType(Target target, FieldPath path) {
        FieldType type = FIELDS.get(target.kind()).get(path.schemaKey());
        if (type == null) {
            throw new EditRejectedException(target.id(), "field '" + path + "' does not exist or is not editable");
        }
        return type;
    }

    private static ObjectNode container(Target target, FieldPath path) {
        if (!path.isNested()) {
            return target.tree();
        }
        JsonNode list = target.tree().get(path.name());
        int size = list == null ? 0 : list.size();
        int index = path.index() < 0 ? size + path.index() : path.index();
        if (list == null || !list.isArray() || index < 0 || index >= size) {
            throw new EditRejectedException(target.id(), "no entry " + path.index() + " in " + path.name());
        }
        return (ObjectNode) list.get(index);
    }

    private static String key(FieldPath path) {
        return path.isNested() ? path.subField() : path.name();
    }

    private static ArrayNode list(Target target, FieldPath path, FieldType type) {
        if (type == FieldType.TEXT || type == FieldType.VERSION) {
            throw new EditRejectedException(target.id(), path + " is not a list; set it instead");
        }
        ObjectNode container = container(target, path);
        JsonNode node = container.get(key(path));
        if (node == null || node.isNull()) {
            return container.putArray(key(path));
        }
        return (ArrayNode) node;
    }

    /** Matchable forms of each entry; criteria also match with their category prefix. */
    private static List<List<String>> entries(ArrayNode list, FieldType type) {
        List<List<String>> entries = new ArrayList<>();
        for (JsonNode element : list) {
            if (type == FieldType.CRITERIA) {
                String text = element.path("text").asText();
                String category = element.path("category").asText("");
                entries.add(category.isEmpty() ? List.of(text) : List.of(text, category + ": " + text));
            } else if (type == FieldType.ALTERNATIVES) {
                entries.add(List.of(element.path("text").asText()));
            } else {
                entries.add(List.of(element.asText()));
            }
        }
        return entries;
    }

    // ── Persistence ──────────────────────────────────────────────

    private void commit(GovernanceIndex index, Target target) {
        LocalDate today = LocalDate.now(clock);
        switch (target.kind()) {
            case RFC -> store.saveRfc(convert(target, Rfc.class).withUpdated(today));
            case CLAUSE -> {
                // clause file first, parent last
                store.saveClause(target.document().id(), convert(target, Clause.class));
                store.saveRfc(target.document().rfc().withUpdated(today));
            }
            case ADR -> store.saveAdr(convert(target, Adr.class));
            case WORK_ITEM -> store.saveWorkItem(convert(target, WorkItem.class));
            default -> throw new IllegalStateException("Unhandled kind " + target.kind());
        }
    }

    private <T> T convert(Target target, Class<T> type) {
        try {
            return mapper.treeToValue(target.tree(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EditRejectedException(target.id(), "invalid value: " + e.getMessage(), e);
        }
    }

    private static EditRejectedException notFound(String artifactId) {
        return new EditRejectedException(artifactId, "no such artifact");
    }
}
