package com.charter.core.signature;

import com.charter.core.model.Adr;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.Clause;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.WorkItem;
import com.charter.core.store.GovernanceJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Computes reproducible SHA-256 signatures over the logical content of artifacts.
 * <p>
 * The record is turned into a JSON tree, object keys are sorted at every level
 * (array order is kept), the tree is written without whitespace and hashed.
 * An RFC is signed together with all of its clauses, sorted by clause id, as
 * {@code {"clauses": [...], "rfc": {...}}}; the RFC's {@code released_signature}
 * is bookkeeping and not part of the signed content.
 * <p>
 * {@link #contentSignature(RfcDocument)} additionally leaves out the lifecycle
 * fields ({@code status}, {@code phase}, {@code updated}) so that moving an RFC
 * through its lifecycle does not count as changing what it says.
 */
@Component
public class CanonicalSigner {

    private static final String RELEASED_SIGNATURE = "released_signature";
    private static final List<String> LIFECYCLE_FIELDS = List.of("status", "phase", "updated");

    private final ObjectMapper mapper = GovernanceJson.mapper();

    public String sign(RfcDocument document) {
        return signTree(tree(document));
    }

    /** Signature of the RFC's content alone, recorded as {@code released_signature}. */
    public String contentSignature(RfcDocument document) {
        ObjectNode root = tree(document);
        ((ObjectNode) root.get("rfc")).remove(LIFECYCLE_FIELDS);
        return signTree(root);
    }

    public String sign(Adr adr) {
        return signTree(mapper.valueToTree(adr));
    }

    public String sign(WorkItem item) {
        return signTree(mapper.valueToTree(item));
    }

    /** Signs the artifact with the given id. Clauses are covered by their RFC and have no signature of their own. */
    public Optional<String> sign(GovernanceIndex index, String artifactId) {
        ArtifactKind kind = ArtifactKind.ofId(artifactId);
        if (kind == null) {
            return Optional.empty();
        }
        return switch (kind) {
            case RFC -> index.rfc(artifactId).map(this::sign);
            case ADR -> index.adr(artifactId).map(this::sign);
            case WORK_ITEM -> index.workItem(artifactId).map(this::sign);
            case CLAUSE -> Optional.empty();
        };
    }

    /** The tree an RFC signature is computed over, before key sorting. */
    public ObjectNode tree(RfcDocument document) {
        ObjectNode rfc = mapper.valueToTree(document.rfc());
        rfc.remove(RELEASED_SIGNATURE);
        ArrayNode clauses = mapper.createArrayNode();
        for (Clause clause : document.clausesSortedById()) {
            clauses.add(mapper.<JsonNode>valueToTree(clause));
        }
        ObjectNode root = mapper.createObjectNode();
        root.set("rfc", rfc);
        root.set("clauses", clauses);
        return root;
    }

    public String signTree(JsonNode tree) {
        return sha256Hex(canonicalBytes(tree));
    }

    /** Compact serialization of the key-sorted tree. */
    public byte[] canonicalBytes(JsonNode tree) {
        try {
            return mapper.writeValueAsBytes(canonicalize(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize canonical form", e);
        }
    }

    /** Returns a copy of {@code node} with object keys sorted lexicographically at every level. */
    public JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            names.sort(null);
            ObjectNode sorted = mapper.createObjectNode();
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = mapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(canonicalize(element));
            }
            return copy;
        }
        return node;
    }

    static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
