package io.cgmes.eqflat.model;

import io.cgmes.eqflat.diagnostics.DiagnosticKind;
import io.cgmes.eqflat.diagnostics.Diagnostics;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup from identifier to object.
 *
 * <p>Keys are canonical identifiers, so {@code _abc}, {@code #_abc}, {@code #abc} and {@code
 * urn:uuid:abc} all find the same object. When two objects share a canonical identifier the later
 * one wins and both occurrences are reported.
 */
public final class IdentifierIndex {
    private static final Logger LOG = LoggerFactory.getLogger(IdentifierIndex.class);

    private static final String URN_UUID = "urn:uuid:";

    private final Map<String, CimObject> byId;

    private IdentifierIndex(Map<String, CimObject> byId) {
        this.byId = Collections.unmodifiableMap(byId);
    }

    public static IdentifierIndex build(List<CimObject> objects, Diagnostics diagnostics) {
        Map<String, CimObject> byId = new HashMap<>(objects.size() * 2);
        for (CimObject object : objects) {
            String key = canonical(object.id());
            if (key == null) {
                continue;
            }
            CimObject previous = byId.put(key, object);
            if (previous != null) {
                LOG.warn(
                        "Duplicate identifier {}: {} replaces earlier {}",
                        object.id(),
                        object.className(),
                        previous.className());
                diagnostics.record(
                        DiagnosticKind.DUPLICATE_IDENTIFIER,
                        previous.className(),
                        previous.id(),
                        null,
                        "superseded by a later " + object.className());
                diagnostics.record(
                        DiagnosticKind.DUPLICATE_IDENTIFIER,
                        object.className(),
                        object.id(),
                        null,
                        "supersedes an earlier " + previous.className());
            }
        }
        LOG.debug("Indexed {} identifiers from {} objects", byId.size(), objects.size());
        return new IdentifierIndex(byId);
    }

    public Optional<CimObject> find(String id) {
        String key = canonical(id);
        return key == null ? Optional.empty() : Optional.ofNullable(byId.get(key));
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    public int size() {
        return byId.size();
    }

    /**
     * Canonical form used for matching: strips a leading '#', a leading {@code urn:uuid:} and then
     * one leading '_'. Returns null for blank input.
     */
    public static String canonical(String id) {
        if (id == null) {
            return null;
        }
        String text = id.trim();
        if (text.startsWith("#")) {
            text = text.substring(1);
        }
        if (text.regionMatches(true, 0, URN_UUID, 0, URN_UUID.length())) {
            text = text.substring(URN_UUID.length());
        }
        if (text.startsWith("_")) {
            text = text.substring(1);
        }
        return text.isEmpty() ? null : text;
    }
}
