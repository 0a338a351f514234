package io.cgmes.eqflat.parse;

import com.ctc.wstx.stax.WstxInputFactory;
import io.cgmes.eqflat.diagnostics.DiagnosticKind;
import io.cgmes.eqflat.diagnostics.Diagnostics;
import io.cgmes.eqflat.model.CimObject;
import io.cgmes.eqflat.model.FieldValue;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import org.apache.jena.vocabulary.RDF;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link CimObject}s from an EQ RDF/XML document.
 *
 * <p>The document is streamed with Woodstox. Every child element of the root becomes one object,
 * in document order, so two elements carrying the same identifier stay two objects. Typed node
 * elements ({@code <cim:Breaker>}) take their class from the tag; {@code rdf:Description}
 * elements take it from their first {@code rdf:type} child. Identifiers are read as written:
 * {@code rdf:ID} exactly, {@code rdf:about} reduced to its fragment.
 */
public class ObjectModelBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ObjectModelBuilder.class);

    static final String UNTYPED_CLASS = "Description";

    private static final String RDF_NS = RDF.getURI();
    private static final String TYPE = RDF.type.getLocalName();
    private static final String ROOT = "RDF";

    private final Diagnostics diagnostics;
    private final XMLInputFactory2 factory;

    public ObjectModelBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory2.P_LAZY_PARSING, false);
        factory.setXMLReporter(
                (message, type, info, location) -> {
                    LOG.warn("XML {} at {}: {}", type, position(location), message);
                    diagnostics.record(
                            DiagnosticKind.PARSER_WARNING,
                            null,
                            null,
                            null,
                            "[" + position(location) + "] " + message);
                });
    }

    /**
     * Parses the document and returns its objects in discovery order.
     *
     * @throws UnparseableDocumentException when the input is not well-formed XML
     */
    public List<CimObject> build(InputStream in) throws UnparseableDocumentException {
        List<CimObject> objects = new ArrayList<>();
        try {
            XMLStreamReader2 reader = (XMLStreamReader2) factory.createXMLStreamReader(in);
            try {
                readDocument(reader, objects);
            } finally {
                reader.close();
            }
        } catch (XMLStreamException e) {
            throw new UnparseableDocumentException(
                    "Document cannot be parsed as RDF/XML: " + e.getMessage(), e);
        }
        LOG.info("Extracted {} objects", objects.size());
        return Collections.unmodifiableList(objects);
    }

    private void readDocument(XMLStreamReader2 reader, List<CimObject> objects)
            throws XMLStreamException {
        while (reader.next() != XMLStreamConstants.START_ELEMENT) {
            if (reader.getEventType() == XMLStreamConstants.END_DOCUMENT) {
                throw new XMLStreamException("no root element");
            }
        }
        if (!ROOT.equals(reader.getLocalName())) {
            LOG.warn("Root element is <{}>, not rdf:RDF", reader.getPrefixedName());
        }
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                readNodeElement(reader).ifPresent(objects::add);
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                return;
            }
        }
    }

    /** Reads one top-level element, leaving the reader on its end tag. */
    private Optional<CimObject> readNodeElement(XMLStreamReader2 reader)
            throws XMLStreamException {
        String tag = reader.getLocalName();
        boolean description =
                RDF_NS.equals(reader.getNamespaceURI()) && UNTYPED_CLASS.equals(tag);
        String id = identifier(reader);
        Draft draft = new Draft(description ? null : tag);
        while (true) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                readPropertyElement(reader, draft);
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
        }

        if (id == null) {
            String className = draft.className();
            LOG.warn(
                    "Skipping {} element without rdf:ID or rdf:about ({} properties)",
                    className,
                    draft.fields.size());
            diagnostics.record(
                    DiagnosticKind.MALFORMED_RECORD,
                    className,
                    null,
                    null,
                    "element has neither rdf:ID nor rdf:about");
            return Optional.empty();
        }
        return Optional.of(draft.toObject(id));
    }

    /** Reads one property element into the draft, leaving the reader on its end tag. */
    private void readPropertyElement(XMLStreamReader2 reader, Draft draft)
            throws XMLStreamException {
        String name = reader.getLocalName();
        boolean rdfType = RDF_NS.equals(reader.getNamespaceURI()) && TYPE.equals(name);
        String resource = rdfAttribute(reader, "resource");
        StringBuilder text = new StringBuilder();
        boolean nested = false;
        String nestedId = null;
        while (true) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                if (!nested) {
                    nested = true;
                    nestedId = identifier(reader);
                }
                reader.skipElement();
            } else if (event == XMLStreamConstants.CHARACTERS
                    || event == XMLStreamConstants.CDATA) {
                text.append(reader.getText());
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
        }

        if (rdfType) {
            if (resource != null) {
                draft.type(NamespaceNormalizer.localName(resource));
            }
        } else if (resource != null) {
            draft.put(
                    FieldValue.referenceField(name),
                    new FieldValue.Reference(NamespaceNormalizer.fragment(resource)));
        } else if (nested && nestedId != null) {
            draft.put(FieldValue.referenceField(name), new FieldValue.Reference(nestedId));
            draft.warn(name, "nested node element reduced to a reference to " + nestedId);
        } else if (nested) {
            draft.warn(name, "nested content without rdf:ID or rdf:about skipped");
        } else {
            String value = text.toString().trim();
            if (!value.isEmpty()) {
                draft.put(name, new FieldValue.Scalar(value));
            }
        }
    }

    /** Identifier of the element the reader is on, or null when it has none. */
    static String identifier(XMLStreamReader2 reader) {
        String id = rdfAttribute(reader, "ID");
        if (id != null && !id.isBlank()) {
            return id.trim();
        }
        String about = rdfAttribute(reader, "about");
        if (about != null && !about.isBlank()) {
            return NamespaceNormalizer.fragment(about);
        }
        return null;
    }

    private static String rdfAttribute(XMLStreamReader2 reader, String localName) {
        String value = reader.getAttributeValue(RDF_NS, localName);
        return value != null ? value : reader.getAttributeValue(null, localName);
    }

    private static String position(Location location) {
        return location == null
                ? "?"
                : "line " + location.getLineNumber() + ", col " + location.getColumnNumber();
    }

    private record Pending(DiagnosticKind kind, String field, String detail) {}

    private final class Draft {
        private String className;
        private final Map<String, FieldValue> fields = new LinkedHashMap<>();
        private final List<Pending> pending = new ArrayList<>();

        Draft(String className) {
            this.className = className;
        }

        String className() {
            return className == null ? UNTYPED_CLASS : className;
        }

        void type(String type) {
            if (className == null) {
                className = type;
            } else if (!className.equals(type)) {
                LOG.debug("Ignoring additional rdf:type {} on a {}", type, className);
            }
        }

        void put(String name, FieldValue value) {
            if (fields.put(name, value) != null) {
                pending.add(
                        new Pending(
                                DiagnosticKind.REPEATED_FIELD, name, "earlier value overwritten"));
            }
        }

        void warn(String name, String detail) {
            pending.add(new Pending(DiagnosticKind.PARSER_WARNING, name, detail));
        }

        CimObject toObject(String id) {
            String resolvedClass = className();
            for (Pending entry : pending) {
                LOG.debug(
                        "{} on {} {} at {}: {}",
                        entry.kind(),
                        resolvedClass,
                        id,
                        entry.field(),
                        entry.detail());
                diagnostics.record(entry.kind(), resolvedClass, id, entry.field(), entry.detail());
            }
            return new CimObject(id, resolvedClass, fields);
        }
    }
}
