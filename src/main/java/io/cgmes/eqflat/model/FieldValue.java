package io.cgmes.eqflat.model;

/**
 * Value of a single field on a {@link CimObject}: either a scalar literal or a pointer to another
 * object by identifier.
 */
public sealed interface FieldValue permits FieldValue.Scalar, FieldValue.Reference {

    /** Marker appended to the name of every reference-valued field. */
    String RESOURCE_MARKER = "__resource";

    /** Raw textual form, as written to the enriched table. */
    String raw();

    /** Literal text content of a property element. */
    record Scalar(String raw) implements FieldValue {}

    /** Content of an {@code rdf:resource} attribute, with the leading {@code #} stripped. */
    record Reference(String raw) implements FieldValue {
        public String targetId() {
            return raw;
        }
    }

    static boolean isReferenceField(String fieldName) {
        return fieldName.endsWith(RESOURCE_MARKER);
    }

    static String referenceField(String localName) {
        return localName + RESOURCE_MARKER;
    }

    /** "ConductingEquipment.BaseVoltage__resource" -> "ConductingEquipment.BaseVoltage". */
    static String stripMarker(String fieldName) {
        return isReferenceField(fieldName)
                ? fieldName.substring(0, fieldName.length() - RESOURCE_MARKER.length())
                : fieldName;
    }
}
