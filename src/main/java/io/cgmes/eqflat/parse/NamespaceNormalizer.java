package io.cgmes.eqflat.parse;

/**
 * Reduces namespace-qualified names to their local part, without a namespace table. Works the same
 * for CIM14, CIM15 and CIM16 documents since only the separator matters.
 */
public final class NamespaceNormalizer {

    private NamespaceNormalizer() {}

    /**
     * Local name of an element or attribute name given as {@code prefix:Local}, Clark notation
     * {@code {uri}Local}, {@code uri#Local}, {@code uri/Local} or plain {@code Local}.
     */
    public static String localName(String name) {
        if (name == null) {
            return null;
        }
        String text = name.trim();
        int brace = text.lastIndexOf('}');
        if (text.startsWith("{") && brace > 0) {
            return nonEmptyTail(text, brace);
        }
        int hash = text.lastIndexOf('#');
        if (hash >= 0) {
            return nonEmptyTail(text, hash);
        }
        int slash = text.lastIndexOf('/');
        if (slash >= 0) {
            return nonEmptyTail(text, slash);
        }
        int colon = text.lastIndexOf(':');
        if (colon >= 0) {
            return nonEmptyTail(text, colon);
        }
        return text;
    }

    /**
     * Fragment of a resource value: {@code #_abc} gives {@code _abc}, {@code http://x/cim#Foo.Bar}
     * gives {@code Foo.Bar}. Values without a fragment ({@code urn:uuid:...}) are returned whole.
     */
    public static String fragment(String value) {
        if (value == null) {
            return null;
        }
        String text = value.trim();
        int hash = text.lastIndexOf('#');
        if (hash < 0) {
            return text;
        }
        return nonEmptyTail(text, hash);
    }

    private static String nonEmptyTail(String text, int separator) {
        String tail = text.substring(separator + 1);
        return tail.isEmpty() ? text : tail;
    }
}
