package io.cgmes.eqflat.parse;

import java.io.IOException;

/** The input could not be read as RDF/XML at all; nothing was built. */
public class UnparseableDocumentException extends IOException {
    public UnparseableDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
