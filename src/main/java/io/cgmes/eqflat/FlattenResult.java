package io.cgmes.eqflat;

import io.cgmes.eqflat.diagnostics.Diagnostics;
import io.cgmes.eqflat.mapping.ClassTable;
import java.util.Map;

/**
 * Outcome of flattening one document.
 *
 * @param enriched full table per class name, in first-seen class order
 * @param clean presentation table per class name, same keys as {@code enriched}
 */
public record FlattenResult(
        Map<String, ClassTable> enriched,
        Map<String, ClassTable> clean,
        Diagnostics diagnostics,
        int objectCount) {}
