package io.cgmes.eqflat.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.cgmes.eqflat.diagnostics.Diagnostic;
import io.cgmes.eqflat.diagnostics.DiagnosticKind;
import io.cgmes.eqflat.diagnostics.Diagnostics;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdentifierIndexTest {

    private static CimObject object(String id, String className) {
        return new CimObject(id, className, Map.of());
    }

    @Test
    @DisplayName("canonical() unifies '#', '#_', '_' and urn:uuid: spellings")
    void canonical_forms() {
        assertThat(IdentifierIndex.canonical("_abc")).isEqualTo("abc");
        assertThat(IdentifierIndex.canonical("#_abc")).isEqualTo("abc");
        assertThat(IdentifierIndex.canonical("#abc")).isEqualTo("abc");
        assertThat(IdentifierIndex.canonical("urn:uuid:abc")).isEqualTo("abc");
        assertThat(IdentifierIndex.canonical("abc")).isEqualTo("abc");
        assertThat(IdentifierIndex.canonical("#")).isNull();
        assertThat(IdentifierIndex.canonical(null)).isNull();
    }

    @Test
    @DisplayName("find() matches any spelling of an indexed identifier")
    void find_by_any_spelling() {
        IdentifierIndex index =
                IdentifierIndex.build(List.of(object("_bv1", "BaseVoltage")), new Diagnostics());

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.find("_bv1")).isPresent();
        assertThat(index.find("#_bv1")).isPresent();
        assertThat(index.find("urn:uuid:bv1")).isPresent();
        assertThat(index.find("_bv2")).isEmpty();
        assertThat(index.contains(null)).isFalse();
    }

    @Test
    @DisplayName("build() lets the later of two objects with the same identifier win and reports both")
    void build_duplicate_identifier_last_write_wins() {
        Diagnostics diagnostics = new Diagnostics();
        CimObject first = object("_x", "Substation");
        CimObject second = object("#_x", "Line");

        IdentifierIndex index = IdentifierIndex.build(List.of(first, second), diagnostics);

        assertThat(index.find("_x")).containsSame(second);
        assertThat(diagnostics.entries(DiagnosticKind.DUPLICATE_IDENTIFIER))
                .extracting(Diagnostic::className)
                .containsExactly("Substation", "Line");
    }
}
