package io.cgmes.eqflat.mapping;

import static io.cgmes.eqflat.mapping.CimObjects.object;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cgmes.eqflat.diagnostics.Diagnostic;
import io.cgmes.eqflat.diagnostics.DiagnosticKind;
import io.cgmes.eqflat.diagnostics.Diagnostics;
import io.cgmes.eqflat.model.CimObject;
import io.cgmes.eqflat.model.IdentifierIndex;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReferenceResolverTest {

    private static ReferenceResolver resolver(
            List<CimObject> objects, int maxDepth, Diagnostics diagnostics) {
        return new ReferenceResolver(
                IdentifierIndex.build(objects, diagnostics), maxDepth, diagnostics);
    }

    @Test
    @DisplayName("resolve() splices a referenced BaseVoltage into an ACLineSegment record")
    void resolve_base_voltage_scenario() {
        CimObject baseVoltage = object("_bv1", "BaseVoltage").scalar("nominalVoltage", "110").build();
        CimObject line =
                object("_ln1", "ACLineSegment")
                        .scalar("length", "12.3")
                        .ref("ConductingEquipment.BaseVoltage", "_bv1")
                        .build();
        Diagnostics diagnostics = new Diagnostics();

        FlattenedRecord record =
                resolver(List.of(baseVoltage, line), 5, diagnostics).resolve(line);

        assertThat(record.columns().keySet())
                .containsExactly(
                        "rdf_ID",
                        "length",
                        "ConductingEquipment.BaseVoltage__resource",
                        "ConductingEquipment.BaseVoltage__BaseVoltage.nominalVoltage");
        assertThat(record.get("rdf_ID")).isEqualTo("_ln1");
        assertThat(record.get("length")).isEqualTo("12.3");
        assertThat(record.get("ConductingEquipment.BaseVoltage__resource")).isEqualTo("_bv1");
        assertThat(record.get("ConductingEquipment.BaseVoltage__BaseVoltage.nominalVoltage"))
                .isEqualTo("110");
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("resolve() does not repeat the class when the target column is already qualified")
    void resolve_keeps_class_qualified_columns() {
        CimObject baseVoltage =
                object("_bv1", "BaseVoltage")
                        .scalar("BaseVoltage.nominalVoltage", "110")
                        .scalar("IdentifiedObject.name", "110 kV")
                        .build();
        CimObject level =
                object("_vl1", "VoltageLevel").ref("VoltageLevel.BaseVoltage", "#_bv1").build();

        FlattenedRecord record =
                resolver(List.of(baseVoltage, level), 5, new Diagnostics()).resolve(level);

        assertThat(record.columns())
                .containsEntry("VoltageLevel.BaseVoltage__BaseVoltage.nominalVoltage", "110")
                .containsEntry(
                        "VoltageLevel.BaseVoltage__BaseVoltage.IdentifiedObject.name", "110 kV");
    }

    @Test
    @DisplayName("resolve() follows A -> B -> C chains within the depth bound")
    void resolve_chain() {
        CimObject region = object("_geo1", "GeographicalRegion").scalar("name", "UK").build();
        CimObject subRegion =
                object("_reg1", "SubGeographicalRegion")
                        .scalar("name", "East")
                        .ref("Region", "_geo1")
                        .build();
        CimObject substation = object("_sub1", "Substation").ref("Region", "_reg1").build();

        FlattenedRecord record =
                resolver(List.of(region, subRegion, substation), 5, new Diagnostics())
                        .resolve(substation);

        assertThat(record.columns().keySet())
                .containsExactly(
                        "rdf_ID",
                        "Region__resource",
                        "Region__SubGeographicalRegion.name",
                        "Region__SubGeographicalRegion.Region__resource",
                        "Region__SubGeographicalRegion.Region__GeographicalRegion.name");
        assertThat(record.get("Region__SubGeographicalRegion.Region__GeographicalRegion.name"))
                .isEqualTo("UK");
    }

    @Test
    @DisplayName("resolve() keeps an unresolved reference raw and adds no columns for it")
    void resolve_unresolved_reference() {
        CimObject terminal =
                object("_t1", "Terminal")
                        .scalar("sequenceNumber", "1")
                        .ref("Terminal.ConnectivityNode", "_cn404")
                        .build();
        Diagnostics diagnostics = new Diagnostics();

        FlattenedRecord record = resolver(List.of(terminal), 5, diagnostics).resolve(terminal);

        assertThat(record.columns().keySet())
                .containsExactly("rdf_ID", "sequenceNumber", "Terminal.ConnectivityNode__resource");
        assertThat(record.get("Terminal.ConnectivityNode__resource")).isEqualTo("_cn404");
        assertThat(diagnostics.entries(DiagnosticKind.UNRESOLVED_REFERENCE))
                .singleElement()
                .satisfies(
                        d -> {
                            assertThat(d.objectId()).isEqualTo("_t1");
                            assertThat(d.field()).isEqualTo("Terminal.ConnectivityNode__resource");
                        });
    }

    @Test
    @DisplayName("resolve() stops at a reference back to an object already on the path")
    void resolve_cycle_terminates() {
        CimObject a = object("_a", "A").scalar("name", "a").ref("toB", "_b").build();
        CimObject b = object("_b", "B").scalar("name", "b").ref("toA", "_a").build();
        Diagnostics diagnostics = new Diagnostics();

        FlattenedRecord record = resolver(List.of(a, b), 50, diagnostics).resolve(a);

        assertThat(record.columns().keySet())
                .containsExactly(
                        "rdf_ID", "name", "toB__resource", "toB__B.name", "toB__B.toA__resource");
        assertThat(record.columns().keySet()).noneMatch(column -> column.contains("toA__A."));
        assertThat(diagnostics.entries(DiagnosticKind.CYCLE_DETECTED))
                .extracting(Diagnostic::field)
                .containsExactly("toB__B.toA__resource");
    }

    @Test
    @DisplayName("resolve() treats a self reference as a cycle")
    void resolve_self_reference() {
        CimObject node = object("_n", "Node").ref("self", "#_n").build();
        Diagnostics diagnostics = new Diagnostics();

        FlattenedRecord record = resolver(List.of(node), 5, diagnostics).resolve(node);

        assertThat(record.columns().keySet()).containsExactly("rdf_ID", "self__resource");
        assertThat(diagnostics.count(DiagnosticKind.CYCLE_DETECTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("resolve() truncates chains longer than maxDepth")
    void resolve_depth_bound() {
        CimObject c = object("_c", "C").scalar("z", "w").build();
        CimObject b = object("_b", "B").ref("toC", "_c").build();
        CimObject a = object("_a", "A").ref("toB", "_b").build();
        Diagnostics diagnostics = new Diagnostics();
        ReferenceResolver resolver = resolver(List.of(a, b, c), 1, diagnostics);

        FlattenedRecord record = resolver.resolve(a);

        assertThat(record.columns()).containsEntry("toB__B.toC__resource", "_c");
        assertThat(record.columns()).doesNotContainKey("toB__B.toC__C.z");
        assertThat(diagnostics.entries(DiagnosticKind.DEPTH_EXCEEDED))
                .extracting(Diagnostic::field)
                .containsExactly("toB__B.toC__resource");
        assertThat(resolver.resolve(b).columns()).containsEntry("toC__C.z", "w");
    }

    @Test
    @DisplayName("maxDepth 0 disables enrichment")
    void resolve_depth_zero() {
        CimObject c = object("_c", "C").scalar("z", "w").build();
        CimObject b = object("_b", "B").ref("toC", "_c").build();

        FlattenedRecord record = resolver(List.of(b, c), 0, new Diagnostics()).resolve(b);

        assertThat(record.columns().keySet()).containsExactly("rdf_ID", "toC__resource");
    }

    @Test
    @DisplayName("enrichment never overwrites a column the object already has")
    void resolve_own_columns_win() {
        CimObject target = object("_t", "T").scalar("v", "from-target").build();
        CimObject source =
                object("_s", "S").ref("x", "_t").scalar("x__T.v", "own").build();

        FlattenedRecord record =
                resolver(List.of(target, source), 5, new Diagnostics()).resolve(source);

        assertThat(record.get("x__T.v")).isEqualTo("own");
    }

    @Test
    @DisplayName("resolving twice, sequentially or in parallel, gives identical records")
    void resolve_is_idempotent() {
        List<CimObject> objects = new ArrayList<>();
        objects.add(object("_root", "Root").scalar("name", "root").build());
        for (int i = 0; i < 200; i++) {
            objects.add(
                    object("_n" + i, "Node")
                            .scalar("index", String.valueOf(i))
                            .ref("parent", i == 0 ? "_root" : "_n" + (i - 1))
                            .ref("peer", "_n" + ((i * 7) % 200))
                            .build());
        }
        Diagnostics first = new Diagnostics();
        Diagnostics second = new Diagnostics();

        List<FlattenedRecord> sequential = resolver(objects, 4, first).resolveAll(objects, false);
        List<FlattenedRecord> parallel = resolver(objects, 4, second).resolveAll(objects, true);

        assertThat(parallel).isEqualTo(sequential);
        for (int i = 0; i < sequential.size(); i++) {
            assertThat(parallel.get(i).columns().keySet())
                    .containsExactlyElementsOf(sequential.get(i).columns().keySet());
        }
        assertThat(second.summary()).isEqualTo(first.summary());
    }

    @Test
    void rejects_negative_depth() {
        assertThatThrownBy(() -> resolver(List.of(), -1, new Diagnostics()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
