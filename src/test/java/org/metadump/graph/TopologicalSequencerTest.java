package org.metadump.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.metadump.graph.GraphFixtures.baseType;
import static org.metadump.graph.GraphFixtures.compositeType;
import static org.metadump.graph.GraphFixtures.domain;
import static org.metadump.graph.GraphFixtures.function;
import static org.metadump.graph.GraphFixtures.names;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metadump.catalog.CatalogObjectRecord;
import org.metadump.catalog.ObjectDefinition.DatabaseDefinition;
import org.metadump.catalog.ObjectDefinition.FunctionDefinition;
import org.metadump.catalog.ObjectDefinition.RoleGrantDefinition;
import org.metadump.catalog.ObjectDefinition.SessionGucs;
import org.metadump.catalog.ObjectDefinition.TablespaceDefinition;
import org.metadump.catalog.ObjectKind;
import org.metadump.output.Section;

@Tag("unit")
class TopologicalSequencerTest {

    private final DependencyResolver resolver = new DependencyResolver();
    private final TopologicalSequencer sequencer = new TopologicalSequencer();

    private EmissionSequence sequence(List<CatalogObjectRecord> records) {
        return sequencer.sequence(resolver.resolve(records));
    }

    @Test
    void dependenciesComeFirst() {
        CatalogObjectRecord funcX = function(10, "func_x", "");
        CatalogObjectRecord typeA = baseType(20, "type_a", "public.func_x()");
        CatalogObjectRecord typeB = baseType(30, "type_b", "public.type_a");

        EmissionSequence sequence = sequence(List.of(typeB, typeA, funcX));

        assertThat(names(sequence.steps())).containsExactly("func_x", "type_a", "type_b");
        assertThat(sequence.shellCount()).isZero();
    }

    @Test
    void missingDependencyLeavesObjectWithoutPredecessor() {
        CatalogObjectRecord typeA = baseType(20, "type_a", "public.func_x()");
        CatalogObjectRecord typeB = baseType(30, "type_b", "public.type_a");

        EmissionSequence sequence = sequence(List.of(typeB, typeA));

        assertThat(names(sequence.steps())).containsExactly("type_a", "type_b");
    }

    @Test
    void tiesBreakBySchemaThenNameThenOid() {
        CatalogObjectRecord zeta = CatalogObjectRecord.of(1, "alpha", "zeta", ObjectKind.FUNCTION,
                new FunctionDefinition("", "void", "sql", ""));
        CatalogObjectRecord beta = baseType(2, "beta");
        CatalogObjectRecord alphaLate = baseType(9, "alpha");
        CatalogObjectRecord alphaEarly = function(5, "alpha", "int4");

        EmissionSequence sequence = sequence(List.of(beta, alphaLate, zeta, alphaEarly));

        assertThat(sequence.steps()).extracting(step -> step.record().oid()).containsExactly(1L, 5L, 9L, 2L);
    }

    @Test
    void everyStepFollowsItsDependenciesInRandomAcyclicGraphs() {
        Random random = new Random(42);
        for (int round = 0; round < 20; round++) {
            List<CatalogObjectRecord> records = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                List<String> dependencies = new ArrayList<>();
                for (int j = 0; j < i; j++) {
                    if (random.nextInt(8) == 0) {
                        dependencies.add("public.n" + j + "()");
                    }
                }
                records.add(function(1000 + random.nextInt(1000) * 100L + i, "n" + i, "",
                        dependencies.toArray(new String[0])));
            }
            Collections.shuffle(records, random);

            DependencyGraph graph = resolver.resolve(records);
            List<EmissionStep> steps = sequencer.sequence(graph).steps();

            Map<Long, Integer> position = new HashMap<>();
            for (int i = 0; i < steps.size(); i++) {
                position.put(steps.get(i).record().oid(), i);
            }
            assertThat(steps).hasSize(records.size());
            for (CatalogObjectRecord record : graph.nodes()) {
                for (long dependency : graph.dependencyOids(record.oid())) {
                    assertThat(position.get(dependency)).isLessThan(position.get(record.oid()));
                }
            }
        }
    }

    @Test
    void orderIsIdenticalForAnyInputOrder() {
        List<CatalogObjectRecord> records = new ArrayList<>(List.of(
                function(10, "func_x", ""),
                baseType(20, "type_a", "public.func_x()", "public.type_b"),
                baseType(30, "type_b", "public.type_a"),
                compositeType(40, "pair", "public.type_a"),
                domain(50, "positive"),
                function(60, "check_positive", "int4", "public.positive")));
        List<EmissionStep> expected = sequence(records).steps();

        Random random = new Random(7);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(records, random);
            assertThat(sequence(records).steps()).isEqualTo(expected);
        }
    }

    @Test
    void twoTypeCycleIsBrokenWithOneShell() {
        CatalogObjectRecord typeA = baseType(20, "type_a", "public.type_b");
        CatalogObjectRecord typeB = baseType(30, "type_b", "public.type_a");

        EmissionSequence sequence = sequence(List.of(typeB, typeA));

        assertThat(names(sequence.steps())).containsExactly("shell:type_b", "type_a", "type_b");
        assertThat(sequence.records()).extracting(CatalogObjectRecord::name).containsExactly("type_a", "type_b");
        assertThat(sequence.steps().get(0).tocKind()).isEqualTo(ObjectKind.SHELL_TOC_KIND);
    }

    @Test
    void fullDefinitionStillWaitsForItsOutsideDependencies() {
        CatalogObjectRecord helper = function(5, "zz_helper", "");
        CatalogObjectRecord typeA = baseType(20, "type_a", "public.type_b");
        CatalogObjectRecord typeB = baseType(30, "type_b", "public.type_a", "public.zz_helper()");

        EmissionSequence sequence = sequence(List.of(helper, typeA, typeB));

        assertThat(names(sequence.steps())).containsExactly("shell:type_b", "type_a", "zz_helper", "type_b");
    }

    @Test
    void typeAndIoFunctionCycleShellsTheType() {
        CatalogObjectRecord input = function(10, "money_in", "cstring", "public.money_t");
        CatalogObjectRecord output = function(11, "money_out", "public.money_t", "public.money_t");
        CatalogObjectRecord type = baseType(12, "money_t", "public.money_in(cstring)", "public.money_out(public.money_t)");

        EmissionSequence sequence = sequence(List.of(type, output, input));

        assertThat(names(sequence.steps())).containsExactly("shell:money_t", "money_in", "money_out", "money_t");
    }

    @Test
    void domainInTypeCycleIsTheAnchor() {
        CatalogObjectRecord amount = domain(10, "amount", "public.ledger");
        CatalogObjectRecord ledger = compositeType(20, "ledger", "public.amount");

        EmissionSequence sequence = sequence(List.of(ledger, amount));

        assertThat(names(sequence.steps())).containsExactly("shell:ledger", "amount", "ledger");
    }

    @Test
    void twoDomainsInOneCycleCannotBeBroken() {
        CatalogObjectRecord first = domain(10, "first", "public.second");
        CatalogObjectRecord second = domain(20, "second", "public.first");

        assertThatThrownBy(() -> sequence(List.of(first, second)))
                .isInstanceOfSatisfying(UnbreakableCycleException.class, e ->
                        assertThat(e.getMembers()).hasSize(2)
                                .anySatisfy(member -> assertThat(member).contains("public.first"))
                                .anySatisfy(member -> assertThat(member).contains("public.second")));
    }

    @Test
    void cycleWithoutTypesCannotBeBroken() {
        CatalogObjectRecord f = function(10, "f", "", "public.g()");
        CatalogObjectRecord g = function(20, "g", "", "public.h()");
        CatalogObjectRecord h = function(30, "h", "", "public.f()");

        assertThatThrownBy(() -> sequence(List.of(f, g, h)))
                .isInstanceOfSatisfying(UnbreakableCycleException.class, e ->
                        assertThat(e.getMembers()).hasSize(3));
    }

    @Test
    void mixedCycleStillCyclicAfterShellingFails() {
        CatalogObjectRecord f = function(10, "f", "", "public.g()");
        CatalogObjectRecord g = function(20, "g", "", "public.f()", "public.t");
        CatalogObjectRecord t = baseType(30, "t", "public.g()");

        assertThatThrownBy(() -> sequence(List.of(f, g, t)))
                .isInstanceOf(UnbreakableCycleException.class);
    }

    @Test
    void globalObjectsFollowPriorityClasses() {
        CatalogObjectRecord session = CatalogObjectRecord.of(900, "", "session", ObjectKind.SESSION_GUCS,
                new SessionGucs("UTF8", "off"));
        CatalogObjectRecord tablespace = CatalogObjectRecord.of(1, "", "archive", ObjectKind.TABLESPACE,
                new TablespaceDefinition("fs_archive"));
        CatalogObjectRecord grant = CatalogObjectRecord.of(2, "", "analyst", ObjectKind.ROLE_GRANT,
                new RoleGrantDefinition("readers", "analyst", "admin", false));
        CatalogObjectRecord database = CatalogObjectRecord.of(3, "", "warehouse", ObjectKind.DATABASE,
                new DatabaseDefinition("archive"));
        CatalogObjectRecord type = baseType(4, "aaa");

        EmissionSequence sequence = sequence(List.of(type, tablespace, grant, database, session));

        assertThat(sequence.steps()).extracting(step -> step.record().kind()).containsExactly(
                ObjectKind.SESSION_GUCS, ObjectKind.DATABASE, ObjectKind.ROLE_GRANT, ObjectKind.TABLESPACE,
                ObjectKind.BASE_TYPE);
        assertThat(sequence.forSection(Section.GLOBAL)).extracting(step -> step.record().kind()).containsExactly(
                ObjectKind.SESSION_GUCS, ObjectKind.DATABASE, ObjectKind.ROLE_GRANT, ObjectKind.TABLESPACE);
        assertThat(sequence.forSection(Section.PREDATA)).extracting(step -> step.record().kind())
                .containsExactly(ObjectKind.SESSION_GUCS, ObjectKind.BASE_TYPE);
        assertThat(sequence.forSection(Section.POSTDATA)).extracting(step -> step.record().kind())
                .containsExactly(ObjectKind.SESSION_GUCS);
    }
}
