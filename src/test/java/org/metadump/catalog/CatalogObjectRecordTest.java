package org.metadump.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.metadump.catalog.ObjectDefinition.DatabaseDefinition;
import org.metadump.catalog.ObjectDefinition.FunctionDefinition;
import org.metadump.catalog.ObjectDefinition.ShellTypeDefinition;
import org.metadump.output.Section;

@Tag("unit")
class CatalogObjectRecordTest {

    @Test
    void qualifiedNameDependsOnKind() {
        CatalogObjectRecord database = CatalogObjectRecord.of(1, "", "warehouse", ObjectKind.DATABASE,
                new DatabaseDefinition("pg_default"));
        CatalogObjectRecord type = CatalogObjectRecord.of(2, "public", "money_t", ObjectKind.SHELL_TYPE,
                new ShellTypeDefinition());
        CatalogObjectRecord function = CatalogObjectRecord.of(3, "public", "money_in", ObjectKind.FUNCTION,
                new FunctionDefinition("cstring", "public.money_t", "c", "money_in"));

        assertThat(database.qualifiedName()).isEqualTo("warehouse");
        assertThat(type.qualifiedName()).isEqualTo("public.money_t");
        assertThat(function.qualifiedName()).isEqualTo("public.money_in(cstring)");
    }

    @Test
    void normalizesAbsentFieldsAndCopiesLists() {
        List<String> dependencies = new ArrayList<>(List.of("public.a"));
        CatalogObjectRecord record = new CatalogObjectRecord(7, null, "t", ObjectKind.SHELL_TYPE,
                new ShellTypeDefinition(), null, null, dependencies);
        dependencies.add("public.b");

        assertThat(record.schema()).isEmpty();
        assertThat(record.metadata()).isSameAs(ObjectMetadata.NONE);
        assertThat(record.origin()).isEqualTo(Origin.EXPLICIT);
        assertThat(record.dependsUpon()).containsExactly("public.a");
    }

    @Test
    void sessionSettingsBelongToEverySection() {
        assertThat(ObjectKind.SESSION_GUCS.sections()).containsExactlyInAnyOrder(Section.values());
        assertThat(ObjectKind.ROLE.sections()).containsExactly(Section.GLOBAL);
        assertThat(ObjectKind.FUNCTION.sections()).containsExactly(Section.PREDATA);
    }

    @Test
    void onlyBaseCompositeAndEnumTypesAreShellable() {
        assertThat(ObjectKind.BASE_TYPE.isShellable()).isTrue();
        assertThat(ObjectKind.COMPOSITE_TYPE.isShellable()).isTrue();
        assertThat(ObjectKind.ENUM_TYPE.isShellable()).isTrue();
        assertThat(ObjectKind.DOMAIN_TYPE.isShellable()).isFalse();
        assertThat(ObjectKind.SHELL_TYPE.isShellable()).isFalse();
        assertThat(ObjectKind.FUNCTION.isShellable()).isFalse();
        assertThat(ObjectKind.DOMAIN_TYPE.isType()).isTrue();
    }
}
