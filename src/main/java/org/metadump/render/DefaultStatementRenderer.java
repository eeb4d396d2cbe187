package org.metadump.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.metadump.catalog.CatalogObjectRecord;
import org.metadump.catalog.ObjectDefinition;
import org.metadump.catalog.ObjectDefinition.BaseTypeDefinition;
import org.metadump.catalog.ObjectDefinition.CompositeTypeDefinition;
import org.metadump.catalog.ObjectDefinition.DatabaseDefinition;
import org.metadump.catalog.ObjectDefinition.DatabaseGuc;
import org.metadump.catalog.ObjectDefinition.DomainTypeDefinition;
import org.metadump.catalog.ObjectDefinition.EnumTypeDefinition;
import org.metadump.catalog.ObjectDefinition.FunctionDefinition;
import org.metadump.catalog.ObjectDefinition.ResourceGroupDefinition;
import org.metadump.catalog.ObjectDefinition.ResourceQueueDefinition;
import org.metadump.catalog.ObjectDefinition.RoleDefinition;
import org.metadump.catalog.ObjectDefinition.RoleGrantDefinition;
import org.metadump.catalog.ObjectDefinition.SessionGucs;
import org.metadump.catalog.ObjectDefinition.TablespaceDefinition;
import org.metadump.catalog.ObjectDefinition.TimeConstraint;
import org.metadump.catalog.ObjectKind;
import org.metadump.catalog.ObjectMetadata;
import org.metadump.catalog.SourceVersion;
import org.metadump.graph.EmissionStep;

/**
 * Renders catalog objects as replayable DDL.
 * <p>
 * Statements start with blank-line separators so that consecutive entries concatenate into a
 * readable script. Identifiers and literals arrive pre-escaped and are printed as given, with the
 * exception of comments, whose quotes are doubled here.
 * <p>
 * Ownership, comment and privileges become the annotation of an object's full definition. Shell
 * declarations never carry an annotation.
 */
public class DefaultStatementRenderer implements IStatementRenderer {

    private static final String DEFAULT_TABLESPACE = "pg_default";
    private static final String DEFAULT_RESOURCE_QUEUE = "pg_default";
    private static final List<String> BUILTIN_RESOURCE_GROUPS = List.of("default_group", "admin_group");

    private final SourceVersion sourceVersion;

    public DefaultStatementRenderer(SourceVersion sourceVersion) {
        this.sourceVersion = sourceVersion;
    }

    @Override
    public RenderedStatement render(EmissionStep step) {
        CatalogObjectRecord record = step.record();
        if (step.isShell()) {
            return RenderedStatement.of(shellType(record));
        }
        String statement = switch (record.kind()) {
            case SESSION_GUCS -> sessionGucs(definition(record, SessionGucs.class));
            case DATABASE -> database(record, definition(record, DatabaseDefinition.class));
            case DATABASE_GUC -> "\nALTER DATABASE " + record.name() + " "
                    + definition(record, DatabaseGuc.class).setting() + ";";
            case RESOURCE_QUEUE -> resourceQueue(record, definition(record, ResourceQueueDefinition.class));
            case RESOURCE_GROUP -> resourceGroup(record, definition(record, ResourceGroupDefinition.class));
            case ROLE -> role(record, definition(record, RoleDefinition.class));
            case ROLE_GRANT -> roleGrant(definition(record, RoleGrantDefinition.class));
            case TABLESPACE -> "\n\nCREATE TABLESPACE " + record.name() + " FILESPACE "
                    + definition(record, TablespaceDefinition.class).filespace() + ";";
            case SHELL_TYPE -> shellType(record);
            case BASE_TYPE -> baseType(record, definition(record, BaseTypeDefinition.class));
            case COMPOSITE_TYPE -> "\n\nCREATE TYPE " + qualified(record) + " AS (\n\t"
                    + String.join(",\n\t", definition(record, CompositeTypeDefinition.class).attributes()) + "\n);";
            case DOMAIN_TYPE -> domain(record, definition(record, DomainTypeDefinition.class));
            case ENUM_TYPE -> "\n\nCREATE TYPE " + qualified(record) + " AS ENUM (\n\t"
                    + String.join(",\n\t", definition(record, EnumTypeDefinition.class).labels()) + "\n);";
            case FUNCTION -> function(record, definition(record, FunctionDefinition.class));
        };
        return new RenderedStatement(statement, annotation(record));
    }

    private String sessionGucs(SessionGucs gucs) {
        StringBuilder sb = new StringBuilder()
                .append("SET statement_timeout = 0;\n")
                .append("SET check_function_bodies = false;\n")
                .append("SET client_min_messages = error;\n")
                .append("SET client_encoding = '").append(gucs.clientEncoding()).append("';\n")
                .append("SET standard_conforming_strings = on;\n")
                .append("SET default_with_oids = ").append(gucs.defaultWithOids()).append(";\n");
        if (sourceVersion.before("5")) {
            // Strict XML parsing is always off during restore, whatever the source had.
            sb.append("SET gp_strict_xml_parse = off;\n");
        }
        return sb.toString();
    }

    private static String database(CatalogObjectRecord record, DatabaseDefinition db) {
        StringBuilder sb = new StringBuilder("\n\nCREATE DATABASE ").append(record.name());
        if (!db.tablespace().isEmpty() && !DEFAULT_TABLESPACE.equals(db.tablespace())) {
            sb.append(" TABLESPACE ").append(db.tablespace());
        }
        return sb.append(';').toString();
    }

    private static String resourceQueue(CatalogObjectRecord record, ResourceQueueDefinition queue) {
        List<String> attributes = new ArrayList<>();
        if (queue.activeStatements() != -1) {
            attributes.add("ACTIVE_STATEMENTS=" + queue.activeStatements());
        }
        if (parseCost(record, queue.maxCost(), -1) > -1) {
            attributes.add("MAX_COST=" + queue.maxCost());
        }
        if (queue.costOvercommit()) {
            attributes.add("COST_OVERCOMMIT=TRUE");
        }
        if (parseCost(record, queue.minCost(), 0) > 0) {
            attributes.add("MIN_COST=" + queue.minCost());
        }
        if (!queue.priority().isEmpty() && !"medium".equalsIgnoreCase(queue.priority())) {
            attributes.add("PRIORITY=" + queue.priority().toUpperCase(Locale.ROOT));
        }
        if (!queue.memoryLimit().isEmpty() && !"-1".equals(queue.memoryLimit())) {
            attributes.add("MEMORY_LIMIT='" + queue.memoryLimit() + "'");
        }
        String action = DEFAULT_RESOURCE_QUEUE.equals(record.name()) ? "ALTER" : "CREATE";
        return "\n\n" + action + " RESOURCE QUEUE " + record.name() + " WITH (" + String.join(", ", attributes) + ");";
    }

    private static double parseCost(CatalogObjectRecord record, String cost, double absent) {
        if (cost.isEmpty()) {
            return absent;
        }
        try {
            return Double.parseDouble(cost);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed cost '" + cost + "' on " + record.describe(), e);
        }
    }

    private static String resourceGroup(CatalogObjectRecord record, ResourceGroupDefinition group) {
        String name = record.name();
        if (BUILTIN_RESOURCE_GROUPS.contains(name)) {
            // Built-in groups already exist on the target and can only be altered, one setting at a time.
            return "\n\nALTER RESOURCE GROUP " + name + " SET CPU_RATE_LIMIT " + group.cpuRateLimit() + ";"
                    + "\nALTER RESOURCE GROUP " + name + " SET MEMORY_LIMIT " + group.memoryLimit() + ";"
                    + "\nALTER RESOURCE GROUP " + name + " SET MEMORY_SHARED_QUOTA " + group.memorySharedQuota() + ";"
                    + "\nALTER RESOURCE GROUP " + name + " SET MEMORY_SPILL_RATIO " + group.memorySpillRatio() + ";"
                    + "\nALTER RESOURCE GROUP " + name + " SET CONCURRENCY " + group.concurrency() + ";";
        }
        return "\n\nCREATE RESOURCE GROUP " + name + " WITH (CPU_RATE_LIMIT=" + group.cpuRateLimit()
                + ", MEMORY_LIMIT=" + group.memoryLimit()
                + ", MEMORY_SHARED_QUOTA=" + group.memorySharedQuota()
                + ", MEMORY_SPILL_RATIO=" + group.memorySpillRatio()
                + ", CONCURRENCY=" + group.concurrency() + ");";
    }

    private String role(CatalogObjectRecord record, RoleDefinition role) {
        List<String> attributes = new ArrayList<>();
        attributes.add(role.superuser() ? "SUPERUSER" : "NOSUPERUSER");
        attributes.add(role.inherit() ? "INHERIT" : "NOINHERIT");
        attributes.add(role.createRole() ? "CREATEROLE" : "NOCREATEROLE");
        attributes.add(role.createDb() ? "CREATEDB" : "NOCREATEDB");
        attributes.add(role.canLogin() ? "LOGIN" : "NOLOGIN");
        if (role.connectionLimit() != -1) {
            attributes.add("CONNECTION LIMIT " + role.connectionLimit());
        }
        if (!role.password().isEmpty()) {
            attributes.add("PASSWORD '" + role.password() + "'");
        }
        if (!role.validUntil().isEmpty()) {
            attributes.add("VALID UNTIL '" + role.validUntil() + "'");
        }
        attributes.add("RESOURCE QUEUE " + role.resourceQueue());
        if (sourceVersion.atLeast("5")) {
            attributes.add("RESOURCE GROUP " + role.resourceGroup());
        }
        if (role.createReadExtHttp()) {
            attributes.add("CREATEEXTTABLE (protocol='http')");
        }
        if (role.createReadExtGpfdist()) {
            attributes.add("CREATEEXTTABLE (protocol='gpfdist', type='readable')");
        }
        if (role.createWriteExtGpfdist()) {
            attributes.add("CREATEEXTTABLE (protocol='gpfdist', type='writable')");
        }
        if (role.createReadExtHdfs()) {
            attributes.add("CREATEEXTTABLE (protocol='gphdfs', type='readable')");
        }
        if (role.createWriteExtHdfs()) {
            attributes.add("CREATEEXTTABLE (protocol='gphdfs', type='writable')");
        }

        String name = record.name();
        StringBuilder sb = new StringBuilder()
                .append("\n\nCREATE ROLE ").append(name).append(';')
                .append("\nALTER ROLE ").append(name).append(" WITH ").append(String.join(" ", attributes)).append(';');
        for (TimeConstraint constraint : role.timeConstraints()) {
            sb.append(String.format("\nALTER ROLE %s DENY BETWEEN DAY %d TIME '%s' AND DAY %d TIME '%s';",
                    name, constraint.startDay(), constraint.startTime(), constraint.endDay(), constraint.endTime()));
        }
        return sb.toString();
    }

    private static String roleGrant(RoleGrantDefinition grant) {
        StringBuilder sb = new StringBuilder("\nGRANT ").append(grant.role()).append(" TO ").append(grant.member());
        if (grant.adminOption()) {
            sb.append(" WITH ADMIN OPTION");
        }
        if (!grant.grantor().isEmpty()) {
            sb.append(" GRANTED BY ").append(grant.grantor());
        }
        return sb.append(';').toString();
    }

    private static String shellType(CatalogObjectRecord record) {
        return "\n\nCREATE TYPE " + qualified(record) + ";";
    }

    private static String baseType(CatalogObjectRecord record, BaseTypeDefinition type) {
        List<String> clauses = new ArrayList<>();
        clauses.add("INPUT = " + type.input());
        clauses.add("OUTPUT = " + type.output());
        addIfPresent(clauses, "RECEIVE = ", type.receive());
        addIfPresent(clauses, "SEND = ", type.send());
        addIfPresent(clauses, "TYPMOD_IN = ", type.modIn());
        addIfPresent(clauses, "TYPMOD_OUT = ", type.modOut());
        clauses.add("INTERNALLENGTH = " + (type.internalLength() == -1 ? "VARIABLE" : type.internalLength()));
        if (type.passedByValue()) {
            clauses.add("PASSEDBYVALUE");
        }
        addIfPresent(clauses, "ALIGNMENT = ", type.alignment());
        addIfPresent(clauses, "STORAGE = ", type.storage());
        if (!type.defaultValue().isEmpty()) {
            clauses.add("DEFAULT = '" + type.defaultValue() + "'");
        }
        addIfPresent(clauses, "ELEMENT = ", type.element());
        if (!type.delimiter().isEmpty()) {
            clauses.add("DELIMITER = '" + type.delimiter() + "'");
        }
        return "\n\nCREATE TYPE " + qualified(record) + " (\n\t" + String.join(",\n\t", clauses) + "\n);";
    }

    private static void addIfPresent(List<String> clauses, String prefix, String value) {
        if (!value.isEmpty()) {
            clauses.add(prefix + value);
        }
    }

    private static String domain(CatalogObjectRecord record, DomainTypeDefinition domain) {
        StringBuilder sb = new StringBuilder("\n\nCREATE DOMAIN ").append(qualified(record))
                .append(" AS ").append(domain.baseType());
        if (!domain.defaultValue().isEmpty()) {
            sb.append(" DEFAULT ").append(domain.defaultValue());
        }
        if (domain.notNull()) {
            sb.append(" NOT NULL");
        }
        return sb.append(';').toString();
    }

    private static String function(CatalogObjectRecord record, FunctionDefinition function) {
        return "\n\nCREATE FUNCTION " + record.qualifiedName() + " RETURNS " + function.returns()
                + " AS $_$" + function.body() + "$_$\nLANGUAGE " + function.language() + ";";
    }

    private static String annotation(CatalogObjectRecord record) {
        ObjectMetadata metadata = record.metadata();
        String objectType = annotationObjectType(record.kind());
        if (metadata.isEmpty() || objectType == null) {
            return "";
        }
        String target = record.kind() == ObjectKind.FUNCTION ? record.qualifiedName() : qualified(record);
        StringBuilder sb = new StringBuilder();
        if (!metadata.comment().isEmpty()) {
            sb.append("\n\nCOMMENT ON ").append(objectType).append(' ').append(target)
                    .append(" IS '").append(metadata.comment().replace("'", "''")).append("';");
        }
        if (!metadata.owner().isEmpty() && isOwnable(record.kind())) {
            sb.append("\n\nALTER ").append(objectType).append(' ').append(target)
                    .append(" OWNER TO ").append(metadata.owner()).append(';');
        }
        if (!metadata.privileges().isEmpty() && isGrantable(record.kind())) {
            sb.append("\n\nREVOKE ALL ON ").append(objectType).append(' ').append(target).append(" FROM PUBLIC;");
            for (ObjectMetadata.Privilege privilege : metadata.privileges()) {
                sb.append("\nGRANT ").append(privilege.privileges()).append(" ON ").append(objectType).append(' ')
                        .append(target).append(" TO ").append(privilege.grantee());
                if (privilege.withGrantOption()) {
                    sb.append(" WITH GRANT OPTION");
                }
                sb.append(';');
            }
        }
        return sb.toString();
    }

    /**
     * @return the object type keyword used in annotation statements, or {@code null} if the kind
     *         carries no annotation.
     */
    private static String annotationObjectType(ObjectKind kind) {
        return switch (kind) {
            case DATABASE -> "DATABASE";
            case RESOURCE_QUEUE -> "RESOURCE QUEUE";
            case RESOURCE_GROUP -> "RESOURCE GROUP";
            case ROLE -> "ROLE";
            case TABLESPACE -> "TABLESPACE";
            case SHELL_TYPE, BASE_TYPE, COMPOSITE_TYPE, ENUM_TYPE -> "TYPE";
            case DOMAIN_TYPE -> "DOMAIN";
            case FUNCTION -> "FUNCTION";
            case SESSION_GUCS, DATABASE_GUC, ROLE_GRANT -> null;
        };
    }

    private static boolean isOwnable(ObjectKind kind) {
        return kind != ObjectKind.ROLE && kind != ObjectKind.RESOURCE_QUEUE && kind != ObjectKind.RESOURCE_GROUP;
    }

    private static boolean isGrantable(ObjectKind kind) {
        return kind == ObjectKind.DATABASE || kind == ObjectKind.TABLESPACE || kind == ObjectKind.FUNCTION;
    }

    private static String qualified(CatalogObjectRecord record) {
        return record.schema().isEmpty() ? record.name() : record.schema() + "." + record.name();
    }

    private static <T extends ObjectDefinition> T definition(CatalogObjectRecord record, Class<T> type) {
        if (!type.isInstance(record.definition())) {
            throw new IllegalArgumentException("Expected " + type.getSimpleName() + " for " + record.describe()
                    + " but got " + record.definition().getClass().getSimpleName());
        }
        return type.cast(record.definition());
    }
}
