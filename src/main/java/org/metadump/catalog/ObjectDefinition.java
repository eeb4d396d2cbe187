package org.metadump.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Kind-specific part of a {@link CatalogObjectRecord}, as delivered by the catalog query layer.
 * <p>
 * All text values are pre-escaped identifiers or literals ready for the renderer. Absent text
 * values are normalized to the empty string and absent lists to empty lists, so a definition read
 * from a hand-off file never carries nulls.
 */
public sealed interface ObjectDefinition {

    /**
     * Settings written at the top of every section file.
     *
     * @param clientEncoding  the source database encoding, e.g. {@code UTF8}.
     * @param defaultWithOids {@code on} or {@code off}.
     */
    record SessionGucs(String clientEncoding, String defaultWithOids) implements ObjectDefinition {
        public SessionGucs {
            clientEncoding = text(clientEncoding);
            defaultWithOids = text(defaultWithOids);
        }
    }

    /**
     * @param tablespace the default tablespace of the database.
     */
    record DatabaseDefinition(String tablespace) implements ObjectDefinition {
        public DatabaseDefinition {
            tablespace = text(tablespace);
        }
    }

    /**
     * A single database-level configuration setting.
     *
     * @param setting the {@code SET ...} clause, e.g. {@code SET search_path TO public}.
     */
    record DatabaseGuc(String setting) implements ObjectDefinition {
        public DatabaseGuc {
            setting = text(setting);
        }
    }

    record ResourceQueueDefinition(int activeStatements, String maxCost, boolean costOvercommit,
                                   String minCost, String priority, String memoryLimit)
            implements ObjectDefinition {
        public ResourceQueueDefinition {
            maxCost = text(maxCost);
            minCost = text(minCost);
            priority = text(priority);
            memoryLimit = text(memoryLimit);
        }
    }

    record ResourceGroupDefinition(int cpuRateLimit, int memoryLimit, int memorySharedQuota,
                                   int memorySpillRatio, int concurrency) implements ObjectDefinition {
    }

    /**
     * Role attributes. {@code connectionLimit} is -1 when unlimited.
     */
    record RoleDefinition(boolean superuser, boolean inherit, boolean createRole, boolean createDb,
                          boolean canLogin, int connectionLimit, String password, String validUntil,
                          String resourceQueue, String resourceGroup,
                          boolean createReadExtHttp, boolean createReadExtGpfdist,
                          boolean createWriteExtGpfdist, boolean createReadExtHdfs,
                          boolean createWriteExtHdfs, List<TimeConstraint> timeConstraints)
            implements ObjectDefinition {
        public RoleDefinition {
            password = text(password);
            validUntil = text(validUntil);
            resourceQueue = text(resourceQueue);
            resourceGroup = text(resourceGroup);
            timeConstraints = list(timeConstraints);
        }
    }

    /**
     * A {@code DENY BETWEEN} window on a role.
     */
    record TimeConstraint(int startDay, String startTime, int endDay, String endTime) {
        public TimeConstraint {
            startTime = text(startTime);
            endTime = text(endTime);
        }
    }

    record RoleGrantDefinition(String role, String member, String grantor, boolean adminOption)
            implements ObjectDefinition {
        public RoleGrantDefinition {
            role = text(role);
            member = text(member);
            grantor = text(grantor);
        }
    }

    record TablespaceDefinition(String filespace) implements ObjectDefinition {
        public TablespaceDefinition {
            filespace = text(filespace);
        }
    }

    /**
     * A type that exists in the catalog with no definition of its own.
     */
    record ShellTypeDefinition() implements ObjectDefinition {
    }

    /**
     * A base type. {@code internalLength} is -1 for variable length types; empty optional
     * functions and attributes are omitted from the rendered statement.
     */
    record BaseTypeDefinition(String input, String output, String receive, String send,
                              String modIn, String modOut, int internalLength, boolean passedByValue,
                              String alignment, String storage, String defaultValue, String element,
                              String delimiter) implements ObjectDefinition {
        public BaseTypeDefinition {
            input = text(input);
            output = text(output);
            receive = text(receive);
            send = text(send);
            modIn = text(modIn);
            modOut = text(modOut);
            alignment = text(alignment);
            storage = text(storage);
            defaultValue = text(defaultValue);
            element = text(element);
            delimiter = text(delimiter);
        }
    }

    /**
     * @param attributes member declarations, each already formatted as {@code name type}.
     */
    record CompositeTypeDefinition(List<String> attributes) implements ObjectDefinition {
        public CompositeTypeDefinition {
            attributes = list(attributes);
        }
    }

    record DomainTypeDefinition(String baseType, String defaultValue, boolean notNull)
            implements ObjectDefinition {
        public DomainTypeDefinition {
            baseType = text(baseType);
            defaultValue = text(defaultValue);
        }
    }

    /**
     * @param labels quoted enum labels in sort order.
     */
    record EnumTypeDefinition(List<String> labels) implements ObjectDefinition {
        public EnumTypeDefinition {
            labels = list(labels);
        }
    }

    /**
     * @param arguments the argument list as printed by the catalog, without parentheses.
     */
    record FunctionDefinition(String arguments, String returns, String language, String body)
            implements ObjectDefinition {
        public FunctionDefinition {
            arguments = text(arguments);
            returns = text(returns);
            language = text(language);
            body = text(body);
        }
    }

    private static String text(String value) {
        return Objects.requireNonNullElse(value, "");
    }

    private static <T> List<T> list(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
