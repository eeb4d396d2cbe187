package org.metadump.catalog;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

/**
 * Reads the JSON hand-off file written by the catalog query layer.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "sourceVersion": "5.28.4",
 *   "records": [
 *     { "oid": 16384, "schema": "public", "name": "complex", "kind": "COMPOSITE_TYPE",
 *       "origin": "EXPLICIT", "dependsUpon": ["public.pair"],
 *       "definition": { "attributes": ["re double precision", "im double precision"] },
 *       "metadata": { "owner": "admin", "comment": "", "privileges": [] } }
 *   ]
 * }
 * </pre>
 * The shape of {@code definition} is selected by {@code kind}; {@code origin}, {@code metadata}
 * and {@code dependsUpon} may be omitted.
 */
public final class CatalogSnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(CatalogSnapshotReader.class);

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(CatalogObjectRecord.class, new RecordDeserializer())
            .create();

    /**
     * Reads a snapshot file.
     *
     * @param file the hand-off file.
     * @return the parsed snapshot.
     * @throws IOException if the file cannot be read or is not a valid snapshot.
     */
    public CatalogSnapshot read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            CatalogSnapshot snapshot = read(reader);
            log.info("Read {} catalog records from {} (source version {})",
                    snapshot.records().size(), file, snapshot.sourceVersion());
            return snapshot;
        }
    }

    /**
     * Reads a snapshot from a character stream.
     *
     * @param reader the JSON source; not closed.
     * @return the parsed snapshot.
     * @throws IOException if the content is not a valid snapshot.
     */
    public CatalogSnapshot read(Reader reader) throws IOException {
        try {
            JsonObject root = gson.fromJson(reader, JsonObject.class);
            if (root == null || !root.has("sourceVersion")) {
                throw new IOException("Catalog snapshot has no sourceVersion");
            }
            SourceVersion version = new SourceVersion(root.get("sourceVersion").getAsString());
            List<CatalogObjectRecord> records = new ArrayList<>();
            JsonArray array = root.has("records") ? root.getAsJsonArray("records") : new JsonArray();
            for (JsonElement element : array) {
                records.add(gson.fromJson(element, CatalogObjectRecord.class));
            }
            return new CatalogSnapshot(version, records);
        } catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Malformed catalog snapshot: " + e.getMessage(), e);
        }
    }

    private static Class<? extends ObjectDefinition> definitionType(ObjectKind kind) {
        return switch (kind) {
            case SESSION_GUCS -> ObjectDefinition.SessionGucs.class;
            case DATABASE -> ObjectDefinition.DatabaseDefinition.class;
            case DATABASE_GUC -> ObjectDefinition.DatabaseGuc.class;
            case RESOURCE_QUEUE -> ObjectDefinition.ResourceQueueDefinition.class;
            case RESOURCE_GROUP -> ObjectDefinition.ResourceGroupDefinition.class;
            case ROLE -> ObjectDefinition.RoleDefinition.class;
            case ROLE_GRANT -> ObjectDefinition.RoleGrantDefinition.class;
            case TABLESPACE -> ObjectDefinition.TablespaceDefinition.class;
            case SHELL_TYPE -> ObjectDefinition.ShellTypeDefinition.class;
            case BASE_TYPE -> ObjectDefinition.BaseTypeDefinition.class;
            case COMPOSITE_TYPE -> ObjectDefinition.CompositeTypeDefinition.class;
            case DOMAIN_TYPE -> ObjectDefinition.DomainTypeDefinition.class;
            case ENUM_TYPE -> ObjectDefinition.EnumTypeDefinition.class;
            case FUNCTION -> ObjectDefinition.FunctionDefinition.class;
        };
    }

    private static final class RecordDeserializer implements JsonDeserializer<CatalogObjectRecord> {

        private static final Type STRING_LIST = new TypeToken<List<String>>() { }.getType();

        @Override
        public CatalogObjectRecord deserialize(JsonElement json, Type typeOfT,
                                               JsonDeserializationContext context) {
            JsonObject object = json.getAsJsonObject();
            if (!object.has("oid") || !object.has("name") || !object.has("kind")) {
                throw new JsonParseException("Record requires oid, name and kind: " + object);
            }
            ObjectKind kind = ObjectKind.valueOf(object.get("kind").getAsString());
            JsonElement definitionJson = object.has("definition") ? object.get("definition") : new JsonObject();
            ObjectDefinition definition = context.deserialize(definitionJson, definitionType(kind));
            ObjectMetadata metadata = object.has("metadata")
                    ? context.deserialize(object.get("metadata"), ObjectMetadata.class)
                    : ObjectMetadata.NONE;
            Origin origin = object.has("origin") ? Origin.valueOf(object.get("origin").getAsString()) : Origin.EXPLICIT;
            List<String> dependsUpon = object.has("dependsUpon")
                    ? context.deserialize(object.get("dependsUpon"), STRING_LIST)
                    : List.of();
            return new CatalogObjectRecord(
                    object.get("oid").getAsLong(),
                    object.has("schema") ? object.get("schema").getAsString() : "",
                    object.get("name").getAsString(),
                    kind,
                    definition,
                    metadata,
                    origin,
                    dependsUpon);
        }
    }
}
