package org.shale.cli.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.shale.definition.SchemaDefinitionLoader;
import org.shale.schema.Schema;
import org.shale.schema.Version;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads schema definition files, opens database connections and renders snapshots for the
 * commands.
 */
public class SchemaIoService {
    private final SchemaDefinitionLoader definitionLoader = new SchemaDefinitionLoader();
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Loads the schema and compiles every version.
     *
     * @throws IOException if the file is missing or unreadable
     */
    public Schema loadSchema(Path schemaFile) throws IOException {
        if (!Files.exists(schemaFile)) {
            throw new IOException("Schema file not found: " + schemaFile);
        }
        return definitionLoader.load(schemaFile).validate();
    }

    /**
     * The caller closes the connection.
     */
    public Connection openConnection(String url) throws SQLException {
        return DriverManager.getConnection(url);
    }

    public String toJson(Version version) throws JsonProcessingException {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", version.number());
        out.put("tables", version.snapshot().getTables());
        out.put("indexes", version.snapshot().getIndexes());
        return objectMapper.writeValueAsString(out);
    }
}
