package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.ContractDocument;

import com.fasterxml.jackson.databind.JsonNode;

import com.networknt.schema.InputFormat;
import com.networknt.schema.Schema;
import com.networknt.schema.SchemaRegistry;
import com.networknt.schema.SchemaRegistryConfig;
import com.networknt.schema.SpecificationVersion;
import com.networknt.schema.path.PathType;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * compiled contracts keyed by contract name. compiled once; contracts are immutable for the life of the process.
 */
public final class ContractRegistry {
    private final Map<String, Schema> schemasByName;

    public ContractRegistry(final List<ContractDocument> documents) {
        // violations are reported against JSON paths ($, $.payload.id), not JSON pointers
        final SchemaRegistryConfig schemaRegistryConfig =
                SchemaRegistryConfig.builder().pathType(PathType.JSON_PATH).build();
        final SchemaRegistry schemaRegistry = SchemaRegistry.withDefaultDialect(
                SpecificationVersion.DRAFT_2020_12,
                builder -> builder.schemaRegistryConfig(schemaRegistryConfig)
        );
        final Map<String, Schema> map = new HashMap<>();

        for (final ContractDocument document : documents) {
            final JsonNode schemaNode = document.jsonSchema();
            final Schema schema = schemaRegistry.getSchema(schemaNode.toString(), InputFormat.JSON);
            map.put(document.name(), schema);
        }

        this.schemasByName = Map.copyOf(map);
    }

    public boolean contains(final String name) {
        return schemasByName.containsKey(name);
    }

    public Schema require(final String name) throws IllegalArgumentException {
        final Schema schema = schemasByName.get(name);

        if (schema == null) {
            throw new IllegalArgumentException("unknown contract: " + name);
        } else {
            return schema;
        }
    }
}
