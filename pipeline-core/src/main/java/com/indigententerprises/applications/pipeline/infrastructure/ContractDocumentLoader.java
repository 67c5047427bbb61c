package com.indigententerprises.applications.pipeline.infrastructure;

import com.indigententerprises.applications.pipeline.domain.ContractDocument;
import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * reads published contract documents, {@code <name>.json}, from a schemas directory.
 */
public final class ContractDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(ContractDocumentLoader.class);

    private final ObjectMapper objectMapper;

    public ContractDocumentLoader(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<ContractDocument> load(final Path schemasDirectory, final List<String> names) throws ConfigurationException {
        final List<ContractDocument> documents = new ArrayList<>(names.size());

        for (final String name : names) {
            final Path path = schemasDirectory.resolve(name + ".json");

            if (!Files.isRegularFile(path)) {
                throw new ConfigurationException("contract not found: " + path);
            }

            final JsonNode schema;

            try {
                schema = objectMapper.readTree(path.toFile());
            } catch (IOException e) {
                throw new ConfigurationException("contract is not readable JSON: " + path, e);
            }

            if (schema == null || !schema.isObject()) {
                throw new ConfigurationException("contract is not a JSON object: " + path);
            }

            // id and version are policed by the governance tooling; only reported here
            final String id = schema.path("$id").asText(null);
            final String version = schema.path("version").asText(null);

            if (id == null || version == null) {
                log.warn("contract {} does not declare both $id and version", path);
            }

            log.info("loaded contract {} ({} v{})", name, id, version);
            documents.add(new ContractDocument(name, id, version, schema));
        }

        return documents;
    }
}
