package com.indigententerprises.applications.pipeline.domain;

import com.fasterxml.jackson.databind.JsonNode;

public record ContractDocument(
        String name,
        String id,
        String version,
        JsonNode jsonSchema
) {}
