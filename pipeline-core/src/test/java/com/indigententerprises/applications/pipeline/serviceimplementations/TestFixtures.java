package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.infrastructure.ContractDocumentLoader;
import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class TestFixtures {

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static {
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private TestFixtures() {}

    public static Path schemasDirectory() {
        try {
            return Paths.get(TestFixtures.class.getResource("/contracts/schemas").toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static ContractValidator contractValidator() {
        try {
            final ContractDocumentLoader loader = new ContractDocumentLoader(OBJECT_MAPPER);
            final ContractRegistry registry = new ContractRegistry(
                    loader.load(
                            schemasDirectory(),
                            List.of(ContractValidator.ENVELOPE_CONTRACT, ContractValidator.JOB_CONTRACT)
                    )
            );
            return new ContractValidator(registry);
        } catch (ConfigurationException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String jobCreatedEvent(final String jobPayloadJson) {
        return "{\n" +
                "  \"contractVersion\": \"1.0.0\",\n" +
                "  \"eventType\": \"job.created\",\n" +
                "  \"eventId\": \"evt-123\",\n" +
                "  \"occurredAt\": \"2024-01-01T00:00:00Z\",\n" +
                "  \"producer\": { \"service\": \"gateway\", \"instanceId\": \"gw-1\", \"version\": \"0.1.0\" },\n" +
                "  \"correlationId\": \"corr-456\",\n" +
                "  \"idempotencyKey\": \"idem-456\",\n" +
                "  \"payload\": " + jobPayloadJson + "\n" +
                "}";
    }

    public static String job(final String status) {
        return "{ \"id\": \"job-123\", \"type\": \"compute\", \"status\": \"" + status + "\", " +
                "\"payload\": { \"data\": \"test\" }, \"createdAt\": \"2024-01-01T00:00:00Z\" }";
    }

    public static String validJobCreatedEvent() {
        return jobCreatedEvent(job("PENDING"));
    }
}
