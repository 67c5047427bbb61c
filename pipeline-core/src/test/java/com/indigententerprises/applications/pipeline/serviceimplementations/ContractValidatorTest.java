package com.indigententerprises.applications.pipeline.serviceimplementations;

import com.indigententerprises.applications.pipeline.domain.ContractDocument;
import com.indigententerprises.applications.pipeline.domain.ContractValidation;
import com.indigententerprises.applications.pipeline.domain.ErrorKind;
import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class ContractValidatorTest {

    private final ContractValidator systemUnderTest = TestFixtures.contractValidator();

    @Test
    public void testValidJobCreatedEventPasses() throws JsonProcessingException {
        final ContractValidation result = systemUnderTest.validate(read(TestFixtures.validJobCreatedEvent()));

        Assertions.assertTrue(result.valid());
        Assertions.assertNull(result.diagnostic());
        Assertions.assertNull(result.errorKind());
    }

    @Test
    public void testJobWithoutPayloadFieldPasses() throws JsonProcessingException {
        final String job = "{ \"id\": \"job-1\", \"type\": \"compute\", \"status\": \"PENDING\", \"createdAt\": \"2024-01-01T00:00:00Z\" }";

        Assertions.assertTrue(systemUnderTest.validate(read(TestFixtures.jobCreatedEvent(job))).valid());
    }

    @Test
    public void testMissingEnvelopeFieldsAreReported() throws JsonProcessingException {
        final ContractValidation result = systemUnderTest.validate(read("{ \"eventType\": \"job.created\" }"));

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals(ErrorKind.ENVELOPE_INVALID, result.errorKind());
        Assertions.assertTrue(result.diagnostic().startsWith("Envelope validation failed: "));
        Assertions.assertTrue(result.diagnostic().contains("contractVersion"), result.diagnostic());
    }

    @Test
    public void testViolationsAtTheRootAreReportedAgainstDollar() throws JsonProcessingException {
        final ContractValidation result = systemUnderTest.validate(read("{ \"eventType\": \"job.created\" }"));

        Assertions.assertTrue(
                result.diagnostic().startsWith(
                        "Envelope validation failed: $: required property 'contractVersion' not found; $: "
                ),
                result.diagnostic()
        );
    }

    @Test
    public void testNestedViolationsAreReportedAsJsonPaths() throws JsonProcessingException {
        final String event = TestFixtures.validJobCreatedEvent().replace("\"instanceId\": \"gw-1\"", "\"instanceId\": 7");

        final ContractValidation result = systemUnderTest.validate(read(event));

        Assertions.assertEquals(ErrorKind.ENVELOPE_INVALID, result.errorKind());
        Assertions.assertTrue(
                result.diagnostic().startsWith("Envelope validation failed: $.producer.instanceId: "),
                result.diagnostic()
        );
        Assertions.assertFalse(result.diagnostic().contains("/producer"), result.diagnostic());
    }

    @Test
    public void testPayloadViolationsAreReportedRelativeToTheJob() throws JsonProcessingException {
        final String job = TestFixtures.job("PENDING").replace("\"id\": \"job-123\"", "\"id\": 123");

        final ContractValidation result = systemUnderTest.validate(read(TestFixtures.jobCreatedEvent(job)));

        Assertions.assertEquals(ErrorKind.PAYLOAD_INVALID, result.errorKind());
        Assertions.assertTrue(
                result.diagnostic().startsWith("Payload validation failed: $.id: "),
                result.diagnostic()
        );
    }

    @Test
    public void testDiagnosticIsBoundedToThreeViolations() throws JsonProcessingException {
        // seven required fields missing
        final ContractValidation result = systemUnderTest.validate(read("{ \"eventType\": \"job.created\" }"));
        final String violations = result.diagnostic().substring("Envelope validation failed: ".length());

        Assertions.assertEquals(3, violations.split("; ").length, result.diagnostic());
    }

    @Test
    public void testInvalidJobPayloadIsReported() throws JsonProcessingException {
        final ContractValidation result =
                systemUnderTest.validate(read(TestFixtures.jobCreatedEvent("{ \"type\": \"compute\" }")));

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals(ErrorKind.PAYLOAD_INVALID, result.errorKind());
        Assertions.assertTrue(result.diagnostic().toLowerCase().contains("payload"));
        Assertions.assertTrue(result.diagnostic().contains("id"), result.diagnostic());
    }

    @Test
    public void testUnknownJobStatusIsReported() throws JsonProcessingException {
        final ContractValidation result =
                systemUnderTest.validate(read(TestFixtures.jobCreatedEvent(TestFixtures.job("EXECUTING"))));

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals(ErrorKind.PAYLOAD_INVALID, result.errorKind());
    }

    @Test
    public void testNonJobEventSkipsPayloadContract() throws JsonProcessingException {
        final String event = TestFixtures.jobCreatedEvent("{ \"anything\": true }")
                .replace("\"job.created\"", "\"user.registered\"");

        Assertions.assertTrue(systemUnderTest.validate(read(event)).valid());
    }

    @Test
    public void testNonObjectMessageIsInvalid() throws JsonProcessingException {
        final ContractValidation result = systemUnderTest.validate(read("[1, 2, 3]"));

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals(ErrorKind.ENVELOPE_INVALID, result.errorKind());
    }

    @Test
    public void testValidationDoesNotMutateInput() throws JsonProcessingException {
        final JsonNode event = read(TestFixtures.jobCreatedEvent("{ \"type\": \"compute\" }"));
        final JsonNode copy = event.deepCopy();

        systemUnderTest.validate(event);

        Assertions.assertEquals(copy, event);
    }

    @Test
    public void testMissingContractIsAConfigurationError() throws JsonProcessingException {
        final ContractDocument envelopeOnly = new ContractDocument(
                ContractValidator.ENVELOPE_CONTRACT,
                "urn:test",
                "1.0.0",
                read("{ \"type\": \"object\" }")
        );

        Assertions.assertThrows(
                ConfigurationException.class,
                () -> new ContractValidator(new ContractRegistry(List.of(envelopeOnly)))
        );
    }

    private static JsonNode read(final String json) throws JsonProcessingException {
        return TestFixtures.OBJECT_MAPPER.readTree(json);
    }
}
