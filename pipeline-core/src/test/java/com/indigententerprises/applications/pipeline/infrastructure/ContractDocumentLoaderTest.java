package com.indigententerprises.applications.pipeline.infrastructure;

import com.indigententerprises.applications.pipeline.domain.ContractDocument;
import com.indigententerprises.applications.pipeline.serviceimplementations.TestFixtures;
import com.indigententerprises.applications.pipeline.serviceinterfaces.ConfigurationException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ContractDocumentLoaderTest {

    private final ContractDocumentLoader systemUnderTest = new ContractDocumentLoader(TestFixtures.OBJECT_MAPPER);

    @Test
    public void testLoadsPublishedContracts() throws ConfigurationException {
        final List<ContractDocument> documents =
                systemUnderTest.load(TestFixtures.schemasDirectory(), List.of("event-envelope", "job"));

        Assertions.assertEquals(2, documents.size());
        Assertions.assertEquals("event-envelope", documents.get(0).name());
        Assertions.assertEquals("1.0.0", documents.get(0).version());
        Assertions.assertEquals("job", documents.get(1).name());
        Assertions.assertTrue(documents.get(1).jsonSchema().has("properties"));
    }

    @Test
    public void testMissingContractIsAConfigurationError(@TempDir final Path directory) {
        Assertions.assertThrows(
                ConfigurationException.class,
                () -> systemUnderTest.load(directory, List.of("job"))
        );
    }

    @Test
    public void testMalformedContractIsAConfigurationError(@TempDir final Path directory) throws IOException {
        Files.writeString(directory.resolve("job.json"), "{ not json", StandardCharsets.UTF_8);

        Assertions.assertThrows(
                ConfigurationException.class,
                () -> systemUnderTest.load(directory, List.of("job"))
        );
    }

    @Test
    public void testNonObjectContractIsAConfigurationError(@TempDir final Path directory) throws IOException {
        Files.writeString(directory.resolve("job.json"), "[]", StandardCharsets.UTF_8);

        Assertions.assertThrows(
                ConfigurationException.class,
                () -> systemUnderTest.load(directory, List.of("job"))
        );
    }
}
