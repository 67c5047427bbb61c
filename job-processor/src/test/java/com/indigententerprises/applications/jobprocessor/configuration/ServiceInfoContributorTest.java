package com.indigententerprises.applications.jobprocessor.configuration;

import com.indigententerprises.applications.pipeline.domain.ServiceIdentity;

import org.springframework.boot.actuate.info.Info;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

public class ServiceInfoContributorTest {

    @Test
    public void testContributesNameAndVersion() {
        final ServiceInfoContributor systemUnderTest =
                new ServiceInfoContributor(new ServiceIdentity("job-processor", "0.1.0"));
        final Info.Builder builder = new Info.Builder();

        systemUnderTest.contribute(builder);

        Assertions.assertEquals(
                Map.of("name", "job-processor", "version", "0.1.0"),
                builder.build().get("service")
        );
    }
}
