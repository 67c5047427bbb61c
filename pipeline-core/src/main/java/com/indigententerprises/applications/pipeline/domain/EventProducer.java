package com.indigententerprises.applications.pipeline.domain;

public record EventProducer(
        String service,
        String instanceId,
        String version
) {
}
