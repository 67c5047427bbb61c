package com.indigententerprises.applications.jobprocessor.configuration;

import com.indigententerprises.applications.pipeline.domain.ServiceIdentity;

import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * exposes the service name and version under /actuator/info.
 */
@Component
public class ServiceInfoContributor implements InfoContributor {

    private final ServiceIdentity serviceIdentity;

    public ServiceInfoContributor(final ServiceIdentity serviceIdentity) {
        this.serviceIdentity = serviceIdentity;
    }

    @Override
    public void contribute(final Info.Builder builder) {
        builder.withDetail(
                "service",
                Map.of("name", serviceIdentity.name(), "version", serviceIdentity.version())
        );
    }
}
