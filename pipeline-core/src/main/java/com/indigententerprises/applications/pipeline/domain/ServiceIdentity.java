package com.indigententerprises.applications.pipeline.domain;

public record ServiceIdentity(String name, String version) {}
