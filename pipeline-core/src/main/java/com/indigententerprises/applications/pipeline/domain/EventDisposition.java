package com.indigententerprises.applications.pipeline.domain;

public enum EventDisposition {
    PROCESSED,
    DUPLICATE
}
