package com.indigententerprises.applications.pipeline.domain;

public enum ErrorKind {
    ENVELOPE_INVALID,
    PAYLOAD_INVALID,
    UNBINDABLE
}
