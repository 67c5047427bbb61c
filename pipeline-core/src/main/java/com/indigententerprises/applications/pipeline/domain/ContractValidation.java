package com.indigententerprises.applications.pipeline.domain;

/**
 * outcome of checking one message against the published contracts.
 *
 * @param valid true when every contract that applies was satisfied
 * @param errorKind which contract rejected the message, null when valid
 * @param diagnostic bounded, human-readable list of violations, null when valid
 */
public record ContractValidation(boolean valid, ErrorKind errorKind, String diagnostic) {

    public static ContractValidation ok() {
        return new ContractValidation(true, null, null);
    }

    public static ContractValidation fail(final ErrorKind errorKind, final String diagnostic) {
        return new ContractValidation(false, errorKind, diagnostic);
    }
}
