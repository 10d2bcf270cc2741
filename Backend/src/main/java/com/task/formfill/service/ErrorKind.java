package com.task.formfill.service;

public enum ErrorKind {
    /** Mime type or image format the pipeline cannot read. Not retried. */
    UNSUPPORTED_INPUT,
    /** Recognition or classification provider error. The caller may retry. */
    PROVIDER_FAILURE,
    /** Malformed request, rejected before any external call. */
    VALIDATION_FAILURE,
    /** The output document could not be produced. Single fields that fail are skipped instead. */
    RENDER_FAILURE;

    /** Unknown or missing names are treated as provider failures. */
    public static ErrorKind fromName(String name) {
        if (name == null) return PROVIDER_FAILURE;
        for (ErrorKind k : values()) {
            if (k.name().equals(name)) return k;
        }
        return PROVIDER_FAILURE;
    }
}
