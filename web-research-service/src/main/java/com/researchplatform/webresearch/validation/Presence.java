package com.researchplatform.webresearch.validation;

public enum Presence {
    REQUIRED,
    OPTIONAL,           // may be absent, must not be null
    OPTIONAL_NULLABLE   // may be absent or explicitly null
}
