package com.researchplatform.webresearch.validation;

import com.researchplatform.common.model.EndpointKind;

/** Binds an endpoint to its declared JSON shape and the record a valid body decodes into. */
public record ResponseSchema<T>(
    EndpointKind endpoint,
    ObjectSchema shape,
    Class<T> payloadType
) {}
