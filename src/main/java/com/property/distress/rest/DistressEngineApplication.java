package com.property.distress.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS application with OpenAPI metadata.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Property Distress Engine API",
                version = "1.0.0",
                description = "Ingests public-record extracts, resolves them to properties and serves " +
                        "distress-scored leads."
        )
)
public class DistressEngineApplication extends Application {
}
