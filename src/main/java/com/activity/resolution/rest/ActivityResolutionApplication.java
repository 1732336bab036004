package com.activity.resolution.rest;

import jakarta.ws.rs.ApplicationPath;
import jakarta.ws.rs.core.Application;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.info.Info;

/**
 * Jakarta RS application with OpenAPI metadata for the read-only activity API.
 */
@ApplicationPath("/")
@OpenAPIDefinition(
        info = @Info(
                title = "Activity Resolution API",
                version = "1.0.0",
                description = "Read access to canonical workout activities reconciled from a GPS platform " +
                        "and a desktop training log, with their source links and training annotations."
        )
)
public class ActivityResolutionApplication extends Application {
}
