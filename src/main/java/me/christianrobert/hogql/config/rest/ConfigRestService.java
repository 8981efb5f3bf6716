package me.christianrobert.hogql.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.hogql.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read and edit parser settings at runtime. Unknown keys are rejected.
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.debug("Getting parser configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return badRequest("Request body must contain at least one setting");
        }
        List<String> unknown = config.keySet().stream()
                .filter(key -> !ConfigService.knownKeys().contains(key))
                .collect(Collectors.toList());
        if (!unknown.isEmpty()) {
            log.warn("Rejected unknown configuration keys: {}", unknown);
            return badRequest("Unknown configuration keys: " + String.join(", ", unknown));
        }

        configService.updateConfiguration(config);
        return ok("Configuration saved successfully");
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }
        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        return ok("Configuration reset to defaults successfully");
    }

    private static Response ok(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", message);
        return Response.ok(response).build();
    }

    private static Response badRequest(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return Response.status(Response.Status.BAD_REQUEST).entity(response).build();
    }
}
