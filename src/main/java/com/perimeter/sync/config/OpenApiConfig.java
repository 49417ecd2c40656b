package com.perimeter.sync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) documentation for the diagnostics API.
 *
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI perimeterSyncOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Perimeter State Sync Diagnostics API")
                        .description("Operator view of the perimeter device cache.\n\n" +
                                "## Reconciliation\n\n" +
                                "1. Poll production for device status changes since the checkpoint\n" +
                                "2. Classify each status and cascade fence fails along the line\n" +
                                "3. Commit the cache, write derived statuses back to production\n" +
                                "4. Advance the checkpoint\n\n" +
                                "## WebSocket Topics\n\n" +
                                "Connect to `ws://localhost:" + serverPort + "/ws/device-states`\n\n" +
                                "- `/topic/device-states` - committed state changes\n" +
                                "- `/topic/alerts` - devices that went to FAIL or ALARM")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
