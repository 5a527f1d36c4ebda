package dev.letterbox.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.name:letterbox}")
    private String appName;

    @Value("${app.version:0.1.0}")
    private String appVersion;

    @Value("${server.port:8000}")
    private String serverPort;

    @Bean
    public OpenAPI letterboxOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(appName + " API")
                        .description("""
                                Newsletter subscription ingestion.

                                Subscriptions are submitted as URL-encoded forms with `name` and `email` fields.
                                Every response carries an `X-Request-ID` header for correlating server logs.
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Server")));
    }
}
