package com.nnipa.admin.config;

import com.nnipa.admin.web.AdminRequestFilter;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Admin Service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.servlet.context-path:}")
    private String contextPath;

    @Value("${server.port:8001}")
    private int serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(servers());
    }

    private Info apiInfo() {
        return new Info()
                .title("Admin Service API")
                .description("NNIPA Platform Admin Service - Password policy, credential rotation " +
                        "and audit trail. Every response carries the " + AdminRequestFilter.TRACE_ID_HEADER +
                        " header; mutating requests under /admin are recorded in the audit log.")
                .version("1.0.0")
                .contact(new Contact()
                        .name("NNIPA Platform Team")
                        .email("admin-support@nnipa.cloud")
                        .url("https://nnipa.cloud"))
                .license(new License()
                        .name("Proprietary")
                        .url("https://nnipa.cloud/license"));
    }

    private List<Server> servers() {
        String basePath = StringUtils.hasText(contextPath) ? contextPath : "";

        Server localServer = new Server()
                .url("http://localhost:" + serverPort + basePath)
                .description("Direct Local Access");

        return List.of(localServer);
    }
}
