package com.kreasipositif.ledgerimporter.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI ledgerImporterOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ledger Importer API")
                        .description("""
                                Imports bank and crypto spreadsheet exports into a normalised ledger and
                                reports the cash position in a chosen display currency.

                                **Exposed resources:**
                                - `/api/v1/imports` start and follow workbook imports
                                - `/api/v1/transactions`, `/api/v1/summary` query the ledger
                                - `/api/v1/fx`, `/api/v1/quotes` refresh market data
                                - `/api/v1/settings` user preferences
                                """)
                        .version("0.1.0")
                        .contact(new Contact()
                                .name("Kreasi Positif")
                                .url("https://github.com/kreasipositif"))
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
