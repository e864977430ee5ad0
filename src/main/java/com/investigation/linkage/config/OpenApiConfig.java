package com.investigation.linkage.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI linkAnalysisOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Link Analysis API")
                        .version("1.0.0")
                        .description(
                                "Entity resolution and risk scoring across investigative records.\n\n" +
                                "**Pipeline:**\n" +
                                "1. Upload CSV files via `POST /analyses`\n" +
                                "2. Map column aliases and classify each file (bank / person / phone / crypto)\n" +
                                "3. Ingest people first, building the phone/account/wallet cross-reference\n" +
                                "4. Ingest bank, phone and crypto records, folding activity onto declared owners\n" +
                                "5. Score every entity (0-100) with explainable factors\n" +
                                "6. Optionally export the graph to a case via `POST /analyses/{id}/export`\n\n" +
                                "**Risk factors:** suspect +30, victim +5, received > ฿500K +25 " +
                                "(> ฿100K +15), > 3 transactions +10, mixer +20, foreign transfer +15, " +
                                "> 5 calls +10, seen in 3+ files +10. Capped at 100.")
                        .contact(new Contact().name("Link Analysis Team")));
    }
}
