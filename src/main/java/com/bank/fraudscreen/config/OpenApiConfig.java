package com.bank.fraudscreen.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI fraudScreeningOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Fraud Screening API")
                        .version("1.0.0")
                        .description(
                                "Fraud and compliance screening workflow for payment transactions.\n\n" +
                                "**Workflow:**\n" +
                                "1. Enrichment: load the transaction, customer profile and history\n" +
                                "2. Risk scoring: weighted rules plus a narrative from the reasoning service\n" +
                                "3. In parallel: compliance audit report and fraud alert decision\n\n" +
                                "**Recommendation:** **APPROVE** (<45), **INVESTIGATE** (45-75), **BLOCK** (>=75)\n\n" +
                                "**Compliance rating:** COMPLIANT (<50), CONDITIONAL_COMPLIANCE (50-75), NON_COMPLIANT (>=75)\n\n" +
                                "**Alert severity:** LOW, MEDIUM (>=50), HIGH (>=75), CRITICAL (>=90)")
                        .contact(new Contact().name("Financial Crime Engineering")));
    }
}
