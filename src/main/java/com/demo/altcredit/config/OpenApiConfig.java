package com.demo.altcredit.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI scoringOpenAPI(@Value("${app.api-version:6.0.0}") String version) {
        return new OpenAPI().info(new Info()
                .title("Alternative Credit Scoring API")
                .description("Scores underbanked borrowers across five profiles (salaried, student, gig, "
                        + "shopkeeper, rural) with a calibrated 35-feature logistic model. Returns a "
                        + "300-900 credit score, a risk band and the top scoring factors.")
                .version(version));
    }
}
