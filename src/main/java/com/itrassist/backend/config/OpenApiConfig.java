package com.itrassist.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.itrassist.backend.controllers.OwnerHeader;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI itrAssistOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ITR Assist API")
                        .description("Tax document extraction, reconciliation and ITR review.")
                        .version("v1"))
                // Filer scoping is header based until an identity provider is wired in.
                .components(new Components()
                        .addParameters(OwnerHeader.NAME, new HeaderParameter()
                                .name(OwnerHeader.NAME)
                                .description("Filer identifier; defaults to " + OwnerHeader.DEFAULT_OWNER)
                                .required(false)
                                .schema(new StringSchema())));
    }
}
