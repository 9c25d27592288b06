package com.watchflixx.gateway.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger配置类
 * 只描述网关自身的管理与健康接口，后端服务的文档不经网关聚合
 */
@Configuration
public class SwaggerConfig {

    static final String API_KEY_SCHEME = "adminApiKey";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("WatchFlixx Gateway API")
                        .description("WatchFlixx API 网关的运维接口：负载均衡、熔断器、限流与指标")
                        .version("v1.0")
                        .contact(new Contact()
                                .name("WatchFlixx Platform Team")
                                .email("platform@watchflixx.com")))
                .components(new Components()
                        .addSecuritySchemes(API_KEY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-API-Key")))
                .addSecurityItem(new SecurityRequirement().addList(API_KEY_SCHEME));
    }
}
