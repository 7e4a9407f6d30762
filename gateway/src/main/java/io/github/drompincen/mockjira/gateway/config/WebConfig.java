package io.github.drompincen.mockjira.gateway.config;

import io.github.drompincen.mockjira.gateway.web.AuthGateInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthGateInterceptor authGateInterceptor;

    public WebConfig(AuthGateInterceptor authGateInterceptor) {
        this.authGateInterceptor = authGateInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authGateInterceptor).addPathPatterns("/rest/**", "/_mock/webhooks/**");
    }
}
