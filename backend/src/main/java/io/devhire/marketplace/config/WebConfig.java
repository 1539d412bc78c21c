package io.devhire.marketplace.config;

import io.devhire.marketplace.security.CurrentActorArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private final CurrentActorArgumentResolver currentActorArgumentResolver;

  public WebConfig(CurrentActorArgumentResolver currentActorArgumentResolver) {
    this.currentActorArgumentResolver = currentActorArgumentResolver;
  }

  @Override
  public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
    resolvers.add(currentActorArgumentResolver);
  }
}
