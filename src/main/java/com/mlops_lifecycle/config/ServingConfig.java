package com.mlops_lifecycle.config;

import com.mlops_lifecycle.model.ServerModelState;
import com.mlops_lifecycle.service.ModelInitializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The model is acquired while the context refreshes, i.e. before the embedded server starts
 * accepting requests. Handlers receive the resulting state by injection.
 */
@Configuration
@ConditionalOnWebApplication
public class ServingConfig {

    @Bean
    public ServerModelState serverModelState(ModelInitializer modelInitializer) {
        return modelInitializer.initialize();
    }
}
