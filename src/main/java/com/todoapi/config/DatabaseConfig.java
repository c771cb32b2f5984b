package com.todoapi.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the reactive R2DBC connection.
 * The ConnectionFactory itself comes from Spring Boot auto-configuration.
 */
@Configuration
@EnableR2dbcRepositories(basePackages = "com.todoapi.repository")
public class DatabaseConfig {

    /**
     * Initialize database schema on startup.
     * Executes schema.sql unless todo.database.initialize-schema is false.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(
            ConnectionFactory connectionFactory,
            @Value("${todo.database.initialize-schema:true}") boolean initializeSchema) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initializeSchema);

        return initializer;
    }
}
