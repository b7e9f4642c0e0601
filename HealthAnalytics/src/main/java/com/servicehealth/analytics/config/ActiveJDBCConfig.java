package com.servicehealth.analytics.config;

import org.javalite.activejdbc.Base;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * ActiveJDBC Database Configuration
 *
 * PostgreSQL access through ActiveJDBC. Connections are bound to the calling
 * thread and are opened and closed around each store operation.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    @Value("${spring.datasource.url}")
    private String dbUrl;

    @Value("${spring.datasource.username}")
    private String dbUsername;

    @Value("${spring.datasource.password}")
    private String dbPassword;

    @Value("${spring.datasource.driver-class-name}")
    private String driverClassName;

    @PostConstruct
    public void init() {
        try {
            Class.forName(driverClassName);
            log.info("ActiveJDBC configured for {} ({})", dbUrl, driverClassName);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("JDBC driver not found: " + driverClassName, e);
        }
    }

    /**
     * Opens a new database connection for the current thread.
     *
     * @return true if a connection was opened, false if the thread already had one
     */
    public boolean openConnection() {
        if (Base.hasConnection()) {
            return false;
        }
        Base.open(driverClassName, dbUrl, dbUsername, dbPassword);
        return true;
    }

    /**
     * Closes the database connection for the current thread.
     */
    public void closeConnection() {
        if (Base.hasConnection()) {
            Base.close();
        }
    }

}
