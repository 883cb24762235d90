package com.xbleey.marketreport.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the context, then ends the JVM with the given code.
 */
@Component
public class SpringApplicationExitHandler implements ApplicationExitHandler {

    private final ConfigurableApplicationContext context;

    public SpringApplicationExitHandler(ConfigurableApplicationContext context) {
        this.context = context;
    }

    @Override
    public void exit(int exitCode) {
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
