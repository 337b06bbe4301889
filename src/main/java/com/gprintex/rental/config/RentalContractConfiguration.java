package com.gprintex.rental.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
    RentalContractProperties.class,
    DocuSignProperties.class
})
public class RentalContractConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
