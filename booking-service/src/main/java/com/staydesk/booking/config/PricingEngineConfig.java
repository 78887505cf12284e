package com.staydesk.booking.config;

import com.staydesk.pricing.engine.AvailabilityChecker;
import com.staydesk.pricing.engine.QuoteAggregator;
import com.staydesk.pricing.engine.RateResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free pricing engine into the service.
 */
@Configuration
public class PricingEngineConfig {

    @Bean
    public RateResolver rateResolver() {
        return new RateResolver();
    }

    @Bean
    public AvailabilityChecker availabilityChecker() {
        return new AvailabilityChecker();
    }

    @Bean
    public QuoteAggregator quoteAggregator(RateResolver rateResolver) {
        return new QuoteAggregator(rateResolver);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
