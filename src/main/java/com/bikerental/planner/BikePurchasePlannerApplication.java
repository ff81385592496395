package com.bikerental.planner;

import com.bikerental.planner.config.PlannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PlannerProperties.class)
public class BikePurchasePlannerApplication {
    private static final Logger log = LoggerFactory.getLogger(BikePurchasePlannerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BikePurchasePlannerApplication.class, args);
        log.info("Bike purchase planner started");
    }
}
