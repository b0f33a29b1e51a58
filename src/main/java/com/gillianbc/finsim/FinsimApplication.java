package com.gillianbc.finsim;

import com.gillianbc.finsim.config.ReferenceDataProperties;
import com.gillianbc.finsim.config.SimulationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ReferenceDataProperties.class, SimulationProperties.class})
public class FinsimApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinsimApplication.class, args);
    }
}
