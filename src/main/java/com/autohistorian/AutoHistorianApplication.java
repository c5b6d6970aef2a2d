package com.autohistorian;

import com.autohistorian.config.AppProperties;
import com.autohistorian.config.GenerationProperties;
import com.autohistorian.config.NytProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProperties.class, GenerationProperties.class, NytProperties.class})
public class AutoHistorianApplication {
    public static void main(String[] args) {
        SpringApplication.run(AutoHistorianApplication.class, args);
    }
}
