package com.aiinpocket.grinexrate;

import com.aiinpocket.grinexrate.config.GrinexApiProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GrinexApiProperties.class)
public class GrinexRateApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrinexRateApplication.class, args);
    }

}
