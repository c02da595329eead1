package com.example.finance.fincheck;

import com.example.finance.fincheck.config.ValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ValidationProperties.class)
public class FinCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinCheckApplication.class, args);
    }

}
