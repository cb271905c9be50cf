package com.kmg.merch;

import com.kmg.merch.config.MerchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MerchProperties.class)
public class MerchUploaderApplication {
    public static void main(String[] args) {
        SpringApplication.run(MerchUploaderApplication.class, args);
    }
}
