package com.example.acr;

import com.example.acr.config.AcrProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AcrProperties.class)
public class AcrApplication {

	public static void main(String[] args) {
		SpringApplication.run(AcrApplication.class, args);
	}

}
