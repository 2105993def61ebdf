package com.example.realty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RealtyLeadBotApplication {

	public static void main(String[] args) {
		SpringApplication.run(RealtyLeadBotApplication.class, args);
	}

}
