package com.di.bqsampler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BqSamplerApplication {

	public static void main(String[] args) {
		SpringApplication.run(BqSamplerApplication.class, args);
	}
}
