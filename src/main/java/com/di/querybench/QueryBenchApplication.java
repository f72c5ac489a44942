package com.di.querybench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QueryBenchApplication {

	public static void main(String[] args) {
		SpringApplication.run(QueryBenchApplication.class, args);
	}
}
