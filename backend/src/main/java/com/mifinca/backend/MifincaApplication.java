package com.mifinca.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MifincaApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC for consistent logs and audit timestamps
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(MifincaApplication.class, args);
	}

}
