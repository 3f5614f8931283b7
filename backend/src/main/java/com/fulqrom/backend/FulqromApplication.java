package com.fulqrom.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FulqromApplication {

	public static void main(String[] args) {
		// Grant timestamps and logs are UTC regardless of the host zone
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(FulqromApplication.class, args);
	}

}
