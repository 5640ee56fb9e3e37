package com.fueltrack.archival;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FuelArchivalApplication {

	public static void main(String[] args) {
		SpringApplication.run(FuelArchivalApplication.class, args);
	}

}
