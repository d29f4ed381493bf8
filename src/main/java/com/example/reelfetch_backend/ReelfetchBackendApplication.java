package com.example.reelfetch_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ReelfetchBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReelfetchBackendApplication.class, args);
	}

}
