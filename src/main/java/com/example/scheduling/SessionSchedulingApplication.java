package com.example.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SessionSchedulingApplication {

	public static void main(String[] args) {
		SpringApplication.run(SessionSchedulingApplication.class, args);
	}

}
