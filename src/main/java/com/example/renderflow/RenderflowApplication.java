package com.example.renderflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RenderflowApplication {

	public static void main(String[] args) {
		SpringApplication.run(RenderflowApplication.class, args);
	}

}
