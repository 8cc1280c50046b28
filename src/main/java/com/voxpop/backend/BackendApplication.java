package com.voxpop.backend;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

import java.util.Arrays;

@SpringBootApplication
@Slf4j
public class BackendApplication {

	private final Environment environment;

	public BackendApplication(Environment environment) {
		this.environment = environment;
	}

	@EventListener(ApplicationReadyEvent.class)
	public void logActiveProfiles() {
		log.info("Active profiles: {}", Arrays.toString(environment.getActiveProfiles()));
	}

	public static void main(String[] args) {
		SpringApplication.run(BackendApplication.class, args);
	}
}
