package org.mides.fieldvisit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FieldVisitEngine {

	public static void main(String[] args) {
		SpringApplication.run(FieldVisitEngine.class, args);
	}
}
