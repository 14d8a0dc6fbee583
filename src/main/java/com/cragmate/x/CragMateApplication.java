package com.cragmate.x;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CragMateApplication {

	public static void main(String[] args) {
		SpringApplication.run(CragMateApplication.class, args);
	}

}
