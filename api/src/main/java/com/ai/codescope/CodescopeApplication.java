package com.ai.codescope;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodescopeApplication {

	public static void main(String[] args) {
		SpringApplication.run(CodescopeApplication.class, args);
	}

}
