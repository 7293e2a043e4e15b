package com.quick.bluff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BluffApplication {

	public static void main(String[] args) {
		SpringApplication.run(BluffApplication.class, args);
	}

}
