package com.tugochat.tugochat_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TugochatApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(TugochatApiApplication.class, args);
	}

}
