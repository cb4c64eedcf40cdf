package com.framecap.framecap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FramecapApplication {

	public static void main(String[] args) {
		SpringApplication.run(FramecapApplication.class, args);
	}

}
