package com.latchkey.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LatchkeyApplication {

	public static void main(String[] args) {
		// Token expiry and session timestamps are all UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(LatchkeyApplication.class, args);
	}

}
