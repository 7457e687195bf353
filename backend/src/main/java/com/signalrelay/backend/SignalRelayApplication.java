package com.signalrelay.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SignalRelayApplication {
	public static void main(String[] args) {
		SpringApplication.run(SignalRelayApplication.class, args);
	}
}
