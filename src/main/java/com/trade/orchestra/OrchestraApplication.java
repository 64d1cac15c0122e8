package com.trade.orchestra;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class OrchestraApplication {

	public static void main(String[] args) {
		SpringApplication.run(OrchestraApplication.class, args);
	}

}
