package com.tony.footValue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FootValueApplication {

	public static void main(String[] args) {
		SpringApplication.run(FootValueApplication.class, args);
	}

}
