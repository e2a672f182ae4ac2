package com.campusevents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampusEventsApplication {

	public static void main(String[] args) {
		SpringApplication.run(CampusEventsApplication.class, args);
	}

}
