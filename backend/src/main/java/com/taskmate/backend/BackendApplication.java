package com.taskmate.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BackendApplication {

	public static void main(String[] args) {
		// Timestamps are stored and rendered in UTC regardless of host settings
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(BackendApplication.class, args);
	}

}

/*
Must stay in the root package: component scanning starts here, so moving it into a
sub-package would hide the global.* and modules.* beans from the application context.
 */
