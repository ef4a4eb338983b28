package com.taskflow.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskflowApplication {

	public static void main(String[] args) {
		// Task deadlines and notification timestamps are compared in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(TaskflowApplication.class, args);
	}

}

/*
Keep this class in the root package: component scanning starts here, so moving it
into a sub-package hides every module outside that package.
 */
