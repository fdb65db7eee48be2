package com.example.workflowdispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkflowDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkflowDispatchApplication.class, args);
    }
}
