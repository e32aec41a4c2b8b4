package com.zzf.toolevents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolEventsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolEventsApplication.class, args);
    }
}
