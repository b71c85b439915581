package net.openhours.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OpenHoursApplication {
    public static void main(String[] args) {
        SpringApplication.run(OpenHoursApplication.class, args);
    }
}
