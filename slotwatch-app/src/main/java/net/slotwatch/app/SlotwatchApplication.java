package net.slotwatch.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SlotwatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(SlotwatchApplication.class, args);
    }
}
