package application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"application", "common", "controller", "engine", "service"})
public class RideHailApplication {
    public static void main(String[] args) {
        SpringApplication.run(RideHailApplication.class, args);
    }
}
