package eu.virtualparadox.patentsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PatentSearchApplication {

    public static void main(final String[] args) {
        SpringApplication.run(PatentSearchApplication.class, args);
    }
}
