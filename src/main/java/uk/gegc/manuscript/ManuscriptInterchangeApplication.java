package uk.gegc.manuscript;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ManuscriptInterchangeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ManuscriptInterchangeApplication.class, args);
    }
}
