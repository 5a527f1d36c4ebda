package dev.letterbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LetterboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(LetterboxApplication.class, args);
    }
}
