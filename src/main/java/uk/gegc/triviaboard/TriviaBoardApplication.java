package uk.gegc.triviaboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriviaBoardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriviaBoardApplication.class, args);
    }
}
