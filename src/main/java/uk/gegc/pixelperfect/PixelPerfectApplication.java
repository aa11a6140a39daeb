package uk.gegc.pixelperfect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PixelPerfectApplication {

    public static void main(String[] args) {
        SpringApplication.run(PixelPerfectApplication.class, args);
    }
}
