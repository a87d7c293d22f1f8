package eu.virtualparadox.regreader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegReaderApplication.class, args);
    }
}
