package org.worksindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorksIndexApplication {
    public static void main(String[] args) {
        SpringApplication.run(WorksIndexApplication.class, args);
    }
}
