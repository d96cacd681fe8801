package uk.gegc.courseprogress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseProgressApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseProgressApplication.class, args);
    }
}
