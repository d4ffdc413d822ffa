package com.podshift.dependency;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PodshiftDependencyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodshiftDependencyApplication.class, args);
    }
}
