package com.etl.migration.kettlegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KettleGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(KettleGraphApplication.class, args);
    }
}
