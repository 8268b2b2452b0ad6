package com.example.report.docgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class ReportDocgenApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportDocgenApplication.class, args);
    }
}
