package com.leumit.reportindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReportIndexerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReportIndexerApplication.class, args);
    }
}
