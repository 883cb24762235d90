package com.xbleey.marketreport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketReportApplication.class, args);
    }

}
