package com.whereq.evtfilter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ evtfilter.
 * Extracts Windows event-log records through Log Parser in parallel and merges them
 * into a single delimited file.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class EvtFilterApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EvtFilterApplication.class, args)));
    }
}
