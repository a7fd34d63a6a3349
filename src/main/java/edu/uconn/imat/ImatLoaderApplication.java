package edu.uconn.imat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the iMAT raw loader.
 *
 * This application reads the iMAT label map spreadsheet and the per-split
 * JSON documents and bulk-loads them into the raw schema of a PostgreSQL
 * database, replacing each split's previous rows.
 */
@SpringBootApplication
public class ImatLoaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
            SpringApplication.run(ImatLoaderApplication.class, args)
        ));
    }
}
