package com.livemux;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for livemux.
 *
 * livemux is a Livestatus multiplexer: it mirrors the tables of several monitoring
 * sources and answers Livestatus queries over all of them from one endpoint.
 *
 * Key Features:
 * - Filters, stats, sorting and paging merged across all sources
 * - Group-by and virtual tables computed locally
 * - Blocking wait queries that never hold up other clients
 * - Commands forwarded to one or all sources
 */
@SpringBootApplication
public class LivemuxApplication {

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(LivemuxApplication.class, args);
    }
}
