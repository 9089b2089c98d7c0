package com.livemux.peer;

import reactor.core.publisher.Mono;

/**
 * UpstreamClient defines the interface for talking to one Livestatus source.
 *
 * Every call opens a fresh connection, sends one request and, for queries, reads one
 * fixed16-framed response. Failures are signalled as {@link UpstreamException}.
 */
public interface UpstreamClient {

    /**
     * Send a GET request that asks for {@code ResponseHeader: fixed16}.
     *
     * @param request the complete request text, terminated by a blank line
     * @return Mono containing the response body without the fixed16 header
     */
    Mono<String> query(String request);

    /**
     * Deliver a COMMAND. Completes once the command has been written; the source does not
     * acknowledge commands.
     *
     * @param command the command line, e.g. {@code COMMAND [1473627610] SCHEDULE_HOST_CHECK;web1}
     */
    Mono<Void> command(String command);

    /**
     * @return the configured address, {@code host:port} or a socket path
     */
    String getAddress();
}
