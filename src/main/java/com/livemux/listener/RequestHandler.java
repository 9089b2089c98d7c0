package com.livemux.listener;

import com.livemux.peer.PeerMap;
import com.livemux.peer.UpstreamException;
import com.livemux.query.BadRequestException;
import com.livemux.query.Request;
import com.livemux.query.RequestParser;
import com.livemux.response.ResponseEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.regex.Pattern;

/**
 * Answers one framed client request: parse, run on the peer map, encode.
 * Every failure becomes an error response; nothing is signalled to the connection.
 */
@Component
public class RequestHandler {

    private static final Logger log = LoggerFactory.getLogger(RequestHandler.class);

    // requests that fail to parse still get the header they asked for
    private static final Pattern FIXED16 = Pattern.compile("(?im)^ResponseHeader:\\s*fixed16\\s*$");

    private final RequestParser parser;
    private final PeerMap peerMap;
    private final ResponseEncoder encoder;

    public RequestHandler(RequestParser parser, PeerMap peerMap, ResponseEncoder encoder) {
        this.parser = parser;
        this.peerMap = peerMap;
        this.encoder = encoder;
    }

    public Mono<ClientResponse> handle(String text) {
        Request request;
        try {
            request = parser.parse(text);
        } catch (BadRequestException e) {
            log.debug("Rejected request: {}", e.getMessage());
            boolean fixed16 = FIXED16.matcher(text).find();
            return Mono.just(new ClientResponse(encoder.encodeError(e.getStatusCode(), e.getMessage(), fixed16), false));
        }

        Mono<byte[]> payload;
        if (request.isCommand()) {
            payload = peerMap.command(request)
                .then(Mono.fromCallable(() -> encoder.encodeCommand(request)));
        } else {
            payload = peerMap.execute(request)
                .flatMap(response -> Mono.fromCallable(() -> encoder.encode(request, response)));
        }
        return payload
            .onErrorResume(e -> Mono.just(encoder.encodeError(statusOf(e), String.valueOf(e.getMessage()),
                request.isFixed16())))
            .map(bytes -> new ClientResponse(bytes, request.isKeepAlive()));
    }

    private static int statusOf(Throwable error) {
        if (error instanceof BadRequestException) {
            log.debug("Rejected request: {}", error.getMessage());
            return ((BadRequestException) error).getStatusCode();
        }
        if (error instanceof UpstreamException) {
            log.warn("Upstream failure: {}", error.getMessage());
            return UpstreamException.STATUS_CODE;
        }
        log.error("Request failed", error);
        return 500;
    }
}
