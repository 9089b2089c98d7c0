package com.livemux.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.livemux.domain.QueryResponse;
import com.livemux.query.OutputFormat;
import com.livemux.query.Request;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Serializes responses for clients.
 *
 * {@code json} writes the row array, {@code wrapped_json} the whole {@link QueryResponse}.
 * With {@code ResponseHeader: fixed16} the payload is prefixed by a 16 byte header holding
 * the status code and the payload length.
 */
@Component
public class ResponseEncoder {

    public static final int HEADER_SIZE = 16;

    private final ObjectMapper objectMapper;

    public ResponseEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(Request request, QueryResponse response) throws JsonProcessingException {
        byte[] body;
        if (request.getEffectiveOutputFormat() == OutputFormat.WRAPPED_JSON) {
            body = objectMapper.writeValueAsBytes(response);
        } else {
            body = objectMapper.writeValueAsBytes(response.getData());
        }
        return frame(200, withNewline(body), request.isFixed16());
    }

    /**
     * Commands produce no payload; only the header is written when requested.
     */
    public byte[] encodeCommand(Request request) {
        return frame(200, new byte[0], request.isFixed16());
    }

    public byte[] encodeError(int status, String message, boolean fixed16) {
        return frame(status, (message + "\n").getBytes(StandardCharsets.UTF_8), fixed16);
    }

    static String header(int status, int length) {
        return String.format("%3d %11d\n", status, length);
    }

    private static byte[] frame(int status, byte[] body, boolean fixed16) {
        if (!fixed16) {
            return body;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(HEADER_SIZE + body.length);
        out.writeBytes(header(status, body.length).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(body);
        return out.toByteArray();
    }

    private static byte[] withNewline(byte[] body) {
        byte[] terminated = new byte[body.length + 1];
        System.arraycopy(body, 0, terminated, 0, body.length);
        terminated[body.length] = '\n';
        return terminated;
    }
}
