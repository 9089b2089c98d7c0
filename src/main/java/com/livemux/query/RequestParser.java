package com.livemux.query;

import com.livemux.schema.SchemaRegistry;
import com.livemux.schema.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parser for the line-oriented Livestatus request language.
 *
 * A request is {@code GET <table>} or {@code COMMAND [<timestamp>] <text>} followed by
 * {@code Header: value} lines and terminated by a blank line or the end of input. Several
 * requests may be concatenated; {@link #parse(String, int)} consumes exactly one and reports
 * how much input it used.
 *
 * Filter, Stats and WaitCondition groups are built with explicit stacks local to one parse:
 * every leaf line pushes a node, every {@code And: N} / {@code Or: N} pops N nodes and pushes
 * one group.
 *
 * Every problem is reported as a {@link BadRequestException} before any peer is contacted.
 */
@Component
public class RequestParser {

    private static final Logger log = LoggerFactory.getLogger(RequestParser.class);

    private final SchemaRegistry schema;
    private final FilterParser filterParser;

    public RequestParser(SchemaRegistry schema) {
        this.schema = schema;
        this.filterParser = new FilterParser();
    }

    /**
     * Parse the first request of {@code text}.
     */
    public Request parse(String text) {
        return parse(text, 0).getRequest();
    }

    /**
     * Parse one request starting at character {@code offset}.
     */
    public ParsedRequest parse(String text, int offset) {
        List<String> lines = new ArrayList<>();
        int pos = offset;
        int end = text.length();
        while (pos < end) {
            int newline = text.indexOf('\n', pos);
            String line;
            if (newline < 0) {
                line = text.substring(pos);
                pos = end;
            } else {
                line = text.substring(pos, newline);
                pos = newline + 1;
            }
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            if (line.isEmpty()) {
                break;
            }
            lines.add(line);
        }
        int consumedBytes = text.substring(offset, pos).getBytes(StandardCharsets.UTF_8).length;
        Request request = build(lines);
        if (log.isDebugEnabled()) {
            log.debug("Parsed request ({} bytes): {}", consumedBytes, request.toString().trim());
        }
        return new ParsedRequest(request, consumedBytes, pos);
    }

    /**
     * Parse every request in {@code text}.
     */
    public List<Request> parseAll(String text) {
        List<Request> requests = new ArrayList<>();
        int offset = 0;
        while (offset < text.length() && !text.substring(offset).isBlank()) {
            ParsedRequest parsed = parse(text, offset);
            requests.add(parsed.getRequest());
            offset = parsed.getEnd();
        }
        return requests;
    }

    private Request build(List<String> lines) {
        if (lines.isEmpty()) {
            throw new BadRequestException("bad request: empty request");
        }
        String first = lines.get(0);
        List<String> headers = lines.subList(1, lines.size());
        if (first.startsWith("GET ")) {
            String tableName = first.substring(4).trim();
            Table table = schema.getTable(tableName);
            if (table == null) {
                throw new BadRequestException("bad request: table " + tableName + " does not exist", first);
            }
            return buildQuery(Request.get(table), headers);
        }
        if (first.startsWith("COMMAND ")) {
            return buildCommand(Request.command(first), headers);
        }
        throw new BadRequestException("bad request: " + first, first);
    }

    private Request buildQuery(Request request, List<String> headers) {
        Table table = request.getTable();
        List<Filter> filterStack = new ArrayList<>();
        List<Filter> statsStack = new ArrayList<>();
        List<Filter> waitStack = new ArrayList<>();

        for (String line : headers) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new BadRequestException("bad request header: " + line, line);
            }
            String header = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();

            switch (header) {
                case "columns":
                    request.setColumns(splitWords(value));
                    break;
                case "filter":
                    filterStack.add(filterParser.parseFilter(table, value, line));
                    break;
                case "and":
                    popGroup(filterStack, GroupOperator.AND, header, value, line, false);
                    break;
                case "or":
                    popGroup(filterStack, GroupOperator.OR, header, value, line, false);
                    break;
                case "stats":
                    statsStack.add(filterParser.parseStats(table, value, line));
                    break;
                case "statsand":
                    popGroup(statsStack, GroupOperator.AND, header, value, line, true);
                    break;
                case "statsor":
                    popGroup(statsStack, GroupOperator.OR, header, value, line, true);
                    break;
                case "sort":
                    request.getSort().add(parseSort(value, line));
                    break;
                case "limit":
                    request.setLimit(parseNonNegative(value, "bad request: limit must be a positive number", line));
                    break;
                case "offset":
                    request.setOffset(parseNonNegative(value, "bad request: offset must be a positive number", line));
                    break;
                case "backends":
                    request.setBackends(splitWords(value));
                    break;
                case "responseheader":
                    request.setFixed16(parseResponseHeader(value, line));
                    break;
                case "outputformat":
                    OutputFormat format = OutputFormat.fromValue(value);
                    if (format == null) {
                        throw new BadRequestException("bad request: unrecognized outputformat, "
                                + "only json and wrapped_json is supported", line);
                    }
                    request.setOutputFormat(format);
                    break;
                case "waittrigger":
                    if (!WaitTriggers.isKnown(value, schema)) {
                        throw new BadRequestException("bad request: unknown WaitTrigger " + value, line);
                    }
                    request.setWaitTrigger(value);
                    break;
                case "waitobject":
                    request.setWaitObject(value);
                    break;
                case "waittimeout":
                    request.setWaitTimeout(
                            parseNonNegative(value, "bad request: waittimeout must be a positive number", line));
                    break;
                case "waitcondition":
                    waitStack.add(filterParser.parseFilter(table, value, line));
                    break;
                case "waitconditionand":
                    popGroup(waitStack, GroupOperator.AND, header, value, line, false);
                    break;
                case "waitconditionor":
                    popGroup(waitStack, GroupOperator.OR, header, value, line, false);
                    break;
                case "keepalive":
                    request.setKeepAlive(parseKeepAlive(value, line));
                    break;
                default:
                    throw new BadRequestException("bad request: unrecognized header " + line, line);
            }
        }

        request.setFilters(filterStack);
        request.setStats(statsStack);
        request.setWaitCondition(waitStack);

        if (request.getWaitTrigger() != null) {
            if (waitStack.isEmpty()) {
                throw new BadRequestException("bad request: WaitTrigger without WaitCondition");
            }
            if (request.getWaitTimeout() == null) {
                throw new BadRequestException("bad request: WaitTrigger without WaitTimeout");
            }
            if (request.getWaitObject() == null) {
                throw new BadRequestException("bad request: WaitTrigger without WaitObject");
            }
        }

        request.resolveOutputColumns();
        return request;
    }

    private Request buildCommand(Request request, List<String> headers) {
        for (String line : headers) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new BadRequestException("bad request header: " + line, line);
            }
            String header = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).trim();
            switch (header) {
                case "backends":
                    request.setBackends(splitWords(value));
                    break;
                case "responseheader":
                    request.setFixed16(parseResponseHeader(value, line));
                    break;
                case "keepalive":
                    request.setKeepAlive(parseKeepAlive(value, line));
                    break;
                default:
                    throw new BadRequestException("bad request: unrecognized header " + line, line);
            }
        }
        return request;
    }

    private static void popGroup(List<Filter> stack, GroupOperator operator, String header, String value,
                                 String line, boolean stats) {
        int count;
        try {
            count = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            count = -1;
        }
        if (count < 0) {
            throw new BadRequestException("bad request: " + header + " must be a positive number in: " + line, line);
        }
        if (stack.size() < count) {
            throw new BadRequestException("bad request: not enough filter on stack in " + line, line);
        }
        List<Filter> popped = stack.subList(stack.size() - count, stack.size());
        List<Filter> children = new ArrayList<>(popped);
        popped.clear();
        if (stats) {
            for (Filter child : children) {
                if (child.getStatsType().isReducer()) {
                    throw new BadRequestException("bad request: stats functions cannot be combined in " + line, line);
                }
            }
        }
        stack.add(Filter.group(operator, children));
    }

    private static SortField parseSort(String value, String line) {
        String[] parts = value.isEmpty() ? new String[0] : value.split("\\s+");
        if (parts.length != 2 && parts.length != 3) {
            throw new BadRequestException("bad request: invalid sort header, must be 'Sort: <field> <asc|desc>' "
                    + "or 'Sort: custom_variables <name> <asc|desc>'", line);
        }
        SortDirection direction = SortDirection.fromValue(parts[parts.length - 1]);
        if (direction == null) {
            throw new BadRequestException("bad request: unrecognized sort direction, must be asc or desc", line);
        }
        return parts.length == 3
                ? new SortField(parts[0], direction, parts[1])
                : new SortField(parts[0], direction);
    }

    private static int parseNonNegative(String value, String message, String line) {
        try {
            int number = Integer.parseInt(value);
            if (number >= 0) {
                return number;
            }
        } catch (NumberFormatException e) {
            log.debug("Not a number in {}", line);
        }
        throw new BadRequestException(message, line);
    }

    private static boolean parseResponseHeader(String value, String line) {
        if ("fixed16".equals(value)) {
            return true;
        }
        if ("off".equals(value)) {
            return false;
        }
        throw new BadRequestException("bad request: unrecognized responseformat, only fixed16 is supported", line);
    }

    private static boolean parseKeepAlive(String value, String line) {
        if ("on".equals(value)) {
            return true;
        }
        if ("off".equals(value)) {
            return false;
        }
        throw new BadRequestException("bad request: must be 'on' or 'off' in " + line, line);
    }

    private static List<String> splitWords(String value) {
        if (value.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(value.split("\\s+")));
    }
}
