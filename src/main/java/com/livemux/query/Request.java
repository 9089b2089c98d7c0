package com.livemux.query;

import com.livemux.schema.Column;
import com.livemux.schema.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured form of a client request.
 *
 * A request is either a GET query against one table or a COMMAND forwarded to the
 * backends. {@link #toString()} writes the request back in request syntax with the
 * headers in canonical order: ResponseHeader, OutputFormat, Columns, Backends, Limit,
 * Offset, Sort, Filter, Stats, WaitTrigger, WaitObject, WaitTimeout, WaitCondition,
 * Keepalive.
 */
public class Request {

    public enum Type { GET, COMMAND }

    private final Type type;
    private final Table table;
    private final String command;

    private List<String> columns = new ArrayList<>();
    private List<Filter> filters = new ArrayList<>();
    private List<Filter> stats = new ArrayList<>();
    private List<SortField> sort = new ArrayList<>();
    private Integer limit;
    private int offset;
    private OutputFormat outputFormat;
    private boolean fixed16;
    private List<String> backends = new ArrayList<>();
    private String waitTrigger;
    private String waitObject;
    private Integer waitTimeout;
    private List<Filter> waitCondition = new ArrayList<>();
    private Boolean keepAlive;

    private List<Column> outputColumns = Collections.emptyList();

    private Request(Type type, Table table, String command) {
        this.type = type;
        this.table = table;
        this.command = command;
    }

    public static Request get(Table table) {
        return new Request(Type.GET, table, null);
    }

    /**
     * @param command the full command line, e.g. {@code COMMAND [1473627610] SCHEDULE_HOST_CHECK;web1}
     */
    public static Request command(String command) {
        return new Request(Type.COMMAND, null, command);
    }

    /**
     * Copy with independent header lists; filter nodes are immutable and shared.
     */
    public Request copy() {
        Request copy = new Request(type, table, command);
        copy.columns = new ArrayList<>(columns);
        copy.filters = new ArrayList<>(filters);
        copy.stats = new ArrayList<>(stats);
        copy.sort = new ArrayList<>();
        for (SortField field : sort) {
            copy.sort.add(field.copy());
        }
        copy.limit = limit;
        copy.offset = offset;
        copy.outputFormat = outputFormat;
        copy.fixed16 = fixed16;
        copy.backends = new ArrayList<>(backends);
        copy.waitTrigger = waitTrigger;
        copy.waitObject = waitObject;
        copy.waitTimeout = waitTimeout;
        copy.waitCondition = new ArrayList<>(waitCondition);
        copy.keepAlive = keepAlive;
        copy.outputColumns = outputColumns;
        return copy;
    }

    /**
     * Resolve the response column layout and point every sort field at its position in it.
     *
     * Without a Columns header the layout is every column of the table. For stats queries
     * the layout starts with the group-by columns, followed by one value per stats entry.
     *
     * @throws BadRequestException if a sort field is not part of the response
     */
    public void resolveOutputColumns() {
        if (type != Type.GET) {
            return;
        }
        List<Column> resolved = new ArrayList<>();
        if (columns.isEmpty()) {
            if (stats.isEmpty()) {
                resolved.addAll(table.getColumns());
            }
        } else {
            for (String name : columns) {
                resolved.add(table.getColumnOrEmpty(name));
            }
        }
        this.outputColumns = Collections.unmodifiableList(resolved);

        for (SortField field : sort) {
            int index = indexOfOutputColumn(field.getName());
            if (index < 0) {
                throw new BadRequestException(
                        "bad request: sort column " + field.getName() + " not in result set");
            }
            field.setIndex(index);
        }
    }

    private int indexOfOutputColumn(String name) {
        List<String> names = getOutputColumnNames();
        for (int i = 0; i < outputColumns.size(); i++) {
            if (names.get(i).equals(name)) {
                return i;
            }
        }
        Column wanted = table.getColumn(name);
        if (wanted == null) {
            return -1;
        }
        return outputColumns.indexOf(wanted);
    }

    /**
     * Names of the response columns, as requested by the client.
     */
    public List<String> getOutputColumnNames() {
        List<String> names = new ArrayList<>();
        if (columns.isEmpty()) {
            for (Column column : outputColumns) {
                names.add(column.getName());
            }
        } else {
            names.addAll(columns);
        }
        for (int i = 1; i <= stats.size(); i++) {
            names.add("stats_" + i);
        }
        return names;
    }

    public boolean isCommand() {
        return type == Type.COMMAND;
    }

    public boolean isStatsQuery() {
        return !stats.isEmpty();
    }

    /**
     * Columns and Stats both set: one output row per distinct column value tuple.
     */
    public boolean isGroupedStats() {
        return !stats.isEmpty() && !columns.isEmpty();
    }

    public boolean isWaiting() {
        return waitTrigger != null;
    }

    public boolean isKeepAlive() {
        return Boolean.TRUE.equals(keepAlive);
    }

    public OutputFormat getEffectiveOutputFormat() {
        return outputFormat == null ? OutputFormat.JSON : outputFormat;
    }

    public Type getType() {
        return type;
    }

    public Table getTable() {
        return table;
    }

    public String getCommand() {
        return command;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<Column> getOutputColumns() {
        return outputColumns;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public void setFilters(List<Filter> filters) {
        this.filters = filters;
    }

    public List<Filter> getStats() {
        return stats;
    }

    public void setStats(List<Filter> stats) {
        this.stats = stats;
    }

    public List<SortField> getSort() {
        return sort;
    }

    public void setSort(List<SortField> sort) {
        this.sort = sort;
    }

    /**
     * @return maximum number of rows, null when unlimited
     */
    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        this.offset = offset;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(OutputFormat outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean isFixed16() {
        return fixed16;
    }

    public void setFixed16(boolean fixed16) {
        this.fixed16 = fixed16;
    }

    public List<String> getBackends() {
        return backends;
    }

    public void setBackends(List<String> backends) {
        this.backends = backends;
    }

    public String getWaitTrigger() {
        return waitTrigger;
    }

    public void setWaitTrigger(String waitTrigger) {
        this.waitTrigger = waitTrigger;
    }

    public String getWaitObject() {
        return waitObject;
    }

    public void setWaitObject(String waitObject) {
        this.waitObject = waitObject;
    }

    /**
     * @return wait timeout in milliseconds, 0 waits until shutdown
     */
    public Integer getWaitTimeout() {
        return waitTimeout;
    }

    public void setWaitTimeout(Integer waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    public List<Filter> getWaitCondition() {
        return waitCondition;
    }

    public void setWaitCondition(List<Filter> waitCondition) {
        this.waitCondition = waitCondition;
    }

    public Boolean getKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(Boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (type == Type.COMMAND) {
            sb.append(command).append('\n');
            if (fixed16) {
                sb.append("ResponseHeader: fixed16\n");
            }
            if (!backends.isEmpty()) {
                sb.append("Backends: ").append(String.join(" ", backends)).append('\n');
            }
            appendKeepAlive(sb);
            return sb.append('\n').toString();
        }

        sb.append("GET ").append(table.getName()).append('\n');
        if (fixed16) {
            sb.append("ResponseHeader: fixed16\n");
        }
        if (outputFormat != null) {
            sb.append("OutputFormat: ").append(outputFormat.getValue()).append('\n');
        }
        if (!columns.isEmpty()) {
            sb.append("Columns: ").append(String.join(" ", columns)).append('\n');
        }
        if (!backends.isEmpty()) {
            sb.append("Backends: ").append(String.join(" ", backends)).append('\n');
        }
        if (limit != null) {
            sb.append("Limit: ").append(limit).append('\n');
        }
        if (offset > 0) {
            sb.append("Offset: ").append(offset).append('\n');
        }
        for (SortField field : sort) {
            sb.append("Sort: ").append(field).append('\n');
        }
        for (Filter filter : filters) {
            filter.appendTo(sb, "Filter");
        }
        for (Filter stat : stats) {
            stat.appendTo(sb, "Stats");
        }
        if (waitTrigger != null) {
            sb.append("WaitTrigger: ").append(waitTrigger).append('\n');
        }
        if (waitObject != null) {
            sb.append("WaitObject: ").append(waitObject).append('\n');
        }
        if (waitTimeout != null) {
            sb.append("WaitTimeout: ").append(waitTimeout).append('\n');
        }
        for (Filter condition : waitCondition) {
            condition.appendTo(sb, "WaitCondition");
        }
        appendKeepAlive(sb);
        return sb.append('\n').toString();
    }

    private void appendKeepAlive(StringBuilder sb) {
        if (keepAlive != null) {
            sb.append("Keepalive: ").append(keepAlive ? "on" : "off").append('\n');
        }
    }
}
