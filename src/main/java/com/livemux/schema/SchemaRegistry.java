package com.livemux.schema;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of every table known to the front-end and its columns.
 *
 * Built once at startup and never mutated afterwards, so it is safe to share between
 * all peers and request threads.
 */
@Component
public class SchemaRegistry {

    public static final String BACKENDS = "backends";

    private final Map<String, Table> tables;

    public SchemaRegistry() {
        Map<String, Table> defined = new LinkedHashMap<>();

        Table status = withPeerColumns(Table.builder("status")
                .time("program_start", "last_command_check", "last_log_rotation")
                .string("program_version", "livestatus_version")
                .number("nagios_pid", "interval_length", "enable_notifications",
                        "execute_service_checks", "accept_passive_service_checks",
                        "execute_host_checks", "accept_passive_host_checks", "enable_event_handlers",
                        "enable_flap_detection", "process_performance_data",
                        "check_service_freshness", "check_host_freshness")
                .number("connections", "connections_rate", "host_checks", "host_checks_rate",
                        "service_checks", "service_checks_rate", "requests", "requests_rate"));
        defined.put(status.getName(), status);

        Table hosts = withPeerColumns(Table.builder("hosts")
                .prefix("host_")
                .string("name", "alias", "address", "display_name", "check_command", "check_period",
                        "notification_period", "plugin_output", "long_plugin_output", "perf_data",
                        "icon_image", "notes", "notes_url", "action_url", "event_handler")
                .number("state", "state_type", "hard_state", "has_been_checked", "is_executing",
                        "is_flapping", "acknowledged", "acknowledgement_type", "scheduled_downtime_depth",
                        "check_type", "current_attempt", "max_check_attempts", "latency",
                        "execution_time", "percent_state_change", "active_checks_enabled",
                        "passive_checks_enabled", "notifications_enabled", "event_handler_enabled",
                        "flap_detection_enabled", "obsess_over_host", "check_interval", "retry_interval",
                        "num_services", "num_services_ok", "num_services_warn", "num_services_crit",
                        "num_services_unknown", "num_services_pending", "worst_service_state",
                        "current_notification_number", "modified_attributes")
                .time("last_check", "next_check", "last_state_change", "last_hard_state_change",
                        "last_notification", "last_time_up", "last_time_down", "last_time_unreachable")
                .stringList("groups", "contacts", "contact_groups", "parents", "childs", "services")
                .numberList("comments", "downtimes")
                .map("custom_variables")
                .key("name"));
        defined.put(hosts.getName(), hosts);

        Table services = withPeerColumns(Table.builder("services")
                .prefix("service_")
                .string("host_name", "description", "display_name", "check_command", "check_period",
                        "notification_period", "plugin_output", "long_plugin_output", "perf_data",
                        "icon_image", "notes", "notes_url", "action_url", "event_handler")
                .number("state", "state_type", "has_been_checked", "is_executing", "is_flapping",
                        "acknowledged", "acknowledgement_type", "scheduled_downtime_depth", "check_type",
                        "current_attempt", "max_check_attempts", "latency", "execution_time",
                        "percent_state_change", "active_checks_enabled", "passive_checks_enabled",
                        "notifications_enabled", "event_handler_enabled", "flap_detection_enabled",
                        "check_interval", "retry_interval", "current_notification_number",
                        "modified_attributes")
                .time("last_check", "next_check", "last_state_change", "last_hard_state_change",
                        "last_notification", "last_time_ok", "last_time_warning", "last_time_critical",
                        "last_time_unknown")
                .stringList("groups", "contacts", "contact_groups")
                .numberList("comments", "downtimes")
                .map("custom_variables")
                .references(hosts, "host_name", "host_", "alias", "address", "display_name",
                        "state", "state_type", "has_been_checked", "latency", "check_command",
                        "acknowledged", "scheduled_downtime_depth", "last_check", "groups",
                        "contacts", "contact_groups", "notifications_enabled", "custom_variables")
                .key("host_name", "description"));
        defined.put(services.getName(), services);

        Table hostgroups = withPeerColumns(Table.builder("hostgroups")
                .prefix("hostgroup_")
                .string("name", "alias", "notes", "notes_url", "action_url")
                .stringList("members")
                .number("num_hosts", "num_hosts_up", "num_hosts_down", "num_hosts_unreach",
                        "num_hosts_pending", "num_services", "num_services_ok", "num_services_warn",
                        "num_services_crit", "num_services_unknown", "num_services_pending",
                        "worst_host_state", "worst_service_state")
                .key("name"));
        defined.put(hostgroups.getName(), hostgroups);

        Table servicegroups = withPeerColumns(Table.builder("servicegroups")
                .prefix("servicegroup_")
                .string("name", "alias", "notes", "notes_url", "action_url")
                .stringList("members")
                .number("num_services", "num_services_ok", "num_services_warn", "num_services_crit",
                        "num_services_unknown", "num_services_pending", "worst_service_state")
                .key("name"));
        defined.put(servicegroups.getName(), servicegroups);

        Table contacts = withPeerColumns(Table.builder("contacts")
                .prefix("contact_")
                .string("name", "alias", "email", "pager", "host_notification_period",
                        "service_notification_period")
                .number("can_submit_commands", "host_notifications_enabled",
                        "service_notifications_enabled", "in_host_notification_period",
                        "in_service_notification_period")
                .map("custom_variables")
                .key("name"));
        defined.put(contacts.getName(), contacts);

        Table contactgroups = withPeerColumns(Table.builder("contactgroups")
                .prefix("contactgroup_")
                .string("name", "alias")
                .stringList("members")
                .key("name"));
        defined.put(contactgroups.getName(), contactgroups);

        Table commands = withPeerColumns(Table.builder("commands")
                .prefix("command_")
                .string("name", "line")
                .key("name"));
        defined.put(commands.getName(), commands);

        Table timeperiods = withPeerColumns(Table.builder("timeperiods")
                .prefix("timeperiod_")
                .string("name", "alias")
                .number("in")
                .key("name"));
        defined.put(timeperiods.getName(), timeperiods);

        Table comments = withPeerColumns(Table.builder("comments")
                .prefix("comment_")
                .number("id")
                .string("author", "comment", "host_name", "service_description")
                .time("entry_time", "expire_time")
                .number("entry_type", "type", "is_service", "persistent", "source", "expires")
                .references(hosts, "host_name", "host_", "alias", "state", "groups")
                .key("id"));
        defined.put(comments.getName(), comments);

        Table downtimes = withPeerColumns(Table.builder("downtimes")
                .prefix("downtime_")
                .number("id")
                .string("author", "comment", "host_name", "service_description")
                .time("entry_time", "start_time", "end_time")
                .number("type", "is_service", "fixed", "duration", "triggered_by")
                .references(hosts, "host_name", "host_", "alias", "state", "groups")
                .key("id"));
        defined.put(downtimes.getName(), downtimes);

        Table log = withPeerColumns(Table.builder("log")
                .time("time")
                .number("class", "lineno", "state", "attempt")
                .string("type", "message", "options", "host_name", "service_description",
                        "contact_name", "command_name", "plugin_output", "state_type")
                .passthroughOnly());
        defined.put(log.getName(), log);

        Table backends = Table.builder(BACKENDS)
                .virtualTable()
                .string("peer_key", "peer_name", "key", "name", "addr")
                .number("status")
                .number("bytes_send", "bytes_received", "queries")
                .string("last_error")
                .time("last_update", "last_online")
                .number("response_time")
                .key("peer_key")
                .build();
        defined.put(backends.getName(), backends);

        Table hostsbygroup = withPeerColumns(
                Table.groupBy("hostsbygroup", hosts, "groups", "hostgroup_name")
                        .references(hostgroups, "hostgroup_name", "hostgroup_", "alias", "members"));
        defined.put(hostsbygroup.getName(), hostsbygroup);

        Table servicesbygroup = withPeerColumns(
                Table.groupBy("servicesbygroup", services, "groups", "servicegroup_name")
                        .references(servicegroups, "servicegroup_name", "servicegroup_", "alias", "members"));
        defined.put(servicesbygroup.getName(), servicesbygroup);

        Table servicesbyhostgroup = withPeerColumns(
                Table.groupBy("servicesbyhostgroup", services, "host_groups", "hostgroup_name")
                        .references(hostgroups, "hostgroup_name", "hostgroup_", "alias", "members"));
        defined.put(servicesbyhostgroup.getName(), servicesbyhostgroup);

        this.tables = Collections.unmodifiableMap(defined);
    }

    private static Table withPeerColumns(Table.Builder builder) {
        return builder
                .virtual("peer_key", ColumnType.STRING, (row, scope) -> scope.getPeerKey())
                .virtual("peer_name", ColumnType.STRING, (row, scope) -> scope.getPeerName())
                .build();
    }

    /**
     * @return the table with the given name, or null if it does not exist
     */
    public Table getTable(String name) {
        return tables.get(name);
    }

    public Collection<Table> getTables() {
        return tables.values();
    }
}
