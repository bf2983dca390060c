package com.healloop.core.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks ticket searches return real tickets: a non-empty list whose entries all carry
 * {@code key} and {@code summary}. The list may be the result itself or sit under
 * {@code data}, {@code tickets} or {@code results}.
 */
@Component
public class TicketSearchValidator implements ToolValidator {

    static final String SEARCH_JQL = "jira_search_jql";
    static final String LIST_TICKETS = "jira_list_tickets";

    @Override
    public Set<String> tools() {
        return Set.of(SEARCH_JQL, LIST_TICKETS);
    }

    @Override
    public List<String> validateParameters(Map<String, Object> params) {
        if (params.containsKey("jql") && String.valueOf(params.get("jql")).isBlank()) {
            return List.of("JQL query is blank");
        }
        return List.of();
    }

    @Override
    public List<String> validateResult(Object result) {
        List<?> tickets = tickets(result);
        if (tickets == null) {
            return List.of("Result holds no ticket list");
        }
        if (tickets.isEmpty()) {
            return List.of("Empty results (0 tickets)");
        }
        var issues = new ArrayList<String>();
        for (int i = 0; i < tickets.size(); i++) {
            if (!(tickets.get(i) instanceof Map<?, ?> ticket)) {
                issues.add("Ticket " + i + " is not an object");
                continue;
            }
            var missing = new ArrayList<String>();
            if (ticket.get("key") == null) missing.add("key");
            if (ticket.get("summary") == null) missing.add("summary");
            if (!missing.isEmpty()) {
                issues.add("Ticket " + i + " is missing fields " + missing);
            }
        }
        return issues;
    }

    private static List<?> tickets(Object result) {
        if (result instanceof List<?> list) {
            return list;
        }
        if (result instanceof Map<?, ?> map) {
            for (String field : List.of("data", "tickets", "results")) {
                if (map.get(field) instanceof List<?> list) {
                    return list;
                }
            }
        }
        return null;
    }
}
