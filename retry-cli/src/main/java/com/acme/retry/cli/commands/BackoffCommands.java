package com.acme.retry.cli.commands;

import com.acme.retry.backoff.DefaultBackoff;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "backoff",
        description = "Inspect the default backoff",
        subcommands = {
                BackoffCommands.Schedule.class
        }
)
public class BackoffCommands {

    @Command(name = "schedule", description = "Print the delay range of the default backoff per attempt")
    static class Schedule implements Callable<Integer> {
        @Option(names = {"-a", "--attempts"}, description = "Number of attempts to show (default: 5)", defaultValue = "5")
        private int attempts;

        @Option(names = {"-f", "--format"}, description = "Output format: table or json (default: table)", defaultValue = "table")
        private String format;

        @Override
        public Integer call() {
            List<Map<String, Object>> rows = rows(attempts);
            if ("json".equalsIgnoreCase(format)) {
                try {
                    System.out.println(toJson(rows));
                } catch (Exception e) {
                    System.err.println("Error formatting JSON: " + e.getMessage());
                    return 1;
                }
            } else {
                printTable(rows);
            }
            return 0;
        }

        private void printTable(List<Map<String, Object>> rows) {
            System.out.println("Default backoff (seconds)");
            System.out.println("=".repeat(50));
            System.out.printf("%-10s %-12s %-12s %-12s%n", "Attempt", "Base", "Min", "Max");
            System.out.println("-".repeat(50));
            for (Map<String, Object> row : rows) {
                System.out.printf("%-10s %-12s %-12s %-12s%n",
                        row.get("attempt"), row.get("baseSeconds"), row.get("minSeconds"), row.get("maxSeconds"));
            }
            System.out.println("=".repeat(50));
        }
    }

    static List<Map<String, Object>> rows(int attempts) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("attempt", attempt);
            row.put("baseSeconds", DefaultBackoff.baseDelaySeconds(attempt));
            row.put("minSeconds", DefaultBackoff.minDelaySeconds(attempt));
            row.put("maxSeconds", DefaultBackoff.maxDelaySeconds(attempt));
            rows.add(row);
        }
        return rows;
    }

    static String toJson(List<Map<String, Object>> rows) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("schedule", rows);
        return mapper.writeValueAsString(result);
    }
}
