package com.acme.retry.cli.commands;

import com.acme.retry.cli.config.CliConfiguration;
import com.acme.retry.cli.service.RetryMqService;
import com.acme.retry.config.RetryConfig;
import com.acme.retry.config.RetryOptions;
import com.acme.retry.config.RetryTopologyConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
        name = "topology",
        description = "Retry topology operations",
        subcommands = {
                TopologyCommands.Declare.class,
                TopologyCommands.Show.class
        }
)
public class TopologyCommands {

    @Command(name = "declare", description = "Declare the main exchange, main queue and retry queue")
    static class Declare implements Callable<Integer> {
        @Option(names = {"-m", "--max-attempts"}, description = "Max attempts (default: RETRY_MAX_ATTEMPTS or 5)")
        private Integer maxAttempts;

        @Override
        public Integer call() {
            CliConfiguration config = CliConfiguration.getInstance();
            RetryOptions options = RetryOptions.builder()
                    .maxAttempts(maxAttempts != null ? maxAttempts : config.getMaxAttempts())
                    .build();
            try {
                RetryConfig retryConfig = new RetryMqService(config).declareTopology(options);
                System.out.println("Retry topology declared");
                System.out.println("=".repeat(60));
                printNames(retryConfig.mainExchange(), retryConfig.mainQueue(), retryConfig.retryQueue(),
                        retryConfig.mainRoutingKey(), retryConfig.retryRoutingKey());
                System.out.println("Max attempts:      " + retryConfig.maxAttempts());
                System.out.println("=".repeat(60));
                return 0;
            } catch (Exception e) {
                System.err.println("Error declaring topology: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "show", description = "Show the configured topology names without contacting the broker")
    static class Show implements Runnable {
        @Override
        public void run() {
            RetryTopologyConfig names = CliConfiguration.getInstance().getTopologyConfig();
            printNames(names.getMainExchange(), names.getMainQueue(), names.getRetryQueue(),
                    names.getMainRoutingKey(), names.getRetryRoutingKey());
        }
    }

    static void printNames(String exchange, String mainQueue, String retryQueue, String mainKey, String retryKey) {
        System.out.println("Exchange (direct): " + exchange);
        System.out.println("Main queue:        " + mainQueue + " <- " + mainKey);
        System.out.println("Retry queue:       " + retryQueue + " <- " + retryKey
                + " (dead-letters to " + exchange + "/" + mainKey + ")");
    }
}
