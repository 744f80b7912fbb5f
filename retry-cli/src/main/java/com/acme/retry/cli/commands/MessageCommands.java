package com.acme.retry.cli.commands;

import com.acme.retry.backoff.DefaultBackoff;
import com.acme.retry.cli.config.CliConfiguration;
import com.acme.retry.cli.service.RetryMqService;
import com.acme.retry.config.RetryCallOptions;
import com.acme.retry.config.RetryOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(
        name = "messages",
        description = "Publish test messages and run a retrying consumer",
        subcommands = {
                MessageCommands.Publish.class,
                MessageCommands.Consume.class
        }
)
public class MessageCommands {

    @Command(name = "publish", description = "Publish a message to the main exchange")
    static class Publish implements Callable<Integer> {
        @Parameters(index = "0", description = "Message body")
        private String body;

        @Option(names = {"-t", "--content-type"}, description = "Content type (default: text/plain)", defaultValue = "text/plain")
        private String contentType;

        @Option(names = {"-n", "--count"}, description = "Number of copies to publish (default: 1)", defaultValue = "1")
        private int count;

        @Override
        public Integer call() {
            try {
                RetryMqService service = new RetryMqService(CliConfiguration.getInstance());
                for (int i = 0; i < count; i++) {
                    service.publish(body, contentType);
                }
                System.out.println("Published " + count + " message(s)");
                return 0;
            } catch (Exception e) {
                System.err.println("Error publishing message: " + e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "consume", description = "Consume the main queue and schedule a retry for every message")
    static class Consume implements Callable<Integer> {
        @Option(names = {"-m", "--max-attempts"}, description = "Max attempts (default: RETRY_MAX_ATTEMPTS or 5)")
        private Integer maxAttempts;

        @Option(names = {"-d", "--delay"}, description = "Fixed delay in seconds for every retry, bypassing backoff")
        private Integer delaySeconds;

        @Option(names = "--fixed-backoff", description = "Use attempt^4 + 5 seconds without jitter")
        private boolean fixedBackoff;

        @Option(names = {"-l", "--limit"}, description = "Stop after this many messages (default: 0, no limit)", defaultValue = "0")
        private int limit;

        @Override
        public Integer call() {
            CliConfiguration config = CliConfiguration.getInstance();
            try {
                RetryMqService.ConsumeSummary summary =
                        new RetryMqService(config).consume(retryOptions(config), callOptions(), limit);
                System.out.println("Retried: " + summary.retried() + ", dropped: " + summary.dropped());
                return 0;
            } catch (Exception e) {
                System.err.println("Error consuming messages: " + e.getMessage());
                return 1;
            }
        }

        RetryOptions retryOptions(CliConfiguration config) {
            RetryOptions.Builder builder = RetryOptions.builder()
                    .maxAttempts(maxAttempts != null ? maxAttempts : config.getMaxAttempts());
            if (fixedBackoff) {
                builder.backoff(DefaultBackoff::baseDelaySeconds);
            }
            return builder.build();
        }

        RetryCallOptions callOptions() {
            return delaySeconds != null ? RetryCallOptions.delayInSeconds(delaySeconds) : RetryCallOptions.none();
        }
    }
}
