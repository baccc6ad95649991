package com.atlas.dispatch.cli;

import com.atlas.core.context.ContextSummarizer;
import com.atlas.core.context.QuickSummarizer;
import com.atlas.core.model.ConversationMessage;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: atlas summarize &lt;messages.json&gt;
 * <p>
 * Reads a JSON array of {@code {role, content, timestamp?}} messages and prints
 * the compacted history, or with {@code --quick} the pattern-based summary.
 */
@Command(name = "summarize", mixinStandardHelpOptions = true,
        description = "Compact a conversation history file")
@Component
public class SummarizeCommand implements Callable<Integer> {

    private static final TypeReference<List<ConversationMessage>> MESSAGES = new TypeReference<>() {};

    @Parameters(index = "0", description = "JSON file containing the conversation")
    private Path file;

    @Option(names = {"--keep", "-k"}, description = "Recent messages to keep verbatim (default: configured value)")
    private Integer keep;

    @Option(names = {"--quick", "-q"}, description = "Pattern-based summary without a model call")
    private boolean quick;

    @Option(names = "--max-length", description = "Maximum length of the quick summary",
            defaultValue = "500")
    private int maxLength;

    private final ContextSummarizer contextSummarizer;

    public SummarizeCommand(ContextSummarizer contextSummarizer) {
        this.contextSummarizer = contextSummarizer;
    }

    @Override
    public Integer call() {
        List<ConversationMessage> messages;
        try {
            messages = CliJson.MAPPER.readValue(Files.readString(file), MESSAGES);
        } catch (IOException | IllegalArgumentException e) {
            ConsoleOutput.error("Cannot read conversation from " + file + ": " + e.getMessage());
            return 1;
        }
        if (keep != null && keep < 0) {
            ConsoleOutput.error("--keep must not be negative");
            return 2;
        }

        if (quick) {
            System.out.println(QuickSummarizer.summarize(messages, maxLength));
            return 0;
        }

        List<ConversationMessage> compacted = keep != null
                ? contextSummarizer.summarizeContext(messages, keep)
                : contextSummarizer.summarizeContext(messages);
        ConsoleOutput.info(messages.size() + " messages in, " + compacted.size() + " out");
        for (ConversationMessage m : compacted) {
            System.out.println("[" + m.role().wireName() + "] " + m.content());
        }
        return 0;
    }
}
