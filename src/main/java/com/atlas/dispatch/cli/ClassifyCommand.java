package com.atlas.dispatch.cli;

import com.atlas.core.intent.IntentClassifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: atlas classify "&lt;message&gt;"
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Classify a message as conversational or a task")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(index = "0", description = "Message to classify")
    private String message;

    private final IntentClassifier intentClassifier;

    public ClassifyCommand(IntentClassifier intentClassifier) {
        this.intentClassifier = intentClassifier;
    }

    @Override
    public void run() {
        ConsoleOutput.classification(intentClassifier.classify(message));
    }
}
