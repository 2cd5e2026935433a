package org.courtside.rotation.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.courtside.rotation.config.ObjectMapperFactory;
import org.courtside.rotation.scheduler.Candidate;
import org.courtside.rotation.scheduler.GeneratedQueue;
import org.courtside.rotation.scheduler.QueueBuilder;
import org.courtside.rotation.scheduler.QueueConfig;
import org.courtside.rotation.scheduler.RecencyInteractionScorer;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point that builds a queue from a JSON snapshot without running the
 * server. Useful for checking what the scheduler would pick for a given night.
 *
 * <p>Usage:
 * <pre>
 * java -cp rotation-scheduler.jar org.courtside.rotation.cli.QueueRunner \
 *   --input snapshot.json --rounds 3 --window 10
 * </pre>
 */
public class QueueRunner {

    public static void main(String[] args) {
        QueueRunOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        try {
            run(options, System.out);
        } catch (IOException e) {
            System.err.println("Failed to read snapshot: " + e.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid snapshot: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Reads the snapshot, builds the queue and prints it.
     */
    static GeneratedQueue run(QueueRunOptions options, PrintStream out) throws IOException {
        ObjectMapper mapper = ObjectMapperFactory.create();
        QueueSnapshot snapshot = mapper.readValue(options.input().toFile(), QueueSnapshot.class);
        GeneratedQueue queue = new QueueBuilder(options.config())
            .buildQueue(snapshot.participants(), snapshot.matches());
        formatQueue(queue).forEach(out::println);
        return queue;
    }

    static List<String> formatQueue(GeneratedQueue queue) {
        if (queue.termination() == GeneratedQueue.Termination.INSUFFICIENT_PARTICIPANTS) {
            return List.of("Not enough players");
        }
        List<String> lines = new ArrayList<>();
        int gameNumber = 1;
        for (Candidate match : queue.matches()) {
            lines.add("Game " + gameNumber++ + ": " + match);
        }
        if (lines.isEmpty()) {
            lines.add("No eligible games");
        }
        return lines;
    }

    static QueueRunOptions parseArgs(String[] args) {
        Path input = null;
        int rounds = QueueConfig.DEFAULT_MAX_QUEUE_ROUNDS;
        int window = RecencyInteractionScorer.DEFAULT_WINDOW;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--input" -> input = Path.of(requireValue(args, ++i, "--input"));
                case "--rounds" -> rounds = parseInt(requireValue(args, ++i, "--rounds"), "--rounds");
                case "--window" -> window = parseInt(requireValue(args, ++i, "--window"), "--window");
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }
        return new QueueRunOptions(input, new QueueConfig(rounds, window, QueueConfig.DEFAULT_PARALLEL_THRESHOLD));
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int parseInt(String value, String flag) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + value, e);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: QueueRunner --input <snapshot.json> [options]");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --input <file>     Snapshot with \"participants\" and \"matches\" (required)");
        System.err.println("  --rounds <n>       Maximum games to generate (default: 3)");
        System.err.println("  --window <n>       Recent matches considered for recency (default: 10)");
    }
}
