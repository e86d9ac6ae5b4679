package com.connectk.core;

import com.connectk.core.ai.MctsConfig;
import com.connectk.core.ai.SearchResult;
import com.connectk.core.ai.SearchTelemetry;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Simple console front-end for playing a connect-K match against the engine.
 *
 * <p>Usage: {@code ConnectKCLI [width height connectLength] [--second] [--iterations=<n>] [--seed=<n>]}.
 */
public final class ConnectKCLI {

    private static final Logger LOGGER = Logger.getLogger(ConnectKCLI.class.getName());

    private ConnectKCLI() {
    }

    public static void main(String[] args) {
        BoardGeometry geometry = BoardGeometry.CONNECT_FOUR;
        MctsConfig.Builder config = MctsConfig.builder().seed(System.nanoTime());
        Player human = Player.FIRST;
        try {
            int index = 0;
            if (args.length >= 3 && !args[0].startsWith("--")) {
                geometry = new BoardGeometry(Integer.parseInt(args[0]), Integer.parseInt(args[1]),
                        Integer.parseInt(args[2]));
                index = 3;
            }
            for (; index < args.length; index++) {
                String option = args[index];
                if ("--second".equals(option)) {
                    human = Player.SECOND;
                } else if (option.startsWith("--iterations=")) {
                    config.iterations(Long.parseLong(option.substring("--iterations=".length())));
                } else if (option.startsWith("--seed=")) {
                    config.seed(Long.parseLong(option.substring("--seed=".length())));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
            return;
        }

        ConnectKEngine engine = new ConnectKEngine(geometry, config.build());
        Scanner scanner = new Scanner(System.in);
        GameState state = engine.newGame();

        System.out.printf("Connect-%d on a %dx%d board, console edition%n", geometry.connectLength(),
                geometry.width(), geometry.height());
        while (!state.isTerminal()) {
            System.out.print(state.getBoard());
            if (state.getCurrentPlayer() != human) {
                SearchResult result = engine.analyse(state);
                printStatistics(result.telemetry());
                System.out.printf("Engine plays column %d%n", result.move());
                state = engine.applyMove(state, result.move());
                continue;
            }

            System.out.printf("Your move (%c), choose a column (0-%d): ", human.symbol(), geometry.width() - 1);
            if (!scanner.hasNextLine()) {
                return;
            }
            String input = scanner.nextLine().trim();
            int column;
            try {
                column = Integer.parseInt(input);
            } catch (NumberFormatException ex) {
                System.out.println("Please enter a valid column index.");
                continue;
            }

            try {
                state = engine.applyMove(state, column);
            } catch (InvalidMoveException ex) {
                System.out.println(ex.getMessage() + ". Choose another one.");
            }
        }

        System.out.print(state.getBoard());
        GameResult result = engine.result(state);
        if (result.status() == GameResult.Status.DRAW) {
            System.out.println("The game is a draw.");
        } else {
            System.out.println(result.winner() == human ? "You win!" : "The engine wins.");
        }
    }

    private static void printUsage() {
        System.err.println("Usage: ConnectKCLI [<width> <height> <connectLength>] [--second] [--iterations=<n>] "
                + "[--seed=<n>]");
    }

    private static void printStatistics(SearchTelemetry telemetry) {
        for (SearchTelemetry.ChildStatistics child : telemetry.rootChildren()) {
            System.out.printf("  column %d: visits=%d, average=%.3f%n", child.move(), child.visits(),
                    child.averageReward());
        }
    }
}
