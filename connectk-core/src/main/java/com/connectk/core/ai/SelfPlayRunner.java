package com.connectk.core.ai;

import com.connectk.core.BoardGeometry;
import com.connectk.core.ConnectKEngine;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link SelfPlay} sessions with configurable parameters.
 */
public final class SelfPlayRunner {

    private static final Logger LOGGER = Logger.getLogger(SelfPlayRunner.class.getName());

    private SelfPlayRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 4) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            BoardGeometry geometry = new BoardGeometry(Integer.parseInt(args[1]), Integer.parseInt(args[2]),
                    Integer.parseInt(args[3]));
            MctsConfig.Builder config = MctsConfig.builder();

            for (int index = 4; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--iterations=")) {
                    config.iterations(Long.parseLong(option.substring("--iterations=".length())));
                } else if (option.startsWith("--timeMillis=")) {
                    config.timeMillis(Long.parseLong(option.substring("--timeMillis=".length())));
                } else if (option.startsWith("--seed=")) {
                    config.seed(Long.parseLong(option.substring("--seed=".length())));
                } else if (option.startsWith("--exploration=")) {
                    config.explorationConstant(Double.parseDouble(option.substring("--exploration=".length())));
                } else if (option.startsWith("--rollouts=")) {
                    config.rolloutsPerLeaf(Integer.parseInt(option.substring("--rollouts=".length())));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            SelfPlay selfPlay = new SelfPlay(new ConnectKEngine(geometry, config.build()));
            selfPlay.playGames(gameCount);
            System.out.printf("First player wins: %d, second player wins: %d, draws: %d, average length: %.1f%n",
                    selfPlay.getFirstPlayerWins(), selfPlay.getSecondPlayerWins(), selfPlay.getDraws(),
                    selfPlay.getAverageGameLength());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: SelfPlayRunner <gameCount> <width> <height> <connectLength> "
                        + "[--iterations=<n>|--timeMillis=<ms>] [--seed=<n>] [--exploration=<c>] [--rollouts=<n>]");
    }
}
