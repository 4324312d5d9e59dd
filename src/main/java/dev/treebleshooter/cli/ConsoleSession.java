package dev.treebleshooter.cli;

import dev.treebleshooter.engine.GuideNavigator;
import dev.treebleshooter.engine.NavigatorState;
import dev.treebleshooter.model.Answer;
import dev.treebleshooter.model.Node;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * Walks a started navigator on a text console. Commands: an answer number,
 * {@code b} to go back, {@code r} to restart, {@code q} to quit.
 */
public final class ConsoleSession {

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleSession(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Run until the user quits or input ends.
     *
     * @return the navigator state when the session ended
     */
    public NavigatorState run(GuideNavigator navigator) throws IOException {
        while (true) {
            NavigatorState state = navigator.state();
            if (state instanceof NavigatorState.AtSolution solution) {
                printSolution(navigator, solution);
            } else {
                printQuestion(navigator.currentNode().orElseThrow());
            }
            out.print("> ");
            out.flush();

            String line = in.readLine();
            if (line == null) {
                return navigator.state();
            }
            String command = line.trim().toLowerCase();
            switch (command) {
                case "q" -> {
                    return navigator.state();
                }
                case "r" -> navigator.restart();
                case "b" -> goBack(navigator);
                default -> choose(navigator, command);
            }
        }
    }

    private void goBack(GuideNavigator navigator) {
        // Going back from the first question would leave nothing to show.
        if (navigator.history().size() <= 1) {
            out.println("Already at the first question.");
            return;
        }
        navigator.goBack();
    }

    private void choose(GuideNavigator navigator, String command) {
        List<Answer> answers = navigator.availableAnswers();
        if (answers.isEmpty()) {
            out.println("Enter r to restart, b to go back or q to quit.");
            return;
        }
        int choice;
        try {
            choice = Integer.parseInt(command);
        } catch (NumberFormatException e) {
            choice = -1;
        }
        if (choice < 1 || choice > answers.size()) {
            out.printf("Please enter a number between 1 and %d, or b, r, q.%n", answers.size());
            return;
        }
        navigator.chooseAnswer(answers.get(choice - 1).answerId());
    }

    private void printQuestion(Node node) {
        out.println();
        out.println(node.question());
        if (node.description() != null && !node.description().isBlank()) {
            out.println(node.description());
        }
        if (node.helpText() != null && !node.helpText().isBlank()) {
            out.println("Hint: " + node.helpText());
        }
        List<Answer> answers = node.answers();
        for (int i = 0; i < answers.size(); i++) {
            out.printf("  %d) %s%n", i + 1, answers.get(i).answerText());
        }
        out.println("  [b]ack  [r]estart  [q]uit");
    }

    private void printSolution(GuideNavigator navigator, NavigatorState.AtSolution solution) {
        out.println();
        out.println("Solution: " + solution.solutionText());
        out.printf("Reached after %d question(s).%n", navigator.visitedNodeIds().size());
        out.println("  [b]ack  [r]estart  [q]uit");
    }
}
