package dev.treebleshooter.engine;

/**
 * Where a navigator currently is. Exactly one of three forms.
 */
public sealed interface NavigatorState {

    NotStarted NOT_STARTED = new NotStarted();

    /** No guide is being walked, or history was rewound past the root. */
    record NotStarted() implements NavigatorState {}

    /** Waiting for the user to answer the question on {@code nodeId}. */
    record AtNode(String nodeId) implements NavigatorState {}

    /** The walk ended: answer {@code answerId} on {@code nodeId} was a solution. */
    record AtSolution(String nodeId, String answerId, String solutionText) implements NavigatorState {}
}
