package io.hearthwarrio.statetrail.core.action;

import io.hearthwarrio.statetrail.core.TaskContext;

import java.util.List;

/**
 * External collaborator that turns a task description into an ordered action list.
 * <p>
 * Implementations may consult a language model, static rules or a prepared plan file.
 */
@FunctionalInterface
public interface ActionPlanner {

    /**
     * @param task task description
     * @return ordered actions; empty when no plan could be produced
     */
    List<Action> plan(TaskContext task);
}
