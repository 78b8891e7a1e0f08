package com.bank.fraudscreen.engine;

/**
 * One typed node of the screening graph. The declared types are checked when the graph is
 * assembled, so a stage can only be wired after one whose output it accepts.
 *
 * @param <I> input consumed by the stage
 * @param <O> output handed to the next stage, or the branch result for a sink
 */
public interface WorkflowStage<I, O> {

    String getName();

    Class<I> inputType();

    Class<O> outputType();

    O execute(I input);
}
