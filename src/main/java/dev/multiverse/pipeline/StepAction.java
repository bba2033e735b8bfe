package dev.multiverse.pipeline;

/**
 * User-supplied work for one pipeline step. Anything thrown fails the current universe only.
 */
@FunctionalInterface
public interface StepAction {

    void apply(StepContext context) throws Exception;
}
