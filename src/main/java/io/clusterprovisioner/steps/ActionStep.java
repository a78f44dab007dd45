package io.clusterprovisioner.steps;

import lombok.Getter;

/**
 * Single attempt of an action; its exception is the step error.
 */
public class ActionStep implements Step {

    @Getter
    private final String name;
    private final StepAction action;

    public ActionStep(String name, StepAction action) {
        this.name = name;
        this.action = action;
    }

    @Override
    public void run(RunContext ctx) throws Exception {
        action.run(ctx);
    }

    @Override
    public String toString() {
        return "[Action " + name + "]";
    }
}
