package com.mcr.core.strategy.handler;

import com.mcr.core.artifact.Artifact;
import com.mcr.core.strategy.Step;
import com.mcr.core.strategy.StepAction;
import com.mcr.core.strategy.StepHandler;
import com.mcr.core.strategy.StepInput;
import com.mcr.core.strategy.StepKind;
import com.mcr.core.strategy.transform.TransformRegistry;
import org.springframework.stereotype.Component;

@Component
public class TransformStepHandler implements StepHandler<StepAction.Transform> {

    private final TransformRegistry transforms;

    public TransformStepHandler(TransformRegistry transforms) {
        this.transforms = transforms;
    }

    @Override
    public StepKind kind() {
        return StepKind.TRANSFORM;
    }

    @Override
    public Class<StepAction.Transform> actionType() {
        return StepAction.Transform.class;
    }

    @Override
    public Artifact handle(Step step, StepAction.Transform action, StepInput input) {
        return transforms.get(action.transform()).apply(input, action.params());
    }
}
