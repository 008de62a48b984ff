package work.lcod.taskgen.syntax;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.taskgen.shared.ValidationException;
import work.lcod.taskgen.syntax.ParsedPipeline.Agent;
import work.lcod.taskgen.syntax.ParsedPipeline.Stage;
import work.lcod.taskgen.syntax.ParsedPipeline.StageStep;

class ParsedPipelineValidatorTest {
    private final ParsedPipelineValidator validator = new ParsedPipelineValidator();

    @Test
    void acceptsWellFormedPipeline() {
        var pipeline = new ParsedPipeline(new Agent("golang:1.12", null), List.of(), List.of(
            Stage.withSteps("build", StageStep.sh("make build")),
            Stage.withStages("deploy", Stage.withSteps("staging", StageStep.sh("make deploy")))
        ));
        assertDoesNotThrow(() -> validator.validate(pipeline));
    }

    @Test
    void pipelineWithoutStagesIsInvalid() {
        var ex = assertThrows(ValidationException.class,
            () -> validator.validate(new ParsedPipeline(new Agent("golang", null), List.of(), List.of())));
        assertEquals(1, ex.problems().size());
    }

    @Test
    void reportsEveryProblem() {
        var pipeline = new ParsedPipeline(null, List.of(), List.of(
            Stage.withSteps("Build", new StageStep(null, "", List.of(), null, "golang")),
            Stage.withSteps("build", StageStep.sh("make")),
            new Stage("empty", null, List.of(), List.of(), List.of())
        ));

        var ex = assertThrows(ValidationException.class, () -> validator.validate(pipeline));

        assertEquals(4, ex.problems().size());
        assertTrue(ex.getMessage().startsWith("Validation failed for Pipeline: "));
        assertTrue(ex.problems().contains("stage 'build' has a duplicate name"));
        assertTrue(ex.problems().contains("stage 'Build' has a step without a command"));
        assertTrue(ex.problems().contains("stage 'build' has a step without an image and no agent to take one from"));
        assertTrue(ex.problems().contains("stage 'empty' must have either steps or nested stages"));
    }

    @Test
    void stageAgentAppliesToNestedStages() {
        var nested = new Stage("deploy", new Agent(null, "helm"), List.of(), List.of(), List.of(
            Stage.withSteps("staging", StageStep.sh("helm upgrade"))
        ));
        assertDoesNotThrow(() -> validator.validate(new ParsedPipeline(null, List.of(), List.of(nested))));
    }
}
