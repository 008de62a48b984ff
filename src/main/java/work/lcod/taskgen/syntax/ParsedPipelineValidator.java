package work.lcod.taskgen.syntax;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import work.lcod.taskgen.shared.KubeNames;
import work.lcod.taskgen.shared.ValidationException;

public final class ParsedPipelineValidator {

    public void validate(ParsedPipeline pipeline) {
        var problems = new ArrayList<String>();
        if (pipeline.stages().isEmpty()) {
            problems.add("a pipeline must declare at least one stage");
        }
        validateStages(pipeline.stages(), pipeline.agent(), "", new HashSet<>(), problems);
        if (!problems.isEmpty()) {
            throw new ValidationException("Pipeline", problems);
        }
    }

    private void validateStages(
        List<ParsedPipeline.Stage> stages,
        ParsedPipeline.Agent inheritedAgent,
        String path,
        Set<String> seenNames,
        List<String> problems
    ) {
        for (ParsedPipeline.Stage stage : stages) {
            String name = stage.name() == null ? "" : stage.name();
            String where = path.isEmpty() ? "stage '" + name + "'" : "stage '" + path + "/" + name + "'";
            if (KubeNames.toValidName(name).isEmpty()) {
                problems.add("every stage needs a name made of letters or digits (" + where + ")");
            } else if (!seenNames.add(KubeNames.toValidName(name))) {
                problems.add(where + " has a duplicate name");
            }
            boolean hasSteps = !stage.steps().isEmpty();
            boolean hasStages = !stage.stages().isEmpty();
            if (hasSteps == hasStages) {
                problems.add(where + " must have either steps or nested stages");
            }
            ParsedPipeline.Agent agent = stage.agent() != null && !stage.agent().isEmpty() ? stage.agent() : inheritedAgent;
            for (ParsedPipeline.StageStep step : stage.steps()) {
                if (step.command() == null || step.command().isBlank()) {
                    problems.add(where + " has a step without a command");
                }
                boolean hasImage = step.image() != null && !step.image().isBlank();
                if (!hasImage && (agent == null || agent.isEmpty())) {
                    problems.add(where + " has a step without an image and no agent to take one from");
                }
            }
            validateStages(stage.stages(), agent, path.isEmpty() ? name : path + "/" + name, seenNames, problems);
        }
    }
}
