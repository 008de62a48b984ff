package work.lcod.taskgen.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.ObjectMeta;
import work.lcod.taskgen.model.Task;
import work.lcod.taskgen.support.Fixtures;

class StepTableViewTest {
    private final StepTableView view = new StepTableView();

    @Test
    void singleTaskOmitsTaskColumn() {
        var steps = List.of(
            new Container("build-step1", "maven", List.of("/bin/sh"), List.of("-c", "mvn install"), null, List.of(), List.of()),
            new Container("promote-changelog", "gcr.io/acme/builder-maven:0.1", List.of("/bin/sh"), List.of("-c", "jx step changelog"), null, List.of(), List.of())
        );
        var task = Task.of(ObjectMeta.named("acme-demo-master"), new Task.Spec(null, null, steps, List.of()));

        String table = view.render(List.of(task));

        assertEquals(
            "NAME              COMMAND                      IMAGE\n"
                + "build-step1       /bin/sh -c mvn install       maven\n"
                + "promote-changelog /bin/sh -c jx step changelog gcr.io/acme/builder-maven:0.1\n",
            table
        );
    }

    @Test
    void multipleTasksShowTaskColumn() {
        String table = view.render(Fixtures.declarativeGraph().tasks());

        String[] lines = table.split("\n");
        assertTrue(lines[0].startsWith("TASK"));
        assertTrue(lines[1].startsWith("acme-demo-master-build "));
        assertTrue(lines[2].startsWith("acme-demo-master-test "));
        assertTrue(lines[1].contains("/bin/sh -c make build"));
        assertTrue(lines[1].endsWith("golang:1.12"));
    }
}
