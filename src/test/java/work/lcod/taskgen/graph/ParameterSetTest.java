package work.lcod.taskgen.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.taskgen.model.Param;
import work.lcod.taskgen.model.TaskParam;
import work.lcod.taskgen.shared.ValidationException;

class ParameterSetTest {
    @Test
    void keepsInsertionOrderAndDescribesVersions() {
        var params = ParameterSet.of(List.of(new Param("version", "1.2.3"), new Param("channel", "stable")));

        assertEquals(List.of("version", "channel"), params.toList().stream().map(Param::name).toList());
        List<TaskParam> taskParams = params.toTaskParams();
        assertTrue(taskParams.get(0).description().startsWith("the version number for this release"));
        assertEquals("", taskParams.get(1).description());
        assertEquals("", taskParams.get(1).defaultValue());
        assertEquals("stable", params.value("channel").orElseThrow());
    }

    @Test
    void duplicateNamesAreRejected() {
        var params = ParameterSet.of(List.of(new Param("version", "1.2.3")));
        var ex = assertThrows(ValidationException.class, () -> params.add(new Param("version", "2.0.0")));
        assertEquals(List.of("duplicate parameter version"), ex.problems());
    }
}
