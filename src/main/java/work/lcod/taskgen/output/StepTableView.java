package work.lcod.taskgen.output;

import java.util.ArrayList;
import java.util.List;
import work.lcod.taskgen.model.Container;
import work.lcod.taskgen.model.Task;

/**
 * Renders the compiled steps of each task as a left-aligned text table. The {@code TASK} column is
 * only shown when there is more than one task.
 */
public final class StepTableView {
    private static final String COLUMN_SEPARATOR = " ";

    public String render(List<Task> tasks) {
        boolean showTaskName = tasks.size() > 1;
        var rows = new ArrayList<List<String>>();
        rows.add(showTaskName ? List.of("TASK", "NAME", "COMMAND", "IMAGE") : List.of("NAME", "COMMAND", "IMAGE"));
        for (Task task : tasks) {
            for (Container step : task.spec().steps()) {
                String image = step.image() == null ? "" : step.image();
                if (showTaskName) {
                    rows.add(List.of(task.name(), nullToEmpty(step.name()), step.commandLine(), image));
                } else {
                    rows.add(List.of(nullToEmpty(step.name()), step.commandLine(), image));
                }
            }
        }
        return format(rows);
    }

    private static String format(List<List<String>> rows) {
        int columns = rows.get(0).size();
        int[] widths = new int[columns];
        for (List<String> row : rows) {
            for (int i = 0; i < columns; i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        var out = new StringBuilder();
        for (List<String> row : rows) {
            var line = new StringBuilder();
            for (int i = 0; i < columns; i++) {
                String cell = row.get(i);
                line.append(cell);
                if (i < columns - 1) {
                    line.append(" ".repeat(widths[i] - cell.length())).append(COLUMN_SEPARATOR);
                }
            }
            out.append(line.toString().stripTrailing()).append('\n');
        }
        return out.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
