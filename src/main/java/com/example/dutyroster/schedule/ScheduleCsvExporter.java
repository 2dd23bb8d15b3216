package com.example.dutyroster.schedule;

import com.example.dutyroster.instance.RosterInstance;
import com.example.dutyroster.instance.Shift;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.StringJoiner;

@Component
public class ScheduleCsvExporter {

    private static final String[] HEADERS = {"日", "スタッフID", "シフトID", "勤務時間(分)"};

    public CsvFile export(RosterInstance instance, List<Assignment> assignments, String name) {
        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');
        builder.append(String.join(",", HEADERS)).append('\n');

        assignments.stream()
                .sorted(Comparator
                        .comparingInt(Assignment::day)
                        .thenComparing(Assignment::shiftId)
                        .thenComparing(Assignment::staffId))
                .forEach(a -> appendRow(builder, instance, a));

        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        String filename = String.format("roster-%s.csv", safeName(name));
        return new CsvFile(filename, data);
    }

    private void appendRow(StringBuilder builder, RosterInstance instance, Assignment assignment) {
        int minutes = instance.findShift(assignment.shiftId()).map(Shift::lengthMinutes).orElse(0);

        StringJoiner joiner = new StringJoiner(",");
        joiner.add(Integer.toString(assignment.day()));
        joiner.add(escapeCsv(assignment.staffId()));
        joiner.add(escapeCsv(assignment.shiftId()));
        joiner.add(Integer.toString(minutes));

        builder.append(joiner).append('\n');
    }

    private String safeName(String name) {
        if (name == null || name.isBlank()) {
            return "export";
        }
        return name.strip().replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
