package com.example.dutyroster.instance;

import com.example.dutyroster.exception.InstanceFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * セクション形式のテキストから {@link RosterInstance} を読み込む。
 * <p>
 * {@code SECTION_} で始まる行がセクションを開始する。空行と {@code #} で始まる行は
 * 読み飛ばし、未知のセクションは無視する。データ行はカンマ区切りで、
 * 複数値の項目は {@code |} で区切る。
 */
@Component
public class InstanceParser {

    private static final Logger logger = LoggerFactory.getLogger(InstanceParser.class);

    private static final String SECTION_PREFIX = "SECTION_";
    static final String HORIZON = "HORIZON";
    static final String SHIFTS = "SHIFTS";
    static final String STAFF = "STAFF";
    static final String DAYS_OFF = "DAYS_OFF";
    static final String SHIFT_ON_REQUESTS = "SHIFT_ON_REQUESTS";
    static final String SHIFT_OFF_REQUESTS = "SHIFT_OFF_REQUESTS";
    static final String COVER = "COVER";

    public RosterInstance parse(String content) {
        return parse(new StringReader(content == null ? "" : content));
    }

    public RosterInstance parse(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            logger.info("インスタンスファイルを読み込みます: {}", file);
            return parse(reader);
        } catch (IOException e) {
            throw new InstanceFormatException(null, 0, "インスタンスファイルを読み込めません: " + file, e);
        }
    }

    public RosterInstance parse(Reader source) {
        State state = new State();
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        try {
            String raw;
            int lineNumber = 0;
            while ((raw = reader.readLine()) != null) {
                lineNumber++;
                String line = raw.strip();
                if (line.isEmpty() || line.startsWith("#")) {
                    continue;
                }
                if (line.startsWith(SECTION_PREFIX)) {
                    state.section = line.substring(SECTION_PREFIX.length()).strip();
                    continue;
                }
                if (state.section == null) {
                    throw new InstanceFormatException(null, lineNumber, "セクション外の行です: " + line);
                }
                parseLine(state, line, lineNumber);
            }
        } catch (IOException e) {
            throw new InstanceFormatException(state.section, 0, "インスタンスの読み込みに失敗しました", e);
        }
        return state.build();
    }

    private void parseLine(State state, String line, int lineNumber) {
        switch (state.section) {
            case HORIZON -> state.horizon = parseInt(HORIZON, lineNumber, "horizon", line);
            case SHIFTS -> state.addShift(parseShift(line, lineNumber), lineNumber);
            case STAFF -> state.addStaff(parseStaff(line, lineNumber), lineNumber);
            case DAYS_OFF -> parseDaysOff(state, line, lineNumber);
            case SHIFT_ON_REQUESTS -> state.requests.add(
                    new Located<>(parseRequest(ShiftRequest.Kind.ON, SHIFT_ON_REQUESTS, line, lineNumber), lineNumber));
            case SHIFT_OFF_REQUESTS -> state.requests.add(
                    new Located<>(parseRequest(ShiftRequest.Kind.OFF, SHIFT_OFF_REQUESTS, line, lineNumber), lineNumber));
            case COVER -> state.cover.add(new Located<>(parseCover(line, lineNumber), lineNumber));
            default -> logger.debug("未対応のセクションを読み飛ばします: {}", state.section);
        }
    }

    private Shift parseShift(String line, int lineNumber) {
        String[] parts = fields(SHIFTS, line, lineNumber, 2, 3);
        String id = requireId(SHIFTS, lineNumber, "shift id", parts[0]);
        int length = parseInt(SHIFTS, lineNumber, "length", parts[1]);
        Set<String> forbidden = new LinkedHashSet<>();
        if (parts.length > 2) {
            for (String token : parts[2].split("\\|")) {
                if (!token.isBlank()) {
                    forbidden.add(token.strip());
                }
            }
        }
        return new Shift(id, length, forbidden);
    }

    private StaffMember parseStaff(String line, int lineNumber) {
        String[] parts = fields(STAFF, line, lineNumber, 8, 9);
        StaffMember.Builder builder = StaffMember.builder(requireId(STAFF, lineNumber, "staff id", parts[0]));
        for (String limit : parts[1].split("\\|")) {
            if (limit.isBlank()) {
                continue;
            }
            String[] pair = limit.split("=", -1);
            if (pair.length != 2) {
                throw new InstanceFormatException(STAFF, lineNumber, "シフト上限は shift=count 形式で指定してください: " + limit);
            }
            builder.shiftLimit(requireId(STAFF, lineNumber, "shift id", pair[0]),
                    parseInt(STAFF, lineNumber, "shift limit", pair[1]));
        }
        builder.maxShifts(parseInt(STAFF, lineNumber, "maxShifts", parts[2]))
                .maxTotalMinutes(parseInt(STAFF, lineNumber, "maxTotalMinutes", parts[3]))
                .minTotalMinutes(parseInt(STAFF, lineNumber, "minTotalMinutes", parts[4]))
                .maxConsecutiveShifts(parseInt(STAFF, lineNumber, "maxConsecutiveShifts", parts[5]))
                .minConsecutiveShifts(parseInt(STAFF, lineNumber, "minConsecutiveShifts", parts[6]))
                .minConsecutiveDaysOff(parseInt(STAFF, lineNumber, "minConsecutiveDaysOff", parts[7]));
        if (parts.length > 8 && !parts[8].isBlank()) {
            builder.maxWeekends(parseInt(STAFF, lineNumber, "maxWeekends", parts[8]));
        }
        return builder.build();
    }

    private void parseDaysOff(State state, String line, int lineNumber) {
        String[] parts = line.split(",", -1);
        String staffId = requireId(DAYS_OFF, lineNumber, "staff id", parts[0]);
        Set<Integer> days = state.daysOff.computeIfAbsent(staffId, k -> new LinkedHashSet<>());
        state.daysOffLines.putIfAbsent(staffId, lineNumber);
        for (int i = 1; i < parts.length; i++) {
            if (parts[i].isBlank()) {
                continue;
            }
            days.add(parseInt(DAYS_OFF, lineNumber, "day", parts[i]));
        }
    }

    private ShiftRequest parseRequest(ShiftRequest.Kind kind, String section, String line, int lineNumber) {
        String[] parts = fields(section, line, lineNumber, 4, 4);
        return new ShiftRequest(kind,
                requireId(section, lineNumber, "staff id", parts[0]),
                parseInt(section, lineNumber, "day", parts[1]),
                requireId(section, lineNumber, "shift id", parts[2]),
                parseInt(section, lineNumber, "weight", parts[3]));
    }

    private CoverRequirement parseCover(String line, int lineNumber) {
        String[] parts = fields(COVER, line, lineNumber, 5, 5);
        return new CoverRequirement(
                parseInt(COVER, lineNumber, "day", parts[0]),
                requireId(COVER, lineNumber, "shift id", parts[1]),
                parseInt(COVER, lineNumber, "requirement", parts[2]),
                parseInt(COVER, lineNumber, "weightUnder", parts[3]),
                parseInt(COVER, lineNumber, "weightOver", parts[4]));
    }

    private static String[] fields(String section, String line, int lineNumber, int min, int max) {
        String[] parts = line.split(",", -1);
        if (parts.length < min || parts.length > max) {
            String expected = min == max ? String.valueOf(min) : min + "〜" + max;
            throw new InstanceFormatException(section, lineNumber,
                    String.format("項目数が不正です (期待値 %s, 実際 %d): %s", expected, parts.length, line));
        }
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].strip();
        }
        return parts;
    }

    private static int parseInt(String section, int lineNumber, String field, String value) {
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new InstanceFormatException(section, lineNumber,
                    String.format("%s は整数で指定してください: '%s'", field, value.strip()), e);
        }
    }

    private static String requireId(String section, int lineNumber, String field, String value) {
        String id = value.strip();
        if (id.isEmpty()) {
            throw new InstanceFormatException(section, lineNumber, field + " が空です");
        }
        return id;
    }

    private record Located<T>(T value, int lineNumber) {
    }

    /**
     * 1回分の読み込み結果。セクションの順序は任意のため、ID参照の検証は
     * 全セクションを読み終えてから行う。
     */
    private static final class State {
        private String section;
        private Integer horizon;
        private final Map<String, Located<Shift>> shifts = new LinkedHashMap<>();
        private final Map<String, Located<StaffMember>> staff = new LinkedHashMap<>();
        private final Map<String, Set<Integer>> daysOff = new LinkedHashMap<>();
        private final Map<String, Integer> daysOffLines = new LinkedHashMap<>();
        private final List<Located<ShiftRequest>> requests = new ArrayList<>();
        private final List<Located<CoverRequirement>> cover = new ArrayList<>();

        void addShift(Shift shift, int lineNumber) {
            if (shifts.putIfAbsent(shift.id(), new Located<>(shift, lineNumber)) != null) {
                throw new InstanceFormatException(SHIFTS, lineNumber, "シフトIDが重複しています: " + shift.id());
            }
        }

        void addStaff(StaffMember member, int lineNumber) {
            if (staff.putIfAbsent(member.getId(), new Located<>(member, lineNumber)) != null) {
                throw new InstanceFormatException(STAFF, lineNumber, "スタッフIDが重複しています: " + member.getId());
            }
        }

        RosterInstance build() {
            if (horizon == null) {
                throw new InstanceFormatException(HORIZON, 0, "計画期間 (SECTION_HORIZON) がありません");
            }
            if (horizon < 0) {
                throw new InstanceFormatException(HORIZON, 0, "計画期間は0以上で指定してください: " + horizon);
            }
            for (Located<Shift> located : shifts.values()) {
                for (String next : located.value().forbiddenFollowing()) {
                    requireShift(SHIFTS, located.lineNumber(), next);
                }
            }
            for (Located<StaffMember> located : staff.values()) {
                for (String shiftId : located.value().getShiftLimits().keySet()) {
                    requireShift(STAFF, located.lineNumber(), shiftId);
                }
            }
            daysOff.forEach((staffId, days) -> {
                int lineNumber = daysOffLines.get(staffId);
                requireStaff(DAYS_OFF, lineNumber, staffId);
                days.forEach(day -> requireDay(DAYS_OFF, lineNumber, day));
            });
            for (Located<ShiftRequest> located : requests) {
                ShiftRequest request = located.value();
                String section = request.kind() == ShiftRequest.Kind.ON ? SHIFT_ON_REQUESTS : SHIFT_OFF_REQUESTS;
                requireStaff(section, located.lineNumber(), request.staffId());
                requireShift(section, located.lineNumber(), request.shiftId());
                requireDay(section, located.lineNumber(), request.day());
            }
            for (Located<CoverRequirement> located : cover) {
                requireShift(COVER, located.lineNumber(), located.value().shiftId());
                requireDay(COVER, located.lineNumber(), located.value().day());
            }
            return new RosterInstance(horizon,
                    shifts.values().stream().map(Located::value).toList(),
                    staff.values().stream().map(Located::value).toList(),
                    daysOff,
                    cover.stream().map(Located::value).toList(),
                    requests.stream().map(Located::value).toList());
        }

        private void requireShift(String section, int lineNumber, String shiftId) {
            if (!shifts.containsKey(shiftId)) {
                throw new InstanceFormatException(section, lineNumber, "未定義のシフトIDです: " + shiftId);
            }
        }

        private void requireStaff(String section, int lineNumber, String staffId) {
            if (!staff.containsKey(staffId)) {
                throw new InstanceFormatException(section, lineNumber, "未定義のスタッフIDです: " + staffId);
            }
        }

        private void requireDay(String section, int lineNumber, int day) {
            if (day < 0 || day >= horizon) {
                throw new InstanceFormatException(section, lineNumber,
                        String.format("日付インデックスが計画期間外です: %d (0〜%d)", day, horizon - 1));
            }
        }
    }
}
