package com.example.dutyroster.schedule;

import com.example.dutyroster.instance.StaffMember;

import java.util.Comparator;
import java.util.List;

/**
 * 各必要人数枠にスタッフを割り当てる際の試行順。
 */
public enum StaffOrder {
    LISTED {
        @Override
        public List<StaffMember> apply(List<StaffMember> staff) {
            return List.copyOf(staff);
        }
    },
    ID_ASCENDING {
        @Override
        public List<StaffMember> apply(List<StaffMember> staff) {
            return staff.stream().sorted(Comparator.comparing(StaffMember::getId)).toList();
        }
    };

    public abstract List<StaffMember> apply(List<StaffMember> staff);
}
