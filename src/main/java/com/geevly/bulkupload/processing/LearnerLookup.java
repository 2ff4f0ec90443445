package com.geevly.bulkupload.processing;

import com.geevly.bulkupload.ValidationError;
import com.geevly.student.StudentService;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the LRN column of an upload to students already enrolled at the upload's school.
 */
final class LearnerLookup {

    interface LearnerRow {
        int row();

        String lrn();
    }

    private LearnerLookup() {
    }

    /**
     * Returns LRN to student id in file order. Unknown and repeated LRNs are reported as errors.
     */
    static Map<String, String> resolve(StudentService students, String schoolId, List<? extends LearnerRow> rows,
                                       List<ValidationError> errors) {
        Map<String, String> ids = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (LearnerRow row : rows) {
            if (!seen.add(row.lrn())) {
                errors.add(new ValidationError(row.row(), "lrn", "lrn " + row.lrn() + " appears more than once"));
                continue;
            }
            Optional<String> id = students.findIdBySchoolStudentId(row.lrn(), schoolId);
            if (id.isEmpty()) {
                errors.add(new ValidationError(row.row(), "lrn",
                    "no student with lrn " + row.lrn() + " at school " + schoolId));
                continue;
            }
            ids.put(row.lrn(), id.get());
        }
        return ids;
    }
}
