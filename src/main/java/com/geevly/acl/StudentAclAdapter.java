package com.geevly.acl;

import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.file.FileService;
import com.geevly.school.SchoolService;
import com.geevly.student.StudentAntiCorruptionLayer;
import org.springframework.stereotype.Component;

/**
 * Answers the student domain's questions from the school and file projections. A missing
 * reference is a bad command for the student, not a missing student.
 */
@Component
public class StudentAclAdapter implements StudentAntiCorruptionLayer {

    private final SchoolService schools;
    private final FileService files;

    public StudentAclAdapter(SchoolService schools, FileService files) {
        this.schools = schools;
        this.files = files;
    }

    @Override
    public void validateSchoolId(String schoolId) {
        try {
            schools.validateSchoolId(schoolId);
        } catch (NotFoundException ex) {
            throw new CommandValidationException("unknown school " + schoolId);
        }
    }

    @Override
    public void validatePhotoId(String fileId) {
        try {
            files.validatePhotoId(fileId);
        } catch (NotFoundException ex) {
            throw new CommandValidationException("unknown photo file " + fileId);
        }
    }

    @Override
    public void validateFileId(String fileId) {
        try {
            files.validateFileId(fileId);
        } catch (NotFoundException ex) {
            throw new CommandValidationException("unknown file " + fileId);
        }
    }
}
