package com.geevly.student;

/**
 * What the student domain needs to know about schools and files. Each check throws when the
 * reference is not usable.
 */
public interface StudentAntiCorruptionLayer {

    void validateSchoolId(String schoolId);

    void validatePhotoId(String fileId);

    void validateFileId(String fileId);
}
