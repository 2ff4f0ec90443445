package com.geevly.bulkupload;

/**
 * Kind of record a bulk upload touched downstream.
 */
public enum RecordType {
    STUDENT,
    FILE
}
