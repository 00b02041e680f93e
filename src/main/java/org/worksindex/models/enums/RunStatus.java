package org.worksindex.models.enums;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED
}
