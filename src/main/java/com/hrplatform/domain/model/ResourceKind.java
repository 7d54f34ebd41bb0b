package com.hrplatform.domain.model;

/**
 * Kinds of business resources that list and query endpoints scope.
 */
public enum ResourceKind {
    EMPLOYEE,
    DEPARTMENT,
    LEAVE,
    ATTENDANCE
}
