package com.sanctions.screening.domain;

/**
 * Kind of party being screened or listed.
 */
public enum EntityType {
    PERSON,
    ORGANIZATION
}
