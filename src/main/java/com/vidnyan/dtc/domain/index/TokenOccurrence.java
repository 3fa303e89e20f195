package com.vidnyan.dtc.domain.index;

/**
 * One occurrence of a token in a record.
 * {@code position} is the token ordinal within the field, counted across all items of a list field.
 */
public record TokenOccurrence(
    String code,
    TextField field,
    int position
) {}
