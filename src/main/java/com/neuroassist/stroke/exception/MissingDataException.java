package com.neuroassist.stroke.exception;

/**
 * A field that becomes mandatory when no CT image is supplied was absent.
 */
public class MissingDataException extends ValidationException {

    public MissingDataException(String field) {
        super(field, "'" + field + "' is required when no CT scan image is supplied");
    }

    @Override
    public String kind() {
        return "MISSING_DATA";
    }
}
