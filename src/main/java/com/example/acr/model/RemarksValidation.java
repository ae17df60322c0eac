package com.example.acr.model;

import java.util.List;

/** Outcome of checking one remark against the rules for its conformance level. */
public record RemarksValidation(boolean valid, List<String> errors) {

    public RemarksValidation {
        errors = List.copyOf(errors);
    }
}
