package com.solfmt.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.solfmt.api.error.FormatterError;

/**
 * Result of a formatting operation. An unsuccessful result carries no formatted code: output of a
 * run that failed part way is never handed out.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final boolean changed;
    private final List<FormatterError> errors;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.successful ? builder.formattedCode : null;
        this.changed = builder.successful && builder.changed;
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * Whether the formatted code differs from the input. Always false for a failed result.
     */
    public boolean isChanged() {
        return changed;
    }

    public static FormatterResult failure(FormatterError error) {
        return builder().successful(false).addError(error).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private boolean changed;
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder changed(boolean changed) {
            this.changed = changed;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
