package com.acme.notesapp.notes;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import net.jqwik.api.lifecycle.AfterContainer;
import net.jqwik.api.lifecycle.BeforeContainer;

import static org.assertj.core.api.Assertions.*;

/**
 * Bean validation rules on the create/update payload.
 */
class NoteRequestValidationPropertyTest {
    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeContainer
    static void createValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterContainer
    static void closeValidator() {
        factory.close();
    }

    @Property(tries = 100)
    void nonBlankFieldsAreAccepted(@ForAll @AlphaChars @NumericChars @Chars({' ', '-'}) @StringLength(min = 1, max = 255) String title,
                                   @ForAll @AlphaChars @Chars({' ', '\n', '.'}) @StringLength(min = 1, max = 2000) String content) {
        Assume.that(!title.isBlank() && !content.isBlank());
        assertThat(validator.validate(new NoteDtos.NoteRequest(title, content))).isEmpty();
    }

    @Property(tries = 100)
    void whitespaceOnlyTitleIsRejected(@ForAll("whitespace") String title, @ForAll @AlphaChars @StringLength(min = 1, max = 50) String content) {
        assertThat(validator.validate(new NoteDtos.NoteRequest(title, content))).isNotEmpty();
    }

    @Property(tries = 100)
    void whitespaceOnlyContentIsRejected(@ForAll @AlphaChars @StringLength(min = 1, max = 50) String title, @ForAll("whitespace") String content) {
        assertThat(validator.validate(new NoteDtos.NoteRequest(title, content))).isNotEmpty();
    }

    @Example
    void missingFieldsAreRejected() {
        assertThat(validator.validate(new NoteDtos.NoteRequest(null, "content"))).hasSize(1);
        assertThat(validator.validate(new NoteDtos.NoteRequest("title", null))).hasSize(1);
        assertThat(validator.validate(new NoteDtos.NoteRequest(null, null))).hasSize(2);
    }

    @Provide
    Arbitrary<String> whitespace() {
        return Arbitraries.strings().withChars(' ', '\t', '\n', '\r').ofMinLength(0).ofMaxLength(20);
    }
}
