package org.javai.httperror;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HttpErrorKeyTest {

    @Test
    void keysFor_eachKind() {
        assertThat(HttpErrorKey.keysFor(HttpErrorKind.FAILED_RESPONSE))
                .containsExactly(HttpErrorKey.STATUS_CODE, HttpErrorKey.BODY_DATA, HttpErrorKey.BODY_JSON);
        assertThat(HttpErrorKey.keysFor(HttpErrorKind.UNEXPECTED_CONTENT_TYPE))
                .containsExactly(HttpErrorKey.BODY_DATA, HttpErrorKey.CONTENT_TYPE);
        assertThat(HttpErrorKey.keysFor(HttpErrorKind.UNEXPECTED_NO_CONTENT)).isEmpty();
        assertThat(HttpErrorKey.keysFor(HttpErrorKind.UNEXPECTED_REDIRECT))
                .containsExactly(HttpErrorKey.STATUS_CODE, HttpErrorKey.BODY_DATA, HttpErrorKey.LOCATION);
    }

    @Test
    void identifiers_areStable() {
        assertThat(HttpErrorKey.fromId("status_code")).isEqualTo(HttpErrorKey.STATUS_CODE);
        assertThat(HttpErrorKey.fromId("body_json")).isEqualTo(HttpErrorKey.BODY_JSON);
        assertThat(HttpErrorKey.LOCATION.id()).isEqualTo("location");
        assertThat(HttpErrorKey.BODY_DATA.valueType()).isEqualTo(byte[].class);
        assertThatThrownBy(() -> HttpErrorKey.fromId("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void kindCodes_areStable() {
        assertThat(HttpErrorKind.FAILED_RESPONSE.code()).isEqualTo(1);
        assertThat(HttpErrorKind.UNEXPECTED_CONTENT_TYPE.code()).isEqualTo(2);
        assertThat(HttpErrorKind.UNEXPECTED_NO_CONTENT.code()).isEqualTo(3);
        assertThat(HttpErrorKind.UNEXPECTED_REDIRECT.code()).isEqualTo(4);
        assertThat(HttpErrorKind.fromCode(4)).isEqualTo(HttpErrorKind.UNEXPECTED_REDIRECT);
        assertThatThrownBy(() -> HttpErrorKind.fromCode(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
