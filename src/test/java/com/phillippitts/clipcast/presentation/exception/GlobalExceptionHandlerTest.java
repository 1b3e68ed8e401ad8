package com.phillippitts.clipcast.presentation.exception;

import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.exception.EncodeError;
import com.phillippitts.clipcast.exception.EncoderNotFoundException;
import com.phillippitts.clipcast.exception.EncodingException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void captureFailureIsServiceUnavailable() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleCapture(CaptureException.unavailable("chain", "No capture backend could start"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().errorCode()).isEqualTo("CaptureException");
        assertThat(response.getBody().details()).contains("Screen Recording permission");
    }

    @Test
    void missingEncoderIsServiceUnavailable() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleEncoderNotFound(new EncoderNotFoundException(List.of("/usr/bin/ffmpeg")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().message()).isEqualTo("Encoder unavailable");
    }

    @Test
    void encodingFailureCarriesUserHint() {
        EncodingException ex = new EncodingException(EncodeError.CRASH_SYSTEM_KILL, "ffmpeg killed", 137, null);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleEncoding(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().details()).isEqualTo(EncodeError.CRASH_SYSTEM_KILL.userHint());
    }

    @Test
    void illegalArgumentIsBadRequest() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("Capture region must have positive size"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("Capture region must have positive size");
    }

    @Test
    void unexpectedErrorsHideDetails() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().details()).doesNotContain("secret");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
