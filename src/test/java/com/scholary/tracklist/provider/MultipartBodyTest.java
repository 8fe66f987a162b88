package com.scholary.tracklist.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MultipartBodyTest {

  @Test
  void toByteArray_shouldFrameFieldsAndFilesWithBoundary() {
    MultipartBody body =
        new MultipartBody("b0undary")
            .field("access_key", "abc")
            .file("sample", "s.wav", "audio/wav", new byte[] {1, 2, 3});

    String text = new String(body.toByteArray(), StandardCharsets.ISO_8859_1);

    assertThat(body.contentType()).isEqualTo("multipart/form-data; boundary=b0undary");
    assertThat(text)
        .isEqualTo(
            "--b0undary\r\n"
                + "Content-Disposition: form-data; name=\"access_key\"\r\n\r\n"
                + "abc\r\n"
                + "--b0undary\r\n"
                + "Content-Disposition: form-data; name=\"sample\"; filename=\"s.wav\"\r\n"
                + "Content-Type: audio/wav\r\n\r\n"
                + "\u0001\u0002\u0003\r\n"
                + "--b0undary--\r\n");
  }

  @Test
  void toByteArray_shouldCountMultibyteCharactersAsBytes() {
    MultipartBody body = new MultipartBody("x").field("title", "café");

    byte[] bytes = body.toByteArray();

    String expected =
        "--x\r\nContent-Disposition: form-data; name=\"title\"\r\n\r\ncafé\r\n--x--\r\n";
    assertThat(bytes).hasSize(expected.getBytes(StandardCharsets.UTF_8).length);
  }
}
