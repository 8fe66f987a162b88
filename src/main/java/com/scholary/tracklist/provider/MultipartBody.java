package com.scholary.tracklist.provider;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Builds multipart/form-data bodies for {@link java.net.http.HttpClient}, which has no multipart
 * support of its own.
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="access_key"
 *
 * abc123
 * --boundary
 * Content-Disposition: form-data; name="sample"; filename="segment.wav"
 * Content-Type: audio/wav
 *
 * [binary data]
 * --boundary--
 * </pre>
 *
 * <p>Everything is assembled as bytes; mixing String and byte lengths is how Content-Length ends
 * up wrong.
 */
public final class MultipartBody {

  private final String boundary;
  private final ByteArrayOutputStream body = new ByteArrayOutputStream();

  public MultipartBody() {
    this(UUID.randomUUID().toString());
  }

  MultipartBody(String boundary) {
    this.boundary = boundary;
  }

  public MultipartBody field(String name, String value) {
    write("--" + boundary + "\r\n");
    write("Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
    write(value);
    write("\r\n");
    return this;
  }

  public MultipartBody file(String name, String filename, String contentType, byte[] data) {
    write("--" + boundary + "\r\n");
    write(
        "Content-Disposition: form-data; name=\"" + name + "\"; filename=\"" + filename + "\"\r\n");
    write("Content-Type: " + contentType + "\r\n\r\n");
    body.writeBytes(data);
    write("\r\n");
    return this;
  }

  public String contentType() {
    return "multipart/form-data; boundary=" + boundary;
  }

  public byte[] toByteArray() {
    ByteArrayOutputStream complete = new ByteArrayOutputStream(body.size() + boundary.length() + 8);
    complete.writeBytes(body.toByteArray());
    complete.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
    return complete.toByteArray();
  }

  public BodyPublisher publisher() {
    return BodyPublishers.ofByteArray(toByteArray());
  }

  private void write(String text) {
    body.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }
}
