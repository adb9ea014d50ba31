package io.campaign.util;

import io.campaign.model.RecipientTarget;

import java.util.List;

/**
 * Codec for the address list stored in a job row's {@code payload} column.
 *
 * <p>The default implementation ({@link DefaultTargetCodec}) is a small, zero-dependency
 * encoder/decoder for an array of {@code {"email": ..., "name": ...}} objects. Applications
 * that already carry Jackson or Gson can implement this interface to delegate to it.
 *
 * @see #getDefault()
 */
public interface TargetCodec {

  static TargetCodec getDefault() {
    return DefaultTargetCodec.INSTANCE;
  }

  /**
   * Encodes the address list as a JSON array. Returns {@code null} for a null or empty list.
   */
  String toJson(List<RecipientTarget> targets);

  /**
   * Parses a JSON array of address objects. Returns an empty list for {@code null},
   * empty or {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not a valid address array
   */
  List<RecipientTarget> parse(String json);
}
