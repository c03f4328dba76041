package org.hypertrace.core.dashboard.query.service.builder;

import com.google.common.base.Preconditions;
import org.hypertrace.core.dashboard.query.service.RefIdExhaustedException;

/**
 * Hands out reference identifiers from a fixed alphabet in order. Once the alphabet is used up
 * every further request fails; identifiers are never handed out twice.
 */
public class RefIdAllocator {
  public static final String DEFAULT_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

  private final String alphabet;
  private int nextIndex;

  public RefIdAllocator(String alphabet) {
    Preconditions.checkArgument(!alphabet.isEmpty(), "ref id alphabet must not be empty");
    Preconditions.checkArgument(
        alphabet.chars().distinct().count() == alphabet.length(),
        "ref id alphabet must not repeat characters: %s",
        alphabet);
    this.alphabet = alphabet;
  }

  public String next() {
    if (nextIndex >= alphabet.length()) {
      throw new RefIdExhaustedException(alphabet.length());
    }
    return String.valueOf(alphabet.charAt(nextIndex++));
  }

  public int remaining() {
    return alphabet.length() - nextIndex;
  }

  /** Position to {@link #rollback(int)} to when a group of assignments has to be abandoned. */
  int checkpoint() {
    return nextIndex;
  }

  /** Releases identifiers assigned since the checkpoint; they were never handed to a query. */
  void rollback(int checkpoint) {
    Preconditions.checkArgument(checkpoint <= nextIndex, "cannot roll forward");
    this.nextIndex = checkpoint;
  }
}
