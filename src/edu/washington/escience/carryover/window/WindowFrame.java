package edu.washington.escience.carryover.window;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import net.jcip.annotations.Immutable;

/**
 * A ROWS window frame: the range of rows, relative to the current row, that a window function sees.
 */
@Immutable
public final class WindowFrame implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW. */
  public static final WindowFrame UNBOUNDED_PRECEDING_TO_CURRENT_ROW =
      new WindowFrame(FrameBound.UNBOUNDED_PRECEDING, null, FrameBound.CURRENT_ROW, null);

  /** Start boundary. */
  @JsonProperty private final FrameBound start;
  /** Offset of the start boundary, only for PRECEDING and FOLLOWING. */
  @JsonProperty private final Long startOffset;
  /** End boundary. */
  @JsonProperty private final FrameBound end;
  /** Offset of the end boundary, only for PRECEDING and FOLLOWING. */
  @JsonProperty private final Long endOffset;

  /**
   * @param start start boundary.
   * @param startOffset offset of the start boundary; required iff the boundary takes one.
   * @param end end boundary.
   * @param endOffset offset of the end boundary; required iff the boundary takes one.
   */
  @JsonCreator
  public WindowFrame(
      @JsonProperty(value = "start", required = true) @Nonnull final FrameBound start,
      @JsonProperty("startOffset") @Nullable final Long startOffset,
      @JsonProperty(value = "end", required = true) @Nonnull final FrameBound end,
      @JsonProperty("endOffset") @Nullable final Long endOffset) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = Objects.requireNonNull(end, "end");
    checkOffset(start, startOffset);
    checkOffset(end, endOffset);
    Preconditions.checkArgument(
        start != FrameBound.UNBOUNDED_FOLLOWING, "a frame cannot start at UNBOUNDED_FOLLOWING");
    Preconditions.checkArgument(
        end != FrameBound.UNBOUNDED_PRECEDING, "a frame cannot end at UNBOUNDED_PRECEDING");
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  /**
   * @param bound a boundary.
   * @param offset its offset.
   */
  private static void checkOffset(final FrameBound bound, final Long offset) {
    if (bound.hasOffset()) {
      Preconditions.checkArgument(
          offset != null && offset >= 0, "%s needs a non-negative offset, got %s", bound, offset);
    } else {
      Preconditions.checkArgument(offset == null, "%s does not take an offset", bound);
    }
  }

  /**
   * @param start start boundary, one without an offset.
   * @param end end boundary, one without an offset.
   * @return the frame.
   */
  public static WindowFrame of(final FrameBound start, final FrameBound end) {
    return new WindowFrame(start, null, end, null);
  }

  /**
   * @return start boundary.
   */
  public FrameBound getStart() {
    return start;
  }

  /**
   * @return offset of the start boundary, null if it takes none.
   */
  @Nullable
  public Long getStartOffset() {
    return startOffset;
  }

  /**
   * @return end boundary.
   */
  public FrameBound getEnd() {
    return end;
  }

  /**
   * @return offset of the end boundary, null if it takes none.
   */
  @Nullable
  public Long getEndOffset() {
    return endOffset;
  }

  /**
   * @return true if the frame covers every row from the start of the partition up to and including the current row.
   */
  public boolean isUnboundedPrecedingToCurrentRow() {
    return start == FrameBound.UNBOUNDED_PRECEDING && end == FrameBound.CURRENT_ROW;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WindowFrame)) {
      return false;
    }
    WindowFrame other = (WindowFrame) o;
    return start == other.start
        && end == other.end
        && Objects.equals(startOffset, other.startOffset)
        && Objects.equals(endOffset, other.endOffset);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, startOffset, end, endOffset);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ROWS BETWEEN ");
    appendBound(sb, start, startOffset);
    sb.append(" AND ");
    appendBound(sb, end, endOffset);
    return sb.toString();
  }

  /**
   * @param sb the builder.
   * @param bound the boundary.
   * @param offset its offset.
   */
  private static void appendBound(final StringBuilder sb, final FrameBound bound, final Long offset) {
    if (offset != null) {
      sb.append(offset).append(' ');
    }
    sb.append(bound.name().replace('_', ' '));
  }
}
