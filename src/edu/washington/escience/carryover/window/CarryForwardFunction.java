package edu.washington.escience.carryover.window;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.washington.escience.carryover.Schema;
import edu.washington.escience.carryover.Type;
import net.jcip.annotations.Immutable;

/**
 * The carry-forward window function bound to the schema of its input: which column holds the flag, which holds the
 * signal, and what the appended output column is called. It hands out a fresh {@link CarryForwardEvaluator} per
 * partition.
 */
@Immutable
public final class CarryForwardFunction implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CarryForwardFunction.class);

  /** The schema of input rows. */
  private final Schema inputSchema;
  /** Index of the flag column. */
  private final int flagColumn;
  /** Index of the signal column. */
  private final int signalColumn;
  /** Input columns followed by the output column. */
  private final Schema outputSchema;
  /** What a carrier with a null signal does. */
  private final NullSignalPolicy nullSignalPolicy;

  /**
   * @param inputSchema the schema of input rows.
   * @param flagColumn index of the flag column, of type INT, LONG or BOOLEAN.
   * @param signalColumn index of the signal column, of any type.
   * @param outputColumn name of the appended output column.
   * @param nullSignalPolicy what a carrier with a null signal does.
   */
  public CarryForwardFunction(
      @Nonnull final Schema inputSchema,
      final int flagColumn,
      final int signalColumn,
      @Nonnull final String outputColumn,
      @Nonnull final NullSignalPolicy nullSignalPolicy) {
    this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema");
    Preconditions.checkElementIndex(flagColumn, inputSchema.numColumns(), "flagColumn");
    Preconditions.checkElementIndex(signalColumn, inputSchema.numColumns(), "signalColumn");
    Type flagType = inputSchema.getColumnType(flagColumn);
    Preconditions.checkArgument(
        SignalFlag.isFlagType(flagType),
        "flag column %s must be of type INT_TYPE, LONG_TYPE or BOOLEAN_TYPE, not %s",
        inputSchema.getColumnName(flagColumn),
        flagType);
    Preconditions.checkArgument(
        flagColumn != signalColumn, "flag and signal must be different columns");
    this.flagColumn = flagColumn;
    this.signalColumn = signalColumn;
    this.nullSignalPolicy = Objects.requireNonNull(nullSignalPolicy, "nullSignalPolicy");
    outputSchema =
        Schema.appendColumn(
            inputSchema,
            inputSchema.getColumnType(signalColumn),
            Objects.requireNonNull(outputColumn, "outputColumn"));
  }

  /**
   * Validate the requested execution context and create an evaluator for one partition. Nothing is allocated if the
   * context is rejected.
   *
   * @param mode the requested mode.
   * @param frame the requested frame, null if the host gave none.
   * @return a fresh evaluator.
   * @throws UnsupportedModeException if the mode or frame cannot be honored.
   */
  public CarryForwardEvaluator setup(
      @Nullable final EvaluatorMode mode, @Nullable final WindowFrame frame)
      throws UnsupportedModeException {
    ExecutionStrategy strategy = ModeGate.check(mode, frame);
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("Setting up {} evaluator for mode {} and frame {}", strategy, mode, frame);
    }
    return newEvaluator(strategy);
  }

  /**
   * @param strategy an already validated strategy.
   * @return a fresh evaluator running that strategy.
   */
  public CarryForwardEvaluator newEvaluator(@Nonnull final ExecutionStrategy strategy) {
    switch (Objects.requireNonNull(strategy, "strategy")) {
      case BUFFERED:
        return new BufferedCarryForward(inputSchema, flagColumn, signalColumn, nullSignalPolicy);
      case STREAMING:
        return new StreamingCarryForward(inputSchema, flagColumn, signalColumn, nullSignalPolicy);
      default:
        throw new IllegalArgumentException("unknown strategy " + strategy);
    }
  }

  /**
   * @return the schema of input rows.
   */
  public Schema getInputSchema() {
    return inputSchema;
  }

  /**
   * @return input columns followed by the output column, which has the type of the signal column.
   */
  public Schema getOutputSchema() {
    return outputSchema;
  }

  /**
   * @return index of the flag column.
   */
  public int getFlagColumn() {
    return flagColumn;
  }

  /**
   * @return index of the signal column.
   */
  public int getSignalColumn() {
    return signalColumn;
  }

  /**
   * @return what a carrier with a null signal does.
   */
  public NullSignalPolicy getNullSignalPolicy() {
    return nullSignalPolicy;
  }
}
