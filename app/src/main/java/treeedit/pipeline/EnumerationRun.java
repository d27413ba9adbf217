package treeedit.pipeline;

/**
 * Timing and count data for one pipeline run, per phase.
 *
 * <p>Phases are recorded through {@link #startTimer(Phase)}; counts are set separately once a
 * phase knows how much work it did.
 */
public final class EnumerationRun {

  public enum Phase {
    CANDIDATE_SETUP,
    SEARCH,
    SCORING,
    TOTAL
  }

  private final long[] phaseMs = new long[Phase.values().length];
  private final long[] phaseCounts = new long[Phase.values().length];

  // ----- Recording -----

  public void recordPhase(Phase phase, long ms, long count) {
    phaseMs[phase.ordinal()] = ms;
    phaseCounts[phase.ordinal()] = count;
  }

  public void recordPhaseMs(Phase phase, long ms) {
    phaseMs[phase.ordinal()] = ms;
  }

  public void recordPhaseCount(Phase phase, long count) {
    phaseCounts[phase.ordinal()] = count;
  }

  // ----- Accessors -----

  public long phaseMs(Phase phase) {
    return phaseMs[phase.ordinal()];
  }

  public long phaseCount(Phase phase) {
    return phaseCounts[phase.ordinal()];
  }

  public long candidateSetupMs() {
    return phaseMs(Phase.CANDIDATE_SETUP);
  }

  public long searchMs() {
    return phaseMs(Phase.SEARCH);
  }

  /** Number of (node, candidate) pairs tried by the search. */
  public long branchesExplored() {
    return phaseCount(Phase.SEARCH);
  }

  public long scoringMs() {
    return phaseMs(Phase.SCORING);
  }

  public long mappingsScored() {
    return phaseCount(Phase.SCORING);
  }

  public long totalMs() {
    return phaseMs(Phase.TOTAL);
  }

  /** Time not attributed to any specific phase. */
  public long overheadMs() {
    return Math.max(0, totalMs() - candidateSetupMs() - searchMs() - scoringMs());
  }

  @Override
  public String toString() {
    return String.format(
        """
            === Run Metrics ===
            Candidate setup: %d ms
            Search:          %d ms (%d branches)
            Scoring:         %d ms (%d mappings)
            Overhead:        %d ms
            ---------------------------
            TOTAL:           %d ms""",
        candidateSetupMs(),
        searchMs(),
        branchesExplored(),
        scoringMs(),
        mappingsScored(),
        overheadMs(),
        totalMs());
  }

  // ----- Timer -----

  public Timer startTimer(Phase phase) {
    return new Timer(this, phase);
  }

  /** Auto-closeable timer that adds its duration to one phase. */
  public static final class Timer implements AutoCloseable {
    private final EnumerationRun run;
    private final Phase phase;
    private final long startNs;

    private Timer(EnumerationRun run, Phase phase) {
      this.run = run;
      this.phase = phase;
      this.startNs = System.nanoTime();
    }

    @Override
    public void close() {
      long durationMs = (System.nanoTime() - startNs) / 1_000_000;
      run.recordPhaseMs(phase, run.phaseMs(phase) + durationMs);
    }
  }
}
