/**
 * Runs conformance, comparison, robustness and record-consistency trials.
 * <p>
 * Start with {@link works.spectest.harness.TrialHarness},
 * or assemble several trials with {@link works.spectest.harness.TrialSuite}.
 */
package works.spectest.harness;
