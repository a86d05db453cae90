package works.spectest.harness;

/**
 * Counts the successful draws of one trial.
 * Opened when the trial starts and closed when it ends; a closed counter can't be used.
 * Confined to the thread running the trial.
 */
public final class TrialCounter implements AutoCloseable {
	private int count = 0;
	private boolean closed = false;

	private TrialCounter() {}

	public static TrialCounter open() {
		return new TrialCounter();
	}

	public void increment() {
		checkOpen();
		count++;
	}

	public int value() {
		checkOpen();
		return count;
	}

	@Override
	public void close() {
		closed = true;
	}

	private void checkOpen() {
		if (closed) {
			throw new IllegalStateException("Trial counter is closed");
		}
	}
}
