package stereo.batch;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative pause and cancel switch shared between a batch worker and
 * whoever drives it. The worker checks it between pairs.
 */
public class PauseToken {
	private final ReentrantLock lock = new ReentrantLock();
	private final Condition resumed = lock.newCondition();
	private boolean paused;
	private boolean cancelled;

	public void pause() {
		lock.lock();
		try {
			paused = true;
		} finally {
			lock.unlock();
		}
	}

	public void resume() {
		lock.lock();
		try {
			paused = false;
			resumed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	public void cancel() {
		lock.lock();
		try {
			cancelled = true;
			resumed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	public boolean isPaused() {
		lock.lock();
		try {
			return paused;
		} finally {
			lock.unlock();
		}
	}

	public boolean isCancelled() {
		lock.lock();
		try {
			return cancelled;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Blocks while paused.
	 *
	 * @return false when the batch was cancelled and must stop
	 */
	public boolean awaitRunnable() throws InterruptedException {
		lock.lock();
		try {
			while (paused && !cancelled) {
				resumed.await();
			}
			return !cancelled;
		} finally {
			lock.unlock();
		}
	}
}
